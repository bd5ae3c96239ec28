/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.text;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.net.URLDecoder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import lombok.NonNull;
import lombok.experimental.UtilityClass;

/**
 * String transforms over event socket payloads.
 *
 * <p>Event bodies ({@code text/event-plain}) are themselves header blocks with url-encoded values:
 *
 * <pre>
 * Event-Name: CHANNEL_ANSWER
 * Caller-Caller-ID-Name: John%20Doe
 * Unique-ID: 6b1e...
 * </pre>
 *
 * <p>Tabular command output ({@code show channels}) is CSV-like, where a column may contain commas
 * inside {@code {...}} or {@code [...]} groups (channel variables, codec lists):
 *
 * <pre>
 * uuid,direction,created,name,...
 * 6b1e...,inbound,2026-01-10 10:00:01,sofia/internal/1000@10.0.0.1,...
 *
 * 1 total.
 * </pre>
 *
 * <p>All methods are pure and thread-safe.
 */
@UtilityClass
public class EventSocketText {

  private static final Pattern TOTAL_TRAILER = Pattern.compile("^\\d+ total\\.$");

  /**
   * Value of the first header line named exactly {@code name}.
   *
   * @param headers LF separated header lines
   * @param name header name
   * @return trimmed value, empty string when no such line exists
   */
  public String headerValue(@NonNull final String headers, @NonNull final String name) {
    for (final var line : headers.split("\n", -1)) {
      final int colon = line.indexOf(':');
      if (colon > 0 && line.substring(0, colon).trim().equals(name)) {
        return line.substring(colon + 1).trim();
      }
    }
    return "";
  }

  /**
   * Decodes a url-encoded header value ({@code +} is a space).
   *
   * @return decoded value, or {@code raw} unchanged when it holds an invalid escape
   */
  public String urlDecode(@NonNull final String raw) {
    try {
      return URLDecoder.decode(raw, UTF_8);
    } catch (final IllegalArgumentException e) {
      return raw;
    }
  }

  /**
   * Converts an event body into a header map with decoded values.
   *
   * @param event event text, one {@code Name: Value} per line
   * @param excludedHeaders header names to leave out (empty for none)
   * @return map in line order; a repeated header keeps its last value
   */
  public Map<String, String> eventToMap(
      @NonNull final String event, @NonNull final Collection<String> excludedHeaders) {

    final Set<String> excluded = Set.copyOf(excludedHeaders);
    final Map<String, String> result = new LinkedHashMap<>();

    for (final var line : event.split("\n")) {
      final int separator = line.indexOf(": ");
      if (separator < 0) {
        continue;
      }
      final var name = line.substring(0, separator);
      if (excluded.contains(name)) {
        continue;
      }
      result.put(name, urlDecode(line.substring(separator + 2).trim()));
    }
    return result;
  }

  /** Start offsets of every non-overlapping occurrence of {@code needle}. */
  public List<Integer> indexAll(@NonNull final String s, @NonNull final String needle) {
    final List<Integer> offsets = new ArrayList<>();
    if (needle.isEmpty()) {
      return offsets;
    }
    int from = 0;
    int found;
    while ((found = s.indexOf(needle, from)) >= 0) {
      offsets.add(found);
      from = found + needle.length();
    }
    return offsets;
  }

  /**
   * Splits on {@code sep} except where the separator sits inside a {@code {}} or {@code []}
   * group.
   *
   * <p>Groups are honored only when opening and closing characters are balanced in {@code line};
   * otherwise the line is split on every separator.
   *
   * @return the fields (trailing empty field kept); empty list for empty input; {@code [line]} for
   *     an empty separator
   */
  public List<String> splitIgnoreGroups(@NonNull final String line, @NonNull final String sep) {
    final List<String> fields = new ArrayList<>();
    if (line.isEmpty()) {
      return fields;
    }
    if (sep.isEmpty()) {
      fields.add(line);
      return fields;
    }

    final boolean honorGroups =
        count(line, '{') == count(line, '}') && count(line, '[') == count(line, ']');

    int curly = 0;
    int square = 0;
    int start = 0;
    int i = 0;
    while (i < line.length()) {
      final char c = line.charAt(i);
      if (honorGroups) {
        if (c == '{') {
          curly++;
        } else if (c == '}') {
          curly = Math.max(0, curly - 1);
        } else if (c == '[') {
          square++;
        } else if (c == ']') {
          square = Math.max(0, square - 1);
        }
      }
      if (curly == 0 && square == 0 && line.startsWith(sep, i)) {
        fields.add(line.substring(start, i));
        i += sep.length();
        start = i;
        continue;
      }
      i++;
    }
    fields.add(line.substring(start));
    return fields;
  }

  /**
   * Converts tabular command output into one map per row, keyed by the header line's columns.
   *
   * <p>Rows end at the first blank line or the {@code N total.} trailer. Rows whose column count
   * differs from the header are skipped.
   */
  public List<Map<String, String>> mapChannelData(@NonNull final String raw) {
    final List<Map<String, String>> rows = new ArrayList<>();
    final var lines = raw.split("\n", -1);
    if (lines.length < 2 || lines[0].isBlank()) {
      return rows;
    }

    final var columns = lines[0].trim().split(",", -1);

    for (int i = 1; i < lines.length; i++) {
      final var line = stripCarriageReturn(lines[i]);
      if (line.isBlank() || TOTAL_TRAILER.matcher(line.trim()).matches()) {
        break;
      }
      final var fields = splitIgnoreGroups(line, ",");
      if (fields.size() != columns.length) {
        continue;
      }
      final Map<String, String> row = new LinkedHashMap<>();
      for (int c = 0; c < columns.length; c++) {
        row.put(columns[c], fields.get(c));
      }
      rows.add(row);
    }
    return rows;
  }

  private int count(final String s, final char c) {
    int n = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == c) {
        n++;
      }
    }
    return n;
  }

  private String stripCarriageReturn(final String line) {
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }
}
