/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.frame;

import static java.nio.charset.StandardCharsets.UTF_8;
import static lombok.AccessLevel.PRIVATE;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;

/**
 * One protocol message: header block plus optional body.
 *
 * <p>A body is present if and only if the header block declared a {@code Content-Length}; its
 * length is exactly the declared value. Built fresh per read by {@link FrameReader}, never reused.
 */
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class Frame {

  private static final byte[] NO_BODY = new byte[0];

  /** Header lines as received (LF-joined, without the terminating blank line). */
  @Getter String headerBlock;

  /** Parsed {@code Name: Value} pairs in wire order (duplicates kept). */
  @Getter List<Map.Entry<String, String>> headers;

  byte[] body;

  public Frame(
      @NonNull final String headerBlock,
      @NonNull final List<Map.Entry<String, String>> headers,
      final byte[] body) {
    this.headerBlock = headerBlock;
    this.headers = List.copyOf(headers);
    this.body = body == null ? NO_BODY : body;
  }

  /**
   * Value of the first header with the given name.
   *
   * @param name header name (case-sensitive, as sent by the switch)
   * @return trimmed value, or empty if absent
   */
  public Optional<String> header(final String name) {
    for (final var header : headers) {
      if (header.getKey().equals(name)) {
        return Optional.of(header.getValue());
      }
    }
    return Optional.empty();
  }

  /** {@code Content-Type} value or empty string. */
  public String getContentType() {
    return header(EslHeaders.CONTENT_TYPE).orElse("");
  }

  public boolean hasBody() {
    return body.length > 0;
  }

  /** Copy of the raw body bytes (empty array when no body). */
  public byte[] getBody() {
    return Arrays.copyOf(body, body.length);
  }

  public String getBodyAsString() {
    return new String(body, UTF_8);
  }

  @Override
  public String toString() {
    return String.format(
        "Frame[contentType=%s, headers=%d, body=%d bytes]",
        getContentType(), headers.size(), body.length);
  }
}
