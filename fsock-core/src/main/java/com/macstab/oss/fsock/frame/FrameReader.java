/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.frame;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.macstab.oss.fsock.error.MalformedFrameException;
import com.macstab.oss.fsock.error.TransportException;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Blocking reader for event socket frames.
 *
 * <p><strong>Wire format:</strong>
 *
 * <pre>
 * Content-Length: 27\n          ← header lines, LF (or CRLF) terminated
 * Content-Type: api/response\n
 * \n                            ← blank line ends the header block
 * +OK\nsecond line of body\n    ← exactly Content-Length bytes, no terminator implied
 * </pre>
 *
 * <p>The protocol has no message boundary other than the blank line and the declared body length,
 * so a body is read byte-for-byte: embedded blank lines in the body are data, not delimiters.
 *
 * <p>Stateless: one instance can serve any number of streams. The stream is expected to be
 * buffered ({@code BufferedInputStream}); lines are read one byte at a time.
 *
 * <p>Failures never tear anything down here. The owning connection wraps every call and
 * disconnects on any exception, see {@code EventSocketConnection#readFrame()}.
 */
@Slf4j
public final class FrameReader {

  /** Default upper bound for a single header line. */
  public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;

  private static final int LF = '\n';
  private static final int CR = '\r';

  @Getter private final int maxLineLength;

  public FrameReader() {
    this(DEFAULT_MAX_LINE_LENGTH);
  }

  public FrameReader(final int maxLineLength) {
    if (maxLineLength <= 0) {
      throw new IllegalArgumentException("maxLineLength must be > 0, got: " + maxLineLength);
    }
    this.maxLineLength = maxLineLength;
  }

  /**
   * Reads one frame.
   *
   * @param in buffered stream positioned at a frame boundary
   * @return header block and body (empty body when no {@code Content-Length})
   * @throws TransportException stream ended or failed while reading headers or body
   * @throws MalformedFrameException {@code Content-Length} not a non-negative integer, body
   *     truncated, or header line longer than {@link #getMaxLineLength()}
   */
  public Frame readFrame(@NonNull final InputStream in)
      throws TransportException, MalformedFrameException {

    final var block = new StringBuilder(256);
    final List<Map.Entry<String, String>> headers = new ArrayList<>();

    while (true) {
      final var line = readLine(in);
      if (line.isBlank()) {
        break;
      }
      if (block.length() > 0) {
        block.append('\n');
      }
      block.append(line);

      final int colon = line.indexOf(':');
      if (colon > 0) {
        headers.add(Map.entry(line.substring(0, colon).trim(), line.substring(colon + 1).trim()));
      }
    }

    final var contentLength = findContentLength(headers);
    if (contentLength < 0) {
      return new Frame(block.toString(), headers, null);
    }

    final var body = readBody(in, contentLength);

    if (log.isTraceEnabled()) {
      log.trace("Read frame: {} header(s), {} body byte(s)", headers.size(), contentLength);
    }

    return new Frame(block.toString(), headers, body);
  }

  /** Declared body length, or -1 when the header is absent. */
  private int findContentLength(final List<Map.Entry<String, String>> headers)
      throws MalformedFrameException {

    for (final var header : headers) {
      if (EslHeaders.CONTENT_LENGTH.equals(header.getKey())) {
        final int length;
        try {
          length = Integer.parseInt(header.getValue());
        } catch (final NumberFormatException e) {
          throw new MalformedFrameException(
              "Cannot extract content length from <" + header.getValue() + ">", e);
        }
        if (length < 0) {
          throw new MalformedFrameException("Negative content length: " + length);
        }
        return length;
      }
    }
    return -1;
  }

  private byte[] readBody(final InputStream in, final int length)
      throws TransportException, MalformedFrameException {

    final var body = new byte[length];
    final int read;
    try {
      read = in.readNBytes(body, 0, length);
    } catch (final IOException e) {
      throw new TransportException("Error reading message body", e);
    }
    if (read < length) {
      throw new MalformedFrameException(
          "Truncated body: expected " + length + " bytes, stream ended after " + read);
    }
    return body;
  }

  /** One line without its LF (and without a trailing CR). */
  private String readLine(final InputStream in)
      throws TransportException, MalformedFrameException {

    final var line = new ByteArrayOutputStream(80);
    try {
      int b;
      while ((b = in.read()) != -1) {
        if (b == LF) {
          return stripCarriageReturn(line);
        }
        if (line.size() >= maxLineLength) {
          throw new MalformedFrameException("Header line longer than " + maxLineLength + " bytes");
        }
        line.write(b);
      }
    } catch (final IOException e) {
      throw new TransportException("Error reading headers", e);
    }
    throw new TransportException("Connection closed by remote while reading headers");
  }

  private static String stripCarriageReturn(final ByteArrayOutputStream line) {
    final var bytes = line.toByteArray();
    final int length = bytes.length > 0 && bytes[bytes.length - 1] == CR ? bytes.length - 1 : bytes.length;
    return new String(bytes, 0, length, UTF_8);
  }
}
