/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.error;

/**
 * Frame could not be parsed: {@code Content-Length} is not a non-negative integer, or the stream
 * ended before the declared body length was read.
 *
 * <p>The byte stream is desynchronized afterwards. Handled exactly like a {@link
 * TransportException}: the socket is torn down.
 */
public class MalformedFrameException extends EventSocketException {

  private static final long serialVersionUID = 1L;

  public MalformedFrameException(final String message) {
    super(message);
  }

  public MalformedFrameException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
