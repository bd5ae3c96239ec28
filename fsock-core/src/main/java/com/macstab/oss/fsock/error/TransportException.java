/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.error;

/**
 * Dial, read or write failure on the event socket.
 *
 * <p>Always leaves the connection disconnected. Thrown as well when a command is issued on a
 * connection whose socket is already gone.
 */
public class TransportException extends EventSocketException {

  private static final long serialVersionUID = 1L;

  public TransportException(final String message) {
    super(message);
  }

  public TransportException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
