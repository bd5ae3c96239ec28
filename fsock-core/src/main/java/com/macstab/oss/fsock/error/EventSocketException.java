/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.error;

/**
 * Base of all failures reported by an event socket connection or pool.
 *
 * <p>Callers decide between retrying, releasing the connection to its pool, or giving up.
 *
 * <ul>
 *   <li>{@link TransportException} - dial, read or write failure, or command on a disconnected
 *       socket
 *   <li>{@link MalformedFrameException} - unparseable {@code Content-Length} or truncated body
 *   <li>{@link ProtocolException} - missing auth challenge or unexpected handshake reply
 *   <li>{@link CommandFailedException} - switch answered {@code -ERR}
 * </ul>
 */
public class EventSocketException extends Exception {

  private static final long serialVersionUID = 1L;

  public EventSocketException(final String message) {
    super(message);
  }

  public EventSocketException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
