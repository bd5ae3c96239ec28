/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.error;

/** Handshake deviated from the protocol (no auth challenge, auth/subscribe/filter not accepted). */
public class ProtocolException extends EventSocketException {

  private static final long serialVersionUID = 1L;

  public ProtocolException(final String message) {
    super(message);
  }

  public ProtocolException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
