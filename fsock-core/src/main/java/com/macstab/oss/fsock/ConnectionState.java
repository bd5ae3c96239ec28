/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock;

/**
 * Lifecycle states of an {@link EventSocketConnection}.
 *
 * <pre>
 * DISCONNECTED → CONNECTING → AUTHENTICATING → SUBSCRIBING → FILTERING → READY ⇄ STREAMING
 *       ↑                                                                     │
 *       └──────────────────────── any I/O failure ────────────────────────────┘
 *
 * close() from any state → CLOSED (terminal)
 * </pre>
 */
public enum ConnectionState {
  /** No live socket. Initial state and the state after any I/O failure. */
  DISCONNECTED,
  /** Dialing, including backoff sleeps between attempts. */
  CONNECTING,
  /** Waiting for the challenge or the reply to {@code auth}. */
  AUTHENTICATING,
  /** {@code event plain ...} sent. */
  SUBSCRIBING,
  /** Installing {@code filter} pairs. */
  FILTERING,
  /** Handshake complete, no background reader. Commands read their own replies. */
  READY,
  /** Handshake complete, background reader demultiplexing frames. */
  STREAMING,
  /** Closed by the owner. No further reconnects. */
  CLOSED
}
