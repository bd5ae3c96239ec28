/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Metric names and tag keys for the Micrometer integration.
 *
 * <p><strong>Naming Convention:</strong> {@code fsock.*}, split by the component that records:
 * {@code fsock.connection.*} (dial, handshake, reconnect), {@code fsock.commands}, {@code
 * fsock.events.*} and {@code fsock.pool.*}.
 *
 * <p><strong>Prometheus Output:</strong>
 *
 * <pre>
 * fsock.connection.reconnects      → fsock_connection_reconnects_total
 * fsock.pool.connections.in_use    → fsock_pool_connections_in_use
 * </pre>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class MetricsConfiguration {

  /** Metric name prefix. */
  public static final String PREFIX = "fsock";

  /**
   * Failed dial attempts (one per refused or timed out TCP connect).
   *
   * <p><strong>Type:</strong> Counter
   */
  public static final String DIAL_FAILURES = PREFIX + ".connection.dial.failures";

  /**
   * Completed handshakes (auth, subscribe, filters).
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code result} ({@code success} or {@code failure})
   */
  public static final String HANDSHAKES = PREFIX + ".connection.handshakes";

  /**
   * Reconnects triggered by the event reader after a lost transport.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code result}
   */
  public static final String RECONNECTS = PREFIX + ".connection.reconnects";

  /**
   * Synchronous commands sent over a connection.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code kind} ({@code api}, {@code command}, {@code sendmsg}),
   * {@code result}
   */
  public static final String COMMANDS = PREFIX + ".commands";

  /**
   * Events handed to at least one handler.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code event.name}
   */
  public static final String EVENTS_DISPATCHED = PREFIX + ".events.dispatched";

  /** Handler invocations submitted for dispatched events (Counter, tag {@code event.name}). */
  public static final String EVENT_HANDLER_INVOCATIONS = PREFIX + ".events.handler.invocations";

  /** Events without a matching handler (Counter, tag {@code event.name}). */
  public static final String EVENTS_DROPPED = PREFIX + ".events.dropped";

  /** Idle pooled connections (Gauge). */
  public static final String POOL_IDLE = PREFIX + ".pool.connections.idle";

  /** Pooled connections currently handed out (Gauge). */
  public static final String POOL_IN_USE = PREFIX + ".pool.connections.in_use";

  /** Tag key for the connection name dimension (present on every metric). */
  public static final String TAG_CONNECTION_NAME = "connection.name";

  /** Tag key for success/failure outcome. */
  public static final String TAG_RESULT = "result";

  /** Tag key for the command kind. */
  public static final String TAG_KIND = "kind";

  /** Tag key for the event name. */
  public static final String TAG_EVENT_NAME = "event.name";

  /** Value of {@link #TAG_RESULT} on success. */
  public static final String RESULT_SUCCESS = "success";

  /** Value of {@link #TAG_RESULT} on failure. */
  public static final String RESULT_FAILURE = "failure";

  /** Event name tag value used when the event carries no {@code Event-Name}. */
  public static final String UNKNOWN_EVENT = "unknown";

  /** Default bound for cached meter instances. */
  public static final int DEFAULT_MAX_CACHE_SIZE = 1000;
}
