/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.metrics;

/**
 * Framework-agnostic metrics hooks for event socket connections and pools.
 *
 * <p><strong>Design Pattern:</strong> Interface with default no-op methods. Implementations
 * override only what they need; the core library calls every hook unconditionally.
 *
 * <p><strong>Implementations:</strong>
 *
 * <ul>
 *   <li>{@link #NOOP} - singleton using the default methods
 *   <li>{@code MicrometerEventSocketMetrics} - Micrometer integration (module {@code
 *       fsock-metrics})
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> Implementations MUST be thread-safe. Hooks are called from
 * caller threads, read-loop threads and dispatch threads concurrently.
 *
 * <p><strong>Failure contract:</strong> Implementations MUST NOT throw. A metrics failure must never
 * turn into a connection failure.
 *
 * <p>Every hook carries the {@code connectionName} dimension (config value, {@code "default"} when
 * not set) so several switches can be told apart on one registry.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
public interface EventSocketMetrics {

  /** No-op singleton instance (uses default methods). */
  EventSocketMetrics NOOP = new EventSocketMetrics() {};

  /**
   * Records one failed TCP dial attempt (before any backoff sleep).
   *
   * <p><strong>Metric Type:</strong> Counter. <strong>Expected Name:</strong> {@code
   * fsock.connection.dial.failures}
   *
   * @param connectionName connection name
   */
  default void recordDialFailure(String connectionName) {
    // No-op by default
  }

  /**
   * Records the outcome of a handshake (auth, subscribe, filter) after a successful dial.
   *
   * <p><strong>Metric Type:</strong> Counter tagged {@code result=success|failure}.
   *
   * @param connectionName connection name
   * @param success whether the connection reached {@code READY}
   */
  default void recordHandshake(String connectionName, boolean success) {
    // No-op by default
  }

  /**
   * Records a reconnect triggered by a read failure in the background loop.
   *
   * @param connectionName connection name
   * @param success whether the loop could continue
   */
  default void recordReconnect(String connectionName, boolean success) {
    // No-op by default
  }

  /**
   * Records one synchronous command.
   *
   * <p><strong>Metric Type:</strong> Counter tagged {@code kind} ({@code api}, {@code command},
   * {@code sendmsg}) and {@code result}.
   *
   * @param connectionName connection name
   * @param kind command kind
   * @param success false for transport failures and {@code -ERR} replies
   */
  default void recordCommand(String connectionName, String kind, boolean success) {
    // No-op by default
  }

  /**
   * Records an event handed to handlers.
   *
   * @param connectionName connection name
   * @param eventName value of {@code Event-Name} (may be empty)
   * @param handlers number of handler tasks submitted
   */
  default void recordEventDispatched(String connectionName, String eventName, int handlers) {
    // No-op by default
  }

  /**
   * Records an event nobody was registered for.
   *
   * @param connectionName connection name
   * @param eventName value of {@code Event-Name} (may be empty)
   */
  default void recordEventDropped(String connectionName, String eventName) {
    // No-op by default
  }

  /**
   * Reports the current pool occupancy.
   *
   * <p>Called after every acquire and release. The pool owns the counts; metrics only report them.
   *
   * <p><strong>Metric Type:</strong> Gauges {@code fsock.pool.connections.idle} and {@code
   * fsock.pool.connections.in_use}.
   *
   * @param connectionName connection name
   * @param idle connections waiting in the ready buffer
   * @param inUse connections checked out
   */
  default void setPoolConnections(String connectionName, int idle, int inUse) {
    // No-op by default
  }

  /**
   * Removes every meter registered for {@code connectionName}.
   *
   * <p>Called once by {@code EventSocketPool.close()}. Implementations catch and log their own
   * failures.
   *
   * @param connectionName connection name
   */
  default void close(String connectionName) {
    // No-op by default
  }
}
