/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.metrics.micrometer;

import static com.macstab.oss.fsock.metrics.micrometer.MetricsConfiguration.*;

import java.util.Objects;

import com.macstab.oss.fsock.metrics.EventSocketMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link EventSocketMetrics} with dimensional tags.
 *
 * <p><strong>Dimensions:</strong> every meter carries {@code connection.name}. One instance can be
 * shared by several pools and connections; the name passed with each call keeps them apart.
 *
 * <p><strong>Meters:</strong>
 *
 * <ul>
 *   <li>{@code fsock.connection.dial.failures} - counter
 *   <li>{@code fsock.connection.handshakes} - counter, {@code result}
 *   <li>{@code fsock.connection.reconnects} - counter, {@code result}
 *   <li>{@code fsock.commands} - counter, {@code kind}, {@code result}
 *   <li>{@code fsock.events.dispatched} / {@code fsock.events.handler.invocations} - counters,
 *       {@code event.name}
 *   <li>{@code fsock.events.dropped} - counter, {@code event.name}
 *   <li>{@code fsock.pool.connections.idle} / {@code fsock.pool.connections.in_use} - gauges
 * </ul>
 *
 * <p><strong>Contract:</strong> recording methods never throw. A broken registry must not take
 * the event reader down with it.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class MicrometerEventSocketMetrics implements EventSocketMetrics {

  private final MetricCache cache;

  /**
   * Creates Micrometer metrics collector.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meter instances
   * @throws NullPointerException if registry is null
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  public MicrometerEventSocketMetrics(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.cache =
        new MetricCache(
            Objects.requireNonNull(registry, "MeterRegistry must not be null"), maxCacheSize);

    log.debug("Created MicrometerEventSocketMetrics (maxCacheSize: {})", maxCacheSize);
  }

  /**
   * Creates Micrometer metrics collector with default cache size.
   *
   * @param registry Micrometer meter registry
   */
  public MicrometerEventSocketMetrics(@NonNull final MeterRegistry registry) {
    this(registry, DEFAULT_MAX_CACHE_SIZE);
  }

  @Override
  public void recordDialFailure(final String connectionName) {
    increment(
        DIAL_FAILURES, "Failed TCP connect attempts", TAG_CONNECTION_NAME, name(connectionName));
  }

  @Override
  public void recordHandshake(final String connectionName, final boolean success) {
    increment(
        HANDSHAKES,
        "Completed event socket handshakes",
        TAG_CONNECTION_NAME,
        name(connectionName),
        TAG_RESULT,
        result(success));
  }

  @Override
  public void recordReconnect(final String connectionName, final boolean success) {
    increment(
        RECONNECTS,
        "Reconnects after a lost transport",
        TAG_CONNECTION_NAME,
        name(connectionName),
        TAG_RESULT,
        result(success));
  }

  @Override
  public void recordCommand(final String connectionName, final String kind, final boolean success) {
    increment(
        COMMANDS,
        "Synchronous commands sent",
        TAG_CONNECTION_NAME,
        name(connectionName),
        TAG_KIND,
        kind == null ? "unknown" : kind,
        TAG_RESULT,
        result(success));
  }

  @Override
  public void recordEventDispatched(
      final String connectionName, final String eventName, final int handlers) {
    try {
      final var connection = name(connectionName);
      final var event = eventName(eventName);
      cache
          .getOrCreateCounter(
              EVENTS_DISPATCHED,
              "Events handed to at least one handler",
              TAG_CONNECTION_NAME,
              connection,
              TAG_EVENT_NAME,
              event)
          .increment();
      if (handlers > 0) {
        cache
            .getOrCreateCounter(
                EVENT_HANDLER_INVOCATIONS,
                "Handler tasks submitted for dispatched events",
                TAG_CONNECTION_NAME,
                connection,
                TAG_EVENT_NAME,
                event)
            .increment(handlers);
      }
    } catch (final RuntimeException e) {
      log.warn("Failed to record dispatched event <{}>: {}", eventName, e.getMessage());
    }
  }

  @Override
  public void recordEventDropped(final String connectionName, final String eventName) {
    increment(
        EVENTS_DROPPED,
        "Events without a matching handler",
        TAG_CONNECTION_NAME,
        name(connectionName),
        TAG_EVENT_NAME,
        eventName(eventName));
  }

  @Override
  public void setPoolConnections(final String connectionName, final int idle, final int inUse) {
    try {
      final var connection = name(connectionName);
      cache
          .getOrCreateGaugeValue(
              POOL_IDLE, "Idle pooled connections", TAG_CONNECTION_NAME, connection)
          .set(Math.max(0, idle));
      cache
          .getOrCreateGaugeValue(
              POOL_IN_USE, "Pooled connections handed out", TAG_CONNECTION_NAME, connection)
          .set(Math.max(0, inUse));
    } catch (final RuntimeException e) {
      log.warn("Failed to update pool gauges for {}: {}", connectionName, e.getMessage());
    }
  }

  /**
   * Unregisters the gauges of a connection name. Counters stay registered: they are cumulative
   * and a pool recreated under the same name continues them.
   *
   * @param connectionName connection name whose gauges are removed
   */
  @Override
  public void close(final String connectionName) {
    try {
      cache.removeGaugesForConnection(name(connectionName));
      log.info("Closed event socket metrics for connection '{}'", connectionName);
    } catch (final RuntimeException e) {
      log.error("Error during metrics cleanup for connection '{}'", connectionName, e);
    }
  }

  /**
   * Gets cache size (for testing/monitoring).
   *
   * @return number of cached metrics
   */
  int getCacheSize() {
    return cache.getCacheSize();
  }

  private void increment(final String metric, final String description, final String... tags) {
    try {
      cache.getOrCreateCounter(metric, description, tags).increment();
    } catch (final RuntimeException e) {
      log.warn("Failed to record {}: {}", metric, e.getMessage());
    }
  }

  private static String name(final String connectionName) {
    return connectionName == null ? "default" : connectionName;
  }

  private static String eventName(final String eventName) {
    return eventName == null || eventName.isBlank() ? UNKNOWN_EVENT : eventName;
  }

  private static String result(final boolean success) {
    return success ? RESULT_SUCCESS : RESULT_FAILURE;
  }
}
