/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.metrics.micrometer;

import static com.macstab.oss.fsock.metrics.micrometer.MetricsConfiguration.TAG_CONNECTION_NAME;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache for Micrometer counters and gauge values.
 *
 * <p><strong>Problem:</strong> Registry lookup with tag matching costs far more than an increment.
 * Command and event recording sits on the reader and caller hot paths.
 *
 * <p><strong>Solution:</strong> Counters and gauge holders ({@code AtomicInteger}) are cached by
 * key. First access registers the meter, later accesses reuse the cached instance.
 *
 * <p><strong>Graceful Degradation:</strong> Past {@code maxCacheSize} entries meters are resolved
 * through the registry directly. Event names are a caller-controlled dimension, so the bound keeps
 * memory flat even when a switch emits custom event names.
 *
 * <p><strong>Key Format:</strong> {@code metric.name:tag1=value1:tag2=value2} (tags in call
 * order).
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Counter> counters;
  private final ConcurrentHashMap<String, GaugeEntry> gauges;
  private final AtomicInteger cacheSize;

  /**
   * Creates metric cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached metrics
   * @throws NullPointerException if registry is null
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");

    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }

    this.maxCacheSize = maxCacheSize;
    this.counters = new ConcurrentHashMap<>(64);
    this.gauges = new ConcurrentHashMap<>(16);
    this.cacheSize = new AtomicInteger(0);
  }

  /**
   * Gets or creates counter with tags.
   *
   * @param name metric name (e.g., "fsock.commands")
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return counter instance (cached or direct)
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  Counter getOrCreateCounter(
      final String name, final String description, final String... tagPairs) {

    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);

    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return counters.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return createCounter(name, description, tagPairs);
          });
    }

    log.warn(
        "Metric cache full at {} entries. Direct registry used for counter: {}", maxCacheSize, key);
    return createCounter(name, description, tagPairs);
  }

  /**
   * Gets or creates gauge value with tags.
   *
   * <p><strong>Memory Management:</strong> Gauges hold strong references to their value. Call
   * {@link #removeGaugesForConnection(String)} when the connection or pool goes away.
   *
   * <p>Gauges are always cached: an uncached gauge could never be updated again after
   * registration.
   *
   * @param name metric name (e.g., "fsock.pool.connections.idle")
   * @param description metric description
   * @param tagPairs tag key-value pairs, must include {@code connection.name}
   * @return AtomicInteger holding gauge value
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  AtomicInteger getOrCreateGaugeValue(
      final String name, final String description, final String... tagPairs) {

    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = gauges.get(key);

    if (cached != null) {
      return cached.value;
    }

    return gauges.computeIfAbsent(
            key,
            k -> {
              cacheSize.incrementAndGet();
              final var value = new AtomicInteger(0);
              Gauge.builder(name, value, AtomicInteger::get)
                  .description(description)
                  .tags(tagPairs)
                  .register(registry);
              return new GaugeEntry(name, connectionNameOf(tagPairs), value);
            })
        .value;
  }

  /**
   * Removes all gauges registered for a connection name.
   *
   * <p>Meters are matched by metric name and {@code connection.name} tag, so gauges of other
   * connections sharing the registry stay registered.
   *
   * @param connectionName connection name to remove gauges for
   */
  void removeGaugesForConnection(final String connectionName) {
    gauges
        .entrySet()
        .removeIf(
            entry -> {
              final var gauge = entry.getValue();
              if (!Objects.equals(connectionName, gauge.connectionName)) {
                return false;
              }
              try {
                registry
                    .find(gauge.name)
                    .tag(TAG_CONNECTION_NAME, connectionName)
                    .gauges()
                    .forEach(meter -> registry.remove(meter.getId()));
                cacheSize.decrementAndGet();
                log.debug("Removed gauge for connection {}: {}", connectionName, entry.getKey());
                return true;
              } catch (final RuntimeException e) {
                log.warn("Failed to remove gauge {}: {}", entry.getKey(), e.getMessage());
                return false;
              }
            });
  }

  private String buildKey(final String name, final String... tagPairs) {
    final var key = new StringBuilder(32 + (tagPairs.length / 2 * 25));
    key.append(name);
    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }
    return key.toString();
  }

  private static String connectionNameOf(final String... tagPairs) {
    for (int i = 0; i < tagPairs.length; i += 2) {
      if (TAG_CONNECTION_NAME.equals(tagPairs[i])) {
        return tagPairs[i + 1];
      }
    }
    return null;
  }

  private Counter createCounter(
      final String name, final String description, final String... tagPairs) {
    return Counter.builder(name).description(description).tags(tagPairs).register(registry);
  }

  private void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }

  /**
   * Gets current cache size (for testing/monitoring).
   *
   * @return number of cached metrics
   */
  int getCacheSize() {
    return cacheSize.get();
  }

  /**
   * Gets max cache size (for testing).
   *
   * @return maximum cached metrics
   */
  int getMaxCacheSize() {
    return maxCacheSize;
  }

  private static final class GaugeEntry {
    private final String name;
    private final String connectionName;
    private final AtomicInteger value;

    private GaugeEntry(final String name, final String connectionName, final AtomicInteger value) {
      this.name = name;
      this.connectionName = connectionName;
      this.value = value;
    }
  }
}
