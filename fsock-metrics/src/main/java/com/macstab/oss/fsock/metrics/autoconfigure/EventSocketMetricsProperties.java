/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.fsock.metrics.micrometer.MetricsConfiguration;

import lombok.Data;

/**
 * Configuration properties for event socket metrics.
 *
 * <p><strong>Configuration Example:</strong>
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     fsock:
 *       enabled: true
 *       max-cache-size: 1000
 * }</pre>
 *
 * <p>The {@code connection.name} dimension comes from the pool configuration ({@code
 * fsock.connection-name}), not from here.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.fsock")
public class EventSocketMetricsProperties {

  /**
   * Enable event socket metrics collection.
   *
   * <p><strong>Default:</strong> {@code true}
   *
   * <p><strong>When disabled:</strong> {@code EventSocketMetrics.NOOP} is used.
   */
  private boolean enabled = true;

  /**
   * Maximum cached meter instances.
   *
   * <p><strong>Default:</strong> {@code 1000}
   *
   * <p>Event names are a tag, so a switch emitting many custom events grows the cache. Past the
   * bound meters are still recorded, through the registry directly.
   */
  private int maxCacheSize = MetricsConfiguration.DEFAULT_MAX_CACHE_SIZE;
}
