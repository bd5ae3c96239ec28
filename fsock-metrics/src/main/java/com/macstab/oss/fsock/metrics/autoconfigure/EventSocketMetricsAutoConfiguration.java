/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.fsock.metrics.EventSocketMetrics;
import com.macstab.oss.fsock.metrics.micrometer.MicrometerEventSocketMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot auto-configuration for event socket metrics.
 *
 * <p><strong>Activation Conditions:</strong>
 *
 * <ol>
 *   <li>{@code MeterRegistry.class} on classpath
 *   <li>{@code MeterRegistry} bean exists (Actuator or user defined)
 *   <li>{@code management.metrics.fsock.enabled=true} (default)
 * </ol>
 *
 * <p><strong>Bean Created:</strong>
 *
 * <ul>
 *   <li>If conditions met: {@link MicrometerEventSocketMetrics}
 *   <li>Otherwise: {@link EventSocketMetrics#NOOP}
 * </ul>
 *
 * <p>The pool auto-configuration picks the bean up when present and falls back to {@code NOOP}
 * when it is not.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(EventSocketMetricsProperties.class)
public class EventSocketMetricsAutoConfiguration {

  /**
   * Creates Micrometer-based metrics collector when enabled.
   *
   * @param registry Micrometer meter registry
   * @param properties metrics configuration properties
   * @return Micrometer metrics collector
   */
  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.fsock",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(EventSocketMetrics.class)
  public EventSocketMetrics micrometerEventSocketMetrics(
      final MeterRegistry registry, final EventSocketMetricsProperties properties) {

    log.info(
        "Activating event socket metrics (Micrometer) - maxCacheSize: {}",
        properties.getMaxCacheSize());

    return new MicrometerEventSocketMetrics(registry, properties.getMaxCacheSize());
  }

  /**
   * Creates no-op metrics collector when disabled or no registry exists.
   *
   * @return no-op metrics collector
   */
  @Bean
  @ConditionalOnMissingBean(EventSocketMetrics.class)
  public EventSocketMetrics noOpEventSocketMetrics() {
    log.debug("Event socket metrics disabled - using NOOP singleton");
    return EventSocketMetrics.NOOP;
  }
}
