/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.spring3;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.fsock.EventHandler;
import com.macstab.oss.fsock.EventSocketConfig;
import com.macstab.oss.fsock.EventSocketPool;
import com.macstab.oss.fsock.metrics.EventSocketMetrics;
import com.macstab.oss.fsock.metrics.autoconfigure.EventSocketMetricsAutoConfiguration;

import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration for the event socket connection pool.
 *
 * <p>Activated when {@code fsock.enabled=true}. The pool is lazy: no connection is opened until
 * the first {@link EventSocketPool#acquire()}, so application startup never depends on the
 * switch being reachable.
 *
 * <p><strong>Beans:</strong>
 *
 * <ul>
 *   <li>{@link EventSocketConfig} built from {@link EventSocketProperties}, every {@link
 *       EventSubscription} bean and the {@link EventSocketMetrics} bean when present
 *   <li>{@link EventSocketPool}, closed on context shutdown
 * </ul>
 *
 * <p>Both back off when the application defines its own.
 *
 * @see EventSocketProperties
 */
@Slf4j
@AutoConfiguration(after = EventSocketMetricsAutoConfiguration.class)
@ConditionalOnClass(EventSocketPool.class)
@ConditionalOnProperty(prefix = "fsock", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(EventSocketProperties.class)
public class EventSocketAutoConfiguration {

  /**
   * Builds the per-connection configuration.
   *
   * @param properties pool properties
   * @param subscriptions event subscriptions (optional)
   * @param metricsProvider metrics collector provider (optional)
   * @return validated configuration
   */
  @Bean
  @ConditionalOnMissingBean
  public EventSocketConfig eventSocketConfig(
      final EventSocketProperties properties,
      final ObjectProvider<EventSubscription> subscriptions,
      final ObjectProvider<EventSocketMetrics> metricsProvider) {

    final var builder =
        EventSocketConfig.builder()
            .host(properties.getHost())
            .port(properties.getPort())
            .password(properties.getPassword())
            .reconnects(properties.getReconnects())
            .connectTimeout(properties.getConnectTimeout())
            .backoffUnit(properties.getBackoffUnit())
            .connectionName(properties.getConnectionName())
            .metrics(metricsProvider.getIfAvailable(() -> EventSocketMetrics.NOOP))
            .eventFilters(properties.getFilters());

    groupByEventName(subscriptions).forEach(builder::eventHandler);

    final var config = builder.build();
    config.validate();
    return config;
  }

  /**
   * Creates the connection pool.
   *
   * @param config per-connection configuration
   * @param properties pool properties
   * @return lazy pool
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public EventSocketPool eventSocketPool(
      final EventSocketConfig config, final EventSocketProperties properties) {

    final var pool =
        new EventSocketPool(config, properties.getMaxConnections(), properties.isEagerStreaming());

    if (log.isInfoEnabled()) {
      log.info(
          "Event socket pool: {}:{}, {} connection(s), {} subscribed event name(s), {} filter(s), metrics={}",
          config.getHost(),
          Integer.valueOf(config.getPort()),
          Integer.valueOf(pool.getMaxConnections()),
          Integer.valueOf(config.getEventHandlers().size()),
          Integer.valueOf(config.getEventFilters().size()),
          config.getMetrics() == EventSocketMetrics.NOOP ? "disabled" : "enabled");
    }

    return pool;
  }

  private static Map<String, List<EventHandler>> groupByEventName(
      final ObjectProvider<EventSubscription> subscriptions) {
    final Map<String, List<EventHandler>> grouped = new LinkedHashMap<>();
    subscriptions
        .orderedStream()
        .forEach(
            subscription ->
                grouped
                    .computeIfAbsent(subscription.getEventName(), name -> new ArrayList<>())
                    .add(subscription.getHandler()));
    return grouped;
  }
}
