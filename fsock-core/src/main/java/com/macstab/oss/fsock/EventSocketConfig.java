/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import com.macstab.oss.fsock.metrics.EventSocketMetrics;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.FieldDefaults;

/**
 * Immutable settings shared by every connection of a pool.
 *
 * <pre>{@code
 * EventSocketConfig config = EventSocketConfig.builder()
 *     .host("10.0.0.5")
 *     .password("ClueCon")
 *     .eventHandler("CHANNEL_ANSWER", List.of(event -> onAnswer(event)))
 *     .eventHandler("ALL", List.of(event -> audit(event)))
 *     .eventFilter("Event-Name", "CHANNEL_ANSWER")
 *     .build();
 * }</pre>
 *
 * <p>Filters keep their registration order. The password is excluded from {@link #toString()}.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@FieldDefaults(level = PRIVATE, makeFinal = true)
public class EventSocketConfig {

  public static final int DEFAULT_PORT = 8021;
  public static final String DEFAULT_PASSWORD = "ClueCon";
  public static final int DEFAULT_RECONNECTS = 5;
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_BACKOFF_UNIT = Duration.ofSeconds(1);
  public static final String DEFAULT_CONNECTION_NAME = "default";

  @NonNull String host;

  @Builder.Default int port = DEFAULT_PORT;

  @ToString.Exclude @NonNull @Builder.Default String password = DEFAULT_PASSWORD;

  /** Dial attempts per {@code connect()}, at least 1. */
  @Builder.Default int reconnects = DEFAULT_RECONNECTS;

  @NonNull @Builder.Default Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

  /** One Fibonacci step; the n-th retry waits {@code fib(n) * backoffUnit}. */
  @NonNull @Builder.Default Duration backoffUnit = DEFAULT_BACKOFF_UNIT;

  /** Event name (or {@code ALL}) to handlers. */
  @ToString.Exclude @Singular Map<String, List<EventHandler>> eventHandlers;

  /** Header name to required value, installed as {@code filter} commands in this order. */
  @Singular Map<String, String> eventFilters;

  /** Executor for handler tasks; {@code null} selects a shared daemon pool. */
  @ToString.Exclude Executor dispatchExecutor;

  @ToString.Exclude @NonNull @Builder.Default EventSocketMetrics metrics = EventSocketMetrics.NOOP;

  /** Metrics dimension and thread-name component. */
  @NonNull @Builder.Default String connectionName = DEFAULT_CONNECTION_NAME;

  /**
   * Checks value ranges the builder cannot express.
   *
   * @throws IllegalArgumentException on an invalid port, attempt count or duration
   */
  public void validate() {
    if (host.isBlank()) {
      throw new IllegalArgumentException("host must not be blank");
    }
    if (port < 1 || port > 65_535) {
      throw new IllegalArgumentException("port must be in 1..65535, got: " + port);
    }
    if (reconnects < 1) {
      throw new IllegalArgumentException("reconnects must be >= 1, got: " + reconnects);
    }
    if (connectTimeout.isNegative()) {
      throw new IllegalArgumentException("connectTimeout must not be negative");
    }
    if (backoffUnit.isNegative()) {
      throw new IllegalArgumentException("backoffUnit must not be negative");
    }
  }
}
