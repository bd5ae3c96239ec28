/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.spring3;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.fsock.EventSocketConfig;

import lombok.Getter;
import lombok.Setter;

/**
 * Event socket connection pool configuration properties.
 *
 * <pre>{@code
 * fsock:
 *   enabled: true
 *   host: pbx.internal
 *   port: 8021
 *   password: ClueCon
 *   reconnects: 5
 *   connect-timeout: 10s
 *   backoff-unit: 1s
 *   max-connections: 8      # 1-64
 *   eager-streaming: true
 *   connection-name: pbx
 *   filters:
 *     "[Event-Name]": CHANNEL_ANSWER
 * }</pre>
 *
 * <p><strong>Connection budget:</strong> every pooled connection is one TCP session to the switch
 * and, with eager streaming, one reader thread.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "fsock")
public class EventSocketProperties {

  public static final int MIN_CONNECTIONS = 1;
  public static final int MAX_CONNECTIONS = 64;
  public static final int DEFAULT_CONNECTIONS = 8;

  /** Creates the pool bean. Off unless set. */
  private boolean enabled = false;

  /** Switch host name or address. */
  private String host = "localhost";

  private int port = EventSocketConfig.DEFAULT_PORT;

  /** Event socket password. */
  private String password = EventSocketConfig.DEFAULT_PASSWORD;

  /** Dial attempts per connect (at least 1). */
  private int reconnects = EventSocketConfig.DEFAULT_RECONNECTS;

  private Duration connectTimeout = EventSocketConfig.DEFAULT_CONNECT_TIMEOUT;

  /** Unit of the Fibonacci backoff between dial attempts. */
  private Duration backoffUnit = EventSocketConfig.DEFAULT_BACKOFF_UNIT;

  /**
   * Pool capacity.
   *
   * <p>Valid range: 1-64. Values outside this range are clamped.
   */
  private int maxConnections = DEFAULT_CONNECTIONS;

  /** Start each new connection's event reader before handing it out. */
  private boolean eagerStreaming = true;

  /** Metrics dimension and thread-name component. */
  private String connectionName = EventSocketConfig.DEFAULT_CONNECTION_NAME;

  /** Event filters (header name to value), installed in declaration order. */
  private Map<String, String> filters = new LinkedHashMap<>();

  /**
   * Sets the pool capacity, clamping to valid range [MIN_CONNECTIONS, MAX_CONNECTIONS].
   *
   * @param maxConnections requested capacity
   */
  public void setMaxConnections(final int maxConnections) {
    this.maxConnections = Math.max(MIN_CONNECTIONS, Math.min(maxConnections, MAX_CONNECTIONS));
  }
}
