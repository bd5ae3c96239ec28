/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.macstab.oss.fsock.error.EventSocketException;
import com.macstab.oss.fsock.metrics.EventSocketMetrics;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded pool of event socket connections with blocking admission.
 *
 * <p><strong>Accounting:</strong> {@code maxConnections} creation permits exist at construction.
 * A permit is spent when a connection is created and earned back when a broken connection is
 * discarded:
 *
 * <pre>
 * idle + inUse + permits == maxConnections      (always, under lock)
 *
 * acquire:  idle → inUse                        (reuse)
 *           permits → inUse                     (create; permit returned if creation fails)
 *           otherwise wait
 * release:  inUse → idle                        (still connected)
 *           inUse → permits                     (disconnected, closed)
 *           anything not in inUse               → IllegalArgumentException
 * </pre>
 *
 * <p>Connections are created lazily, on the acquiring thread and outside the lock, so a slow
 * handshake never blocks other acquirers that could reuse an idle connection.
 *
 * <p><strong>Liveness:</strong> the pool trusts {@link EventSocketConnection#isConnected()} at
 * release time. A connection whose reader has given up after a failed reconnect reports false and
 * is replaced on a later acquire.
 *
 * <p>There is no acquire timeout: callers that need one interrupt the waiting thread.
 */
@Slf4j
public final class EventSocketPool implements AutoCloseable {

  private final EventSocketConfig config;
  private final ConnectionFactory factory;
  private final EventSocketMetrics metrics;
  private final String connectionName;
  @Getter private final int maxConnections;
  @Getter private final boolean eagerStreaming;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition available = lock.newCondition();
  private final Deque<EventSocketConnection> idle;
  private final Set<EventSocketConnection> inUse =
      Collections.newSetFromMap(new IdentityHashMap<>());
  private int permits;
  private volatile boolean closed;

  /**
   * Creates an empty pool. No connection is opened until the first {@link #acquire()}.
   *
   * @param config settings for every pooled connection (validated here)
   * @param maxConnections capacity (must be &gt;= 1)
   * @param eagerStreaming start the background reader of each new connection before handing it
   *     out
   */
  public EventSocketPool(
      @NonNull final EventSocketConfig config, final int maxConnections, final boolean eagerStreaming) {
    this(config, maxConnections, eagerStreaming, ConnectionFactory.DEFAULT);
  }

  EventSocketPool(
      @NonNull final EventSocketConfig config,
      final int maxConnections,
      final boolean eagerStreaming,
      @NonNull final ConnectionFactory factory) {

    if (maxConnections < 1) {
      throw new IllegalArgumentException("maxConnections must be >= 1, got: " + maxConnections);
    }
    config.validate();

    this.config = config;
    this.factory = factory;
    this.metrics = config.getMetrics();
    this.connectionName = config.getConnectionName();
    this.maxConnections = maxConnections;
    this.eagerStreaming = eagerStreaming;
    this.idle = new ArrayDeque<>(maxConnections);
    this.permits = maxConnections;

    if (log.isInfoEnabled()) {
      log.info(
          "Created EventSocketPool for {}:{} with {} connection(s), eager streaming {} (connection: {})",
          config.getHost(),
          config.getPort(),
          maxConnections,
          eagerStreaming,
          connectionName);
    }
  }

  /**
   * Takes a connection: an idle one if available, else a new one if a permit is free, else waits.
   *
   * @return connected connection; hand it back with {@link #release(EventSocketConnection)}
   * @throws EventSocketException creating a new connection failed (its permit is returned)
   * @throws InterruptedException interrupted while waiting or during dial backoff
   * @throws IllegalStateException the pool is closed
   */
  public EventSocketConnection acquire() throws EventSocketException, InterruptedException {
    lock.lockInterruptibly();
    try {
      while (true) {
        checkNotClosed();
        final var reusable = idle.pollFirst();
        if (reusable != null) {
          inUse.add(reusable);
          publishGauges();
          return reusable;
        }
        if (permits > 0) {
          permits--;
          break;
        }
        available.await();
      }
    } finally {
      lock.unlock();
    }

    return createWithPermit();
  }

  private EventSocketConnection createWithPermit()
      throws EventSocketException, InterruptedException {
    EventSocketConnection connection = null;
    try {
      connection = factory.create(config);
      if (eagerStreaming) {
        connection.startStreaming();
      }
    } catch (final EventSocketException | InterruptedException | RuntimeException e) {
      if (connection != null) {
        connection.close();
      }
      returnPermit();
      log.warn("Creating pooled connection to {}:{} failed: {}", config.getHost(), config.getPort(), e.getMessage());
      throw e;
    }

    lock.lock();
    try {
      if (!closed) {
        inUse.add(connection);
        publishGauges();
        if (log.isDebugEnabled()) {
          log.debug("Created pooled connection {}", connection);
        }
        return connection;
      }
    } finally {
      lock.unlock();
    }

    connection.close();
    returnPermit();
    throw new IllegalStateException("EventSocketPool has been closed");
  }

  /**
   * Hands a connection back. Connected ones become idle; disconnected ones are closed and free
   * their permit. {@code null} is ignored. After {@link #close()} every released connection is
   * closed.
   *
   * @throws IllegalArgumentException the connection is not currently checked out from this pool
   *     (released twice, or never acquired here)
   */
  public void release(final EventSocketConnection connection) {
    if (connection == null) {
      return;
    }

    final boolean discard;
    lock.lock();
    try {
      if (!inUse.remove(connection)) {
        throw new IllegalArgumentException(
            "Connection " + connection + " is not checked out from this pool");
      }
      discard = closed || !connection.isConnected();
      if (discard) {
        permits++;
      } else {
        idle.addLast(connection);
      }
      publishGauges();
      available.signal();
    } finally {
      lock.unlock();
    }

    if (discard) {
      connection.close();
    }
  }

  /**
   * Closes every idle connection and wakes all waiting acquirers, which then fail with {@link
   * IllegalStateException}. Checked-out connections are closed when released. Idempotent.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }

    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      EventSocketConnection connection;
      while ((connection = idle.pollFirst()) != null) {
        connection.close();
        permits++;
      }
      available.signalAll();
    } finally {
      lock.unlock();
    }

    try {
      metrics.close(connectionName);
    } catch (final RuntimeException e) {
      log.error("Error closing metrics for {}", connectionName, e);
    }

    if (log.isInfoEnabled()) {
      log.info("Closed EventSocketPool (connection: {})", connectionName);
    }
  }

  public boolean isClosed() {
    return closed;
  }

  public int getIdleCount() {
    lock.lock();
    try {
      return idle.size();
    } finally {
      lock.unlock();
    }
  }

  public int getAvailablePermits() {
    lock.lock();
    try {
      return permits;
    } finally {
      lock.unlock();
    }
  }

  /** Connections handed out and not yet released. */
  public int getInUseCount() {
    lock.lock();
    try {
      return inUse.size();
    } finally {
      lock.unlock();
    }
  }

  // ==================== Private Methods ====================

  private void returnPermit() {
    lock.lock();
    try {
      permits++;
      publishGauges();
      available.signal();
    } finally {
      lock.unlock();
    }
  }

  /** Caller holds {@code lock}. Nothing is published once closed: the gauges are gone by then. */
  private void publishGauges() {
    if (closed) {
      return;
    }
    metrics.setPoolConnections(connectionName, idle.size(), inUse.size());
  }

  private void checkNotClosed() {
    if (closed) {
      throw new IllegalStateException("EventSocketPool has been closed");
    }
  }
}
