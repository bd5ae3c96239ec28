/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock;

import static lombok.AccessLevel.PRIVATE;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import com.macstab.oss.fsock.frame.EslHeaders;
import com.macstab.oss.fsock.metrics.EventSocketMetrics;
import com.macstab.oss.fsock.text.EventSocketText;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes event bodies to registered {@link EventHandler}s.
 *
 * <p><strong>Lookup:</strong> handlers registered under the exact {@code Event-Name} of the event;
 * only when none are registered there, handlers registered under {@code ALL}. Every handler of the
 * first matching key is submitted to the executor as its own task.
 *
 * <pre>
 * registrations: CHANNEL_ANSWER → [a, b], ALL → [c]
 *
 * CHANNEL_ANSWER  → a, b     (c not invoked)
 * CHANNEL_HANGUP  → c
 * </pre>
 *
 * <p><strong>Isolation:</strong> dispatch never waits for handlers. A handler that throws is
 * logged inside its own task; other handlers and the reader thread are unaffected.
 *
 * <p>Registrations are copied at construction and never change afterwards, so lookups need no
 * locking.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class EventDispatcher {

  Map<String, List<EventHandler>> handlers;
  Executor executor;
  EventSocketMetrics metrics;
  String connectionName;

  public EventDispatcher(
      @NonNull final Map<String, List<EventHandler>> handlers,
      @NonNull final Executor executor,
      @NonNull final EventSocketMetrics metrics,
      @NonNull final String connectionName) {

    final Map<String, List<EventHandler>> copy = new LinkedHashMap<>();
    handlers.forEach(
        (name, list) -> {
          if (list != null && !list.isEmpty()) {
            copy.put(name, List.copyOf(list));
          }
        });

    this.handlers = Map.copyOf(copy);
    this.executor = executor;
    this.metrics = metrics;
    this.connectionName = connectionName;
  }

  /** Event names with at least one registration, sorted. */
  public Set<String> getEventNames() {
    return new TreeSet<>(handlers.keySet());
  }

  public boolean hasHandlers() {
    return !handlers.isEmpty();
  }

  /**
   * Submits the event to its handlers.
   *
   * @param event raw event body
   * @return number of handler tasks submitted (0 when the event was dropped)
   */
  public int dispatch(@NonNull final String event) {
    final var eventName = EventSocketText.headerValue(event, EslHeaders.EVENT_NAME);
    final var targets = resolve(eventName);

    if (targets.isEmpty()) {
      if (log.isDebugEnabled()) {
        log.debug("No handler for event <{}> on {}, dropping", eventName, connectionName);
      }
      metrics.recordEventDropped(connectionName, eventName);
      return 0;
    }

    int submitted = 0;
    for (final var handler : targets) {
      try {
        executor.execute(() -> invoke(handler, eventName, event));
        submitted++;
      } catch (final RejectedExecutionException e) {
        log.error("Dispatch executor rejected handler for event <{}> on {}", eventName, connectionName, e);
      }
    }

    metrics.recordEventDispatched(connectionName, eventName, submitted);
    return submitted;
  }

  private List<EventHandler> resolve(final String eventName) {
    final var exact = handlers.get(eventName);
    if (exact != null && !exact.isEmpty()) {
      return exact;
    }
    return handlers.getOrDefault(EslHeaders.ALL_EVENTS, List.of());
  }

  private void invoke(final EventHandler handler, final String eventName, final String event) {
    try {
      handler.onEvent(event);
    } catch (final RuntimeException e) {
      log.error("Event handler failed for event <{}> on {}", eventName, connectionName, e);
    }
  }

  /**
   * Process-wide executor used when a configuration names none: cached pool of daemon threads
   * named {@code fsock-dispatch-N}.
   */
  static Executor defaultExecutor() {
    return DefaultExecutorHolder.INSTANCE;
  }

  private static final class DefaultExecutorHolder {

    static final ExecutorService INSTANCE = Executors.newCachedThreadPool(new DispatchThreadFactory());
  }

  private static final class DispatchThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(final Runnable task) {
      final var thread = new Thread(task, "fsock-dispatch-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
