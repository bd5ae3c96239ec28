/* (C)2026 Macstab GmbH */

/**
 * Core event socket client (NO Spring dependencies).
 *
 * <h2>Purpose</h2>
 *
 * <p>Talks the inbound event socket protocol of a FreeSWITCH switch: one TCP connection carries
 * synchronous command replies and an unbounded stream of asynchronous events, framed as header
 * blocks with optional bodies.
 *
 * <h2>Core Problem: One Stream, Three Consumers</h2>
 *
 * <pre>{@code
 * → api status                          (caller thread A)
 * ← Content-Type: text/event-plain      (event, nobody asked for it)
 * ← Content-Type: api/response          (reply for A)
 * → sendmsg <uuid> ...                  (caller thread B)
 * ← Content-Type: command/reply         (reply for B)
 * }</pre>
 *
 * <p>The protocol has no request ids. Replies are matched by content type and order, so one
 * reader must own the stream and hand replies to the single caller waiting on each reply type.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────┐
 * │ Application threads                                    │
 * └───────────────┬───────────────────────────────────────┘
 *                 ↓ acquire / release
 * ┌───────────────────────────────────────────────────────┐
 * │ EventSocketPool (permits + idle deque)                 │
 * │   └─→ EventSocketConnection[0..N-1]                    │
 * │         ├─→ FrameReader (header block + body)          │
 * │         ├─→ reader thread → api / command hand-offs    │
 * │         └─→ EventDispatcher → executor → EventHandler  │
 * └───────────────┬───────────────────────────────────────┘
 *                 ↓ N TCP connections
 * ┌───────────────────────────────────────────────────────┐
 * │ FreeSWITCH mod_event_socket (port 8021)                │
 * └───────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Key Components</h2>
 *
 * <dl>
 *   <dt>{@link com.macstab.oss.fsock.EventSocketConnection}
 *   <dd>Handshake, Fibonacci-backoff reconnect, demultiplexing reader, commands.
 *   <dt>{@link com.macstab.oss.fsock.EventSocketPool}
 *   <dd>Bounded pool with blocking admission. Thread-safe.
 *   <dt>{@link com.macstab.oss.fsock.EventDispatcher}
 *   <dd>Event name to handlers, asynchronous and failure-isolated.
 *   <dt>{@link com.macstab.oss.fsock.frame.FrameReader}
 *   <dd>Wire framing.
 *   <dt>{@link com.macstab.oss.fsock.text.EventSocketText}
 *   <dd>Header extraction, url decoding, tabular output parsing.
 * </dl>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EventSocketConfig config = EventSocketConfig.builder()
 *     .host("10.0.0.5")
 *     .eventHandler("CHANNEL_HANGUP", List.of(event -> log.info("hangup: {}", event)))
 *     .build();
 *
 * try (EventSocketPool pool = new EventSocketPool(config, 4, true)) {
 *   EventSocketConnection connection = pool.acquire();
 *   try {
 *     String status = connection.sendApiCommand("status");
 *   } finally {
 *     pool.release(connection);
 *   }
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <ul>
 *   <li>{@code EventSocketPool}: thread-safe.
 *   <li>{@code EventSocketConnection}: thread-safe; commands on one connection are serialized.
 *       Use the pool for parallelism.
 *   <li>{@code EventDispatcher}, {@code FrameReader}, {@code EventSocketText}: stateless after
 *       construction.
 *   <li>{@code FibonacciBackoff}: not thread-safe, one instance per connect.
 * </ul>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 * @see com.macstab.oss.fsock.EventSocketPool
 */
package com.macstab.oss.fsock;
