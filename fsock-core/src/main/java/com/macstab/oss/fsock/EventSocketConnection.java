/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.Map;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import com.macstab.oss.fsock.error.CommandFailedException;
import com.macstab.oss.fsock.error.EventSocketException;
import com.macstab.oss.fsock.error.ProtocolException;
import com.macstab.oss.fsock.error.TransportException;
import com.macstab.oss.fsock.frame.EslHeaders;
import com.macstab.oss.fsock.frame.Frame;
import com.macstab.oss.fsock.frame.FrameReader;
import com.macstab.oss.fsock.metrics.EventSocketMetrics;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * One authenticated event socket session with reconnect and reply/event demultiplexing.
 *
 * <p><strong>Handshake</strong> (every {@link #connect()}, including reconnects):
 *
 * <pre>
 * ← Content-Type: auth/request
 * → auth ClueCon
 * ← Content-Type: command/reply / Reply-Text: +OK accepted
 * → event plain CHANNEL_ANSWER CHANNEL_HANGUP     (or "event plain all"; skipped without handlers)
 * ← Reply-Text: +OK ...
 * → filter Event-Name CHANNEL_ANSWER              (one per filter, in order)
 * ← Reply-Text: +OK ...
 * </pre>
 *
 * <p>The socket is published only after the handshake completed, so {@link #isConnected()} implies
 * an authenticated, subscribed session. Any read or write failure closes the socket and clears the
 * reference before the error reaches the caller.
 *
 * <p><strong>Demultiplexing:</strong> while the background reader runs ({@link #startStreaming()}
 * or {@link #readEvents()}) it owns the input stream and routes each frame by {@code Content-Type}:
 *
 * <ul>
 *   <li>{@code api/response} → body handed to the caller of {@link #sendApiCommand(String)}
 *   <li>{@code command/reply} → {@code Reply-Text} handed to the caller of {@link
 *       #sendCommand(String)} or {@link #sendMessage(String, Map)}
 *   <li>{@code text/disconnect-notice} → logged; the close that follows triggers a reconnect
 *   <li>anything with a body → {@link EventDispatcher}
 * </ul>
 *
 * <p>Replies travel through {@link SynchronousQueue} hand-offs. Replies of one type arrive in the
 * order their commands were written, so each caller takes a ticket before writing and the reader
 * numbers replies as they arrive; a caller only accepts the reply carrying its ticket. Replies of
 * callers that gave up (interrupted) are discarded instead of reaching the next caller. Without a
 * background reader the calling thread reads frames itself until its reply arrives, dispatching
 * events it meets on the way.
 *
 * <p><strong>Concurrency:</strong> commands are serialized per connection ({@code commandLock});
 * writes are serialized separately ({@code writeLock}) because the reader thread writes during a
 * reconnect handshake. {@code connect()} calls are serialized by {@code lifecycleLock}.
 *
 * <p><strong>Reconnect:</strong> a read failure in the background reader triggers one {@code
 * connect()} (up to {@code reconnects} dial attempts with Fibonacci backoff). If that fails the
 * reader ends and the connection stays disconnected; a pool discards it on release.
 */
@Slf4j
public final class EventSocketConnection implements AutoCloseable {

  private static final AtomicInteger READER_THREAD_IDS = new AtomicInteger();

  /** Poll interval of callers waiting on a reply channel; liveness is re-checked between polls. */
  private static final long REPLY_POLL_MILLIS = 200;

  /** Upper bound for handing a reply to its caller before the reader discards it. */
  private static final long REPLY_HANDOFF_MILLIS = 5_000;

  @Getter private final EventSocketConfig config;
  @Getter private final String connectionName;
  private final EventSocketMetrics metrics;
  private final FrameReader frameReader;
  private final EventDispatcher dispatcher;
  private final Sleeper sleeper;

  private final ReentrantLock lifecycleLock = new ReentrantLock();
  private final ReentrantLock commandLock = new ReentrantLock();
  private final ReentrantLock writeLock = new ReentrantLock();

  private final ReplyChannel apiReplies = new ReplyChannel();
  private final ReplyChannel commandReplies = new ReplyChannel();

  private final AtomicReference<Session> session = new AtomicReference<>();
  private final AtomicBoolean streamingRequested = new AtomicBoolean();

  @Getter private volatile ConnectionState state = ConnectionState.DISCONNECTED;
  private volatile boolean readerActive;
  private volatile boolean closed;
  private volatile long generation;

  /**
   * Creates a disconnected connection. Call {@link #connect()} before issuing commands.
   *
   * @param config connection settings (validated here)
   */
  public EventSocketConnection(@NonNull final EventSocketConfig config) {
    this(config, Sleeper.SYSTEM);
  }

  EventSocketConnection(@NonNull final EventSocketConfig config, @NonNull final Sleeper sleeper) {
    config.validate();

    this.config = config;
    this.connectionName = config.getConnectionName();
    this.metrics = config.getMetrics();
    this.frameReader = new FrameReader();
    this.sleeper = sleeper;

    final var executor =
        config.getDispatchExecutor() != null
            ? config.getDispatchExecutor()
            : EventDispatcher.defaultExecutor();
    this.dispatcher =
        new EventDispatcher(config.getEventHandlers(), executor, metrics, connectionName);
  }

  /**
   * Creates a connection and connects it (dial, authenticate, subscribe, filter).
   *
   * @param config connection settings
   * @return connected connection in state {@link ConnectionState#READY}
   * @throws EventSocketException dial attempts exhausted or handshake rejected
   * @throws InterruptedException interrupted during a backoff sleep
   */
  public static EventSocketConnection open(@NonNull final EventSocketConfig config)
      throws EventSocketException, InterruptedException {
    final var connection = new EventSocketConnection(config);
    connection.connect();
    return connection;
  }

  // ==================== Lifecycle ====================

  /**
   * Connects, replacing a live session if there is one.
   *
   * <p>Makes exactly {@code reconnects} dial attempts, sleeping {@code 1, 1, 2, 3, 5, ...} backoff
   * units between them (none after the last). Handshake failures after a successful dial are not
   * retried.
   *
   * @throws TransportException every dial attempt failed (carries the last dial error)
   * @throws ProtocolException no challenge, authentication rejected, subscription or filter refused
   * @throws EventSocketException the handshake hit a malformed frame
   * @throws InterruptedException interrupted during a backoff sleep
   * @throws IllegalStateException the connection was closed
   */
  public void connect() throws EventSocketException, InterruptedException {
    checkNotClosed();

    lifecycleLock.lock();
    try {
      if (isConnected()) {
        disconnect();
      }

      state = ConnectionState.CONNECTING;
      final var candidate = dial();

      try {
        handshake(candidate);
      } catch (final EventSocketException e) {
        candidate.close();
        markDisconnected();
        metrics.recordHandshake(connectionName, false);
        log.warn("Handshake with {} failed: {}", address(), e.getMessage());
        throw e;
      }

      generation++;
      apiReplies.resync();
      commandReplies.resync();
      session.set(candidate);
      state = readerActive ? ConnectionState.STREAMING : ConnectionState.READY;
      metrics.recordHandshake(connectionName, true);

      if (closed) {
        disconnect();
        throw new TransportException("Connection closed while connecting to " + address());
      }

      if (log.isInfoEnabled()) {
        log.info("Connected to {} (connection: {})", address(), connectionName);
      }
    } finally {
      lifecycleLock.unlock();
    }
  }

  /** Closes the socket if open. Idempotent; a closed connection stays {@code CLOSED}. */
  public void disconnect() {
    final var current = session.getAndSet(null);
    markDisconnected();
    if (current != null) {
      current.close();
      if (log.isInfoEnabled()) {
        log.info("Disconnected from {} (connection: {})", address(), connectionName);
      }
    }
  }

  /** Whether a handshaken socket is live. */
  public boolean isConnected() {
    return session.get() != null;
  }

  /** Whether a background reader currently owns the input stream. */
  public boolean isStreaming() {
    return readerActive;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Closes the connection for good: no reconnects, socket closed, state {@code CLOSED}. A running
   * reader ends on its next read. Idempotent.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    disconnect();
    state = ConnectionState.CLOSED;
  }

  // ==================== Demultiplexer ====================

  /**
   * Starts the background reader on a daemon thread named {@code fsock-events-<name>-<n>}. No-op
   * while a reader is already running.
   */
  public void startStreaming() {
    checkNotClosed();
    if (!streamingRequested.compareAndSet(false, true)) {
      return;
    }
    final var thread =
        new Thread(
            this::runReader,
            "fsock-events-" + connectionName + "-" + READER_THREAD_IDS.incrementAndGet());
    thread.setDaemon(true);
    thread.start();
  }

  /**
   * Runs the reader on the calling thread until the connection is closed or a reconnect fails.
   * Returns immediately when a reader is already running.
   */
  public void readEvents() {
    checkNotClosed();
    if (!streamingRequested.compareAndSet(false, true)) {
      log.warn("Event reader already running on {}", connectionName);
      return;
    }
    runReader();
  }

  private void runReader() {
    // In-flight direct-read commands finish before the reader takes over the stream
    commandLock.lock();
    try {
      apiReplies.resync();
      commandReplies.resync();
      readerActive = true;
      if (isConnected()) {
        state = ConnectionState.STREAMING;
      }
    } finally {
      commandLock.unlock();
    }

    if (log.isInfoEnabled()) {
      log.info("Event reader started (connection: {})", connectionName);
    }

    try {
      while (!closed) {
        final var current = session.get();
        try {
          if (current == null) {
            throw new TransportException("Not connected");
          }
          route(readFrame(current));
        } catch (final EventSocketException e) {
          if (closed || !reconnect(e)) {
            break;
          }
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          log.warn("Event reader interrupted (connection: {})", connectionName);
          break;
        }
      }
    } finally {
      readerActive = false;
      streamingRequested.set(false);
      if (isConnected()) {
        state = ConnectionState.READY;
      }
      if (log.isInfoEnabled()) {
        log.info("Event reader stopped (connection: {})", connectionName);
      }
    }
  }

  private boolean reconnect(final EventSocketException cause) {
    log.warn("Reading from {} failed: {}. Reconnecting", address(), cause.getMessage());
    try {
      connect();
      metrics.recordReconnect(connectionName, true);
      return true;
    } catch (final EventSocketException e) {
      metrics.recordReconnect(connectionName, false);
      log.error(
          "Reconnect to {} failed, event reader stops (connection: {})",
          address(),
          connectionName,
          e);
      return false;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (final IllegalStateException e) {
      // closed concurrently
      return false;
    }
  }

  private void route(final Frame frame) throws InterruptedException {
    final var contentType = frame.getContentType();
    if (EslHeaders.API_RESPONSE.equals(contentType)) {
      handOff(apiReplies, frame.getBodyAsString());
    } else if (EslHeaders.COMMAND_REPLY.equals(contentType)) {
      handOff(commandReplies, frame.header(EslHeaders.REPLY_TEXT).orElse(""));
    } else {
      handleUnsolicited(frame);
    }
  }

  private void handOff(final ReplyChannel channel, final String reply)
      throws InterruptedException {
    final var sequence = channel.routed.getAndIncrement();
    if (sequence <= channel.abandoned.get()) {
      if (log.isDebugEnabled()) {
        log.debug(
            "Discarding reply of abandoned command on {}: {}", connectionName, abbreviate(reply));
      }
      return;
    }
    if (!channel.queue.offer(new Reply(sequence, reply), REPLY_HANDOFF_MILLIS, MILLISECONDS)) {
      log.warn("Discarding unclaimed reply on {}: {}", connectionName, abbreviate(reply));
    }
  }

  private void handleUnsolicited(final Frame frame) {
    final var contentType = frame.getContentType();
    if (EslHeaders.DISCONNECT_NOTICE.equals(contentType)) {
      log.warn("Disconnect notice from {} (connection: {})", address(), connectionName);
    } else if (frame.hasBody()) {
      dispatcher.dispatch(frame.getBodyAsString());
    } else if (log.isDebugEnabled()) {
      log.debug("Ignoring frame without body on {}: {}", connectionName, frame);
    }
  }

  // ==================== Commands ====================

  /**
   * Runs {@code api <command>} and returns the response body.
   *
   * @throws CommandFailedException body starts with {@code -ERR}
   * @throws TransportException not connected, write failed, or connection lost before the reply
   */
  public String sendApiCommand(@NonNull final String command)
      throws EventSocketException, InterruptedException {
    final var body = request("api", "api " + command, EslHeaders.API_RESPONSE, apiReplies);
    if (body.startsWith(EslHeaders.ERR)) {
      throw new CommandFailedException(command, body.trim());
    }
    return body;
  }

  /**
   * Sends a raw command ({@code bgapi ...}, {@code log ...}, {@code nixevent ...}) and returns its
   * {@code Reply-Text}.
   *
   * @throws CommandFailedException reply starts with {@code -ERR}
   */
  public String sendCommand(@NonNull final String command)
      throws EventSocketException, InterruptedException {
    final var reply = request("command", command, EslHeaders.COMMAND_REPLY, commandReplies);
    if (reply.startsWith(EslHeaders.ERR)) {
      throw new CommandFailedException(command, reply);
    }
    return reply;
  }

  /**
   * Sends {@code sendmsg} to a channel.
   *
   * <pre>
   * sendmsg 6b1e...
   * call-command:execute
   * execute-app-name:playback
   * execute-app-arg:/tmp/hello.wav
   * </pre>
   *
   * @param uuid channel unique id
   * @param arguments message headers, written in iteration order
   * @throws IllegalArgumentException {@code arguments} is empty
   * @throws CommandFailedException reply starts with {@code -ERR}
   */
  public void sendMessage(@NonNull final String uuid, @NonNull final Map<String, String> arguments)
      throws EventSocketException, InterruptedException {
    if (arguments.isEmpty()) {
      throw new IllegalArgumentException("sendmsg needs at least one argument");
    }

    final var command = new StringBuilder("sendmsg ").append(uuid);
    arguments.forEach((name, value) -> command.append('\n').append(name).append(':').append(value));

    final var reply =
        request("sendmsg", command.toString(), EslHeaders.COMMAND_REPLY, commandReplies);
    if (reply.startsWith(EslHeaders.ERR)) {
      throw new CommandFailedException("sendmsg " + uuid, reply);
    }
  }

  private String request(
      final String kind,
      final String command,
      final String expectedContentType,
      final ReplyChannel channel)
      throws EventSocketException, InterruptedException {

    commandLock.lockInterruptibly();
    try {
      final var current = session.get();
      if (current == null) {
        throw new TransportException("Not connected");
      }

      final var sentOnGeneration = generation;
      final var streaming = readerActive;
      final var ticket = streaming ? channel.issued.getAndIncrement() : -1L;
      write(current, command);

      final var reply =
          streaming
              ? awaitReply(channel, ticket, sentOnGeneration)
              : readReply(current, expectedContentType);

      metrics.recordCommand(connectionName, kind, !reply.startsWith(EslHeaders.ERR));
      return reply;
    } catch (final EventSocketException e) {
      metrics.recordCommand(connectionName, kind, false);
      throw e;
    } finally {
      commandLock.unlock();
    }
  }

  private String awaitReply(
      final ReplyChannel channel, final long ticket, final long sentOnGeneration)
      throws TransportException, InterruptedException {
    try {
      while (true) {
        final var reply = channel.queue.poll(REPLY_POLL_MILLIS, MILLISECONDS);
        if (reply != null) {
          if (reply.sequence == ticket) {
            return reply.text;
          }
          if (reply.sequence > ticket) {
            throw new TransportException("Reply stream out of order on " + connectionName);
          }
          if (log.isDebugEnabled()) {
            log.debug("Skipping stale reply on {}: {}", connectionName, abbreviate(reply.text));
          }
          continue;
        }
        if (!readerActive || !isConnected() || generation != sentOnGeneration) {
          throw new TransportException("Connection lost while waiting for reply");
        }
      }
    } catch (final InterruptedException e) {
      channel.abandon(ticket);
      throw e;
    }
  }

  /** Direct-read mode: this thread owns the stream until its reply arrives. */
  private String readReply(final Session current, final String expectedContentType)
      throws EventSocketException {
    while (true) {
      final var frame = readFrame(current);
      final var contentType = frame.getContentType();

      if (expectedContentType.equals(contentType)) {
        return EslHeaders.API_RESPONSE.equals(contentType)
            ? frame.getBodyAsString()
            : frame.header(EslHeaders.REPLY_TEXT).orElse("");
      }

      if (EslHeaders.API_RESPONSE.equals(contentType)
          || EslHeaders.COMMAND_REPLY.equals(contentType)) {
        if (log.isDebugEnabled()) {
          log.debug("Discarding unexpected {} on {}", contentType, connectionName);
        }
      } else {
        handleUnsolicited(frame);
      }
    }
  }

  // ==================== Handshake ====================

  private Session dial() throws TransportException, InterruptedException {
    final var backoff = new FibonacciBackoff(config.getBackoffUnit());
    final var attempts = config.getReconnects();
    final var timeoutMillis =
        (int) Math.min(Integer.MAX_VALUE, config.getConnectTimeout().toMillis());

    IOException lastError = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      final var socket = new Socket();
      try {
        socket.connect(new InetSocketAddress(config.getHost(), config.getPort()), timeoutMillis);
        socket.setTcpNoDelay(true);
        return new Session(socket);
      } catch (final IOException e) {
        lastError = e;
        closeSocket(socket);
        metrics.recordDialFailure(connectionName);
        log.warn("Dial attempt {}/{} to {} failed: {}", attempt, attempts, address(), e.getMessage());
        if (attempt < attempts) {
          sleeper.sleep(backoff.nextDelay());
        }
      }
    }

    markDisconnected();
    throw new TransportException(
        "Could not connect to " + address() + " after " + attempts + " attempt(s)", lastError);
  }

  private void handshake(final Session candidate) throws EventSocketException {
    state = ConnectionState.AUTHENTICATING;
    authenticate(candidate);

    state = ConnectionState.SUBSCRIBING;
    subscribe(candidate);

    state = ConnectionState.FILTERING;
    for (final var filter : config.getEventFilters().entrySet()) {
      final var reply =
          handshakeReply(candidate, "filter " + filter.getKey() + " " + filter.getValue());
      if (!reply.startsWith(EslHeaders.OK)) {
        throw new ProtocolException(
            "Unexpected filter reply for <" + filter.getKey() + ">: " + reply);
      }
    }
  }

  private void authenticate(final Session candidate) throws EventSocketException {
    final Frame challenge;
    try {
      challenge = readFrame(candidate);
    } catch (final EventSocketException e) {
      throw new ProtocolException("No auth challenge received", e);
    }
    if (!EslHeaders.AUTH_REQUEST.equals(challenge.getContentType())) {
      throw new ProtocolException(
          "No auth challenge received, got <" + challenge.getContentType() + ">");
    }

    write(candidate, "auth " + config.getPassword());
    final var reply = readCommandReply(candidate);
    if (!reply.startsWith(EslHeaders.AUTH_ACCEPTED)) {
      throw new ProtocolException("Unexpected auth reply received: " + reply);
    }
  }

  private void subscribe(final Session candidate) throws EventSocketException {
    if (!dispatcher.hasHandlers()) {
      return;
    }
    final var names = dispatcher.getEventNames();
    final var command =
        names.contains(EslHeaders.ALL_EVENTS)
            ? "event plain all"
            : "event plain " + String.join(" ", names);

    final var reply = handshakeReply(candidate, command);
    if (!reply.startsWith(EslHeaders.OK)) {
      throw new ProtocolException("Unexpected events-subscribe reply received: " + reply);
    }
  }

  private String handshakeReply(final Session candidate, final String command)
      throws EventSocketException {
    write(candidate, command);
    return readCommandReply(candidate);
  }

  private String readCommandReply(final Session candidate) throws EventSocketException {
    final var frame = readFrame(candidate);
    if (!EslHeaders.COMMAND_REPLY.equals(frame.getContentType())) {
      throw new ProtocolException(
          "Expected " + EslHeaders.COMMAND_REPLY + ", got <" + frame.getContentType() + ">");
    }
    return frame.header(EslHeaders.REPLY_TEXT).orElse("");
  }

  // ==================== I/O ====================

  /** Every frame read goes through here: a failed read tears the session down before rethrowing. */
  private Frame readFrame(final Session current) throws EventSocketException {
    try {
      return frameReader.readFrame(current.in);
    } catch (final EventSocketException e) {
      drop(current);
      throw e;
    }
  }

  private void write(final Session current, final String command) throws TransportException {
    writeLock.lock();
    try {
      current.out.write((command + "\n\n").getBytes(UTF_8));
      current.out.flush();
    } catch (final IOException e) {
      drop(current);
      throw new TransportException("Error writing <" + verb(command) + "> to " + address(), e);
    } finally {
      writeLock.unlock();
    }
  }

  private void drop(final Session current) {
    if (session.compareAndSet(current, null)) {
      markDisconnected();
    }
    current.close();
  }

  private void markDisconnected() {
    if (state != ConnectionState.CLOSED) {
      state = closed ? ConnectionState.CLOSED : ConnectionState.DISCONNECTED;
    }
  }

  private void checkNotClosed() {
    if (closed) {
      throw new IllegalStateException("EventSocketConnection " + connectionName + " is closed");
    }
  }

  private String address() {
    return config.getHost() + ":" + config.getPort();
  }

  private static String verb(final String command) {
    final int space = command.indexOf(' ');
    return space < 0 ? command : command.substring(0, space);
  }

  private static String abbreviate(final String reply) {
    return reply.length() <= 80 ? reply : reply.substring(0, 80) + "...";
  }

  private static void closeSocket(final Socket socket) {
    try {
      socket.close();
    } catch (final IOException e) {
      log.debug("Error closing socket", e);
    }
  }

  @Override
  public String toString() {
    return "EventSocketConnection[" + connectionName + ", " + address() + ", " + state + "]";
  }

  /**
   * Hand-off for one reply type. {@code issued} counts tickets taken by callers, {@code routed}
   * counts replies the reader received; both restart together on every new session or reader.
   * Tickets up to {@code abandoned} belong to callers that stopped waiting.
   */
  private static final class ReplyChannel {

    private final SynchronousQueue<Reply> queue = new SynchronousQueue<>();
    private final AtomicLong issued = new AtomicLong();
    private final AtomicLong routed = new AtomicLong();
    private final AtomicLong abandoned = new AtomicLong(-1);

    void abandon(final long ticket) {
      abandoned.accumulateAndGet(ticket, Math::max);
    }

    void resync() {
      final var next = issued.get();
      routed.set(next);
      abandoned.set(next - 1);
    }
  }

  private static final class Reply {

    private final long sequence;
    private final String text;

    Reply(final long sequence, final String text) {
      this.sequence = sequence;
      this.text = text;
    }
  }

  /** Socket plus its buffered streams. Replaced on every connect. */
  private static final class Session {

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;

    Session(final Socket socket) throws IOException {
      this.socket = socket;
      this.in = new BufferedInputStream(socket.getInputStream(), 8192);
      this.out = new BufferedOutputStream(socket.getOutputStream());
    }

    void close() {
      closeSocket(socket);
    }
  }
}
