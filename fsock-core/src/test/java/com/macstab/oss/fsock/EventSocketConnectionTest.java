/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.fsock.error.CommandFailedException;
import com.macstab.oss.fsock.error.MalformedFrameException;
import com.macstab.oss.fsock.error.ProtocolException;
import com.macstab.oss.fsock.error.TransportException;
import com.macstab.oss.fsock.metrics.EventSocketMetrics;
import com.macstab.oss.fsock.support.FakeEventSocketServer;

/**
 * Tests for {@link EventSocketConnection} against an in-process {@link FakeEventSocketServer}.
 *
 * <p><strong>What we're testing:</strong>
 *
 * <ul>
 *   <li>Handshake order and content (auth, subscription, filters) and its failure modes
 *   <li>Dial retries with Fibonacci backoff, exact attempt count
 *   <li>Commands with and without the background reader
 *   <li>Event delivery, reconnect after a dropped socket, close semantics
 * </ul>
 */
@DisplayName("EventSocketConnection")
class EventSocketConnectionTest {

  private static final String ANSWER_EVENT = "Event-Name: CHANNEL_ANSWER\nUnique-ID: 6b1e\n";

  /** Announces 50 body bytes, delivers five. */
  private static final String TRUNCATED_REPLY =
      "Content-Type: api/response\nContent-Length: 50\n\nshort";

  private FakeEventSocketServer server;
  private final List<String> received = new CopyOnWriteArrayList<>();
  private final List<EventSocketConnection> opened = new ArrayList<>();

  @BeforeEach
  void setUp() throws IOException {
    server = new FakeEventSocketServer();
  }

  @AfterEach
  void tearDown() {
    opened.forEach(EventSocketConnection::close);
    server.close();
  }

  private EventSocketConfig.EventSocketConfigBuilder config() {
    return EventSocketConfig.builder()
        .host(server.getHost())
        .port(server.getPort())
        .reconnects(1)
        .connectTimeout(Duration.ofSeconds(2))
        .backoffUnit(Duration.ofMillis(10))
        .connectionName("test")
        .dispatchExecutor(Runnable::run);
  }

  private static void pause(final long millis) {
    try {
      Thread.sleep(millis);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private EventHandler recording(final String tag) {
    return event -> received.add(tag + ":" + event);
  }

  private EventSocketConnection track(final EventSocketConnection connection) {
    opened.add(connection);
    return connection;
  }

  private EventSocketConnection connected(final EventSocketConfig config) throws Exception {
    return track(EventSocketConnection.open(config));
  }

  @Nested
  @DisplayName("Handshake")
  class Handshake {

    @Test
    @DisplayName("Authenticates, subscribes sorted event names, installs filters in order")
    void connect_SendsAuthSubscribeFilters() throws Exception {
      // Arrange
      final var config =
          config()
              .eventHandler("CHANNEL_HANGUP", List.of(recording("h")))
              .eventHandler("CHANNEL_ANSWER", List.of(recording("a")))
              .eventFilter("Event-Name", "CHANNEL_ANSWER")
              .eventFilter("Unique-ID", "6b1e")
              .build();

      // Act
      final var connection = connected(config);

      // Assert
      assertThat(connection.isConnected()).isTrue();
      assertThat(connection.getState()).isEqualTo(ConnectionState.READY);
      assertThat(server.getCommands())
          .containsExactly(
              "auth ClueCon",
              "event plain CHANNEL_ANSWER CHANNEL_HANGUP",
              "filter Event-Name CHANNEL_ANSWER",
              "filter Unique-ID 6b1e");
    }

    @Test
    @DisplayName("Wildcard registration subscribes to all events")
    void connect_WildcardHandler_EventPlainAll() throws Exception {
      // Arrange
      final var config =
          config()
              .eventHandler("CHANNEL_ANSWER", List.of(recording("a")))
              .eventHandler("ALL", List.of(recording("all")))
              .build();

      // Act
      connected(config);

      // Assert
      assertThat(server.getCommands("event")).containsExactly("event plain all");
    }

    @Test
    @DisplayName("No handlers, no subscription command")
    void connect_NoHandlers_OnlyAuth() throws Exception {
      // Act
      connected(config().build());

      // Assert
      assertThat(server.getCommands()).containsExactly("auth ClueCon");
    }

    @Test
    @DisplayName("Rejected password leaves the connection disconnected")
    void connect_WrongPassword_ProtocolException() {
      // Arrange
      server.setPassword("secret");
      final var connection = track(new EventSocketConnection(config().build()));

      // Act & Assert
      assertThatThrownBy(connection::connect)
          .isInstanceOf(ProtocolException.class)
          .hasMessageContaining("-ERR invalid");
      assertThat(connection.isConnected()).isFalse();
      assertThat(connection.getState()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    @DisplayName("Missing challenge is a protocol error")
    void connect_NoChallenge_ProtocolException() {
      // Arrange
      server.setChallengeContentType("text/disconnect-notice");
      final var connection = track(new EventSocketConnection(config().build()));

      // Act & Assert
      assertThatThrownBy(connection::connect)
          .isInstanceOf(ProtocolException.class)
          .hasMessageContaining("No auth challenge");
      assertThat(server.getCommands()).isEmpty();
    }

    @Test
    @DisplayName("Refused subscription disconnects")
    void connect_SubscriptionRefused_ProtocolException() {
      // Arrange
      server.setSubscribeReply("-ERR no keywords supplied");
      final var connection =
          track(
              new EventSocketConnection(
                  config().eventHandler("CHANNEL_ANSWER", List.of(recording("a"))).build()));

      // Act & Assert
      assertThatThrownBy(connection::connect)
          .isInstanceOf(ProtocolException.class)
          .hasMessageContaining("events-subscribe");
      assertThat(connection.isConnected()).isFalse();
    }

    @Test
    @DisplayName("Refused filter disconnects")
    void connect_FilterRefused_ProtocolException() {
      // Arrange
      server.setFilterReply("-ERR invalid filter");
      final var connection =
          track(new EventSocketConnection(config().eventFilter("Event-Name", "X").build()));

      // Act & Assert
      assertThatThrownBy(connection::connect)
          .isInstanceOf(ProtocolException.class)
          .hasMessageContaining("Event-Name");
      assertThat(connection.isConnected()).isFalse();
    }

    @Test
    @DisplayName("Connecting again replaces the live socket")
    void connect_WhileConnected_Replaces() throws Exception {
      // Arrange
      final var connection = connected(config().build());

      // Act
      connection.connect();

      // Assert
      assertThat(connection.isConnected()).isTrue();
      assertThat(server.getAcceptedConnections()).isEqualTo(2);
      await().atMost(10, SECONDS).until(() -> server.getOpenClients() == 1);
    }

    @Test
    @DisplayName("Handshake outcome is reported to metrics")
    void connect_RecordsHandshake() throws Exception {
      // Arrange
      final var metrics = mock(EventSocketMetrics.class);

      // Act
      connected(config().metrics(metrics).build());

      // Assert
      verify(metrics).recordHandshake("test", true);
    }
  }

  @Nested
  @DisplayName("Dialing")
  class Dialing {

    @Test
    @DisplayName("Exactly `reconnects` attempts with 1, 1, 2, 3 unit sleeps in between")
    void connect_NothingListening_FibonacciBackoff() throws Exception {
      // Arrange
      final int port;
      try (var unused = new ServerSocket(0)) {
        port = unused.getLocalPort();
      }
      final List<Duration> sleeps = new CopyOnWriteArrayList<>();
      final var metrics = mock(EventSocketMetrics.class);
      final var config =
          config()
              .port(port)
              .reconnects(5)
              .backoffUnit(Duration.ofSeconds(1))
              .metrics(metrics)
              .build();
      final var connection = track(new EventSocketConnection(config, sleeps::add));

      // Act & Assert
      assertThatThrownBy(connection::connect)
          .isInstanceOf(TransportException.class)
          .hasMessageContaining("5 attempt(s)")
          .hasCauseInstanceOf(IOException.class);
      assertThat(sleeps)
          .containsExactly(
              Duration.ofSeconds(1),
              Duration.ofSeconds(1),
              Duration.ofSeconds(2),
              Duration.ofSeconds(3));
      verify(metrics, times(5)).recordDialFailure("test");
      assertThat(connection.getState()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    @DisplayName("Backoff restarts on every connect call")
    void connect_Twice_BackoffRestarts() throws Exception {
      // Arrange
      final int port;
      try (var unused = new ServerSocket(0)) {
        port = unused.getLocalPort();
      }
      final List<Duration> sleeps = new CopyOnWriteArrayList<>();
      final var connection =
          track(
              new EventSocketConnection(
                  config().port(port).reconnects(2).backoffUnit(Duration.ofSeconds(1)).build(),
                  sleeps::add));

      // Act
      assertThatThrownBy(connection::connect).isInstanceOf(TransportException.class);
      assertThatThrownBy(connection::connect).isInstanceOf(TransportException.class);

      // Assert
      assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Zero attempts rejected at construction")
    void constructor_ZeroReconnects_Throws() {
      assertThatThrownBy(() -> new EventSocketConnection(config().reconnects(0).build()))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("reconnects");
    }
  }

  @Nested
  @DisplayName("Commands without background reader")
  class DirectCommands {

    @Test
    @DisplayName("api returns the response body")
    void sendApiCommand_ReturnsBody() throws Exception {
      // Arrange
      final var connection = connected(config().build());

      // Act
      final var reply = connection.sendApiCommand("status");

      // Assert
      assertThat(reply).isEqualTo("+OK status");
      assertThat(server.getCommands()).contains("api status");
    }

    @Test
    @DisplayName("Sequential commands receive their own replies in order")
    void sendApiCommand_Sequential_InOrder() throws Exception {
      // Arrange
      final var connection = connected(config().build());

      // Act
      final var first = connection.sendApiCommand("one");
      final var second = connection.sendApiCommand("two");
      final var third = connection.sendApiCommand("three");

      // Assert
      assertThat(List.of(first, second, third)).containsExactly("+OK one", "+OK two", "+OK three");
    }

    @Test
    @DisplayName("-ERR reply fails the command, not the connection")
    void sendApiCommand_Err_CommandFailedException() throws Exception {
      // Arrange
      server.setApiResponder(command -> "-ERR " + command + " Command not found!\n");
      final var connection = connected(config().build());

      // Act & Assert
      assertThatThrownBy(() -> connection.sendApiCommand("bogus"))
          .isInstanceOfSatisfying(
              CommandFailedException.class,
              e -> {
                assertThat(e.getCommand()).isEqualTo("bogus");
                assertThat(e.getReply()).isEqualTo("-ERR bogus Command not found!");
              });
      assertThat(connection.isConnected()).isTrue();
    }

    @Test
    @DisplayName("Events met while waiting for a reply are dispatched")
    void sendApiCommand_EventBeforeReply_Dispatched() throws Exception {
      // Arrange
      server.setEventBeforeApiReply(ANSWER_EVENT);
      final var connection =
          connected(config().eventHandler("CHANNEL_ANSWER", List.of(recording("a"))).build());

      // Act
      final var reply = connection.sendApiCommand("status");

      // Assert
      assertThat(reply).isEqualTo("+OK status");
      assertThat(received).containsExactly("a:" + ANSWER_EVENT);
    }

    @Test
    @DisplayName("Generic command returns Reply-Text")
    void sendCommand_ReturnsReplyText() throws Exception {
      // Arrange
      server.setCommandResponder(command -> "+OK Job-UUID: 42");
      final var connection = connected(config().build());

      // Act
      final var reply = connection.sendCommand("bgapi status");

      // Assert
      assertThat(reply).isEqualTo("+OK Job-UUID: 42");
      assertThat(server.getCommands()).contains("bgapi status");
    }

    @Test
    @DisplayName("sendmsg writes one header line per argument in order")
    void sendMessage_WritesArguments() throws Exception {
      // Arrange
      final var connection = connected(config().build());
      final Map<String, String> arguments = new LinkedHashMap<>();
      arguments.put("call-command", "execute");
      arguments.put("execute-app-name", "playback");
      arguments.put("execute-app-arg", "/tmp/hello.wav");

      // Act
      connection.sendMessage("6b1e", arguments);

      // Assert
      assertThat(server.getCommands("sendmsg"))
          .containsExactly(
              "sendmsg 6b1e\n"
                  + "call-command:execute\n"
                  + "execute-app-name:playback\n"
                  + "execute-app-arg:/tmp/hello.wav");
    }

    @Test
    @DisplayName("sendmsg -ERR reply fails the command")
    void sendMessage_Err_CommandFailedException() throws Exception {
      // Arrange
      server.setSendMessageReply("-ERR invalid session id [6b1e]");
      final var connection = connected(config().build());

      // Act & Assert
      assertThatThrownBy(() -> connection.sendMessage("6b1e", Map.of("call-command", "hangup")))
          .isInstanceOf(CommandFailedException.class)
          .hasMessageContaining("invalid session id");
    }

    @Test
    @DisplayName("sendmsg without arguments rejected before any I/O")
    void sendMessage_NoArguments_Throws() throws Exception {
      // Arrange
      final var connection = connected(config().build());

      // Act & Assert
      assertThatThrownBy(() -> connection.sendMessage("6b1e", Map.of()))
          .isInstanceOf(IllegalArgumentException.class);
      assertThat(server.getCommands("sendmsg")).isEmpty();
    }

    @Test
    @DisplayName("Commands on a disconnected connection fail fast")
    void sendApiCommand_NotConnected_TransportException() {
      // Arrange
      final var connection = track(new EventSocketConnection(config().build()));

      // Act & Assert
      assertThatThrownBy(() -> connection.sendApiCommand("status"))
          .isInstanceOf(TransportException.class)
          .hasMessage("Not connected");
    }

    @Test
    @DisplayName("Socket lost while reading the reply disconnects")
    void sendApiCommand_ConnectionLost_Disconnects() throws Exception {
      // Arrange
      server.setApiResponder(
          command -> {
            server.dropClients();
            return "";
          });
      final var connection = connected(config().build());

      // Act & Assert
      assertThatThrownBy(() -> connection.sendApiCommand("status"))
          .isInstanceOf(TransportException.class);
      assertThat(connection.isConnected()).isFalse();
      assertThat(connection.getState()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    @DisplayName("Truncated reply body fails the command and disconnects")
    void sendApiCommand_TruncatedBody_Disconnects() throws Exception {
      // Arrange
      server.setApiResponder(
          command -> {
            server.pushRaw(TRUNCATED_REPLY);
            server.dropClients();
            return "";
          });
      final var connection = connected(config().build());

      // Act & Assert
      assertThatThrownBy(() -> connection.sendApiCommand("status"))
          .isInstanceOf(MalformedFrameException.class)
          .hasMessageContaining("Truncated body");
      assertThat(connection.isConnected()).isFalse();
      assertThat(connection.getState()).isEqualTo(ConnectionState.DISCONNECTED);
    }
  }

  @Nested
  @DisplayName("Background reader")
  class Streaming {

    @Test
    @DisplayName("Pushed events reach their handler")
    void startStreaming_Event_Dispatched() throws Exception {
      // Arrange
      final var connection =
          connected(config().eventHandler("CHANNEL_ANSWER", List.of(recording("a"))).build());

      // Act
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);
      server.pushEvent(ANSWER_EVENT);

      // Assert
      await().atMost(10, SECONDS).until(() -> received.size() == 1);
      assertThat(received).containsExactly("a:" + ANSWER_EVENT);
      assertThat(connection.getState()).isEqualTo(ConnectionState.STREAMING);
    }

    @Test
    @DisplayName("Unregistered events fall back to ALL handlers")
    void startStreaming_UnknownEvent_AllHandler() throws Exception {
      // Arrange
      final var connection =
          connected(
              config()
                  .eventHandler("CHANNEL_HANGUP", List.of(recording("h")))
                  .eventHandler("ALL", List.of(recording("all")))
                  .build());
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);

      // Act
      server.pushEvent(ANSWER_EVENT);

      // Assert
      await().atMost(10, SECONDS).until(() -> received.size() == 1);
      assertThat(received.get(0)).startsWith("all:");
    }

    @Test
    @DisplayName("Replies are routed to concurrent callers, each gets its own")
    void sendApiCommand_ConcurrentCallers_OwnReplies() throws Exception {
      // Arrange
      final var connection = connected(config().build());
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);
      final ExecutorService callers = Executors.newFixedThreadPool(4);

      try {
        // Act
        final List<Future<List<String>>> results = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
          final var caller = t;
          results.add(
              callers.submit(
                  () -> {
                    final List<String> replies = new ArrayList<>();
                    for (int i = 0; i < 10; i++) {
                      replies.add(connection.sendApiCommand("echo " + caller + "-" + i));
                    }
                    return replies;
                  }));
        }

        // Assert
        for (int t = 0; t < 4; t++) {
          final var replies = results.get(t).get(30, SECONDS);
          for (int i = 0; i < 10; i++) {
            assertThat(replies.get(i)).isEqualTo("+OK echo " + t + "-" + i);
          }
        }
      } finally {
        callers.shutdownNow();
      }
    }

    @Test
    @DisplayName("Disconnect notice is logged and reading continues")
    void startStreaming_DisconnectNotice_KeepsReading() throws Exception {
      // Arrange
      final var connection = connected(config().build());
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);

      // Act
      server.pushRaw("Content-Type: text/disconnect-notice\n\n");
      final var reply = connection.sendApiCommand("status");

      // Assert
      assertThat(reply).isEqualTo("+OK status");
      assertThat(connection.isStreaming()).isTrue();
    }

    @Test
    @DisplayName("Dropped socket is reconnected with a fresh handshake")
    void startStreaming_SocketDropped_Reconnects() throws Exception {
      // Arrange
      final var metrics = mock(EventSocketMetrics.class);
      final var connection =
          connected(
              config()
                  .metrics(metrics)
                  .eventHandler("CHANNEL_ANSWER", List.of(recording("a")))
                  .build());
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);

      // Act
      server.dropClients();

      // Assert
      await()
          .atMost(10, SECONDS)
          .until(() -> server.getAcceptedConnections() == 2 && connection.isConnected());
      assertThat(server.getCommands("auth")).hasSize(2);
      assertThat(server.getCommands("event")).hasSize(2);
      assertThat(connection.sendApiCommand("status")).isEqualTo("+OK status");
      await()
          .atMost(10, SECONDS)
          .untilAsserted(() -> verify(metrics).recordReconnect("test", true));
    }

    @Test
    @DisplayName("Truncated frame on the stream is followed by a fresh handshake")
    void startStreaming_TruncatedFrame_Reconnects() throws Exception {
      // Arrange
      final var connection = connected(config().build());
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);

      // Act
      server.pushRaw(TRUNCATED_REPLY);
      server.dropClients();

      // Assert
      await()
          .atMost(10, SECONDS)
          .until(() -> server.getAcceptedConnections() == 2 && connection.isConnected());
      assertThat(server.getCommands("auth")).hasSize(2);
      assertThat(connection.isStreaming()).isTrue();
      assertThat(connection.sendApiCommand("status")).isEqualTo("+OK status");
    }

    @Test
    @DisplayName("Reply owed to an interrupted caller is not handed to the next caller")
    void sendApiCommand_CallerInterrupted_NextCallerGetsOwnReply() throws Exception {
      // Arrange
      server.setApiResponder(
          command -> {
            if (command.equals("slow")) {
              pause(600);
            }
            return "+OK " + command;
          });
      final var connection = connected(config().build());
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);

      final var outcome = new AtomicReference<Throwable>();
      final var caller =
          new Thread(
              () -> {
                try {
                  outcome.set(new AssertionError("returned " + connection.sendApiCommand("slow")));
                } catch (final Exception e) {
                  outcome.set(e);
                }
              },
              "slow-caller");
      caller.start();
      await().atMost(10, SECONDS).until(() -> server.getCommands("api slow").size() == 1);
      Thread.sleep(150);

      // Act
      caller.interrupt();
      caller.join(10_000);
      final var reply = connection.sendApiCommand("fast");

      // Assert
      assertThat(outcome.get()).isInstanceOf(InterruptedException.class);
      assertThat(reply).isEqualTo("+OK fast");
      assertThat(connection.sendApiCommand("next")).isEqualTo("+OK next");
      assertThat(connection.isStreaming()).isTrue();
    }

    @Test
    @DisplayName("Failed reconnect stops the reader and leaves the connection disconnected")
    void startStreaming_ReconnectFails_ReaderStops() throws Exception {
      // Arrange
      final var metrics = mock(EventSocketMetrics.class);
      final var connection = connected(config().metrics(metrics).build());
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);

      // Act
      server.close();

      // Assert
      await()
          .atMost(10, SECONDS)
          .until(() -> !connection.isStreaming() && !connection.isConnected());
      verify(metrics).recordReconnect("test", false);
      assertThatThrownBy(() -> connection.sendApiCommand("status"))
          .isInstanceOf(TransportException.class);
    }

    @Test
    @DisplayName("Caller waiting for a reply fails when the socket is lost")
    void sendApiCommand_SocketLostWhileWaiting_TransportException() throws Exception {
      // Arrange
      server.setApiResponder(
          command -> {
            server.dropClients();
            return "";
          });
      final var connection = connected(config().build());
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);

      // Act & Assert
      assertTimeoutPreemptively(
          Duration.ofSeconds(10),
          () ->
              assertThatThrownBy(() -> connection.sendApiCommand("status"))
                  .isInstanceOf(TransportException.class));
    }

    @Test
    @DisplayName("readEvents returns immediately while a reader is running")
    void readEvents_AlreadyStreaming_ReturnsImmediately() throws Exception {
      // Arrange
      final var connection = connected(config().build());
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);

      // Act & Assert
      assertTimeoutPreemptively(Duration.ofSeconds(5), connection::readEvents);
      assertThat(connection.isStreaming()).isTrue();
    }

    @Test
    @DisplayName("Command metrics count successes")
    void sendApiCommand_RecordsCommandMetric() throws Exception {
      // Arrange
      final var metrics = mock(EventSocketMetrics.class);
      final var connection = connected(config().metrics(metrics).build());
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);

      // Act
      connection.sendApiCommand("status");

      // Assert
      verify(metrics).recordCommand("test", "api", true);
      verify(metrics, atLeastOnce()).recordHandshake(anyString(), anyBoolean());
    }
  }

  @Nested
  @DisplayName("Close")
  class Close {

    @Test
    @DisplayName("close() is terminal and stops the reader")
    void close_Terminal() throws Exception {
      // Arrange
      final var connection = connected(config().build());
      connection.startStreaming();
      await().atMost(10, SECONDS).until(connection::isStreaming);

      // Act
      connection.close();
      connection.close();

      // Assert
      assertThat(connection.isClosed()).isTrue();
      assertThat(connection.isConnected()).isFalse();
      assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
      await().atMost(10, SECONDS).until(() -> !connection.isStreaming());
      assertThat(server.getAcceptedConnections()).isEqualTo(1);
      assertThatThrownBy(connection::connect).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("disconnect() is idempotent and allows reconnecting")
    void disconnect_Idempotent() throws Exception {
      // Arrange
      final var connection = connected(config().build());

      // Act
      connection.disconnect();
      connection.disconnect();

      // Assert
      assertThat(connection.isConnected()).isFalse();
      assertThat(connection.getState()).isEqualTo(ConnectionState.DISCONNECTED);

      connection.connect();
      assertThat(connection.isConnected()).isTrue();
    }
  }
}
