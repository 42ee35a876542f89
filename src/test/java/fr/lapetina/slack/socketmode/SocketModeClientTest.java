package fr.lapetina.slack.socketmode;

import fr.lapetina.slack.domain.exception.SlackApiException;
import fr.lapetina.slack.domain.exception.SlackClientNotConnectedException;
import fr.lapetina.slack.domain.exception.SlackConnectionException;
import fr.lapetina.slack.domain.retry.Jitter;
import fr.lapetina.slack.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.slack.realtime.RealtimeOptions;
import fr.lapetina.slack.support.FakeWebSocketConnector;
import fr.lapetina.slack.support.FakeWebSocketConnector.FakeSession;
import fr.lapetina.slack.support.StubHttpServer;
import fr.lapetina.slack.web.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static fr.lapetina.slack.support.Eventually.await;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SocketModeClientTest {

    private static final String URL_RESPONSE = "{\"ok\":true,\"url\":\"wss://wss.example.com/link/?ticket=t1\"}";

    private StubHttpServer server;
    private MetricsRegistry metrics;
    private FakeWebSocketConnector connector;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private SocketModeClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubHttpServer();
        server.enqueue(200, URL_RESPONSE);
        metrics = new MetricsRegistry("test");
        connector = new FakeWebSocketConnector();
        sleeps.clear();

        WebClient webClient = WebClient.builder()
                .token("xoxb-bot")
                .baseUrl(server.url("/api/"))
                .httpClient(StubHttpServer.directClient())
                .metricsRegistry(metrics)
                .build();
        RealtimeOptions options = RealtimeOptions.defaults()
                .withPingInterval(Duration.ofMillis(100))
                .withReconnectBackoff(Duration.ofMillis(10), Duration.ofMillis(50), 3)
                .withJitter(Jitter.none())
                .withSleeper(sleeps::add);
        client = SocketModeClient.builder("xapp-1-token")
                .webClient(webClient)
                .connector(connector)
                .options(options)
                .metricsRegistry(metrics)
                .build();
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
        metrics.close();
    }

    @Test
    @DisplayName("should open a session on the URL issued with the app-level token")
    void shouldConnectWithAppToken() {
        client.connect();

        assertThat(client.isConnected()).isTrue();
        assertThat(client.sessionId()).isEqualTo("session-1");
        assertThat(connector.connectedUris()).extracting(Object::toString)
                .containsExactly("wss://wss.example.com/link/?ticket=t1");
        assertThat(server.lastRequest().path()).isEqualTo("/api/apps.connections.open");
        assertThat(server.lastRequest().header("Authorization")).isEqualTo("Bearer xapp-1-token");
        assertThat(metrics.getConnectedSessions("socket-mode")).isEqualTo(1);
    }

    @Test
    @DisplayName("should hand envelopes to request listeners and send acknowledgements")
    void shouldAcknowledgeRequests() {
        List<SocketModeRequest> received = new CopyOnWriteArrayList<>();
        List<String> sessionIds = new CopyOnWriteArrayList<>();
        client.addSocketModeRequestListener((c, request) -> {
            received.add(request);
            sessionIds.add(MDC.get("sessionId"));
            c.sendSocketModeResponse(SocketModeResponse.of(request.envelopeId()));
        });
        client.connect();

        connector.lastSession().receive("{\"type\":\"events_api\",\"envelope_id\":\"e1\","
                + "\"payload\":{\"event\":{\"type\":\"app_mention\"}},\"accepts_response_payload\":false,"
                + "\"retry_attempt\":0,\"retry_reason\":\"\"}");

        await("acknowledgement", () -> !connector.lastSession().sentTexts().isEmpty());
        assertThat(connector.lastSession().sentTexts()).containsExactly("{\"envelope_id\":\"e1\"}");
        assertThat(received).singleElement().satisfies(request -> {
            assertThat(request.type()).isEqualTo("events_api");
            assertThat(request.retryAttempt()).isZero();
            assertThat(request.payload()).containsKey("event");
        });
        assertThat(sessionIds).containsExactly("session-1");
    }

    @Test
    @DisplayName("should keep dispatching when a listener fails")
    void shouldIsolateListenerFailures() {
        List<Object> types = new CopyOnWriteArrayList<>();
        client.addWebSocketMessageListener((c, message, raw) -> {
            throw new IllegalStateException("listener bug");
        });
        client.addWebSocketMessageListener((c, message, raw) -> types.add(message.get("type")));
        client.connect();

        connector.lastSession().receive("{\"type\":\"hello\",\"num_connections\":1}");
        connector.lastSession().receive("{\"type\":\"events_api\",\"envelope_id\":\"e2\",\"payload\":{}}");

        await("both messages", () -> types.size() == 2);
        assertThat(types).containsExactlyInAnyOrder("hello", "events_api");
    }

    @Test
    @DisplayName("should move to a new session on a disconnect envelope")
    void shouldReconnectOnDisconnectEnvelope() {
        List<Object> types = new CopyOnWriteArrayList<>();
        client.addWebSocketMessageListener((c, message, raw) -> types.add(message.get("type")));
        client.connect();
        FakeSession first = connector.lastSession();

        first.receive("{\"type\":\"disconnect\",\"reason\":\"refresh_requested\"}");

        await("second session", () -> connector.sessions().size() == 2 && client.isConnected());
        assertThat(first.isClosedByClient()).isTrue();
        assertThat(client.sessionId()).isEqualTo("session-2");

        first.receive("{\"type\":\"stale\"}");
        connector.lastSession().receive("{\"type\":\"fresh\"}");

        await("message on the new session", () -> types.contains("fresh"));
        assertThat(types).doesNotContain("disconnect", "stale");
        assertThat(metrics.getConnectedSessions("socket-mode")).isEqualTo(1);
    }

    @Test
    @DisplayName("should reconnect when the server closes the session")
    void shouldReconnectOnServerClose() {
        List<Integer> closeCodes = new CopyOnWriteArrayList<>();
        client.addCloseListener((code, reason) -> closeCodes.add(code));
        client.connect();

        connector.lastSession().serverClose(1006, "abnormal");

        await("reconnect", () -> connector.sessions().size() == 2 && client.isConnected());
        assertThat(closeCodes).containsExactly(1006);
        assertThat(metrics.scrape()).contains("test_reconnects_total");
    }

    @Test
    @DisplayName("should retry failed connections with exponential backoff")
    void shouldBackOffBetweenConnectionAttempts() {
        client.connect();
        connector.failNextConnects(2);

        connector.lastSession().serverClose(1001, "going away");

        await("reconnect", () -> connector.sessions().size() == 2 && client.isConnected());
        assertThat(connector.connectedUris()).hasSize(4);
        assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
    }

    @Test
    @DisplayName("should ignore frames of a connection attempt that failed")
    void shouldIgnoreFramesOfFailedAttempt() {
        List<Object> types = new CopyOnWriteArrayList<>();
        client.addWebSocketMessageListener((c, message, raw) -> types.add(message.get("type")));
        connector.failNextConnects(1);

        client.connect();
        FakeSession late = connector.lateSession(0);
        late.receive("{\"type\":\"orphan\"}");
        late.serverClose(1006, "abnormal");
        connector.lastSession().receive("{\"type\":\"live\"}");

        await("message on the live session", () -> types.contains("live"));
        assertThat(types).containsExactly("live");
        assertThat(connector.sessions()).hasSize(1);
        assertThat(client.sessionId()).isEqualTo("session-1");
    }

    @Test
    @DisplayName("should give up once the reconnect attempts are exhausted")
    void shouldGiveUpAfterMaxAttempts() {
        connector.failNextConnects(10);

        assertThatThrownBy(client::connect).isInstanceOf(SlackConnectionException.class);
        assertThat(connector.connectedUris()).hasSize(4);
        assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40));
        assertThat(client.isConnected()).isFalse();
    }

    @Test
    @DisplayName("should wait for Retry-After when URL issuance is rate limited")
    void shouldHonourRetryAfterOnRateLimit() throws IOException {
        server.close();
        server = new StubHttpServer();
        server.enqueue(429, Map.of("Retry-After", "7"), "{\"ok\":false,\"error\":\"ratelimited\"}")
                .enqueue(200, URL_RESPONSE);
        SocketModeClient rateLimited = SocketModeClient.builder("xapp-1-token")
                .webClient(WebClient.builder()
                        .baseUrl(server.url("/api/"))
                        .httpClient(StubHttpServer.directClient())
                        .metricsRegistry(metrics)
                        .build())
                .connector(connector)
                .options(RealtimeOptions.defaults()
                        .withJitter(Jitter.none())
                        .withSleeper(sleeps::add))
                .metricsRegistry(metrics)
                .build();
        try {
            rateLimited.connect();

            assertThat(rateLimited.isConnected()).isTrue();
            assertThat(sleeps).containsExactly(Duration.ofSeconds(7));
        } finally {
            rateLimited.close();
        }
    }

    @Test
    @DisplayName("should not retry platform errors other than rate limits")
    void shouldSurfaceInvalidAuth() throws IOException {
        server.close();
        server = new StubHttpServer();
        server.enqueue(200, "{\"ok\":false,\"error\":\"invalid_auth\"}");
        SocketModeClient invalid = SocketModeClient.builder("xapp-bad")
                .webClient(WebClient.builder()
                        .baseUrl(server.url("/api/"))
                        .httpClient(StubHttpServer.directClient())
                        .metricsRegistry(metrics)
                        .build())
                .connector(connector)
                .options(RealtimeOptions.defaults()
                        .withSleeper(sleeps::add))
                .metricsRegistry(metrics)
                .build();
        try {
            assertThatThrownBy(invalid::connect)
                    .isInstanceOfSatisfying(SlackApiException.class,
                            e -> assertThat(e.getError()).isEqualTo("invalid_auth"));
            assertThat(connector.connectedUris()).isEmpty();
            assertThat(sleeps).isEmpty();
            assertThat(server.requests()).hasSize(1);
        } finally {
            invalid.close();
        }
    }

    @Test
    @DisplayName("should stay disconnected after disconnect")
    void shouldNotReconnectAfterDisconnect() throws InterruptedException {
        client.connect();

        client.disconnect();
        Thread.sleep(300);

        assertThat(client.isConnected()).isFalse();
        assertThat(connector.sessions()).hasSize(1);
        assertThat(connector.lastSession().isClosedByClient()).isTrue();
        assertThat(metrics.getConnectedSessions("socket-mode")).isZero();
    }

    @Test
    @DisplayName("should ping with the session id and reconnect when pongs stop")
    void shouldReconnectStaleSession() {
        client.connect();
        FakeSession first = connector.lastSession();

        await("first ping", () -> !first.sentPings().isEmpty());
        assertThat(first.sentPings().get(0)).startsWith("session-1:");
        first.stopAnsweringPings();

        await("stale session replaced", () -> connector.sessions().size() == 2 && client.isConnected());
        assertThat(first.isClosedByClient()).isTrue();
    }

    @Test
    @DisplayName("should refuse to send before connecting")
    void shouldRejectSendWhenNotConnected() {
        assertThatThrownBy(() -> client.send("{}"))
                .isInstanceOf(SlackClientNotConnectedException.class);
    }

    @Test
    @DisplayName("should refuse to connect once closed")
    void shouldRejectConnectAfterClose() {
        client.close();

        assertThat(client.isClosed()).isTrue();
        assertThatThrownBy(client::connect).hasMessageContaining("closed");
    }
}
