package fr.lapetina.slack.rtm;

import fr.lapetina.slack.domain.retry.Jitter;
import fr.lapetina.slack.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.slack.realtime.RealtimeOptions;
import fr.lapetina.slack.support.FakeWebSocketConnector;
import fr.lapetina.slack.support.StubHttpServer;
import fr.lapetina.slack.web.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static fr.lapetina.slack.support.Eventually.await;
import static org.assertj.core.api.Assertions.assertThat;

class RtmClientTest {

    private StubHttpServer server;
    private MetricsRegistry metrics;
    private FakeWebSocketConnector connector;
    private RtmClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubHttpServer();
        // answers both auth.test and rtm.connect
        server.enqueue(200, "{\"ok\":true,\"user_id\":\"U1\",\"bot_id\":\"B1\",\"url\":\"wss://rtm.example.com/ws\"}");
        metrics = new MetricsRegistry("test");
        connector = new FakeWebSocketConnector();

        WebClient webClient = WebClient.builder()
                .token("xoxb-rtm")
                .baseUrl(server.url("/api/"))
                .httpClient(StubHttpServer.directClient())
                .metricsRegistry(metrics)
                .build();
        client = RtmClient.builder(webClient)
                .connector(connector)
                .options(RealtimeOptions.defaults()
                        .withPingInterval(Duration.ofMillis(100))
                        .withJitter(Jitter.none())
                        .withSleeper(duration -> { }))
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
    @DisplayName("should resolve the bot id then connect with rtm.connect")
    void shouldResolveBotIdAndConnect() {
        client.connect();

        assertThat(client.getBotId()).isEqualTo("B1");
        assertThat(server.requests()).extracting(StubHttpServer.RecordedRequest::path)
                .containsExactly("/api/auth.test", "/api/rtm.connect");
        assertThat(client.isConnected()).isTrue();
        assertThat(connector.connectedUris()).extracting(Object::toString).containsExactly("wss://rtm.example.com/ws");
    }

    @Test
    @DisplayName("should notify typed and wildcard listeners")
    void shouldNotifyListeners() {
        List<String> typed = new CopyOnWriteArrayList<>();
        List<String> all = new CopyOnWriteArrayList<>();
        client.on("message", (c, event) -> typed.add((String) event.get("text")))
                .on(RtmClient.ALL_EVENTS, (c, event) -> all.add((String) event.get("type")));
        client.connect();

        connector.lastSession().receive("{\"type\":\"message\",\"text\":\"hi\",\"user\":\"U2\"}");
        connector.lastSession().receive("{\"type\":\"user_typing\",\"user\":\"U2\"}");

        await("both events", () -> all.size() == 2);
        assertThat(typed).containsExactly("hi");
        assertThat(all).containsExactlyInAnyOrder("message", "user_typing");
    }

    @Test
    @DisplayName("should skip events sent by its own bot")
    void shouldSkipOwnEvents() {
        List<Object> texts = new CopyOnWriteArrayList<>();
        client.on("message", (c, event) -> texts.add(event.get("text")));
        client.connect();

        connector.lastSession().receive("{\"type\":\"message\",\"text\":\"echo\",\"bot_id\":\"B1\"}");
        connector.lastSession().receive("{\"type\":\"message\",\"text\":\"other\",\"bot_id\":\"B2\"}");

        await("other bot event", () -> texts.contains("other"));
        assertThat(texts).doesNotContain("echo");
    }

    @Test
    @DisplayName("should move to a new endpoint on goodbye")
    void shouldReconnectOnGoodbye() {
        List<Object> goodbyes = new CopyOnWriteArrayList<>();
        client.on("goodbye", (c, event) -> goodbyes.add(event.get("type")));
        client.connect();

        connector.lastSession().receive("{\"type\":\"goodbye\"}");

        await("new session", () -> connector.sessions().size() == 2 && client.isConnected());
        await("goodbye listener", () -> goodbyes.size() == 1);
        assertThat(connector.sessions().get(0).isClosedByClient()).isTrue();
        assertThat(server.requests()).extracting(StubHttpServer.RecordedRequest::path)
                .containsExactly("/api/auth.test", "/api/rtm.connect", "/api/rtm.connect");
    }

    @Test
    @DisplayName("should send events as JSON and ignore null payloads")
    void shouldSendJson() {
        client.connect();

        client.send(Map.of("type", "ping", "id", 1));
        client.send((Map<String, Object>) null);

        assertThat(connector.lastSession().sentTexts()).hasSize(1);
        assertThat(connector.lastSession().sentTexts().get(0))
                .contains("\"type\":\"ping\"")
                .contains("\"id\":1");
    }

    @Test
    @DisplayName("should send on the new session after a reconnect")
    void shouldSendAfterReconnect() {
        client.connect();
        connector.lastSession().serverClose(1006, "");
        await("new session", () -> connector.sessions().size() == 2 && client.isConnected());

        client.send("{\"type\":\"ping\"}");

        assertThat(connector.lastSession().sentTexts()).containsExactly("{\"type\":\"ping\"}");
        assertThat(metrics.getConnectedSessions("rtm")).isEqualTo(1);
    }
}
