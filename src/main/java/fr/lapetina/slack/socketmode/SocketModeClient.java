package fr.lapetina.slack.socketmode;

import fr.lapetina.slack.domain.exception.SlackApiException;
import fr.lapetina.slack.domain.exception.SlackClientException;
import fr.lapetina.slack.infrastructure.json.JsonSupport;
import fr.lapetina.slack.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.slack.realtime.AbstractRealtimeClient;
import fr.lapetina.slack.realtime.RealtimeOptions;
import fr.lapetina.slack.realtime.WebSocketConnector;
import fr.lapetina.slack.web.WebClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Socket Mode client.
 *
 * WebSocket URLs are issued by {@code apps.connections.open} with an
 * app-level token. The server announces each new session with {@code hello}
 * and asks for a reconnect with {@code disconnect} before rotating it.
 *
 * <pre>{@code
 * try (SocketModeClient client = SocketModeClient.builder("xapp-...").build()) {
 *     client.addSocketModeRequestListener((c, request) ->
 *             c.sendSocketModeResponse(SocketModeResponse.of(request.envelopeId())));
 *     client.start();
 * }
 * }</pre>
 */
public class SocketModeClient extends AbstractRealtimeClient {

    private static final Logger log = LoggerFactory.getLogger(SocketModeClient.class);

    static final String CLIENT_NAME = "socket-mode";

    private final String appToken;
    private final WebClient webClient;
    private final List<WebSocketMessageListener> messageListeners = new CopyOnWriteArrayList<>();
    private final List<SocketModeRequestListener> requestListeners = new CopyOnWriteArrayList<>();

    protected SocketModeClient(Builder builder) {
        super(CLIENT_NAME, builder.connector, builder.options, builder.metricsRegistry);
        this.appToken = Objects.requireNonNull(builder.appToken, "App-level token is required");
        this.webClient = builder.webClient != null
                ? builder.webClient
                : WebClient.builder().metricsRegistry(builder.metricsRegistry).build();
    }

    public static Builder builder(String appToken) {
        return new Builder(appToken);
    }

    @Override
    protected URI issueNewWssUrl() {
        try {
            String url = webClient.appsConnectionsOpen(appToken).getString("url");
            if (url == null) {
                throw new SlackClientException("apps.connections.open returned no URL");
            }
            return URI.create(url);
        } catch (SlackApiException e) {
            log.error("Failed to retrieve a WSS URL: error={}", e.getError());
            throw e;
        }
    }

    @Override
    protected void dispatch(Map<String, Object> message, String raw) {
        Object type = message.get("type");
        if ("disconnect".equals(type)) {
            log.info("Received a disconnect message, reconnecting: reason={}", message.get("reason"));
            requestReconnect(true);
            return;
        }
        if ("hello".equals(type)) {
            log.info("Received hello: connectionInfo={}", message.get("connection_info"));
        }

        for (WebSocketMessageListener listener : messageListeners) {
            try {
                listener.onMessage(this, message, raw);
            } catch (RuntimeException e) {
                log.error("WebSocket message listener failed: error={}", e.getMessage(), e);
            }
        }

        if (requestListeners.isEmpty()) {
            return;
        }
        Optional<SocketModeRequest> request = SocketModeRequest.fromMap(message);
        request.ifPresent(r -> {
            for (SocketModeRequestListener listener : requestListeners) {
                try {
                    listener.onRequest(this, r);
                } catch (RuntimeException e) {
                    log.error("Socket Mode request listener failed: envelopeId={}, error={}",
                            r.envelopeId(), e.getMessage(), e);
                }
            }
        });
    }

    /**
     * Acknowledges an envelope.
     */
    public void sendSocketModeResponse(SocketModeResponse response) {
        send(JsonSupport.write(response.toMap()));
    }

    public void sendSocketModeResponse(Map<String, Object> response) {
        send(JsonSupport.write(response));
    }

    public void addWebSocketMessageListener(WebSocketMessageListener listener) {
        messageListeners.add(Objects.requireNonNull(listener));
    }

    public void removeWebSocketMessageListener(WebSocketMessageListener listener) {
        messageListeners.remove(listener);
    }

    public void addSocketModeRequestListener(SocketModeRequestListener listener) {
        requestListeners.add(Objects.requireNonNull(listener));
    }

    public void removeSocketModeRequestListener(SocketModeRequestListener listener) {
        requestListeners.remove(listener);
    }

    /**
     * The Web API client, for calls made while handling requests.
     */
    public WebClient getWebClient() {
        return webClient;
    }

    public static final class Builder {
        private final String appToken;
        private WebClient webClient;
        private WebSocketConnector connector;
        private RealtimeOptions options = RealtimeOptions.defaults();
        private MetricsRegistry metricsRegistry;

        private Builder(String appToken) {
            this.appToken = appToken;
        }

        /**
         * Web API client used for {@code apps.connections.open}, typically holding the bot token.
         */
        public Builder webClient(WebClient webClient) {
            this.webClient = webClient;
            return this;
        }

        public Builder connector(WebSocketConnector connector) {
            this.connector = connector;
            return this;
        }

        public Builder options(RealtimeOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public SocketModeClient build() {
            return new SocketModeClient(this);
        }
    }
}
