package fr.lapetina.slack.rtm;

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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Real Time Messaging client.
 *
 * URLs are issued by {@code rtm.connect} with the token of the given
 * {@link WebClient}. The bot id is resolved once with {@code auth.test} so
 * that the bot's own events can be skipped. A {@code goodbye} event makes the
 * client move to a new endpoint.
 */
public class RtmClient extends AbstractRealtimeClient {

    private static final Logger log = LoggerFactory.getLogger(RtmClient.class);

    static final String CLIENT_NAME = "rtm";
    public static final String ALL_EVENTS = "*";

    private final WebClient webClient;
    private final Map<String, List<RtmEventListener>> listeners = new ConcurrentHashMap<>();
    private volatile String botId;

    protected RtmClient(Builder builder) {
        super(CLIENT_NAME, builder.connector, builder.options, builder.metricsRegistry);
        this.webClient = Objects.requireNonNull(builder.webClient, "Web API client is required");
    }

    public static Builder builder(WebClient webClient) {
        return new Builder(webClient);
    }

    /**
     * Registers a listener for an event type, or {@link #ALL_EVENTS}.
     */
    public RtmClient on(String eventType, RtmEventListener listener) {
        Objects.requireNonNull(eventType, "Event type is required");
        Objects.requireNonNull(listener, "Listener is required");
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(listener);
        return this;
    }

    /**
     * Sends an event serialized as JSON. Null payloads are ignored.
     */
    public void send(Map<String, Object> payload) {
        if (payload == null) {
            return;
        }
        send(JsonSupport.write(payload));
    }

    @Override
    protected void beforeConnect() {
        if (botId == null) {
            botId = webClient.authTest().getString("bot_id");
            log.debug("Resolved bot id: botId={}", botId);
        }
    }

    @Override
    protected URI issueNewWssUrl() {
        String url = webClient.rtmConnect().getString("url");
        if (url == null) {
            throw new SlackClientException("rtm.connect returned no URL");
        }
        return URI.create(url);
    }

    @Override
    protected void dispatch(Map<String, Object> event, String raw) {
        Object type = event.get("type");
        if ("goodbye".equals(type)) {
            log.info("Received goodbye, moving to a new endpoint");
            requestReconnect(true);
        }

        if (botId != null && botId.equals(event.get("bot_id"))) {
            log.debug("Skipping an event of this bot: type={}", type);
            return;
        }

        notify(listeners.get(ALL_EVENTS), event);
        if (type != null && !ALL_EVENTS.equals(type)) {
            notify(listeners.get(type.toString()), event);
        }
    }

    private void notify(List<RtmEventListener> registered, Map<String, Object> event) {
        if (registered == null) {
            return;
        }
        for (RtmEventListener listener : registered) {
            try {
                listener.onEvent(this, event);
            } catch (RuntimeException e) {
                log.error("RTM event listener failed: type={}, error={}", event.get("type"), e.getMessage(), e);
            }
        }
    }

    /**
     * The bot id resolved on first connect, or null for user tokens.
     */
    public String getBotId() {
        return botId;
    }

    public WebClient getWebClient() {
        return webClient;
    }

    public static final class Builder {
        private final WebClient webClient;
        private WebSocketConnector connector;
        private RealtimeOptions options = RealtimeOptions.defaults();
        private MetricsRegistry metricsRegistry;

        private Builder(WebClient webClient) {
            this.webClient = webClient;
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

        public RtmClient build() {
            return new RtmClient(this);
        }
    }
}
