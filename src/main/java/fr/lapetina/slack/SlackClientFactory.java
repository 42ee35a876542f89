package fr.lapetina.slack;

import fr.lapetina.slack.domain.exception.SlackClientConfigurationException;
import fr.lapetina.slack.domain.retry.BackoffRetryIntervalCalculator;
import fr.lapetina.slack.domain.retry.RandomJitter;
import fr.lapetina.slack.domain.retry.RetryHandler;
import fr.lapetina.slack.domain.retry.RetryHandlers;
import fr.lapetina.slack.domain.retry.RetryIntervalCalculator;
import fr.lapetina.slack.infrastructure.config.ConfigLoader;
import fr.lapetina.slack.infrastructure.config.SlackClientConfig;
import fr.lapetina.slack.infrastructure.http.HttpClientFactory;
import fr.lapetina.slack.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.slack.realtime.AbstractRealtimeClient;
import fr.lapetina.slack.realtime.JdkWebSocketConnector;
import fr.lapetina.slack.realtime.RealtimeOptions;
import fr.lapetina.slack.realtime.WebSocketConnector;
import fr.lapetina.slack.rtm.RtmClient;
import fr.lapetina.slack.socketmode.SocketModeClient;
import fr.lapetina.slack.web.WebClient;
import fr.lapetina.slack.webhook.WebhookClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Creates clients wired from a YAML configuration.
 * All clients of a factory share one HTTP client and one metrics registry.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SlackClientFactory factory = SlackClientFactory.create("slack-client.yaml")) {
 *     WebClient web = factory.webClient(System.getenv("SLACK_BOT_TOKEN"));
 *     web.chatPostMessage("#general", "Hello");
 * }
 * }</pre>
 */
public class SlackClientFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SlackClientFactory.class);

    public static final String DEFAULT_CONFIG = "slack-client.yaml";

    private final SlackClientConfig config;
    private final MetricsRegistry metricsRegistry;
    private final HttpClient httpClient;
    private final WebSocketConnector connector;
    private final List<RetryHandler> retryHandlers;
    private final List<AbstractRealtimeClient> realtimeClients = new CopyOnWriteArrayList<>();

    protected SlackClientFactory(SlackClientConfig config, WebSocketConnector connectorOverride) {
        this.config = config;
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.httpClient = HttpClientFactory.create(
                Duration.ofMillis(config.getWeb().getConnectTimeoutMs()),
                config.getProxy().getUrl());
        this.connector = connectorOverride != null
                ? connectorOverride
                : new JdkWebSocketConnector(httpClient, Duration.ofMillis(config.getWeb().getConnectTimeoutMs()));
        this.retryHandlers = createRetryHandlers(config.getRetry());
        log.info("SlackClientFactory initialized: retryHandlers={}, baseUrl={}",
                retryHandlers.stream().map(RetryHandler::getName).toList(), config.getWeb().getBaseUrl());
    }

    /**
     * Creates a factory from a configuration file, looked up on the file system then the classpath.
     */
    public static SlackClientFactory create(String configPath) {
        log.info("Loading Slack client configuration: {}", configPath);
        return new SlackClientFactory(new ConfigLoader(configPath).load(), null);
    }

    /**
     * Creates a factory from {@value #DEFAULT_CONFIG}.
     */
    public static SlackClientFactory create() {
        return create(DEFAULT_CONFIG);
    }

    public static SlackClientFactory fromConfig(SlackClientConfig config) {
        return new SlackClientFactory(config, null);
    }

    public static SlackClientFactory fromConfig(SlackClientConfig config, WebSocketConnector connector) {
        return new SlackClientFactory(config, connector);
    }

    static List<RetryHandler> createRetryHandlers(SlackClientConfig.RetryConfig retry) {
        Duration maxBackoff = retry.getMaxBackoffMs() > 0 ? Duration.ofMillis(retry.getMaxBackoffMs()) : null;
        RetryIntervalCalculator calculator = new BackoffRetryIntervalCalculator(
                Duration.ofMillis(retry.getBackoffFactorMs()), new RandomJitter(), maxBackoff);

        List<RetryHandler> handlers = new ArrayList<>();
        for (String name : retry.getHandlers()) {
            handlers.add(RetryHandlers.create(name, retry.getMaxRetryCount(), calculator)
                    .orElseThrow(() -> new SlackClientConfigurationException("Unknown retry handler: " + name)));
        }
        return List.copyOf(handlers);
    }

    public WebClient webClient(String token) {
        SlackClientConfig.WebConfig web = config.getWeb();
        return WebClient.builder()
                .token(token)
                .baseUrl(web.getBaseUrl())
                .timeout(Duration.ofMillis(web.getTimeoutMs()))
                .teamId(web.getTeamId())
                .userAgentPrefix(web.getUserAgentPrefix())
                .userAgentSuffix(web.getUserAgentSuffix())
                .retryHandlers(retryHandlers)
                .httpClient(httpClient)
                .metricsRegistry(metricsRegistry)
                .build();
    }

    public WebhookClient webhookClient(String url) {
        return WebhookClient.builder(url)
                .timeout(Duration.ofMillis(config.getWebhook().getTimeoutMs()))
                .userAgentPrefix(config.getWeb().getUserAgentPrefix())
                .userAgentSuffix(config.getWeb().getUserAgentSuffix())
                .retryHandlers(retryHandlers)
                .httpClient(httpClient)
                .metricsRegistry(metricsRegistry)
                .build();
    }

    /**
     * @param appToken app-level token ({@code xapp-}) used to open connections
     * @param botToken token of the Web API client handed to listeners, may be null
     */
    public SocketModeClient socketModeClient(String appToken, String botToken) {
        SocketModeClient client = SocketModeClient.builder(appToken)
                .webClient(webClient(botToken))
                .connector(connector)
                .options(RealtimeOptions.fromConfig(config.getSocketMode()))
                .metricsRegistry(metricsRegistry)
                .build();
        realtimeClients.add(client);
        return client;
    }

    public RtmClient rtmClient(String token) {
        RtmClient client = RtmClient.builder(webClient(token))
                .connector(connector)
                .options(RealtimeOptions.fromConfig(config.getRtm()))
                .metricsRegistry(metricsRegistry)
                .build();
        realtimeClients.add(client);
        return client;
    }

    public SlackClientConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public List<RetryHandler> getRetryHandlers() {
        return retryHandlers;
    }

    /**
     * Closes the real-time clients created by this factory, then the metrics registry.
     */
    @Override
    public void close() {
        log.info("Shutting down SlackClientFactory");
        for (AbstractRealtimeClient client : realtimeClients) {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.warn("Error closing a real-time client: {}", e.getMessage());
            }
        }
        realtimeClients.clear();
        metricsRegistry.close();
        log.info("SlackClientFactory shutdown complete");
    }
}
