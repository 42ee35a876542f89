package fr.lapetina.slack.webhook;

import fr.lapetina.slack.domain.exception.SlackRequestException;
import fr.lapetina.slack.domain.retry.RetryHandler;
import fr.lapetina.slack.domain.retry.RetryHandlers;
import fr.lapetina.slack.infrastructure.http.HttpClientFactory;
import fr.lapetina.slack.infrastructure.http.HttpResult;
import fr.lapetina.slack.infrastructure.http.RetryingHttpExecutor;
import fr.lapetina.slack.infrastructure.http.UserAgent;
import fr.lapetina.slack.infrastructure.json.JsonSupport;
import fr.lapetina.slack.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Client for incoming webhooks and interaction {@code response_url}s.
 *
 * Unlike the Web API client, HTTP failures are not raised: the caller gets a
 * {@link WebhookResponse} with the status code and body. Only connectivity
 * failures that survive the retry chain raise
 * {@link fr.lapetina.slack.domain.exception.SlackConnectionException}.
 */
public class WebhookClient {

    private static final Logger log = LoggerFactory.getLogger(WebhookClient.class);

    private final URI url;
    private final Duration timeout;
    private final Map<String, String> defaultHeaders;
    private final RetryingHttpExecutor executor;

    protected WebhookClient(Builder builder) {
        this.url = validateUrl(builder.url);
        this.timeout = builder.timeout;

        Map<String, String> headers = new LinkedHashMap<>(builder.headers);
        headers.put("User-Agent", UserAgent.build(builder.userAgentPrefix, builder.userAgentSuffix));
        this.defaultHeaders = Map.copyOf(headers);

        HttpClient httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClientFactory.create(HttpClientFactory.DEFAULT_CONNECT_TIMEOUT, builder.proxy);
        this.executor = new RetryingHttpExecutor(
                "webhook",
                httpClient,
                builder.retryHandlers,
                builder.metricsRegistry != null ? builder.metricsRegistry : new MetricsRegistry()
        );
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    /**
     * Posts a message.
     */
    public WebhookResponse send(WebhookMessage message) {
        Objects.requireNonNull(message, "Message is required");
        return post(JsonSupport.write(message), Map.of());
    }

    /**
     * Posts an arbitrary JSON body. Null values are dropped.
     *
     * @param body    the payload
     * @param headers request headers added for this call only
     */
    public WebhookResponse sendBody(Map<String, ?> body, Map<String, String> headers) {
        Map<String, Object> filtered = new LinkedHashMap<>();
        if (body != null) {
            body.forEach((key, value) -> {
                if (value != null) {
                    filtered.put(key, value);
                }
            });
        }
        return post(JsonSupport.write(filtered), headers != null ? headers : Map.of());
    }

    public WebhookResponse sendBody(Map<String, ?> body) {
        return sendBody(body, Map.of());
    }

    private WebhookResponse post(String body, Map<String, String> additionalHeaders) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        defaultHeaders.forEach(builder::header);
        additionalHeaders.forEach(builder::setHeader);
        builder.setHeader("Content-Type", "application/json;charset=utf-8");
        HttpRequest request = builder.build();

        if (log.isDebugEnabled()) {
            log.debug("Sending webhook request: uri={}, headers={}, body={}",
                    url, RetryingHttpExecutor.redactedHeaders(request), body);
        }

        HttpResult result = executor.execute(request, body.getBytes(StandardCharsets.UTF_8), "webhook");
        WebhookResponse response = new WebhookResponse(
                url.toString(), result.statusCode(), result.bodyAsString(), result.headers());
        if (response.isSuccessful()) {
            log.debug("Webhook response received: status={}, body={}", response.statusCode(), response.body());
        } else {
            log.warn("Webhook request failed: status={}, body={}", response.statusCode(), response.body());
        }
        return response;
    }

    private static URI validateUrl(String url) {
        if (url == null) {
            throw new SlackRequestException("Invalid URL detected: null");
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new SlackRequestException("Invalid URL detected: " + url, e);
        }
        String scheme = uri.getScheme();
        if ((!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
            throw new SlackRequestException("Invalid URL detected: " + url);
        }
        return uri;
    }

    public URI getUrl() {
        return url;
    }

    public static final class Builder {
        private final String url;
        private Duration timeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String proxy;
        private String userAgentPrefix;
        private String userAgentSuffix;
        private List<RetryHandler> retryHandlers = RetryHandlers.defaultHandlers();
        private HttpClient httpClient;
        private MetricsRegistry metricsRegistry;

        private Builder(String url) {
            this.url = url;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder proxy(String proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder userAgentPrefix(String userAgentPrefix) {
            this.userAgentPrefix = userAgentPrefix;
            return this;
        }

        public Builder userAgentSuffix(String userAgentSuffix) {
            this.userAgentSuffix = userAgentSuffix;
            return this;
        }

        public Builder retryHandlers(List<RetryHandler> retryHandlers) {
            this.retryHandlers = List.copyOf(retryHandlers);
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public WebhookClient build() {
            return new WebhookClient(this);
        }
    }
}
