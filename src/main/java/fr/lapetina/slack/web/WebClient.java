package fr.lapetina.slack.web;

import fr.lapetina.slack.domain.exception.SlackApiException;
import fr.lapetina.slack.domain.exception.SlackHttpException;
import fr.lapetina.slack.domain.exception.SlackRequestException;
import fr.lapetina.slack.domain.model.SlackResponse;
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
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Client for the Slack Web API.
 *
 * Every API method is a POST to {@code <baseUrl><method>}, with either a
 * form-encoded or a JSON body. Responses are validated: anything other than
 * {@code "ok": true} raises {@link SlackApiException}, a non-2xx answer
 * without a platform payload raises {@link SlackHttpException}.
 * Transient failures are retried by the configured {@link RetryHandler} chain.
 */
public class WebClient {

    private static final Logger log = LoggerFactory.getLogger(WebClient.class);

    public static final String BASE_URL = "https://slack.com/api/";

    static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";
    static final String JSON_CONTENT_TYPE = "application/json;charset=utf-8";

    private final String token;
    private final String baseUrl;
    private final Duration timeout;
    private final Map<String, String> defaultHeaders;
    private final Map<String, String> defaultParams;
    private final RetryingHttpExecutor executor;

    protected WebClient(Builder builder) {
        this.token = builder.token != null ? builder.token.strip() : null;
        this.baseUrl = builder.baseUrl.endsWith("/") ? builder.baseUrl : builder.baseUrl + "/";
        this.timeout = builder.timeout;

        Map<String, String> headers = new LinkedHashMap<>(builder.headers);
        headers.put("User-Agent", UserAgent.build(builder.userAgentPrefix, builder.userAgentSuffix));
        this.defaultHeaders = Map.copyOf(headers);

        Map<String, String> params = new LinkedHashMap<>();
        if (builder.teamId != null) {
            params.put("team_id", builder.teamId);
        }
        this.defaultParams = Map.copyOf(params);

        HttpClient httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClientFactory.create(builder.connectTimeout, builder.proxy);
        this.executor = new RetryingHttpExecutor(
                "web",
                httpClient,
                builder.retryHandlers,
                builder.metricsRegistry != null ? builder.metricsRegistry : new MetricsRegistry()
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Calls an API method with form-encoded parameters and the client token.
     *
     * @param apiMethod the API method, e.g. {@code chat.postMessage}
     * @param params    parameters; null values are dropped, booleans sent as 1/0,
     *                  maps and lists sent as JSON strings
     * @return the validated response
     * @throws SlackApiException if the platform reports an error
     */
    public SlackResponse apiCall(String apiMethod, Map<String, ?> params) {
        return apiCall(apiMethod, params, token);
    }

    /**
     * Calls an API method with form-encoded parameters and an explicit token.
     */
    public SlackResponse apiCall(String apiMethod, Map<String, ?> params, String tokenToUse) {
        Map<String, Object> allParams = new LinkedHashMap<>(defaultParams);
        if (params != null) {
            allParams.putAll(params);
        }
        String body = encodeForm(allParams);
        HttpRequest.Builder request = newRequest(apiMethod, tokenToUse)
                .header("Content-Type", FORM_CONTENT_TYPE)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        return send(apiMethod, request.build(), body);
    }

    /**
     * Calls an API method with a JSON body and the client token.
     */
    public SlackResponse apiCallJson(String apiMethod, Map<String, ?> jsonBody) {
        Map<String, Object> allParams = new LinkedHashMap<>(defaultParams);
        if (jsonBody != null) {
            allParams.putAll(jsonBody);
        }
        String body = JsonSupport.write(allParams);
        HttpRequest.Builder request = newRequest(apiMethod, token)
                .header("Content-Type", JSON_CONTENT_TYPE)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        return send(apiMethod, request.build(), body);
    }

    /**
     * Iterates over every page of a cursor-paginated method.
     *
     * Each iteration starts from the first page. The first call is sent when
     * the first element is requested; a failing page raises {@link SlackApiException}.
     */
    public Iterable<SlackResponse> paginate(String apiMethod, Map<String, ?> params) {
        return () -> new PageIterator(apiMethod, params);
    }

    // -----------------------------------------------------------------
    // Methods the SDK relies on itself

    /**
     * Checks authentication and returns the caller identity ({@code user_id}, {@code bot_id}, ...).
     */
    public SlackResponse authTest() {
        return apiCall("auth.test", Map.of());
    }

    /**
     * Issues a Socket Mode WebSocket URL. Requires an app-level token.
     */
    public SlackResponse appsConnectionsOpen(String appToken) {
        return apiCall("apps.connections.open", Map.of(), appToken);
    }

    /**
     * Issues an RTM WebSocket URL.
     */
    public SlackResponse rtmConnect() {
        return apiCall("rtm.connect", Map.of());
    }

    public SlackResponse chatPostMessage(String channel, String text) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("channel", channel);
        params.put("text", text);
        return apiCallJson("chat.postMessage", params);
    }

    public SlackResponse conversationsList(Integer limit, String cursor) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("limit", limit);
        params.put("cursor", cursor);
        return apiCall("conversations.list", params);
    }

    // -----------------------------------------------------------------

    private HttpRequest.Builder newRequest(String apiMethod, String tokenToUse) {
        URI uri;
        try {
            uri = URI.create(baseUrl + apiMethod);
        } catch (IllegalArgumentException e) {
            throw new SlackRequestException("Invalid URL detected: " + baseUrl + apiMethod, e);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new SlackRequestException("Invalid URL detected: " + uri);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(timeout);
        defaultHeaders.forEach(builder::header);
        if (tokenToUse != null && !tokenToUse.isBlank()) {
            builder.header("Authorization", "Bearer " + tokenToUse.strip());
        }
        return builder;
    }

    private SlackResponse send(String apiMethod, HttpRequest request, String body) {
        if (log.isDebugEnabled()) {
            log.debug("Sending request: method={}, uri={}, headers={}, body={}",
                    apiMethod, request.uri(), RetryingHttpExecutor.redactedHeaders(request), body);
        }
        HttpResult result = executor.execute(request, body.getBytes(StandardCharsets.UTF_8), apiMethod);
        return toSlackResponse(apiMethod, result);
    }

    private SlackResponse toSlackResponse(String apiMethod, HttpResult result) {
        String rawBody = result.bodyAsString();
        Optional<Map<String, Object>> data = JsonSupport.readObject(rawBody);
        SlackResponse response = new SlackResponse(
                result.uri().toString(), result.statusCode(), result.headers(), data.orElse(null), rawBody);

        if (data.isEmpty()) {
            if (!result.isSuccessful()) {
                log.warn("API call failed with HTTP error: method={}, status={}", apiMethod, result.statusCode());
                throw new SlackHttpException(result.uri().toString(), result.statusCode(), rawBody);
            }
            throw new SlackApiException(unexpectedBodyMessage(rawBody), response);
        }

        log.debug("Received response: method={}, status={}, ok={}, error={}",
                apiMethod, response.statusCode(), response.isOk(), response.getError());
        return response.validate();
    }

    static String unexpectedBodyMessage(String body) {
        String excerpt = body.length() > 100 ? body.substring(0, 100) + "..." : body;
        return "Received a response in a non-JSON format: " + excerpt;
    }

    static String encodeForm(Map<String, ?> params) {
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((name, value) -> {
            if (value != null) {
                joiner.add(URLEncoder.encode(name, StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(formValue(value), StandardCharsets.UTF_8));
            }
        });
        return joiner.toString();
    }

    private static String formValue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? "1" : "0";
        }
        if (value instanceof Map || value instanceof List) {
            return JsonSupport.write(value);
        }
        return value.toString();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Walks the pages of a cursor-paginated method.
     */
    private final class PageIterator implements Iterator<SlackResponse> {

        private final String apiMethod;
        private final Map<String, Object> params;
        private SlackResponse current;
        private boolean exhausted;

        private PageIterator(String apiMethod, Map<String, ?> params) {
            this.apiMethod = apiMethod;
            this.params = params != null ? new LinkedHashMap<>(params) : new LinkedHashMap<>();
        }

        @Override
        public boolean hasNext() {
            if (exhausted) {
                return false;
            }
            return current == null || current.nextCursor().isPresent();
        }

        @Override
        public SlackResponse next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more pages for " + apiMethod);
            }
            if (current != null) {
                params.put("cursor", current.nextCursor().orElseThrow());
            }
            try {
                current = apiCall(apiMethod, params);
            } catch (RuntimeException e) {
                exhausted = true;
                throw e;
            }
            return current;
        }
    }

    public static final class Builder {
        private String token;
        private String baseUrl = BASE_URL;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration connectTimeout = HttpClientFactory.DEFAULT_CONNECT_TIMEOUT;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String teamId;
        private String proxy;
        private String userAgentPrefix;
        private String userAgentSuffix;
        private List<RetryHandler> retryHandlers = RetryHandlers.defaultHandlers();
        private HttpClient httpClient;
        private MetricsRegistry metricsRegistry;

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        /**
         * Team id sent with every call, for org-wide app installations.
         */
        public Builder teamId(String teamId) {
            this.teamId = teamId;
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

        public WebClient build() {
            return new WebClient(this);
        }
    }
}
