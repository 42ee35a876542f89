package fr.lapetina.slack.infrastructure.http;

import fr.lapetina.slack.domain.exception.SlackConnectionException;
import fr.lapetina.slack.domain.retry.RetryHandler;
import fr.lapetina.slack.domain.retry.RetryRequest;
import fr.lapetina.slack.domain.retry.RetryResponse;
import fr.lapetina.slack.domain.retry.RetryState;
import fr.lapetina.slack.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sends HTTP requests and walks the retry handler chain on failures.
 *
 * A call ends when a 2xx response arrives, or when no handler accepts the
 * failure: the last response is then returned, or the last error surfaces as
 * {@link SlackConnectionException}.
 */
public final class RetryingHttpExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryingHttpExecutor.class);

    // Upper bound on attempts whatever the handlers say
    static final int MAX_ATTEMPTS = 100;

    private final HttpClient httpClient;
    private final List<RetryHandler> retryHandlers;
    private final MetricsRegistry metricsRegistry;
    private final String clientName;

    public RetryingHttpExecutor(
            String clientName,
            HttpClient httpClient,
            List<RetryHandler> retryHandlers,
            MetricsRegistry metricsRegistry
    ) {
        this.clientName = clientName;
        this.httpClient = httpClient;
        this.retryHandlers = List.copyOf(retryHandlers);
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Sends a request, retrying as the handler chain decides.
     *
     * @param request   the request to send
     * @param body      the request body, for handlers that inspect it (may be null)
     * @param operation name used in logs and metrics (e.g. the API method)
     * @return the final result, 2xx or not
     * @throws SlackConnectionException if the platform could not be reached
     */
    public HttpResult execute(HttpRequest request, byte[] body, String operation) {
        RetryRequest retryRequest = new RetryRequest(
                request.method(), request.uri(), request.headers().map(), body);
        RetryState state = new RetryState();
        HttpResult lastResult = null;
        IOException lastError = null;

        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            // A new attempt starts here
            state.setNextAttemptRequested(false);
            Instant start = Instant.now();
            try {
                HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
                Duration latency = Duration.between(start, Instant.now());
                metricsRegistry.recordCall(clientName, operation, response.statusCode(), latency);

                HttpResult result = new HttpResult(
                        request.uri(), response.statusCode(), response.headers().map(), response.body());
                log.debug("Received response: client={}, operation={}, status={}, attempt={}, latencyMs={}",
                        clientName, operation, result.statusCode(), state.getCurrentAttempt(), latency.toMillis());
                if (result.isSuccessful()) {
                    return result;
                }

                lastResult = result;
                if (!prepareRetry(state, retryRequest, result.toRetryResponse(), null, operation)) {
                    return result;
                }
            } catch (IOException e) {
                lastError = e;
                log.error("Failed to send request: client={}, operation={}, uri={}, attempt={}, error={}",
                        clientName, operation, request.uri(), state.getCurrentAttempt(), e.toString());
                if (!prepareRetry(state, retryRequest, null, e, operation)) {
                    throw new SlackConnectionException("Failed to send a request to " + request.uri(), e);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SlackConnectionException("Interrupted while calling " + request.uri(), e);
            }
        }

        log.warn("Giving up after {} attempts: client={}, operation={}", MAX_ATTEMPTS, clientName, operation);
        if (lastResult != null) {
            return lastResult;
        }
        throw new SlackConnectionException("Failed to send a request to " + request.uri(), lastError);
    }

    private boolean prepareRetry(
            RetryState state,
            RetryRequest request,
            RetryResponse response,
            IOException error,
            String operation
    ) {
        for (RetryHandler handler : retryHandlers) {
            if (handler.canRetry(state, request, response, error)) {
                log.info("Retry handler found: client={}, operation={}, handler={}, attempt={}",
                        clientName, operation, handler.getName(), state.getCurrentAttempt());
                metricsRegistry.incrementRetryCount(clientName, handler.getName());
                try {
                    handler.prepareForNextAttempt(state, request, response, error);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SlackConnectionException("Interrupted while waiting to retry " + request.uri(), e);
                }
                break;
            }
        }
        return state.isNextAttemptRequested();
    }

    /**
     * Copies request headers for logging, with credentials redacted.
     */
    public static Map<String, List<String>> redactedHeaders(HttpRequest request) {
        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        request.headers().map().forEach((name, values) ->
                headers.put(name, "authorization".equalsIgnoreCase(name) ? List.of("(redacted)") : values));
        return headers;
    }

    public List<RetryHandler> getRetryHandlers() {
        return retryHandlers;
    }
}
