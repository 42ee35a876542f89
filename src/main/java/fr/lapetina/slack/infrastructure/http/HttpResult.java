package fr.lapetina.slack.infrastructure.http;

import fr.lapetina.slack.domain.retry.RetryResponse;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of an HTTP exchange, after retries.
 */
public record HttpResult(
        URI uri,
        int statusCode,
        Map<String, List<String>> headers,
        byte[] body
) {
    public HttpResult {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        body = body != null ? body.clone() : new byte[0];
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    RetryResponse toRetryResponse() {
        return new RetryResponse(statusCode, headers, body);
    }
}
