package fr.lapetina.slack.domain.retry;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of a received HTTP response, as seen by retry handlers.
 * The body is copied on construction and on access; the headers are unmodifiable.
 */
public record RetryResponse(
        int statusCode,
        Map<String, List<String>> headers,
        byte[] body
) {
    public RetryResponse {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("Status code out of range: " + statusCode);
        }
        headers = RetryRequest.Headers.copyOf(headers);
        body = body != null ? body.clone() : new byte[0];
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public Optional<String> header(String name) {
        return RetryRequest.Headers.first(headers, name);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
