package fr.lapetina.slack.webhook;

import java.util.List;
import java.util.Map;

/**
 * Response of an incoming webhook call. The body is plain text ({@code ok} on success).
 */
public record WebhookResponse(
        String url,
        int statusCode,
        String body,
        Map<String, List<String>> headers
) {
    public WebhookResponse {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
