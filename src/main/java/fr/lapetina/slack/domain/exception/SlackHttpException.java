package fr.lapetina.slack.domain.exception;

/**
 * Raised on a non-2xx response that carries no platform error payload.
 */
public class SlackHttpException extends SlackClientException {

    private final int statusCode;
    private final String body;

    public SlackHttpException(String url, int statusCode, String body) {
        super("HTTP " + statusCode + " from " + url);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }
}
