package fr.lapetina.slack.domain.exception;

import fr.lapetina.slack.domain.model.SlackResponse;

/**
 * Raised when the platform answers but does not report success,
 * either with {@code "ok": false} or with a body that is not the expected JSON.
 */
public class SlackApiException extends SlackClientException {

    private final SlackResponse response;

    public SlackApiException(String message, SlackResponse response) {
        super(message + "\nThe server responded with: " + response);
        this.response = response;
    }

    /**
     * Returns the platform error code, e.g. {@code invalid_auth} or {@code ratelimited}.
     * Null when the body was not a platform payload.
     */
    public String getError() {
        return response.getError();
    }

    public SlackResponse getResponse() {
        return response;
    }
}
