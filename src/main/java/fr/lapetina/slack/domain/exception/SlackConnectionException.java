package fr.lapetina.slack.domain.exception;

/**
 * Raised when a request could not reach the platform, once retries are exhausted.
 */
public class SlackConnectionException extends SlackClientException {

    public SlackConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
