package fr.lapetina.slack.domain.exception;

/**
 * Base class of every error raised by the Slack clients.
 */
public class SlackClientException extends RuntimeException {

    public SlackClientException(String message) {
        super(message);
    }

    public SlackClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
