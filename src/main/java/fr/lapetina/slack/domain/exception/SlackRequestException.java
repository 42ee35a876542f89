package fr.lapetina.slack.domain.exception;

/**
 * Raised when a request cannot be built or sent as given (invalid URL, unencodable body).
 */
public class SlackRequestException extends SlackClientException {

    public SlackRequestException(String message) {
        super(message);
    }

    public SlackRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
