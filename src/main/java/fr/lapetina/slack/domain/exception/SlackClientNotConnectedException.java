package fr.lapetina.slack.domain.exception;

/**
 * Raised when sending over a WebSocket session that is not open.
 */
public class SlackClientNotConnectedException extends SlackClientException {

    public SlackClientNotConnectedException(String message) {
        super(message);
    }
}
