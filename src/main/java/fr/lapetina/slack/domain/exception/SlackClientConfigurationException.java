package fr.lapetina.slack.domain.exception;

/**
 * Raised on invalid client-side configuration.
 */
public class SlackClientConfigurationException extends SlackClientException {

    public SlackClientConfigurationException(String message) {
        super(message);
    }
}
