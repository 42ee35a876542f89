package fr.lapetina.slack.realtime;

import java.net.URI;

/**
 * Opens WebSocket sessions. The default is {@link JdkWebSocketConnector}.
 */
@FunctionalInterface
public interface WebSocketConnector {

    /**
     * Connects to the given endpoint and returns once the handshake completed.
     *
     * @throws fr.lapetina.slack.domain.exception.SlackConnectionException if the connection cannot be opened
     */
    WebSocketSession connect(URI uri, WebSocketEventHandler handler);
}
