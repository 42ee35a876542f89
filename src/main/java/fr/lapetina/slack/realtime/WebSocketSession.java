package fr.lapetina.slack.realtime;

/**
 * An open WebSocket connection, as seen by the real-time clients.
 *
 * Implementations must accept sends from several threads.
 */
public interface WebSocketSession {

    /**
     * Client-side identifier of the session, used in logs and ping payloads.
     */
    String getSessionId();

    boolean isOpen();

    /**
     * Sends a complete text frame.
     *
     * @throws fr.lapetina.slack.domain.exception.SlackClientNotConnectedException if the session is not open
     */
    void sendText(String text);

    /**
     * Sends a ping frame. The payload must not exceed 125 bytes once encoded.
     *
     * @throws fr.lapetina.slack.domain.exception.SlackClientNotConnectedException if the session is not open
     */
    void sendPing(String payload);

    /**
     * Starts the closing handshake. Does nothing when already closed.
     */
    void close(int statusCode, String reason);
}
