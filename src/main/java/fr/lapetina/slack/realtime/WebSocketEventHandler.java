package fr.lapetina.slack.realtime;

/**
 * Receives the events of one {@link WebSocketSession}.
 *
 * Called on the transport's own threads; implementations hand work off quickly.
 */
public interface WebSocketEventHandler {

    /**
     * A complete (reassembled) text message.
     */
    void onText(WebSocketSession session, String text);

    void onPong(WebSocketSession session, String payload);

    /**
     * The peer closed the connection.
     */
    void onClose(WebSocketSession session, int statusCode, String reason);

    /**
     * The connection failed. No further event follows.
     */
    void onError(WebSocketSession session, Throwable error);
}
