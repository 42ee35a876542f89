package fr.lapetina.slack.socketmode;

/**
 * Receives the envelopes to acknowledge.
 * Acknowledge with {@link SocketModeClient#sendSocketModeResponse(SocketModeResponse)}.
 */
@FunctionalInterface
public interface SocketModeRequestListener {

    void onRequest(SocketModeClient client, SocketModeRequest request);
}
