package fr.lapetina.slack.socketmode;

import java.util.Map;

/**
 * Receives every message of a Socket Mode session, except {@code disconnect}.
 */
@FunctionalInterface
public interface WebSocketMessageListener {

    void onMessage(SocketModeClient client, Map<String, Object> message, String raw);
}
