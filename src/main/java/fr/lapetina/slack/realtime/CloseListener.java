package fr.lapetina.slack.realtime;

/**
 * Notified when the server closes the current session.
 */
@FunctionalInterface
public interface CloseListener {

    void onClose(int statusCode, String reason);
}
