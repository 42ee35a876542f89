package fr.lapetina.slack.rtm;

import java.util.Map;

/**
 * Receives RTM events of the type it was registered for.
 */
@FunctionalInterface
public interface RtmEventListener {

    void onEvent(RtmClient client, Map<String, Object> event);
}
