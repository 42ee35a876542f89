package fr.lapetina.slack.socketmode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Acknowledgement of a {@link SocketModeRequest}.
 *
 * @param envelopeId the id of the acknowledged envelope
 * @param payload    optional response payload, null to acknowledge only
 */
public record SocketModeResponse(String envelopeId, Map<String, Object> payload) {

    public SocketModeResponse {
        Objects.requireNonNull(envelopeId, "Envelope id is required");
        payload = payload != null ? Map.copyOf(payload) : null;
    }

    public static SocketModeResponse of(String envelopeId) {
        return new SocketModeResponse(envelopeId, null);
    }

    public static SocketModeResponse of(String envelopeId, String text) {
        return new SocketModeResponse(envelopeId, Map.of("text", text));
    }

    public static SocketModeResponse of(String envelopeId, Map<String, Object> payload) {
        return new SocketModeResponse(envelopeId, payload);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("envelope_id", envelopeId);
        if (payload != null) {
            map.put("payload", payload);
        }
        return map;
    }
}
