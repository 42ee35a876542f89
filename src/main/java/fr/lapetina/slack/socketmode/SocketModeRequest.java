package fr.lapetina.slack.socketmode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An envelope delivered over Socket Mode that expects an acknowledgement.
 *
 * @param type                    envelope type, e.g. {@code events_api}, {@code slash_commands}, {@code interactive}
 * @param envelopeId              id to echo back in the {@link SocketModeResponse}
 * @param payload                 the event, command or interaction payload
 * @param acceptsResponsePayload  whether the acknowledgement may carry a payload
 * @param retryAttempt            delivery attempt for Events API envelopes, or null
 * @param retryReason             why the envelope was redelivered, or null
 */
public record SocketModeRequest(
        String type,
        String envelopeId,
        Map<String, Object> payload,
        boolean acceptsResponsePayload,
        Integer retryAttempt,
        String retryReason
) {
    public SocketModeRequest {
        Objects.requireNonNull(type, "Type is required");
        Objects.requireNonNull(envelopeId, "Envelope id is required");
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    /**
     * Builds a request from a received message.
     *
     * @return empty unless {@code type}, {@code envelope_id} and {@code payload} are all present
     * @throws IllegalArgumentException if the payload is neither an object nor a string
     */
    @SuppressWarnings("unchecked")
    public static Optional<SocketModeRequest> fromMap(Map<String, Object> message) {
        Object type = message.get("type");
        Object envelopeId = message.get("envelope_id");
        Object payload = message.get("payload");
        if (type == null || envelopeId == null || payload == null) {
            return Optional.empty();
        }

        Map<String, Object> payloadMap;
        if (payload instanceof Map) {
            payloadMap = new LinkedHashMap<>((Map<String, Object>) payload);
            payloadMap.values().removeIf(Objects::isNull);
        } else if (payload instanceof String) {
            payloadMap = Map.of("text", payload);
        } else {
            throw new IllegalArgumentException("Unsupported payload type: " + payload.getClass().getSimpleName());
        }

        Object retryAttempt = message.get("retry_attempt");
        Object retryReason = message.get("retry_reason");
        return Optional.of(new SocketModeRequest(
                type.toString(),
                envelopeId.toString(),
                payloadMap,
                Boolean.TRUE.equals(message.get("accepts_response_payload")),
                retryAttempt instanceof Number ? ((Number) retryAttempt).intValue() : null,
                retryReason != null ? retryReason.toString() : null
        ));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.put("envelope_id", envelopeId);
        map.put("payload", payload);
        map.put("accepts_response_payload", acceptsResponsePayload);
        if (retryAttempt != null) {
            map.put("retry_attempt", retryAttempt);
        }
        if (retryReason != null) {
            map.put("retry_reason", retryReason);
        }
        return map;
    }
}
