package fr.lapetina.slack.infrastructure.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.slack.domain.exception.SlackRequestException;

import java.util.Map;
import java.util.Optional;

/**
 * Shared Jackson mapper and helpers for JSON payloads.
 *
 * Null fields are never serialized, unknown properties are ignored.
 */
public final class JsonSupport {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonSupport() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes a payload.
     *
     * @throws SlackRequestException if the payload cannot be serialized
     */
    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SlackRequestException("Failed to serialize payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a JSON object. Returns empty when the text is not a JSON object.
     */
    public static Optional<Map<String, Object>> readObject(String text) {
        if (text == null || !text.stripLeading().startsWith("{")) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(MAPPER.readValue(text, MAP_TYPE));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
