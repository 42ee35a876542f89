package fr.lapetina.slack.socketmode;

import fr.lapetina.slack.infrastructure.json.JsonSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SocketModeRequestTest {

    @Test
    @DisplayName("should build a request when type, envelope id and payload are present")
    void shouldBuildRequest() {
        Map<String, Object> message = JsonSupport.readObject("{\"type\":\"slash_commands\",\"envelope_id\":\"e1\","
                + "\"payload\":{\"command\":\"/deploy\"},\"accepts_response_payload\":true}").orElseThrow();

        SocketModeRequest request = SocketModeRequest.fromMap(message).orElseThrow();

        assertThat(request.type()).isEqualTo("slash_commands");
        assertThat(request.envelopeId()).isEqualTo("e1");
        assertThat(request.payload()).containsEntry("command", "/deploy");
        assertThat(request.acceptsResponsePayload()).isTrue();
        assertThat(request.retryAttempt()).isNull();
        assertThat(request.retryReason()).isNull();
    }

    @Test
    @DisplayName("should skip messages missing a required field")
    void shouldSkipIncompleteMessages() {
        assertThat(SocketModeRequest.fromMap(Map.of("type", "hello"))).isEmpty();
        assertThat(SocketModeRequest.fromMap(Map.of("type", "events_api", "envelope_id", "e1"))).isEmpty();
        assertThat(SocketModeRequest.fromMap(Map.of("envelope_id", "e1", "payload", Map.of()))).isEmpty();
    }

    @Test
    @DisplayName("should wrap a string payload as text")
    void shouldWrapStringPayload() {
        SocketModeRequest request = SocketModeRequest.fromMap(
                Map.of("type", "interactive", "envelope_id", "e2", "payload", "plain")).orElseThrow();

        assertThat(request.payload()).isEqualTo(Map.of("text", "plain"));
    }

    @Test
    @DisplayName("should drop null payload values")
    void shouldDropNullPayloadValues() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("a", 1);
        payload.put("b", null);

        SocketModeRequest request = SocketModeRequest.fromMap(
                Map.of("type", "events_api", "envelope_id", "e3", "payload", payload)).orElseThrow();

        assertThat(request.payload()).containsOnlyKeys("a");
    }

    @Test
    @DisplayName("should reject an unsupported payload type")
    void shouldRejectUnsupportedPayload() {
        assertThatThrownBy(() -> SocketModeRequest.fromMap(
                Map.of("type", "events_api", "envelope_id", "e4", "payload", List.of(1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should serialize a response with or without payload")
    void shouldSerializeResponse() {
        assertThat(JsonSupport.write(SocketModeResponse.of("e1").toMap()))
                .isEqualTo("{\"envelope_id\":\"e1\"}");
        assertThat(JsonSupport.write(SocketModeResponse.of("e1", "done").toMap()))
                .isEqualTo("{\"envelope_id\":\"e1\",\"payload\":{\"text\":\"done\"}}");
    }
}
