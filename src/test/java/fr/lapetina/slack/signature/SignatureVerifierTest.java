package fr.lapetina.slack.signature;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SignatureVerifierTest {

    // Example from the Slack documentation on verifying requests
    private static final String SIGNING_SECRET = "8f742231b10e8888abcd99yyyzzz85a5";
    private static final String BODY = "token=xyzz0WbapA4vBCDEFasx0q6G&team_id=T1DC2JH3J&team_domain=testteamnow"
            + "&channel_id=G8PSS9T3V&channel_name=foobar&user_id=U2CERLKJA&user_name=roadrunner"
            + "&command=%2Fwebhook-collect&text=&response_url=https%3A%2F%2Fhooks.slack.com%2Fcommands"
            + "%2FT1DC2JH3J%2F397700885554%2F96rGlfmibIGlgcZRskXaIFfN"
            + "&trigger_id=398738663015.47445629121.803a0bc887a14d10d2c447fce8b6703c";
    private static final String TIMESTAMP = "1531420618";
    private static final String SIGNATURE = "v0=a2114d57b48eac39b9ad189dd8316235a7b4a8d21a10bd27519666489c69b503";

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1531420618), ZoneOffset.UTC);
    private final SignatureVerifier verifier = new SignatureVerifier(SIGNING_SECRET, clock);

    @Test
    @DisplayName("should generate the documented signature")
    void shouldGenerateSignature() {
        assertThat(verifier.generateSignature(TIMESTAMP, BODY)).isEqualTo(SIGNATURE);
    }

    @Test
    @DisplayName("should accept a valid request with headers in any case")
    void shouldAcceptValidRequest() {
        assertThat(verifier.isValidRequest(BODY, Map.of(
                "X-Slack-Request-Timestamp", TIMESTAMP,
                "X-Slack-Signature", SIGNATURE))).isTrue();
        assertThat(verifier.isValidRequest(BODY, Map.of(
                "x-slack-request-timestamp", TIMESTAMP,
                "x-slack-signature", SIGNATURE))).isTrue();
    }

    @Test
    @DisplayName("should reject a tampered body")
    void shouldRejectTamperedBody() {
        assertThat(verifier.isValid(BODY + "------", TIMESTAMP, SIGNATURE)).isFalse();
    }

    @Test
    @DisplayName("should reject a request older than five minutes")
    void shouldRejectExpiredRequest() {
        SignatureVerifier later = new SignatureVerifier(SIGNING_SECRET,
                Clock.offset(clock, Duration.ofMinutes(5).plusSeconds(1)));

        assertThat(later.isValid(BODY, TIMESTAMP, SIGNATURE)).isFalse();
        assertThat(new SignatureVerifier(SIGNING_SECRET).isValid(BODY, TIMESTAMP, SIGNATURE)).isFalse();
    }

    @Test
    @DisplayName("should reject missing values")
    void shouldRejectMissingValues() {
        assertThat(verifier.isValidRequest(null, Map.of(
                "X-Slack-Request-Timestamp", TIMESTAMP,
                "X-Slack-Signature", SIGNATURE))).isFalse();
        assertThat(verifier.isValidRequest(BODY, null)).isFalse();
        assertThat(verifier.isValid(BODY, null, SIGNATURE)).isFalse();
        assertThat(verifier.isValid(BODY, TIMESTAMP, null)).isFalse();
        assertThat(verifier.isValid(BODY, "not-a-number", SIGNATURE)).isFalse();
    }
}
