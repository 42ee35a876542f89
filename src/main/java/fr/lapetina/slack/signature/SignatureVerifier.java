package fr.lapetina.slack.signature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;

/**
 * Verifies the signature Slack puts on the requests it sends to an app.
 *
 * The signature is {@code v0=} followed by the hex HMAC-SHA256, keyed with the
 * signing secret, of {@code v0:<timestamp>:<body>}. Requests whose timestamp is
 * more than five minutes away from the clock are rejected.
 *
 * @see <a href="https://api.slack.com/authentication/verifying-requests-from-slack">Verifying requests from Slack</a>
 */
public final class SignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(SignatureVerifier.class);

    public static final String TIMESTAMP_HEADER = "X-Slack-Request-Timestamp";
    public static final String SIGNATURE_HEADER = "X-Slack-Signature";

    static final Duration MAX_CLOCK_SKEW = Duration.ofMinutes(5);
    private static final String VERSION = "v0";
    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;
    private final Clock clock;

    public SignatureVerifier(String signingSecret, Clock clock) {
        Objects.requireNonNull(signingSecret, "Signing secret is required");
        this.key = new SecretKeySpec(signingSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    public SignatureVerifier(String signingSecret) {
        this(signingSecret, Clock.systemUTC());
    }

    /**
     * Verifies a request from its body and headers. Header names are matched case-insensitively.
     */
    public boolean isValidRequest(String body, Map<String, String> headers) {
        if (headers == null) {
            return false;
        }
        String timestamp = null;
        String signature = null;
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (TIMESTAMP_HEADER.equalsIgnoreCase(header.getKey())) {
                timestamp = header.getValue();
            } else if (SIGNATURE_HEADER.equalsIgnoreCase(header.getKey())) {
                signature = header.getValue();
            }
        }
        return isValid(body, timestamp, signature);
    }

    public boolean isValid(String body, String timestamp, String signature) {
        if (timestamp == null || signature == null) {
            return false;
        }
        long requestSeconds;
        try {
            requestSeconds = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            log.debug("Rejecting a request with an invalid timestamp: timestamp={}", timestamp);
            return false;
        }
        long skew = Math.abs(clock.instant().getEpochSecond() - requestSeconds);
        if (skew > MAX_CLOCK_SKEW.toSeconds()) {
            log.debug("Rejecting a stale request: skewSeconds={}", skew);
            return false;
        }
        String expected = generateSignature(timestamp, body);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Computes the signature of a request. A null body is signed as empty.
     */
    public String generateSignature(String timestamp, String body) {
        Objects.requireNonNull(timestamp, "Timestamp is required");
        String base = VERSION + ":" + timestamp + ":" + (body != null ? body : "");
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal(base.getBytes(StandardCharsets.UTF_8));
            return VERSION + "=" + HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }
}
