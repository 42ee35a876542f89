package fr.lapetina.slack.domain.retry;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Snapshot of an outgoing HTTP request, as seen by retry handlers.
 * The body is copied on construction and on access; the headers are unmodifiable.
 */
public record RetryRequest(
        String method,
        URI uri,
        Map<String, List<String>> headers,
        byte[] body
) {
    public RetryRequest {
        Objects.requireNonNull(method, "Method is required");
        Objects.requireNonNull(uri, "URI is required");
        headers = Headers.copyOf(headers);
        body = body != null ? body.clone() : null;
    }

    @Override
    public byte[] body() {
        return body != null ? body.clone() : null;
    }

    /**
     * Returns the first value of a header, ignoring case.
     */
    public Optional<String> header(String name) {
        return Headers.first(headers, name);
    }

    /**
     * Case-insensitive, immutable header maps shared by request and response snapshots.
     */
    static final class Headers {

        private Headers() {
        }

        static Map<String, List<String>> copyOf(Map<String, List<String>> source) {
            Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            if (source != null) {
                source.forEach((name, values) -> {
                    if (name != null) {
                        copy.computeIfAbsent(name, k -> new ArrayList<>())
                                .addAll(values != null ? values : List.of());
                    }
                });
                copy.replaceAll((name, values) -> List.copyOf(values));
            }
            return Collections.unmodifiableMap(copy);
        }

        static Optional<String> first(Map<String, List<String>> headers, String name) {
            List<String> values = headers.get(name);
            if (values == null || values.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(values.get(0));
        }
    }
}
