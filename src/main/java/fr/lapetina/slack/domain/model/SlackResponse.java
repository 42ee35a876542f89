package fr.lapetina.slack.domain.model;

import fr.lapetina.slack.domain.exception.SlackApiException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Response of a Web API call. Headers and the top level of {@code data} are copied
 * into unmodifiable maps.
 *
 * {@code data} holds the parsed JSON object, or null when the body was not JSON.
 */
public record SlackResponse(
        String url,
        int statusCode,
        Map<String, List<String>> headers,
        Map<String, Object> data,
        String rawBody
) {
    public SlackResponse {
        Objects.requireNonNull(url, "URL is required");
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : null;
    }

    public boolean isOk() {
        return data != null && Boolean.TRUE.equals(data.get("ok"));
    }

    /**
     * Returns the platform error code, or null.
     */
    public String getError() {
        return getString("error");
    }

    public Object get(String key) {
        return data != null ? data.get(key) : null;
    }

    public String getString(String key) {
        Object value = get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = get(key);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String key) {
        Object value = get(key);
        return value instanceof List ? (List<Object>) value : List.of();
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    /**
     * Returns the cursor of the next page, read from {@code response_metadata.next_cursor}
     * or a top-level {@code next_cursor}. Empty when there are no more pages.
     */
    public Optional<String> nextCursor() {
        Object cursor = getMap("response_metadata").get("next_cursor");
        if (cursor == null) {
            cursor = get("next_cursor");
        }
        if (cursor == null || cursor.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cursor.toString());
    }

    /**
     * Checks that the call succeeded.
     *
     * @return this response
     * @throws SlackApiException if the status is not 200 or the payload is not {@code "ok": true}
     */
    public SlackResponse validate() {
        if (statusCode == 200 && isOk()) {
            return this;
        }
        throw new SlackApiException("The request to the Slack API failed. (url: " + url + ")", this);
    }

    @Override
    public String toString() {
        return data != null ? data.toString() : rawBody;
    }
}
