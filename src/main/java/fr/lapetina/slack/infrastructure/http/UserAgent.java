package fr.lapetina.slack.infrastructure.http;

import java.util.StringJoiner;

/**
 * Builds the {@code User-Agent} header sent by every client.
 *
 * Format: {@code [prefix] slack-client/<version> Java/<version> <os>/<version> [suffix]}
 */
public final class UserAgent {

    public static final String SDK_NAME = "slack-client";

    private UserAgent() {
    }

    public static String build(String prefix, String suffix) {
        StringJoiner joiner = new StringJoiner(" ");
        if (prefix != null && !prefix.isBlank()) {
            joiner.add(prefix.trim());
        }
        joiner.add(SDK_NAME + "/" + sdkVersion());
        joiner.add("Java/" + System.getProperty("java.version"));
        joiner.add(System.getProperty("os.name", "unknown").replace(' ', '_')
                + "/" + System.getProperty("os.version", "unknown"));
        if (suffix != null && !suffix.isBlank()) {
            joiner.add(suffix.trim());
        }
        return joiner.toString();
    }

    public static String build() {
        return build(null, null);
    }

    static String sdkVersion() {
        String version = UserAgent.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }
}
