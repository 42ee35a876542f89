package fr.lapetina.slack.infrastructure.http;

import fr.lapetina.slack.domain.exception.SlackClientConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the HTTP proxy to use: an explicit URL first, then the
 * {@code HTTPS_PROXY}, {@code https_proxy}, {@code HTTP_PROXY} and
 * {@code http_proxy} environment variables, in that order. Empty variables
 * are skipped.
 */
public final class ProxySettings {

    private static final Logger log = LoggerFactory.getLogger(ProxySettings.class);

    static final List<String> ENV_VARIABLES = List.of("HTTPS_PROXY", "https_proxy", "HTTP_PROXY", "http_proxy");

    private ProxySettings() {
    }

    public static Optional<InetSocketAddress> resolve(String explicitProxy) {
        return resolve(explicitProxy, System.getenv());
    }

    static Optional<InetSocketAddress> resolve(String explicitProxy, Map<String, String> environment) {
        if (explicitProxy != null && !explicitProxy.isBlank()) {
            return Optional.of(parse(explicitProxy));
        }
        return loadFromEnvironment(environment).map(ProxySettings::parse);
    }

    static Optional<String> loadFromEnvironment(Map<String, String> environment) {
        for (String name : ENV_VARIABLES) {
            String value = environment.get(name);
            if (value == null || value.isEmpty()) {
                continue;
            }
            if (value.isBlank()) {
                // a whitespace-only value means the proxy was deliberately unset
                log.debug("Ignoring blank proxy environment variable: name={}", name);
                return Optional.empty();
            }
            log.debug("HTTP proxy loaded from environment: name={}, proxy={}", name, value);
            return Optional.of(value.trim());
        }
        return Optional.empty();
    }

    static InetSocketAddress parse(String proxy) {
        String value = proxy.trim();
        if (!value.contains("://")) {
            value = "http://" + value;
        }
        URI uri;
        try {
            uri = URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new SlackClientConfigurationException("Invalid proxy URL: " + proxy);
        }
        if (uri.getHost() == null) {
            throw new SlackClientConfigurationException("Invalid proxy URL: " + proxy);
        }
        int port = uri.getPort();
        if (port == -1) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return InetSocketAddress.createUnresolved(uri.getHost(), port);
    }
}
