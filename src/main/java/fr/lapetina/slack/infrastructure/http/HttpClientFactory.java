package fr.lapetina.slack.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * Creates the {@link HttpClient} instances shared by the HTTP and WebSocket clients.
 */
public final class HttpClientFactory {

    private static final Logger log = LoggerFactory.getLogger(HttpClientFactory.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private HttpClientFactory() {
    }

    /**
     * @param connectTimeout connection timeout
     * @param proxy          explicit proxy URL, or null to fall back to environment variables
     */
    public static HttpClient create(Duration connectTimeout, String proxy) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL);

        Optional<InetSocketAddress> proxyAddress = ProxySettings.resolve(proxy);
        proxyAddress.ifPresent(address -> {
            log.info("Using HTTP proxy: host={}, port={}", address.getHostString(), address.getPort());
            builder.proxy(ProxySelector.of(address));
        });
        return builder.build();
    }

    public static HttpClient create() {
        return create(DEFAULT_CONNECT_TIMEOUT, null);
    }
}
