package fr.lapetina.slack.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized client metrics using Micrometer.
 *
 * Provides:
 * - Call counters and latency timers per client and API method
 * - Retry counters per retry handler
 * - Reconnect counters and connected session gauges per real-time client
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "slack_client";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> callCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> reconnectCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> connectedSessions = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        log.debug("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Records one HTTP exchange, successful or not.
     */
    public void recordCall(String client, String method, int status, Duration latency) {
        String statusClass = status / 100 + "xx";
        String counterKey = client + ":" + method + ":" + statusClass;
        callCounters.computeIfAbsent(counterKey, k ->
                Counter.builder(prefix + "_calls_total")
                        .description("Total number of HTTP calls")
                        .tag("client", client)
                        .tag("method", method)
                        .tag("status", statusClass)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(client + ":" + method, k ->
                Timer.builder(prefix + "_call_latency")
                        .description("HTTP call latency")
                        .tag("client", client)
                        .tag("method", method)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments the retry counter of a handler.
     */
    public void incrementRetryCount(String client, String handler) {
        retryCounters.computeIfAbsent(client + ":" + handler, k ->
                Counter.builder(prefix + "_retries_total")
                        .description("Total number of retried calls")
                        .tag("client", client)
                        .tag("handler", handler)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the reconnect counter of a real-time client.
     */
    public void incrementReconnectCount(String client) {
        reconnectCounters.computeIfAbsent(client, k ->
                Counter.builder(prefix + "_reconnects_total")
                        .description("Total number of WebSocket reconnections")
                        .tag("client", client)
                        .register(registry)
        ).increment();
    }

    /**
     * Tracks sessions opened and closed by a real-time client.
     */
    public void sessionOpened(String client) {
        connectedSessionsOf(client).incrementAndGet();
    }

    public void sessionClosed(String client) {
        connectedSessionsOf(client).updateAndGet(current -> Math.max(0, current - 1));
    }

    public int getConnectedSessions(String client) {
        return connectedSessionsOf(client).get();
    }

    private AtomicInteger connectedSessionsOf(String client) {
        return connectedSessions.computeIfAbsent(client, k -> {
            AtomicInteger value = new AtomicInteger(0);
            Gauge.builder(prefix + "_connected_sessions", value, AtomicInteger::get)
                    .description("Number of open WebSocket sessions")
                    .tag("client", client)
                    .register(registry);
            return value;
        });
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
