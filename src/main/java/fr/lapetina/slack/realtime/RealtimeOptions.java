package fr.lapetina.slack.realtime;

import fr.lapetina.slack.domain.retry.BackoffRetryIntervalCalculator;
import fr.lapetina.slack.domain.retry.Jitter;
import fr.lapetina.slack.domain.retry.RandomJitter;
import fr.lapetina.slack.domain.retry.RetryIntervalCalculator;
import fr.lapetina.slack.domain.retry.Sleeper;
import fr.lapetina.slack.infrastructure.config.SlackClientConfig.RealtimeConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings shared by the Socket Mode and RTM clients.
 *
 * @param pingInterval          delay between two session checks (ping + staleness)
 * @param concurrency           number of threads running listeners
 * @param autoReconnect         reconnect when the server closes the session
 * @param initialBackoff        first reconnect delay, doubled on each failed attempt
 * @param maxBackoff            upper bound of a reconnect delay
 * @param maxReconnectAttempts  failed attempts tolerated before giving up
 * @param jitter                applied to every reconnect delay
 * @param sleeper               waits between reconnect attempts
 */
public record RealtimeOptions(
        Duration pingInterval,
        int concurrency,
        boolean autoReconnect,
        Duration initialBackoff,
        Duration maxBackoff,
        int maxReconnectAttempts,
        Jitter jitter,
        Sleeper sleeper
) {
    public RealtimeOptions {
        Objects.requireNonNull(pingInterval, "Ping interval is required");
        Objects.requireNonNull(initialBackoff, "Initial backoff is required");
        Objects.requireNonNull(maxBackoff, "Max backoff is required");
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("Ping interval must be positive: " + pingInterval);
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1: " + concurrency);
        }
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("Max reconnect attempts must not be negative: " + maxReconnectAttempts);
        }
        jitter = jitter != null ? jitter : new RandomJitter();
        sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
    }

    public static RealtimeOptions defaults() {
        return fromConfig(new RealtimeConfig());
    }

    public static RealtimeOptions fromConfig(RealtimeConfig config) {
        return new RealtimeOptions(
                Duration.ofMillis(config.getPingIntervalMs()),
                config.getConcurrency(),
                config.isAutoReconnect(),
                Duration.ofMillis(config.getReconnect().getInitialBackoffMs()),
                Duration.ofMillis(config.getReconnect().getMaxBackoffMs()),
                config.getReconnect().getMaxAttempts(),
                new RandomJitter(),
                Sleeper.THREAD
        );
    }

    public RealtimeOptions withPingInterval(Duration pingInterval) {
        return new RealtimeOptions(pingInterval, concurrency, autoReconnect, initialBackoff, maxBackoff,
                maxReconnectAttempts, jitter, sleeper);
    }

    public RealtimeOptions withAutoReconnect(boolean autoReconnect) {
        return new RealtimeOptions(pingInterval, concurrency, autoReconnect, initialBackoff, maxBackoff,
                maxReconnectAttempts, jitter, sleeper);
    }

    public RealtimeOptions withReconnectBackoff(Duration initialBackoff, Duration maxBackoff, int maxReconnectAttempts) {
        return new RealtimeOptions(pingInterval, concurrency, autoReconnect, initialBackoff, maxBackoff,
                maxReconnectAttempts, jitter, sleeper);
    }

    public RealtimeOptions withJitter(Jitter jitter) {
        return new RealtimeOptions(pingInterval, concurrency, autoReconnect, initialBackoff, maxBackoff,
                maxReconnectAttempts, jitter, sleeper);
    }

    public RealtimeOptions withSleeper(Sleeper sleeper) {
        return new RealtimeOptions(pingInterval, concurrency, autoReconnect, initialBackoff, maxBackoff,
                maxReconnectAttempts, jitter, sleeper);
    }

    RetryIntervalCalculator reconnectIntervalCalculator() {
        return new BackoffRetryIntervalCalculator(initialBackoff, jitter, maxBackoff);
    }
}
