package fr.lapetina.slack.domain.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff with jitter: {@code backoffFactor * 2^attempt}, then jitter,
 * optionally capped at {@code maxInterval}.
 *
 * With a deterministic jitter the produced intervals never decrease as the
 * attempt number grows.
 */
public final class BackoffRetryIntervalCalculator implements RetryIntervalCalculator {

    // 2^30 already overflows any sensible backoff factor
    private static final int MAX_EXPONENT = 30;

    private final Duration backoffFactor;
    private final Jitter jitter;
    private final Duration maxInterval;

    public BackoffRetryIntervalCalculator(Duration backoffFactor, Jitter jitter, Duration maxInterval) {
        this.backoffFactor = Objects.requireNonNull(backoffFactor, "Backoff factor is required");
        if (backoffFactor.isNegative()) {
            throw new IllegalArgumentException("Backoff factor must not be negative: " + backoffFactor);
        }
        this.jitter = jitter != null ? jitter : new RandomJitter();
        this.maxInterval = maxInterval;
    }

    public BackoffRetryIntervalCalculator(Duration backoffFactor, Jitter jitter) {
        this(backoffFactor, jitter, null);
    }

    public BackoffRetryIntervalCalculator() {
        this(Duration.ofMillis(500), new RandomJitter(), null);
    }

    @Override
    public Duration calculateSleepDuration(int currentAttempt) {
        int exponent = Math.min(Math.max(currentAttempt, 0), MAX_EXPONENT);
        long factorMillis = backoffFactor.toMillis();
        long intervalMillis = factorMillis > (Long.MAX_VALUE >> exponent)
                ? Long.MAX_VALUE
                : factorMillis << exponent;
        Duration interval = jitter.recalculate(Duration.ofMillis(intervalMillis));
        if (maxInterval != null && interval.compareTo(maxInterval) > 0) {
            return maxInterval;
        }
        return interval;
    }

    public Duration getBackoffFactor() {
        return backoffFactor;
    }

    public Duration getMaxInterval() {
        return maxInterval;
    }
}
