package fr.lapetina.slack.domain.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry interval calculator that always returns the same value.
 */
public final class FixedValueRetryIntervalCalculator implements RetryIntervalCalculator {

    private final Duration fixedInterval;

    public FixedValueRetryIntervalCalculator(Duration fixedInterval) {
        this.fixedInterval = Objects.requireNonNull(fixedInterval, "Interval is required");
    }

    public FixedValueRetryIntervalCalculator() {
        this(Duration.ofMillis(500));
    }

    @Override
    public Duration calculateSleepDuration(int currentAttempt) {
        return fixedInterval;
    }
}
