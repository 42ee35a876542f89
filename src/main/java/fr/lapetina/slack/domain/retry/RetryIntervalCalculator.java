package fr.lapetina.slack.domain.retry;

import java.time.Duration;

/**
 * Computes how long to wait before the next attempt.
 */
@FunctionalInterface
public interface RetryIntervalCalculator {

    /**
     * @param currentAttempt zero-origin attempt number that just failed
     * @return time to sleep before the next attempt
     */
    Duration calculateSleepDuration(int currentAttempt);
}
