package fr.lapetina.slack.domain.retry;

import java.time.Duration;

/**
 * Blocks the calling thread between attempts. Replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
