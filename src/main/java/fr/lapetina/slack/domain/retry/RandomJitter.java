package fr.lapetina.slack.domain.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Adds a uniformly random amount in [0, 1s) to every interval.
 */
public final class RandomJitter implements Jitter {

    private static final long MAX_JITTER_MILLIS = 1000;

    @Override
    public Duration recalculate(Duration duration) {
        return duration.plusMillis(ThreadLocalRandom.current().nextLong(MAX_JITTER_MILLIS));
    }
}
