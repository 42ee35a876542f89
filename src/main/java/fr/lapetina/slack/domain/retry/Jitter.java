package fr.lapetina.slack.domain.retry;

import java.time.Duration;

/**
 * Adds a jitter amount to a computed retry interval.
 *
 * @see <a href="https://aws.amazon.com/blogs/architecture/exponential-backoff-and-jitter/">Exponential Backoff And Jitter</a>
 */
@FunctionalInterface
public interface Jitter {

    /**
     * Returns a new duration with the jitter amount applied.
     */
    Duration recalculate(Duration duration);

    /**
     * Jitter that leaves durations untouched.
     */
    static Jitter none() {
        return duration -> duration;
    }
}
