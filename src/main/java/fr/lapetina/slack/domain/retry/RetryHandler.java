package fr.lapetina.slack.domain.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * A link of the retry chain: a predicate deciding whether a failed call can be
 * retried, and an action preparing the next attempt.
 *
 * Clients walk their handlers in order; the first handler whose
 * {@link #canRetry} accepts gets to call {@link #prepareForNextAttempt}.
 * Handlers are stateless across calls, all per-call data lives in {@link RetryState}.
 */
public abstract class RetryHandler {

    private static final Logger log = LoggerFactory.getLogger(RetryHandler.class);

    private final int maxRetryCount;
    private final RetryIntervalCalculator intervalCalculator;
    private final Sleeper sleeper;

    protected RetryHandler(int maxRetryCount, RetryIntervalCalculator intervalCalculator, Sleeper sleeper) {
        if (maxRetryCount < 0) {
            throw new IllegalArgumentException("Max retry count must not be negative: " + maxRetryCount);
        }
        this.maxRetryCount = maxRetryCount;
        this.intervalCalculator = intervalCalculator != null
                ? intervalCalculator
                : new BackoffRetryIntervalCalculator();
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
    }

    protected RetryHandler(int maxRetryCount, RetryIntervalCalculator intervalCalculator) {
        this(maxRetryCount, intervalCalculator, Sleeper.THREAD);
    }

    protected RetryHandler() {
        this(1, new BackoffRetryIntervalCalculator(), Sleeper.THREAD);
    }

    /**
     * Returns the name used in logs, metrics and configuration.
     */
    public abstract String getName();

    /**
     * Decides whether the failed call can be retried.
     *
     * @param state    retry state of the current call
     * @param request  the request that failed
     * @param response the response, or null when the call failed without one
     * @param error    the error raised, or null when a response was received
     * @return true if this handler wants to retry
     */
    public final boolean canRetry(RetryState state, RetryRequest request, RetryResponse response, Throwable error) {
        Objects.requireNonNull(state, "State is required");
        if (state.getCurrentAttempt() >= maxRetryCount) {
            return false;
        }
        return canRetryCustom(state, request, response, error);
    }

    /**
     * Handler-specific predicate, only consulted while attempts remain.
     */
    protected abstract boolean canRetryCustom(
            RetryState state,
            RetryRequest request,
            RetryResponse response,
            Throwable error
    );

    /**
     * Waits for the next attempt and advances the state.
     *
     * @throws InterruptedException if the wait is interrupted
     */
    public void prepareForNextAttempt(
            RetryState state,
            RetryRequest request,
            RetryResponse response,
            Throwable error
    ) throws InterruptedException {
        state.setNextAttemptRequested(true);
        Duration duration = intervalCalculator.calculateSleepDuration(state.getCurrentAttempt());
        log.debug("Waiting before retry: handler={}, attempt={}, delayMs={}, uri={}",
                getName(), state.getCurrentAttempt(), duration.toMillis(), request.uri());
        sleeper.sleep(duration);
        state.incrementCurrentAttempt();
    }

    public int getMaxRetryCount() {
        return maxRetryCount;
    }

    public RetryIntervalCalculator getIntervalCalculator() {
        return intervalCalculator;
    }

    protected Sleeper getSleeper() {
        return sleeper;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{maxRetryCount=" + maxRetryCount + '}';
    }
}
