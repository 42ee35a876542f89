package fr.lapetina.slack.domain.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Retries calls rejected with HTTP 429.
 *
 * The wait honours the server's {@code Retry-After} header (in seconds) plus
 * jitter. Without the header it waits one second plus jitter.
 */
public class RateLimitErrorRetryHandler extends RetryHandler {

    private static final Logger log = LoggerFactory.getLogger(RateLimitErrorRetryHandler.class);

    public static final String RETRY_AFTER_HEADER = "Retry-After";

    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);

    private final Jitter jitter;

    public RateLimitErrorRetryHandler(int maxRetryCount, Jitter jitter, Sleeper sleeper) {
        super(maxRetryCount, null, sleeper);
        this.jitter = jitter != null ? jitter : new RandomJitter();
    }

    public RateLimitErrorRetryHandler(int maxRetryCount) {
        this(maxRetryCount, new RandomJitter(), Sleeper.THREAD);
    }

    public RateLimitErrorRetryHandler() {
        this(1);
    }

    @Override
    public String getName() {
        return "rate-limit";
    }

    @Override
    protected boolean canRetryCustom(
            RetryState state,
            RetryRequest request,
            RetryResponse response,
            Throwable error
    ) {
        return response != null && response.statusCode() == 429;
    }

    @Override
    public void prepareForNextAttempt(
            RetryState state,
            RetryRequest request,
            RetryResponse response,
            Throwable error
    ) throws InterruptedException {
        if (response == null) {
            throw new IllegalStateException("Rate limit retry requires a response", error);
        }
        state.setNextAttemptRequested(true);
        Duration duration = jitter.recalculate(retryAfter(response).orElse(DEFAULT_RETRY_AFTER));
        log.info("Rate limited, waiting before retry: attempt={}, delayMs={}, uri={}",
                state.getCurrentAttempt(), duration.toMillis(), request.uri());
        getSleeper().sleep(duration);
        state.incrementCurrentAttempt();
    }

    /**
     * Parses the {@code Retry-After} header of a response, in seconds.
     */
    public static Optional<Duration> retryAfter(RetryResponse response) {
        return response.header(RETRY_AFTER_HEADER).flatMap(RateLimitErrorRetryHandler::parseRetryAfter);
    }

    /**
     * Parses a {@code Retry-After} value in seconds. Empty when absent, negative or not a number.
     */
    public static Optional<Duration> parseRetryAfter(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable Retry-After header: value={}", value);
            return Optional.empty();
        }
    }
}
