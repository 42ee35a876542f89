/**
 * Pluggable retry policy shared by every HTTP-based client.
 *
 * <p>A client owns an ordered list of {@link fr.lapetina.slack.domain.retry.RetryHandler}s.
 * After a failed attempt the list is walked in order and the first handler that accepts
 * the failure sleeps and advances the {@link fr.lapetina.slack.domain.retry.RetryState}.
 * When no handler accepts, the last response is returned or the last error rethrown.
 *
 * <h2>Built-in handlers</h2>
 * <ul>
 *   <li>{@link fr.lapetina.slack.domain.retry.ConnectionErrorRetryHandler} - socket resets, refused connections, connect timeouts</li>
 *   <li>{@link fr.lapetina.slack.domain.retry.RateLimitErrorRetryHandler} - HTTP 429, honours {@code Retry-After}</li>
 *   <li>{@link fr.lapetina.slack.domain.retry.ServerErrorRetryHandler} - HTTP 5xx</li>
 * </ul>
 *
 * <h2>Intervals</h2>
 * <p>{@link fr.lapetina.slack.domain.retry.BackoffRetryIntervalCalculator} computes
 * {@code factor * 2^attempt} plus {@link fr.lapetina.slack.domain.retry.Jitter}.
 */
package fr.lapetina.slack.domain.retry;
