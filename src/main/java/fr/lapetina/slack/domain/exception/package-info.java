/**
 * Unchecked exception hierarchy of the Slack clients.
 *
 * <ul>
 *   <li>{@link fr.lapetina.slack.domain.exception.SlackApiException} - the platform answered with an error code</li>
 *   <li>{@link fr.lapetina.slack.domain.exception.SlackHttpException} - non-2xx answer without a platform payload</li>
 *   <li>{@link fr.lapetina.slack.domain.exception.SlackConnectionException} - connectivity failure after retries</li>
 * </ul>
 */
package fr.lapetina.slack.domain.exception;
