/**
 * Value types returned by the Web API client.
 *
 * <p>{@link fr.lapetina.slack.domain.model.SlackResponse} is an immutable record
 * wrapping the parsed JSON payload together with status code and headers.
 */
package fr.lapetina.slack.domain.model;
