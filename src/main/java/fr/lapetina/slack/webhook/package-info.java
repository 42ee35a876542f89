/**
 * Incoming webhook and {@code response_url} sender.
 */
package fr.lapetina.slack.webhook;
