/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing with SnakeYAML.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.slack.infrastructure.config.SlackClientConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.slack.infrastructure.config.ConfigLoader} - YAML loading from file system or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code web} - Web API base URL, timeouts, team id, User-Agent affixes</li>
 *   <li>{@code retry} - Retry handler chain and backoff settings</li>
 *   <li>{@code webhook} - Incoming webhook timeouts</li>
 *   <li>{@code socketMode} / {@code rtm} - Ping interval, worker pool, reconnect backoff</li>
 *   <li>{@code proxy} - Explicit HTTP proxy URL</li>
 *   <li>{@code metrics} - Prometheus metric name prefix</li>
 * </ul>
 *
 * @see fr.lapetina.slack.SlackClientFactory
 */
package fr.lapetina.slack.infrastructure.config;
