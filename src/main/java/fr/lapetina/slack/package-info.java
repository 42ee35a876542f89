/**
 * Slack client SDK: Web API, incoming webhooks, Socket Mode and RTM.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.slack.SlackClientFactory} - creates clients wired from YAML configuration</li>
 *   <li>{@link fr.lapetina.slack.web.WebClient} - Web API calls with a retry handler chain</li>
 *   <li>{@link fr.lapetina.slack.webhook.WebhookClient} - incoming webhooks and response URLs</li>
 *   <li>{@link fr.lapetina.slack.socketmode.SocketModeClient} and {@link fr.lapetina.slack.rtm.RtmClient}
 *       - WebSocket clients that reconnect with exponential backoff</li>
 *   <li>{@link fr.lapetina.slack.signature.SignatureVerifier} - verifies requests sent by Slack</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (SlackClientFactory factory = SlackClientFactory.create("slack-client.yaml")) {
 *     SocketModeClient client = factory.socketModeClient(appToken, botToken);
 *     client.addSocketModeRequestListener((c, request) -> {
 *         c.sendSocketModeResponse(SocketModeResponse.of(request.envelopeId()));
 *         c.getWebClient().chatPostMessage("#general", "Got " + request.type());
 *     });
 *     client.start();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Pluggable retry handlers (connection errors, rate limits, server errors)</li>
 *   <li>Session health checks with ping/pong and automatic reconnects</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.slack.SlackClientFactory
 */
package fr.lapetina.slack;
