/**
 * WebSocket session management shared by the Socket Mode and RTM clients.
 *
 * <p>{@link fr.lapetina.slack.realtime.WebSocketConnector} is the transport seam;
 * {@link fr.lapetina.slack.realtime.JdkWebSocketConnector} is the default implementation.
 */
package fr.lapetina.slack.realtime;
