package fr.lapetina.slack.realtime;

import fr.lapetina.slack.domain.exception.SlackClientNotConnectedException;
import fr.lapetina.slack.domain.exception.SlackConnectionException;
import fr.lapetina.slack.infrastructure.http.HttpClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link WebSocketConnector} backed by {@link java.net.http.WebSocket}.
 *
 * Fragmented text frames are reassembled before being handed to the handler.
 * Frames are requested one at a time, so a handler never sees two messages
 * of the same session concurrently.
 */
public final class JdkWebSocketConnector implements WebSocketConnector {

    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketConnector.class);

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWebSocketConnector(HttpClient httpClient, Duration connectTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "HTTP client is required");
        this.connectTimeout = connectTimeout != null ? connectTimeout : HttpClientFactory.DEFAULT_CONNECT_TIMEOUT;
    }

    public JdkWebSocketConnector() {
        this(HttpClientFactory.create(), HttpClientFactory.DEFAULT_CONNECT_TIMEOUT);
    }

    @Override
    public WebSocketSession connect(URI uri, WebSocketEventHandler handler) {
        JdkWebSocketSession session = new JdkWebSocketSession(UUID.randomUUID().toString(), connectTimeout);
        log.debug("Opening WebSocket: sessionId={}, host={}", session.getSessionId(), uri.getHost());
        CompletableFuture<WebSocket> handshake = httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, new FrameListener(session, handler));
        try {
            handshake.get(connectTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
            return session;
        } catch (InterruptedException e) {
            abandon(session, handshake);
            Thread.currentThread().interrupt();
            throw new SlackConnectionException("Interrupted while opening a WebSocket session", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SlackConnectionException("Failed to open a WebSocket session: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            abandon(session, handshake);
            throw new SlackConnectionException("Timed out while opening a WebSocket session", e);
        }
    }

    /**
     * Aborts a handshake the caller stopped waiting for, even if it completes later.
     */
    private static void abandon(JdkWebSocketSession session, CompletableFuture<WebSocket> handshake) {
        session.markClosed();
        handshake.whenComplete((webSocket, error) -> {
            if (webSocket != null) {
                log.debug("Aborting a WebSocket opened after its handshake was abandoned: sessionId={}",
                        session.getSessionId());
                webSocket.abort();
            }
        });
    }

    /**
     * Adapts {@link WebSocket.Listener} callbacks to a {@link WebSocketEventHandler}.
     */
    private static final class FrameListener implements WebSocket.Listener {

        private final JdkWebSocketSession session;
        private final WebSocketEventHandler handler;
        private final StringBuilder text = new StringBuilder();

        private FrameListener(JdkWebSocketSession session, WebSocketEventHandler handler) {
            this.session = session;
            this.handler = handler;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            if (session.isAbandoned()) {
                webSocket.abort();
                return;
            }
            session.attach(webSocket);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                String message = text.toString();
                text.setLength(0);
                handler.onText(session, message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            log.debug("Ignoring binary frame: sessionId={}, bytes={}", session.getSessionId(), data.remaining());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPing(WebSocket webSocket, ByteBuffer message) {
            // the JDK answers pings by itself
            log.trace("Received ping: sessionId={}", session.getSessionId());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            handler.onPong(session, StandardCharsets.UTF_8.decode(message).toString());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            session.markClosed();
            handler.onClose(session, statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            session.markClosed();
            handler.onError(session, error);
        }
    }

    /**
     * Session over a JDK WebSocket. Sends are serialised since the JDK
     * rejects a send while the previous one is still pending.
     */
    static final class JdkWebSocketSession implements WebSocketSession {

        private final String sessionId;
        private final Duration sendTimeout;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final Object sendLock = new Object();
        private volatile WebSocket webSocket;

        JdkWebSocketSession(String sessionId, Duration sendTimeout) {
            this.sessionId = sessionId;
            this.sendTimeout = sendTimeout;
        }

        void attach(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        void markClosed() {
            closed.set(true);
        }

        boolean isAbandoned() {
            return closed.get() && webSocket == null;
        }

        @Override
        public String getSessionId() {
            return sessionId;
        }

        @Override
        public boolean isOpen() {
            WebSocket ws = webSocket;
            return ws != null && !closed.get() && !ws.isOutputClosed() && !ws.isInputClosed();
        }

        @Override
        public void sendText(String text) {
            synchronized (sendLock) {
                WebSocket ws = requireOpen();
                await(ws.sendText(text, true).toCompletableFuture(), "text");
            }
        }

        @Override
        public void sendPing(String payload) {
            synchronized (sendLock) {
                WebSocket ws = requireOpen();
                ByteBuffer data = ByteBuffer.wrap(payload.getBytes(StandardCharsets.UTF_8));
                await(ws.sendPing(data).toCompletableFuture(), "ping");
            }
        }

        @Override
        public void close(int statusCode, String reason) {
            WebSocket ws = webSocket;
            if (ws == null || !closed.compareAndSet(false, true)) {
                return;
            }
            log.debug("Closing WebSocket: sessionId={}, code={}", sessionId, statusCode);
            if (ws.isOutputClosed()) {
                ws.abort();
                return;
            }
            ws.sendClose(statusCode, reason != null ? reason : "")
                    .whenComplete((result, error) -> {
                        if (error != null) {
                            log.debug("Close handshake failed: sessionId={}, error={}", sessionId, error.getMessage());
                            ws.abort();
                        }
                    });
        }

        private WebSocket requireOpen() {
            if (!isOpen()) {
                throw new SlackClientNotConnectedException("The WebSocket session is not open: sessionId=" + sessionId);
            }
            return webSocket;
        }

        private void await(CompletableFuture<WebSocket> future, String frame) {
            try {
                future.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SlackConnectionException("Interrupted while sending a " + frame + " frame", e);
            } catch (ExecutionException e) {
                markClosed();
                throw new SlackClientNotConnectedException("Failed to send a " + frame + " frame: sessionId=" + sessionId);
            } catch (TimeoutException e) {
                throw new SlackConnectionException("Timed out while sending a " + frame + " frame", e);
            }
        }
    }
}
