package fr.lapetina.slack.realtime;

import fr.lapetina.slack.domain.exception.SlackApiException;
import fr.lapetina.slack.domain.exception.SlackClientException;
import fr.lapetina.slack.domain.exception.SlackClientNotConnectedException;
import fr.lapetina.slack.domain.exception.SlackConnectionException;
import fr.lapetina.slack.domain.exception.SlackHttpException;
import fr.lapetina.slack.domain.retry.RateLimitErrorRetryHandler;
import fr.lapetina.slack.domain.retry.RetryIntervalCalculator;
import fr.lapetina.slack.infrastructure.json.JsonSupport;
import fr.lapetina.slack.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Base of the WebSocket clients: session lifecycle, reconnects, health checks
 * and listener dispatch.
 *
 * <p>Threads:
 * <ul>
 *   <li>the transport thread only enqueues received frames,</li>
 *   <li>a worker pool of {@code concurrency} threads runs the listeners,</li>
 *   <li>a single monitor thread pings the server and performs reconnects.</li>
 * </ul>
 *
 * <p>Opening a session is serialised by a lock. A replaced session is marked
 * terminated before being closed so that its late frames and close event are
 * ignored.
 */
public abstract class AbstractRealtimeClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AbstractRealtimeClient.class);

    static final String MDC_SESSION_ID = "sessionId";
    static final int NORMAL_CLOSURE = 1000;

    private final String clientName;
    private final WebSocketConnector connector;
    private final RealtimeOptions options;
    private final RetryIntervalCalculator reconnectInterval;
    private final MetricsRegistry metrics;

    private final ReentrantLock connectLock = new ReentrantLock();
    private final ExecutorService workers;
    private final ScheduledExecutorService monitor;
    private final AtomicBoolean monitorStarted = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch closedLatch = new CountDownLatch(1);

    private final List<Consumer<String>> messageListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> errorListeners = new CopyOnWriteArrayList<>();
    private final List<CloseListener> closeListeners = new CopyOnWriteArrayList<>();

    private volatile ActiveSession current;
    private volatile boolean autoReconnectEnabled;

    protected AbstractRealtimeClient(
            String clientName,
            WebSocketConnector connector,
            RealtimeOptions options,
            MetricsRegistry metrics
    ) {
        this.clientName = Objects.requireNonNull(clientName, "Client name is required");
        this.connector = connector != null ? connector : new JdkWebSocketConnector();
        this.options = options != null ? options : RealtimeOptions.defaults();
        this.reconnectInterval = this.options.reconnectIntervalCalculator();
        this.metrics = metrics != null ? metrics : new MetricsRegistry();
        this.autoReconnectEnabled = this.options.autoReconnect();
        this.workers = Executors.newFixedThreadPool(this.options.concurrency(), daemonThreads("slack-" + clientName + "-worker"));
        this.monitor = Executors.newSingleThreadScheduledExecutor(daemonThreads("slack-" + clientName + "-monitor"));
    }

    /**
     * Asks the platform for a fresh WebSocket URL.
     *
     * @throws SlackApiException if the platform refuses
     */
    protected abstract URI issueNewWssUrl();

    /**
     * Handles one received message. Runs on a worker thread.
     *
     * @param message the parsed JSON object, empty when the frame was not JSON
     * @param raw     the frame text
     */
    protected abstract void dispatch(Map<String, Object> message, String raw);

    /**
     * Hook run before the first session opens.
     */
    protected void beforeConnect() {
    }

    // -----------------------------------------------------------------
    // Lifecycle

    /**
     * Opens a session on a freshly issued URL, replacing the current one if any.
     *
     * @throws SlackClientException if no session could be opened within the reconnect attempts
     */
    public void connect() {
        ensureNotClosed();
        beforeConnect();
        connectToNewEndpoint(true);
    }

    /**
     * Connects and blocks until the client is closed.
     */
    public void start() throws InterruptedException {
        connect();
        closedLatch.await();
    }

    /**
     * Opens a session on a new URL.
     *
     * @param force replace the current session even when it is still open
     */
    public void connectToNewEndpoint(boolean force) {
        connectLock.lock();
        try {
            if (closed.get()) {
                log.debug("Skipping reconnect of a closed client: client={}", clientName);
                return;
            }
            if (!force && isConnected()) {
                log.debug("Session is already open, skipping reconnect: client={}", clientName);
                return;
            }
            openWithBackoff();
            autoReconnectEnabled = options.autoReconnect();
        } finally {
            connectLock.unlock();
        }
    }

    private void openWithBackoff() {
        int failures = 0;
        while (true) {
            try {
                URI uri = issueNewWssUrl();
                openSession(uri);
                return;
            } catch (SlackClientException e) {
                if (!isRecoverable(e)) {
                    log.error("Failed to connect: client={}, error={}", clientName, e.getMessage());
                    throw e;
                }
                if (failures >= options.maxReconnectAttempts()) {
                    log.error("Giving up connecting: client={}, attempts={}, error={}",
                            clientName, failures + 1, e.getMessage());
                    throw e;
                }
                int attempt = failures;
                Duration delay = retryAfter(e).orElseGet(() -> reconnectInterval.calculateSleepDuration(attempt));
                log.warn("Failed to connect, retrying: client={}, attempt={}, delay={}ms, error={}",
                        clientName, failures + 1, delay.toMillis(), e.getMessage());
                sleep(delay);
                failures++;
                if (closed.get()) {
                    throw new SlackClientException("The client was closed while connecting");
                }
            }
        }
    }

    private void openSession(URI uri) {
        ActiveSession previous = current;
        SessionEvents events = new SessionEvents();
        WebSocketSession session;
        try {
            session = connector.connect(uri, events);
        } catch (RuntimeException e) {
            // a transport may still open the socket after giving up on it
            events.terminate();
            throw e;
        }
        ActiveSession next = new ActiveSession(session, events);
        current = next;
        metrics.sessionOpened(clientName);
        if (previous != null) {
            metrics.incrementReconnectCount(clientName);
            terminate(previous, "replaced by " + session.getSessionId());
        }
        log.info("A new session has been established: client={}, sessionId={}", clientName, session.getSessionId());
        startMonitor();
    }

    private void terminate(ActiveSession session, String reason) {
        session.events.terminate();
        if (session.events.release()) {
            metrics.sessionClosed(clientName);
        }
        try {
            session.session.close(NORMAL_CLOSURE, "");
        } catch (RuntimeException e) {
            log.debug("Failed to close the old session: client={}, sessionId={}, error={}",
                    clientName, session.session.getSessionId(), e.getMessage());
        }
        log.debug("Session terminated: client={}, sessionId={}, reason={}",
                clientName, session.session.getSessionId(), reason);
    }

    /**
     * Closes the current session without reconnecting. {@link #connect()} may be called again.
     */
    public void disconnect() {
        autoReconnectEnabled = false;
        connectLock.lock();
        try {
            ActiveSession session = current;
            if (session != null) {
                terminate(session, "disconnect");
                log.info("Disconnected: client={}, sessionId={}", clientName, session.session.getSessionId());
            }
        } finally {
            connectLock.unlock();
        }
    }

    /**
     * Disconnects and stops the worker and monitor threads. The client cannot be reused.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        disconnect();
        shutdown(monitor);
        shutdown(workers);
        closedLatch.countDown();
        log.info("Client closed: client={}", clientName);
    }

    public boolean isConnected() {
        ActiveSession session = current;
        return session != null && !session.events.isTerminated() && session.session.isOpen();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Returns the id of the current session, or null before the first connect.
     */
    public String sessionId() {
        ActiveSession session = current;
        return session != null ? session.session.getSessionId() : null;
    }

    // -----------------------------------------------------------------
    // Sending

    /**
     * Sends a text frame on the current session.
     *
     * @throws SlackClientNotConnectedException if no session is open
     */
    public void send(String text) {
        ActiveSession session = current;
        if (session == null) {
            throw new SlackClientNotConnectedException("The client is not connected: client=" + clientName);
        }
        try {
            session.session.sendText(text);
        } catch (SlackClientNotConnectedException e) {
            // the session may be in the middle of being replaced
            connectLock.lock();
            try {
                ActiveSession retried = current;
                if (retried == null || retried == session || !retried.session.isOpen()) {
                    log.warn("Failed to send a message: client={}, sessionId={}", clientName, session.session.getSessionId());
                    throw e;
                }
                retried.session.sendText(text);
            } finally {
                connectLock.unlock();
            }
        }
    }

    // -----------------------------------------------------------------
    // Raw listeners

    public void addMessageListener(Consumer<String> listener) {
        messageListeners.add(Objects.requireNonNull(listener));
    }

    public void removeMessageListener(Consumer<String> listener) {
        messageListeners.remove(listener);
    }

    public void addErrorListener(Consumer<Throwable> listener) {
        errorListeners.add(Objects.requireNonNull(listener));
    }

    public void removeErrorListener(Consumer<Throwable> listener) {
        errorListeners.remove(listener);
    }

    public void addCloseListener(CloseListener listener) {
        closeListeners.add(Objects.requireNonNull(listener));
    }

    public void removeCloseListener(CloseListener listener) {
        closeListeners.remove(listener);
    }

    // -----------------------------------------------------------------
    // Event handling

    private void onText(WebSocketSession session, String text) {
        try {
            workers.execute(() -> processMessage(session, text));
        } catch (RejectedExecutionException e) {
            log.debug("Dropping a message received after close: client={}, sessionId={}",
                    clientName, session.getSessionId());
        }
    }

    private void processMessage(WebSocketSession session, String text) {
        MDC.put(MDC_SESSION_ID, session.getSessionId());
        try {
            log.debug("Message received: client={}, message={}", clientName, text);
            for (Consumer<String> listener : messageListeners) {
                try {
                    listener.accept(text);
                } catch (RuntimeException e) {
                    log.error("Message listener failed: client={}, error={}", clientName, e.getMessage(), e);
                }
            }
            Map<String, Object> message = JsonSupport.readObject(text).orElse(Map.of());
            try {
                dispatch(message, text);
            } catch (RuntimeException e) {
                log.error("Failed to process a message: client={}, error={}", clientName, e.getMessage(), e);
            }
        } finally {
            MDC.remove(MDC_SESSION_ID);
        }
    }

    private void onClose(SessionEvents events, WebSocketSession session, int statusCode, String reason) {
        if (events.release()) {
            metrics.sessionClosed(clientName);
        }
        log.info("Session closed by the server: client={}, sessionId={}, code={}, reason={}",
                clientName, session.getSessionId(), statusCode, reason);
        for (CloseListener listener : closeListeners) {
            try {
                listener.onClose(statusCode, reason);
            } catch (RuntimeException e) {
                log.error("Close listener failed: client={}, error={}", clientName, e.getMessage(), e);
            }
        }
        if (autoReconnectEnabled && !closed.get()) {
            requestReconnect(false);
        }
    }

    private void onError(SessionEvents events, WebSocketSession session, Throwable error) {
        if (events.release()) {
            metrics.sessionClosed(clientName);
        }
        log.error("Session failed: client={}, sessionId={}, error={}",
                clientName, session.getSessionId(), error.getMessage());
        for (Consumer<Throwable> listener : errorListeners) {
            try {
                listener.accept(error);
            } catch (RuntimeException e) {
                log.error("Error listener failed: client={}, error={}", clientName, e.getMessage(), e);
            }
        }
        if (autoReconnectEnabled && !closed.get()) {
            requestReconnect(false);
        }
    }

    /**
     * Reconnects on the monitor thread.
     *
     * @param force replace the current session even when it is still open
     */
    protected void requestReconnect(boolean force) {
        try {
            monitor.execute(() -> {
                try {
                    connectToNewEndpoint(force);
                } catch (RuntimeException e) {
                    log.error("Reconnect failed: client={}, error={}", clientName, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Skipping reconnect of a closed client: client={}", clientName);
        }
    }

    // -----------------------------------------------------------------
    // Session monitor

    private void startMonitor() {
        if (monitorStarted.compareAndSet(false, true)) {
            long interval = options.pingInterval().toMillis();
            monitor.scheduleWithFixedDelay(this::checkSession, interval, interval, TimeUnit.MILLISECONDS);
            log.debug("Session monitor started: client={}, interval={}ms", clientName, interval);
        }
    }

    /**
     * Pings the current session, and reconnects when it is stale or closed.
     */
    void checkSession() {
        ActiveSession session = current;
        if (session == null || closed.get() || session.events.isTerminated()) {
            return;
        }
        try {
            long now = System.currentTimeMillis();
            long lastPong = session.events.lastPongMillis();
            long staleAfter = options.pingInterval().toMillis() * 2;
            if (session.session.isOpen() && lastPong > 0 && now - lastPong > staleAfter) {
                log.warn("No pong received for {}ms, closing the session: client={}, sessionId={}",
                        now - lastPong, clientName, session.session.getSessionId());
                connectLock.lock();
                try {
                    if (current == session) {
                        terminate(session, "stale");
                    }
                } finally {
                    connectLock.unlock();
                }
            } else if (session.session.isOpen()) {
                session.session.sendPing(session.session.getSessionId() + ":" + now);
                return;
            }
            if (autoReconnectEnabled) {
                connectToNewEndpoint(false);
            }
        } catch (RuntimeException e) {
            log.error("Session check failed: client={}, error={}", clientName, e.getMessage(), e);
        }
    }

    // -----------------------------------------------------------------

    private void ensureNotClosed() {
        if (closed.get()) {
            throw new SlackClientException("The client has been closed: client=" + clientName);
        }
    }

    private void sleep(Duration delay) {
        try {
            options.sleeper().sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SlackConnectionException("Interrupted while waiting to reconnect", e);
        }
    }

    /**
     * Connectivity failures and rate limits are worth another attempt; other platform errors are not.
     */
    private static boolean isRecoverable(SlackClientException e) {
        if (e instanceof SlackConnectionException || e instanceof SlackHttpException) {
            return true;
        }
        return e instanceof SlackApiException && "ratelimited".equals(((SlackApiException) e).getError());
    }

    private static Optional<Duration> retryAfter(SlackClientException e) {
        if (e instanceof SlackApiException) {
            SlackApiException apiError = (SlackApiException) e;
            if ("ratelimited".equals(apiError.getError())) {
                return apiError.getResponse()
                        .header(RateLimitErrorRetryHandler.RETRY_AFTER_HEADER)
                        .flatMap(RateLimitErrorRetryHandler::parseRetryAfter);
            }
        }
        return Optional.empty();
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record ActiveSession(WebSocketSession session, SessionEvents events) {
    }

    /**
     * Per-session event handler. Once terminated, events of its session are dropped.
     */
    private final class SessionEvents implements WebSocketEventHandler {

        private final AtomicBoolean terminated = new AtomicBoolean(false);
        private final AtomicBoolean released = new AtomicBoolean(false);
        private final AtomicLong lastPong = new AtomicLong(0);

        void terminate() {
            terminated.set(true);
        }

        boolean isTerminated() {
            return terminated.get();
        }

        /**
         * Returns true the first time only, so a session is counted closed once.
         */
        boolean release() {
            return released.compareAndSet(false, true);
        }

        long lastPongMillis() {
            return lastPong.get();
        }

        @Override
        public void onText(WebSocketSession session, String text) {
            if (isTerminated()) {
                log.debug("Dropping a message of a terminated session: client={}, sessionId={}",
                        clientName, session.getSessionId());
                return;
            }
            AbstractRealtimeClient.this.onText(session, text);
        }

        @Override
        public void onPong(WebSocketSession session, String payload) {
            lastPong.set(System.currentTimeMillis());
            log.trace("Pong received: client={}, payload={}", clientName, payload);
        }

        @Override
        public void onClose(WebSocketSession session, int statusCode, String reason) {
            if (isTerminated()) {
                return;
            }
            AbstractRealtimeClient.this.onClose(this, session, statusCode, reason);
        }

        @Override
        public void onError(WebSocketSession session, Throwable error) {
            if (isTerminated()) {
                log.debug("Ignoring an error of a terminated session: client={}, sessionId={}, error={}",
                        clientName, session.getSessionId(), error.getMessage());
                return;
            }
            AbstractRealtimeClient.this.onError(this, session, error);
        }
    }
}
