package fr.lapetina.slack.domain.retry;

import java.io.EOFException;
import java.net.SocketException;
import java.net.http.HttpConnectTimeoutException;
import java.util.List;

/**
 * Retries calls that failed on connectivity issues (reset or refused
 * connections, remote disconnects, connect timeouts).
 */
public class ConnectionErrorRetryHandler extends RetryHandler {

    public static final List<Class<? extends Throwable>> DEFAULT_ERROR_TYPES = List.of(
            SocketException.class,
            EOFException.class,
            HttpConnectTimeoutException.class
    );

    private final List<Class<? extends Throwable>> errorTypes;

    public ConnectionErrorRetryHandler(
            int maxRetryCount,
            RetryIntervalCalculator intervalCalculator,
            Sleeper sleeper,
            List<Class<? extends Throwable>> errorTypes
    ) {
        super(maxRetryCount, intervalCalculator, sleeper);
        this.errorTypes = errorTypes != null ? List.copyOf(errorTypes) : DEFAULT_ERROR_TYPES;
    }

    public ConnectionErrorRetryHandler(int maxRetryCount, RetryIntervalCalculator intervalCalculator) {
        this(maxRetryCount, intervalCalculator, Sleeper.THREAD, DEFAULT_ERROR_TYPES);
    }

    public ConnectionErrorRetryHandler() {
        this(1, new BackoffRetryIntervalCalculator());
    }

    @Override
    public String getName() {
        return "connection-error";
    }

    @Override
    protected boolean canRetryCustom(
            RetryState state,
            RetryRequest request,
            RetryResponse response,
            Throwable error
    ) {
        // HttpClient wraps the socket-level failure, so walk the cause chain
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            for (Class<? extends Throwable> type : errorTypes) {
                if (type.isInstance(cause)) {
                    return true;
                }
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    public List<Class<? extends Throwable>> getErrorTypes() {
        return errorTypes;
    }
}
