package fr.lapetina.slack.domain.retry;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Factory for built-in retry handlers.
 *
 * Handlers are looked up by the names used in configuration:
 * {@code connection-error}, {@code rate-limit} and {@code server-error}.
 */
public final class RetryHandlers {

    private static final Map<String, BiFunction<Integer, RetryIntervalCalculator, RetryHandler>> REGISTRY =
            new ConcurrentHashMap<>();

    static {
        register("connection-error", ConnectionErrorRetryHandler::new);
        register("server-error", ServerErrorRetryHandler::new);
        register("rate-limit", (maxRetryCount, calculator) -> new RateLimitErrorRetryHandler(maxRetryCount));
    }

    private RetryHandlers() {
        // Utility class
    }

    /**
     * Registers a custom handler.
     *
     * @param name    Handler name (used in configuration)
     * @param factory Creates a handler from a max retry count and an interval calculator
     */
    public static void register(String name, BiFunction<Integer, RetryIntervalCalculator, RetryHandler> factory) {
        REGISTRY.put(name.toLowerCase(), factory);
    }

    /**
     * Creates a handler by name.
     *
     * @return Handler instance, or empty if the name is unknown
     */
    public static Optional<RetryHandler> create(
            String name,
            int maxRetryCount,
            RetryIntervalCalculator intervalCalculator
    ) {
        BiFunction<Integer, RetryIntervalCalculator, RetryHandler> factory = REGISTRY.get(name.toLowerCase());
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(factory.apply(maxRetryCount, intervalCalculator));
    }

    /**
     * Handlers used when a client is built without an explicit chain:
     * a single connection error handler.
     */
    public static List<RetryHandler> defaultHandlers() {
        return List.of(new ConnectionErrorRetryHandler());
    }

    /**
     * Connection error and rate limit handlers.
     */
    public static List<RetryHandler> allBuiltinHandlers() {
        return List.of(new ConnectionErrorRetryHandler(), new RateLimitErrorRetryHandler());
    }

    /**
     * Returns all registered handler names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
