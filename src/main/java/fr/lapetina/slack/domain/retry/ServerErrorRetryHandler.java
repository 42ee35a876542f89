package fr.lapetina.slack.domain.retry;

/**
 * Retries calls answered with a 5xx status.
 */
public class ServerErrorRetryHandler extends RetryHandler {

    public ServerErrorRetryHandler(int maxRetryCount, RetryIntervalCalculator intervalCalculator, Sleeper sleeper) {
        super(maxRetryCount, intervalCalculator, sleeper);
    }

    public ServerErrorRetryHandler(int maxRetryCount, RetryIntervalCalculator intervalCalculator) {
        super(maxRetryCount, intervalCalculator);
    }

    public ServerErrorRetryHandler() {
        super();
    }

    @Override
    public String getName() {
        return "server-error";
    }

    @Override
    protected boolean canRetryCustom(
            RetryState state,
            RetryRequest request,
            RetryResponse response,
            Throwable error
    ) {
        return response != null && response.statusCode() >= 500;
    }
}
