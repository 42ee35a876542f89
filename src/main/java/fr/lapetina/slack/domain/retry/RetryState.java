package fr.lapetina.slack.domain.retry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-call retry bookkeeping shared by every handler of a chain.
 *
 * The attempt counter is zero-origin: 0 while the first try is running,
 * 1 during the first retry, and so on.
 */
public final class RetryState {

    private int currentAttempt;
    private boolean nextAttemptRequested;
    private final Map<String, Object> customValues = new ConcurrentHashMap<>();

    public RetryState() {
        this(0);
    }

    public RetryState(int currentAttempt) {
        if (currentAttempt < 0) {
            throw new IllegalArgumentException("Attempt count must not be negative: " + currentAttempt);
        }
        this.currentAttempt = currentAttempt;
    }

    public int getCurrentAttempt() {
        return currentAttempt;
    }

    public int incrementCurrentAttempt() {
        return ++currentAttempt;
    }

    public boolean isNextAttemptRequested() {
        return nextAttemptRequested;
    }

    public void setNextAttemptRequested(boolean nextAttemptRequested) {
        this.nextAttemptRequested = nextAttemptRequested;
    }

    public Map<String, Object> getCustomValues() {
        return customValues;
    }

    @Override
    public String toString() {
        return "RetryState{" +
                "currentAttempt=" + currentAttempt +
                ", nextAttemptRequested=" + nextAttemptRequested +
                '}';
    }
}
