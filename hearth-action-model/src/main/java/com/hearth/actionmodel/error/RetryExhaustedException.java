package com.hearth.actionmodel.error;

/**
 * A transient-class failure (connection, timeout, server error) that persisted through the whole
 * backoff schedule.
 */
public final class RetryExhaustedException extends ActionExecutionException {

    private final int attempts;
    private final String lastError;

    public RetryExhaustedException(int attempts, String lastError) {
        super(String.format("Action failed after %d attempts: %s", attempts,
                lastError != null ? lastError : "unknown error"));
        this.attempts = attempts;
        this.lastError = lastError;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastError() {
        return lastError;
    }
}
