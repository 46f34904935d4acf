package com.hearth.executor.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff: retry {@code n} (1-based) waits {@code initialDelay * 2^(n-1)}, capped at {@code maxDelay}.
 * A leaf gets at most {@code maxRetries + 1} attempts.
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final Duration initialDelay;
    private final Duration maxDelay;

    public RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        this.maxRetries = maxRetries;
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    }

    /**
     * @param attemptCount attempts made so far, including the one that produced {@code outcome}
     */
    public boolean shouldRetry(AttemptOutcome outcome, int attemptCount) {
        return outcome.isRetryable() && attemptCount <= maxRetries;
    }

    /** Wait before the next attempt, after {@code attemptCount} attempts (>= 1). */
    public Duration backoffDelay(int attemptCount) {
        if (attemptCount < 1) throw new IllegalArgumentException("attemptCount must be >= 1: " + attemptCount);
        int exponent = attemptCount - 1;
        long initialMs = initialDelay.toMillis();
        long capMs = maxDelay.toMillis();
        if (exponent >= 62 || initialMs > (capMs >> Math.min(exponent, 62))) {
            return maxDelay;
        }
        long delayMs = initialMs << exponent;
        return Duration.ofMillis(Math.min(delayMs, capMs));
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
