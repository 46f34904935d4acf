package com.hearth.executor;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for an {@link ActionExecutor} and for individual runs.
 * {@code numWorkers} and {@code queueCapacity} are read once when the executor is built; the remaining
 * values apply per run.
 */
public final class ExecutionOptions {

    public static final int DEFAULT_NUM_WORKERS = 2;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_INITIAL_RETRY_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_RETRY_DELAY = Duration.ofSeconds(60);
    public static final Duration DEFAULT_PER_ACTION_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_QUEUE_CAPACITY = 1024;
    public static final int DEFAULT_MAX_REPEAT_ITERATIONS = 1000;

    private final int numWorkers;
    private final int maxRetries;
    private final Duration initialRetryDelay;
    private final Duration maxRetryDelay;
    private final Duration perActionTimeout;
    private final Duration runDeadline;
    private final int queueCapacity;
    private final int maxRepeatIterations;

    private ExecutionOptions(Builder b) {
        if (b.numWorkers < 1) throw new IllegalArgumentException("numWorkers must be >= 1: " + b.numWorkers);
        if (b.maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0: " + b.maxRetries);
        if (b.queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1: " + b.queueCapacity);
        if (b.maxRepeatIterations < 1) {
            throw new IllegalArgumentException("maxRepeatIterations must be >= 1: " + b.maxRepeatIterations);
        }
        this.numWorkers = b.numWorkers;
        this.maxRetries = b.maxRetries;
        this.initialRetryDelay = nonNegative(b.initialRetryDelay, "initialRetryDelay");
        this.maxRetryDelay = nonNegative(b.maxRetryDelay, "maxRetryDelay");
        this.perActionTimeout = nonNegative(b.perActionTimeout, "perActionTimeout");
        if (perActionTimeout.isZero()) throw new IllegalArgumentException("perActionTimeout must be positive");
        this.runDeadline = b.runDeadline != null ? nonNegative(b.runDeadline, "runDeadline") : null;
        this.queueCapacity = b.queueCapacity;
        this.maxRepeatIterations = b.maxRepeatIterations;
    }

    private static Duration nonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) throw new IllegalArgumentException(name + " must not be negative: " + d);
        return d;
    }

    public static ExecutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with this instance's values. */
    public Builder toBuilder() {
        return new Builder()
                .numWorkers(numWorkers)
                .maxRetries(maxRetries)
                .initialRetryDelay(initialRetryDelay)
                .maxRetryDelay(maxRetryDelay)
                .perActionTimeout(perActionTimeout)
                .runDeadline(runDeadline)
                .queueCapacity(queueCapacity)
                .maxRepeatIterations(maxRepeatIterations);
    }

    public int getNumWorkers() {
        return numWorkers;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getInitialRetryDelay() {
        return initialRetryDelay;
    }

    public Duration getMaxRetryDelay() {
        return maxRetryDelay;
    }

    public Duration getPerActionTimeout() {
        return perActionTimeout;
    }

    /** Null when runs have no deadline. */
    public Duration getRunDeadline() {
        return runDeadline;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int getMaxRepeatIterations() {
        return maxRepeatIterations;
    }

    @Override
    public String toString() {
        return "ExecutionOptions{numWorkers=" + numWorkers + ", maxRetries=" + maxRetries
                + ", initialRetryDelay=" + initialRetryDelay + ", maxRetryDelay=" + maxRetryDelay
                + ", perActionTimeout=" + perActionTimeout + ", runDeadline=" + runDeadline
                + ", queueCapacity=" + queueCapacity + ", maxRepeatIterations=" + maxRepeatIterations + "}";
    }

    public static final class Builder {
        private int numWorkers = DEFAULT_NUM_WORKERS;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration initialRetryDelay = DEFAULT_INITIAL_RETRY_DELAY;
        private Duration maxRetryDelay = DEFAULT_MAX_RETRY_DELAY;
        private Duration perActionTimeout = DEFAULT_PER_ACTION_TIMEOUT;
        private Duration runDeadline;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private int maxRepeatIterations = DEFAULT_MAX_REPEAT_ITERATIONS;

        public Builder numWorkers(int numWorkers) {
            this.numWorkers = numWorkers;
            return this;
        }

        /** Retries after the first attempt; total attempts are at most {@code maxRetries + 1}. */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialRetryDelay(Duration initialRetryDelay) {
            this.initialRetryDelay = initialRetryDelay;
            return this;
        }

        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
            return this;
        }

        public Builder perActionTimeout(Duration perActionTimeout) {
            this.perActionTimeout = perActionTimeout;
            return this;
        }

        /** Null for no deadline. */
        public Builder runDeadline(Duration runDeadline) {
            this.runDeadline = runDeadline;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder maxRepeatIterations(int maxRepeatIterations) {
            this.maxRepeatIterations = maxRepeatIterations;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
