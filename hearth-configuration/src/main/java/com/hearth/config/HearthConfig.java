package com.hearth.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration loaded from environment variables for the Hearth executor and its Home Assistant gateway.
 * <p>
 * Executor: HEARTH_NUM_WORKERS, HEARTH_MAX_RETRIES, HEARTH_INITIAL_RETRY_DELAY_MS, HEARTH_MAX_RETRY_DELAY_MS,
 * HEARTH_PER_ACTION_TIMEOUT_MS, HEARTH_RUN_DEADLINE_MS (0 = none), HEARTH_QUEUE_CAPACITY,
 * HEARTH_MAX_REPEAT_ITERATIONS.
 * <p>
 * Gateway: HEARTH_HA_URL, HEARTH_HA_TOKEN, HEARTH_HA_REQUEST_TIMEOUT_SECONDS.
 * <p>
 * Unset, blank, non-numeric or out-of-range values fall back to the defaults.
 */
public final class HearthConfig {

    private static final Logger log = LoggerFactory.getLogger(HearthConfig.class);

    static final String ENV_NUM_WORKERS = "HEARTH_NUM_WORKERS";
    static final String ENV_MAX_RETRIES = "HEARTH_MAX_RETRIES";
    static final String ENV_INITIAL_RETRY_DELAY_MS = "HEARTH_INITIAL_RETRY_DELAY_MS";
    static final String ENV_MAX_RETRY_DELAY_MS = "HEARTH_MAX_RETRY_DELAY_MS";
    static final String ENV_PER_ACTION_TIMEOUT_MS = "HEARTH_PER_ACTION_TIMEOUT_MS";
    static final String ENV_RUN_DEADLINE_MS = "HEARTH_RUN_DEADLINE_MS";
    static final String ENV_QUEUE_CAPACITY = "HEARTH_QUEUE_CAPACITY";
    static final String ENV_MAX_REPEAT_ITERATIONS = "HEARTH_MAX_REPEAT_ITERATIONS";
    static final String ENV_HA_URL = "HEARTH_HA_URL";
    static final String ENV_HA_TOKEN = "HEARTH_HA_TOKEN";
    static final String ENV_HA_REQUEST_TIMEOUT_SECONDS = "HEARTH_HA_REQUEST_TIMEOUT_SECONDS";

    private static final int DEFAULT_NUM_WORKERS = 2;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_INITIAL_RETRY_DELAY_MS = 1_000;
    private static final long DEFAULT_MAX_RETRY_DELAY_MS = 60_000;
    private static final long DEFAULT_PER_ACTION_TIMEOUT_MS = 30_000;
    private static final int DEFAULT_QUEUE_CAPACITY = 1024;
    private static final int DEFAULT_MAX_REPEAT_ITERATIONS = 1000;
    private static final String DEFAULT_HA_URL = "http://localhost:8123";
    private static final int DEFAULT_HA_REQUEST_TIMEOUT_SECONDS = 10;

    private final int numWorkers;
    private final int maxRetries;
    private final Duration initialRetryDelay;
    private final Duration maxRetryDelay;
    private final Duration perActionTimeout;
    private final Duration runDeadline;
    private final int queueCapacity;
    private final int maxRepeatIterations;
    private final String haUrl;
    private final String haToken;
    private final Duration haRequestTimeout;

    private HearthConfig(Builder b) {
        this.numWorkers = b.numWorkers;
        this.maxRetries = b.maxRetries;
        this.initialRetryDelay = b.initialRetryDelay;
        this.maxRetryDelay = b.maxRetryDelay;
        this.perActionTimeout = b.perActionTimeout;
        this.runDeadline = b.runDeadline;
        this.queueCapacity = b.queueCapacity;
        this.maxRepeatIterations = b.maxRepeatIterations;
        this.haUrl = b.haUrl;
        this.haToken = b.haToken != null ? b.haToken : "";
        this.haRequestTimeout = b.haRequestTimeout;
    }

    public static HearthConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Same parsing as {@link #fromEnvironment()}, over an explicit variable map. */
    public static HearthConfig fromMap(Map<String, String> env) {
        long deadlineMs = parseLong(env, ENV_RUN_DEADLINE_MS, 0, 0);
        return builder()
                .numWorkers(parseInt(env, ENV_NUM_WORKERS, DEFAULT_NUM_WORKERS, 1))
                .maxRetries(parseInt(env, ENV_MAX_RETRIES, DEFAULT_MAX_RETRIES, 0))
                .initialRetryDelay(Duration.ofMillis(parseLong(env, ENV_INITIAL_RETRY_DELAY_MS, DEFAULT_INITIAL_RETRY_DELAY_MS, 0)))
                .maxRetryDelay(Duration.ofMillis(parseLong(env, ENV_MAX_RETRY_DELAY_MS, DEFAULT_MAX_RETRY_DELAY_MS, 0)))
                .perActionTimeout(Duration.ofMillis(parseLong(env, ENV_PER_ACTION_TIMEOUT_MS, DEFAULT_PER_ACTION_TIMEOUT_MS, 1)))
                .runDeadline(deadlineMs > 0 ? Duration.ofMillis(deadlineMs) : null)
                .queueCapacity(parseInt(env, ENV_QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY, 1))
                .maxRepeatIterations(parseInt(env, ENV_MAX_REPEAT_ITERATIONS, DEFAULT_MAX_REPEAT_ITERATIONS, 1))
                .haUrl(getEnv(env, ENV_HA_URL, DEFAULT_HA_URL))
                .haToken(getEnv(env, ENV_HA_TOKEN, ""))
                .haRequestTimeout(Duration.ofSeconds(parseInt(env, ENV_HA_REQUEST_TIMEOUT_SECONDS, DEFAULT_HA_REQUEST_TIMEOUT_SECONDS, 1)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int parseInt(Map<String, String> env, String key, int defaultValue, int min) {
        return (int) parseLong(env, key, defaultValue, min);
    }

    private static long parseLong(Map<String, String> env, String key, long defaultValue, long min) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < min) {
                log.warn("Config value below minimum, using default | key={} | value={} | min={} | default={}",
                        key, parsed, min, defaultValue);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            log.warn("Config value is not a number, using default | key={} | value={} | default={}",
                    key, value, defaultValue);
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public int getNumWorkers() {
        return numWorkers;
    }

    /** Retries after the first attempt. */
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

    /** Hard deadline per run, or null for none. */
    public Duration getRunDeadline() {
        return runDeadline;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int getMaxRepeatIterations() {
        return maxRepeatIterations;
    }

    public String getHaUrl() {
        return haUrl;
    }

    public String getHaToken() {
        return haToken;
    }

    public Duration getHaRequestTimeout() {
        return haRequestTimeout;
    }

    @Override
    public String toString() {
        return "HearthConfig{numWorkers=" + numWorkers + ", maxRetries=" + maxRetries
                + ", initialRetryDelay=" + initialRetryDelay + ", maxRetryDelay=" + maxRetryDelay
                + ", perActionTimeout=" + perActionTimeout + ", runDeadline=" + runDeadline
                + ", queueCapacity=" + queueCapacity + ", maxRepeatIterations=" + maxRepeatIterations
                + ", haUrl=" + haUrl + ", haToken=" + (haToken.isEmpty() ? "<unset>" : "<redacted>") + "}";
    }

    public static final class Builder {
        private int numWorkers = DEFAULT_NUM_WORKERS;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration initialRetryDelay = Duration.ofMillis(DEFAULT_INITIAL_RETRY_DELAY_MS);
        private Duration maxRetryDelay = Duration.ofMillis(DEFAULT_MAX_RETRY_DELAY_MS);
        private Duration perActionTimeout = Duration.ofMillis(DEFAULT_PER_ACTION_TIMEOUT_MS);
        private Duration runDeadline;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private int maxRepeatIterations = DEFAULT_MAX_REPEAT_ITERATIONS;
        private String haUrl = DEFAULT_HA_URL;
        private String haToken = "";
        private Duration haRequestTimeout = Duration.ofSeconds(DEFAULT_HA_REQUEST_TIMEOUT_SECONDS);

        public Builder numWorkers(int numWorkers) {
            this.numWorkers = numWorkers;
            return this;
        }

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

        public Builder haUrl(String haUrl) {
            this.haUrl = haUrl;
            return this;
        }

        public Builder haToken(String haToken) {
            this.haToken = haToken;
            return this;
        }

        public Builder haRequestTimeout(Duration haRequestTimeout) {
            this.haRequestTimeout = haRequestTimeout;
            return this;
        }

        public HearthConfig build() {
            return new HearthConfig(this);
        }
    }
}
