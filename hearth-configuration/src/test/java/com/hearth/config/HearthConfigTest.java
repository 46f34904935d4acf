package com.hearth.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HearthConfigTest {

    @Test
    void defaultsWhenNothingIsSet() {
        HearthConfig config = HearthConfig.fromMap(Map.of());
        assertEquals(2, config.getNumWorkers());
        assertEquals(3, config.getMaxRetries());
        assertEquals(Duration.ofSeconds(1), config.getInitialRetryDelay());
        assertEquals(Duration.ofSeconds(60), config.getMaxRetryDelay());
        assertEquals(Duration.ofSeconds(30), config.getPerActionTimeout());
        assertNull(config.getRunDeadline());
        assertEquals(1024, config.getQueueCapacity());
        assertEquals(1000, config.getMaxRepeatIterations());
        assertEquals("http://localhost:8123", config.getHaUrl());
        assertEquals("", config.getHaToken());
        assertEquals(Duration.ofSeconds(10), config.getHaRequestTimeout());
    }

    @Test
    void readsEveryVariable() {
        HearthConfig config = HearthConfig.fromMap(Map.ofEntries(
                Map.entry(HearthConfig.ENV_NUM_WORKERS, "4"),
                Map.entry(HearthConfig.ENV_MAX_RETRIES, "0"),
                Map.entry(HearthConfig.ENV_INITIAL_RETRY_DELAY_MS, "250"),
                Map.entry(HearthConfig.ENV_MAX_RETRY_DELAY_MS, "5000"),
                Map.entry(HearthConfig.ENV_PER_ACTION_TIMEOUT_MS, "1500"),
                Map.entry(HearthConfig.ENV_RUN_DEADLINE_MS, "120000"),
                Map.entry(HearthConfig.ENV_QUEUE_CAPACITY, "16"),
                Map.entry(HearthConfig.ENV_MAX_REPEAT_ITERATIONS, "50"),
                Map.entry(HearthConfig.ENV_HA_URL, " http://ha.local:8123 "),
                Map.entry(HearthConfig.ENV_HA_TOKEN, "abc"),
                Map.entry(HearthConfig.ENV_HA_REQUEST_TIMEOUT_SECONDS, "3")));

        assertEquals(4, config.getNumWorkers());
        assertEquals(0, config.getMaxRetries());
        assertEquals(Duration.ofMillis(250), config.getInitialRetryDelay());
        assertEquals(Duration.ofSeconds(5), config.getMaxRetryDelay());
        assertEquals(Duration.ofMillis(1500), config.getPerActionTimeout());
        assertEquals(Duration.ofMinutes(2), config.getRunDeadline());
        assertEquals(16, config.getQueueCapacity());
        assertEquals(50, config.getMaxRepeatIterations());
        assertEquals("http://ha.local:8123", config.getHaUrl());
        assertEquals("abc", config.getHaToken());
        assertEquals(Duration.ofSeconds(3), config.getHaRequestTimeout());
    }

    @Test
    void invalidNumbersFallBackToDefaults() {
        HearthConfig config = HearthConfig.fromMap(Map.of(
                HearthConfig.ENV_NUM_WORKERS, "many",
                HearthConfig.ENV_MAX_RETRIES, "-1",
                HearthConfig.ENV_QUEUE_CAPACITY, "0",
                HearthConfig.ENV_RUN_DEADLINE_MS, "0"));
        assertEquals(2, config.getNumWorkers());
        assertEquals(3, config.getMaxRetries());
        assertEquals(1024, config.getQueueCapacity());
        assertNull(config.getRunDeadline());
    }

    @Test
    void tokenIsNotPrinted() {
        String printed = HearthConfig.builder().haToken("super-secret").build().toString();
        assertFalse(printed.contains("super-secret"));
        assertTrue(printed.contains("<redacted>"));
    }
}
