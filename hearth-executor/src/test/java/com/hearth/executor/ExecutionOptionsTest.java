package com.hearth.executor;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExecutionOptionsTest {

    @Test
    void defaults() {
        ExecutionOptions options = ExecutionOptions.defaults();
        assertEquals(2, options.getNumWorkers());
        assertEquals(3, options.getMaxRetries());
        assertEquals(Duration.ofSeconds(1), options.getInitialRetryDelay());
        assertEquals(Duration.ofSeconds(60), options.getMaxRetryDelay());
        assertEquals(Duration.ofSeconds(30), options.getPerActionTimeout());
        assertNull(options.getRunDeadline());
        assertEquals(1024, options.getQueueCapacity());
        assertEquals(1000, options.getMaxRepeatIterations());
    }

    @Test
    void toBuilderKeepsValues() {
        ExecutionOptions base = ExecutionOptions.builder().maxRetries(0).runDeadline(Duration.ofSeconds(5)).build();
        ExecutionOptions copy = base.toBuilder().numWorkers(8).build();
        assertEquals(0, copy.getMaxRetries());
        assertEquals(Duration.ofSeconds(5), copy.getRunDeadline());
        assertEquals(8, copy.getNumWorkers());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionOptions.builder().numWorkers(0).build());
        assertThrows(IllegalArgumentException.class, () -> ExecutionOptions.builder().maxRetries(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ExecutionOptions.builder().queueCapacity(0).build());
        assertThrows(IllegalArgumentException.class, () -> ExecutionOptions.builder().maxRepeatIterations(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ExecutionOptions.builder().initialRetryDelay(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> ExecutionOptions.builder().perActionTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> ExecutionOptions.builder().runDeadline(Duration.ofMillis(-5)).build());
        assertThrows(NullPointerException.class, () -> ExecutionOptions.builder().maxRetryDelay(null).build());
    }
}
