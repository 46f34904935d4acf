package com.hearth.executor.retry;

import com.hearth.gateway.GatewayOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void backoffDoublesUntilCap() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(60));
        assertEquals(Duration.ofSeconds(1), policy.backoffDelay(1));
        assertEquals(Duration.ofSeconds(2), policy.backoffDelay(2));
        assertEquals(Duration.ofSeconds(4), policy.backoffDelay(3));
        assertEquals(Duration.ofSeconds(32), policy.backoffDelay(6));
        assertEquals(Duration.ofSeconds(60), policy.backoffDelay(7));
        assertEquals(Duration.ofSeconds(60), policy.backoffDelay(500));
        assertThrows(IllegalArgumentException.class, () -> policy.backoffDelay(0));
    }

    @Test
    void retriesOnlyRetryableOutcomesWithinBudget() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofSeconds(1));
        AttemptOutcome retryable = AttemptOutcome.retryable("503");
        assertTrue(policy.shouldRetry(retryable, 1));
        assertTrue(policy.shouldRetry(retryable, 3));
        assertFalse(policy.shouldRetry(retryable, 4));
        assertFalse(policy.shouldRetry(AttemptOutcome.fatal("400"), 1));
        assertFalse(policy.shouldRetry(AttemptOutcome.success(null), 1));
    }

    @Test
    void zeroRetriesMeansSingleAttempt() {
        RetryPolicy policy = new RetryPolicy(0, Duration.ofMillis(10), Duration.ofSeconds(1));
        assertFalse(policy.shouldRetry(AttemptOutcome.retryable("timeout"), 1));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO));
    }

    @Test
    void outcomeFromGateway() {
        assertEquals(AttemptOutcome.Kind.SUCCESS, AttemptOutcome.from(GatewayOutcome.success("ok")).getKind());
        AttemptOutcome retryable = AttemptOutcome.from(GatewayOutcome.failure(true, "HTTP 503", 503));
        assertEquals(AttemptOutcome.Kind.RETRYABLE_FAILURE, retryable.getKind());
        assertEquals("HTTP 503", retryable.getMessage());
        assertEquals(AttemptOutcome.Kind.FATAL_FAILURE, AttemptOutcome.from(GatewayOutcome.failure(false, "HTTP 400")).getKind());
        assertEquals("retryable_failure", AttemptOutcome.Kind.RETRYABLE_FAILURE.tagValue());
    }
}
