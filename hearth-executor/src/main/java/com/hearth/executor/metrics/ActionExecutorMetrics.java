package com.hearth.executor.metrics;

import com.hearth.actionmodel.node.ActionKind;
import com.hearth.actionmodel.state.ExecutionState;
import com.hearth.executor.retry.AttemptOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters for the executor:
 * {@code hearth.action.attempts} (domain, service, outcome), {@code hearth.action.duration} (kind, state)
 * and {@code hearth.run.completed} (success).
 */
public final class ActionExecutorMetrics {

    public static final String ATTEMPTS = "hearth.action.attempts";
    public static final String ACTION_DURATION = "hearth.action.duration";
    public static final String RUN_COMPLETED = "hearth.run.completed";

    private final MeterRegistry registry;

    public ActionExecutorMetrics(MeterRegistry registry) {
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void recordAttempt(String domain, String service, AttemptOutcome.Kind outcome) {
        registry.counter(ATTEMPTS,
                "domain", domain,
                "service", service,
                "outcome", outcome.tagValue()
        ).increment();
    }

    public void recordAction(ActionKind kind, ExecutionState state, Duration duration) {
        Timer.builder(ACTION_DURATION)
                .tag("kind", kind.getTypeName())
                .tag("state", state.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(duration);
    }

    public void recordRun(boolean success) {
        registry.counter(RUN_COMPLETED, "success", String.valueOf(success)).increment();
    }
}
