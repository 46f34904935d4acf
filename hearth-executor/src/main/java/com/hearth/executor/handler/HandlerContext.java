package com.hearth.executor.handler;

import com.hearth.actionmodel.node.ActionNode;
import com.hearth.template.ConditionEvaluator;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Shared context passed to composite handlers: the child runner, condition evaluation and the run's
 * bookkeeping hooks.
 */
public final class HandlerContext {

    private final String runId;
    private final ChildNodeRunner childRunner;
    private final ConditionEvaluator conditionEvaluator;
    private final Consumer<String> errorSink;
    private final Consumer<ActionNode> tracker;
    private final BooleanSupplier cancelled;
    private final int maxRepeatIterations;

    public HandlerContext(String runId,
                          ChildNodeRunner childRunner,
                          ConditionEvaluator conditionEvaluator,
                          Consumer<String> errorSink,
                          Consumer<ActionNode> tracker,
                          BooleanSupplier cancelled,
                          int maxRepeatIterations) {
        this.runId = runId;
        this.childRunner = Objects.requireNonNull(childRunner, "childRunner");
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "conditionEvaluator");
        this.errorSink = errorSink != null ? errorSink : msg -> { };
        this.tracker = tracker != null ? tracker : node -> { };
        this.cancelled = cancelled != null ? cancelled : () -> false;
        this.maxRepeatIterations = maxRepeatIterations;
    }

    public String getRunId() {
        return runId;
    }

    public CompletableFuture<Boolean> runChild(ActionNode child, Map<String, Object> variables) {
        return childRunner.run(child, variables);
    }

    /**
     * @throws com.hearth.actionmodel.error.InvalidActionException when the condition cannot be evaluated
     */
    public boolean evaluateCondition(Object condition, Map<String, Object> variables) {
        return conditionEvaluator.evaluate(condition, variables);
    }

    /** Adds a run-level error message to the summary. */
    public void recordError(String message) {
        errorSink.accept(message);
    }

    /** Registers a subtree created at run time (repeat iterations) so deadline cancellation reaches it. */
    public void track(ActionNode subtree) {
        tracker.accept(subtree);
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }

    public int getMaxRepeatIterations() {
        return maxRepeatIterations;
    }
}
