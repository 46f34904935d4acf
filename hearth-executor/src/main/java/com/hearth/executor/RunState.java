package com.hearth.executor;

import com.hearth.actionmodel.node.ActionNode;
import com.hearth.actionmodel.node.ActionTrees;
import com.hearth.actionmodel.result.ActionExecutionResult;
import com.hearth.executor.handler.HandlerContext;
import com.hearth.executor.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bookkeeping for one {@code execute} call: results in completion order, run-level errors, every node
 * the run may touch and the leaf tasks created so far.
 */
final class RunState {

    private static final Logger log = LoggerFactory.getLogger(RunState.class);

    private final String runId;
    private final String correlationId;
    private final ExecutionOptions options;
    private final RetryPolicy retryPolicy;
    private final Instant startedAt = Instant.now();
    private final List<ActionExecutionResult> results = Collections.synchronizedList(new ArrayList<>());
    private final List<String> errors = Collections.synchronizedList(new ArrayList<>());
    private final Set<ActionNode> tracked = ConcurrentHashMap.newKeySet();
    private final Map<String, LeafTask> tasks = new ConcurrentHashMap<>();
    private final AtomicInteger dispatched = new AtomicInteger();
    private volatile boolean cancelled;
    private volatile boolean deadlineExpired;
    private volatile Future<?> deadlineFuture;
    private HandlerContext handlerContext;

    RunState(String runId, String correlationId, ExecutionOptions options) {
        this.runId = runId;
        this.correlationId = correlationId;
        this.options = options;
        this.retryPolicy = new RetryPolicy(options.getMaxRetries(),
                options.getInitialRetryDelay(), options.getMaxRetryDelay());
    }

    String getRunId() {
        return runId;
    }

    String getCorrelationId() {
        return correlationId;
    }

    ExecutionOptions getOptions() {
        return options;
    }

    RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    Instant getStartedAt() {
        return startedAt;
    }

    HandlerContext getHandlerContext() {
        return handlerContext;
    }

    void setHandlerContext(HandlerContext handlerContext) {
        this.handlerContext = handlerContext;
    }

    void track(ActionNode subtree) {
        ActionTrees.walk(List.of(subtree), tracked::add);
        if (cancelled) {
            ActionTrees.walk(List.of(subtree), n -> n.getStateMachine().cancel());
        }
    }

    void register(LeafTask task) {
        tasks.put(task.getNode().getId(), task);
        if (cancelled) {
            task.cancel();
        }
    }

    void addResult(ActionExecutionResult result) {
        results.add(result);
    }

    void addError(String message) {
        errors.add(message);
    }

    void markDispatched() {
        dispatched.incrementAndGet();
    }

    int getDispatchedCount() {
        return dispatched.get();
    }

    boolean isCancelled() {
        return cancelled;
    }

    boolean isDeadlineExpired() {
        return deadlineExpired;
    }

    void setDeadlineFuture(Future<?> deadlineFuture) {
        this.deadlineFuture = deadlineFuture;
    }

    /** Stops the deadline timer once the run is complete. */
    void clearDeadline() {
        Future<?> f = deadlineFuture;
        if (f != null) {
            f.cancel(false);
        }
    }

    /**
     * Cancels every non-terminal node: leaf tasks first (which abandons in-flight calls and timers), then the
     * remaining tracked nodes.
     */
    void cancel(boolean byDeadline) {
        if (byDeadline) {
            deadlineExpired = true;
        }
        cancelled = true;
        log.info("Run cancelled | runId={} | reason={} | dispatched={}",
                runId, byDeadline ? "deadline" : "shutdown", dispatched.get());
        for (LeafTask task : tasks.values()) {
            task.cancel();
        }
        for (ActionNode node : tracked) {
            if (!tasks.containsKey(node.getId())) {
                node.getStateMachine().cancel();
            }
        }
    }

    List<ActionExecutionResult> snapshotResults() {
        synchronized (results) {
            return List.copyOf(results);
        }
    }

    List<String> snapshotErrors() {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }
}
