package com.hearth.executor;

import com.hearth.actionmodel.node.ActionNode;
import com.hearth.actionmodel.result.ActionExecutionResult;
import com.hearth.actionmodel.result.ErrorKind;
import com.hearth.actionmodel.state.ExecutionState;
import com.hearth.actionmodel.state.ExecutionStateMachine;
import com.hearth.executor.metrics.ActionExecutorMetrics;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * One leaf on its way through the queue. State changes are synchronized on the task, so a worker,
 * a timer callback and a cancellation never produce two results for the same leaf.
 */
final class LeafTask {

    private final ActionNode node;
    private final RunState run;
    private final Map<String, Object> variables;
    private final ActionExecutorMetrics metrics;
    private final CompletableFuture<Boolean> completion = new CompletableFuture<>();

    private boolean dispatched;
    private boolean finished;
    private Instant startedAt;
    private Future<?> scheduled;
    private Future<?> inFlight;

    LeafTask(ActionNode node, RunState run, Map<String, Object> variables, ActionExecutorMetrics metrics) {
        this.node = node;
        this.run = run;
        this.variables = variables;
        this.metrics = metrics;
    }

    ActionNode getNode() {
        return node;
    }

    RunState getRun() {
        return run;
    }

    Map<String, Object> getVariables() {
        return variables;
    }

    /** Completes with true when the leaf reached SUCCESS. */
    CompletableFuture<Boolean> getCompletion() {
        return completion;
    }

    /**
     * Moves the leaf to EXECUTING for a new attempt.
     *
     * @return false when the leaf was cancelled meanwhile; the caller must drop it
     */
    boolean begin() {
        Boolean done;
        synchronized (this) {
            if (finished) {
                return false;
            }
            if (node.getStateMachine().transitionIfActive(ExecutionState.EXECUTING)) {
                if (!dispatched) {
                    dispatched = true;
                    startedAt = Instant.now();
                    run.markDispatched();
                }
                return true;
            }
            done = settle();
        }
        deliver(done);
        return false;
    }

    /** EXECUTING to RETRYING; false when the leaf was cancelled meanwhile. */
    boolean toRetrying() {
        Boolean done;
        synchronized (this) {
            if (finished) {
                return false;
            }
            if (node.getStateMachine().transitionIfActive(ExecutionState.RETRYING)) {
                return true;
            }
            done = settle();
        }
        deliver(done);
        return false;
    }

    void complete(ExecutionState terminal, ErrorKind errorKind, String errorDetail, Object response) {
        Boolean done;
        synchronized (this) {
            if (finished) {
                return;
            }
            done = node.getStateMachine().transitionIfActive(terminal)
                    ? finishOnce(terminal, errorKind, errorDetail, response)
                    : settle();
        }
        deliver(done);
    }

    /** Cancels the leaf and abandons any pending timer or in-flight call. */
    void cancel() {
        Boolean done;
        synchronized (this) {
            node.getStateMachine().cancel();
            if (scheduled != null) {
                scheduled.cancel(false);
            }
            if (inFlight != null) {
                inFlight.cancel(true);
            }
            done = settle();
        }
        deliver(done);
    }

    /** Completes the future exceptionally; used for internal errors such as an illegal transition. */
    void fail(Throwable error) {
        synchronized (this) {
            if (finished) {
                return;
            }
            finished = true;
        }
        completion.completeExceptionally(error);
    }

    synchronized void setScheduled(Future<?> future) {
        if (finished) {
            future.cancel(false);
        } else {
            scheduled = future;
        }
    }

    /** @return false when the leaf already finished and the call was abandoned */
    synchronized boolean setInFlight(Future<?> future) {
        if (finished) {
            future.cancel(true);
            return false;
        }
        inFlight = future;
        return true;
    }

    synchronized void clearInFlight() {
        inFlight = null;
    }

    /** Value to deliver when the leaf is now finished because it was cancelled; null otherwise. */
    private Boolean settle() {
        if (finished || node.getStateMachine().getState() != ExecutionState.CANCELLED) {
            return null;
        }
        if (dispatched) {
            return finishOnce(ExecutionState.CANCELLED, ErrorKind.CANCELLED, "cancelled", null);
        }
        finished = true;
        return false;
    }

    private Boolean finishOnce(ExecutionState terminal, ErrorKind errorKind, String errorDetail, Object response) {
        finished = true;
        Instant finishedAt = Instant.now();
        Instant start = startedAt != null ? startedAt : finishedAt;
        ActionExecutionResult result = ActionExecutionResult.builder()
                .actionId(node.getId())
                .alias(node.getAlias())
                .kind(node.getKind())
                .state(terminal)
                .errorKind(terminal == ExecutionState.SUCCESS ? null : errorKind)
                .errorDetail(errorDetail)
                .attemptsUsed(node.getAttemptCount())
                .startedAt(start)
                .finishedAt(finishedAt)
                .response(response)
                .build();
        run.addResult(result);
        metrics.recordAction(node.getKind(), terminal, result.getDuration());
        return terminal == ExecutionState.SUCCESS;
    }

    /** Completes the future outside the lock so dependent stages never run while it is held. */
    private void deliver(Boolean done) {
        if (done != null) {
            completion.complete(done);
        }
    }

    @Override
    public String toString() {
        ExecutionStateMachine sm = node.getStateMachine();
        return "LeafTask{" + node.describe() + ", state=" + sm.getState() + "}";
    }
}
