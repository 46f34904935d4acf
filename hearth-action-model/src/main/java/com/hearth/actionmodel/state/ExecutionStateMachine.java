package com.hearth.actionmodel.state;

import com.hearth.actionmodel.error.IllegalStateTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-node finite state machine. All methods are synchronized: a node may be touched by the worker
 * that dequeued it, by a timer callback it scheduled, and by run cancellation.
 * The only backward movement is the retry cycle EXECUTING -&gt; RETRYING -&gt; EXECUTING.
 */
public final class ExecutionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStateMachine.class);

    private final String nodeId;
    private final List<ExecutionState> history = new ArrayList<>();
    private ExecutionState current;

    public ExecutionStateMachine(String nodeId) {
        this(nodeId, ExecutionState.QUEUED);
    }

    public ExecutionStateMachine(String nodeId, ExecutionState initial) {
        this.nodeId = nodeId;
        this.current = Objects.requireNonNull(initial, "initial");
        this.history.add(initial);
    }

    /** Pure check of the transition table, independent of any machine instance. */
    public static boolean canTransition(ExecutionState from, ExecutionState to) {
        return from != null && from.canTransitionTo(to);
    }

    public synchronized ExecutionState getState() {
        return current;
    }

    public synchronized boolean isTerminal() {
        return current.isTerminal();
    }

    /**
     * Moves to {@code target}.
     *
     * @throws IllegalStateTransitionException if the transition is not in the table (including any move out of a terminal state)
     */
    public synchronized void transition(ExecutionState target) {
        Objects.requireNonNull(target, "target");
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateTransitionException(nodeId, current, target);
        }
        if (log.isDebugEnabled()) {
            log.debug("State transition | nodeId={} | {} -> {}", nodeId, current, target);
        }
        current = target;
        history.add(target);
    }

    /**
     * Moves to {@code target} unless the machine already reached a terminal state (e.g. the run was cancelled
     * concurrently), in which case nothing changes and false is returned.
     *
     * @throws IllegalStateTransitionException if the machine is non-terminal and the transition is not allowed
     */
    public synchronized boolean transitionIfActive(ExecutionState target) {
        if (current.isTerminal()) {
            return false;
        }
        transition(target);
        return true;
    }

    /** Cancels the node when it is not yet terminal; returns true if this call cancelled it. */
    public synchronized boolean cancel() {
        return transitionIfActive(ExecutionState.CANCELLED);
    }

    /** Every state visited, in order, starting with the initial one. */
    public synchronized List<ExecutionState> getHistory() {
        return List.copyOf(history);
    }

    @Override
    public synchronized String toString() {
        return "ExecutionStateMachine{nodeId=" + nodeId + ", state=" + current + "}";
    }
}
