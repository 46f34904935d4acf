package com.hearth.actionmodel.error;

import com.hearth.actionmodel.state.ExecutionState;

/**
 * Internal invariant violation: a node was asked to move along a transition the state machine
 * does not allow (e.g. out of a terminal state). Fatal for the run that hit it.
 */
public final class IllegalStateTransitionException extends ActionExecutionException {

    private final String nodeId;
    private final ExecutionState from;
    private final ExecutionState to;

    public IllegalStateTransitionException(String nodeId, ExecutionState from, ExecutionState to) {
        super(String.format("Illegal state transition %s -> %s for node %s", from, to, nodeId));
        this.nodeId = nodeId;
        this.from = from;
        this.to = to;
    }

    public String getNodeId() {
        return nodeId;
    }

    public ExecutionState getFrom() {
        return from;
    }

    public ExecutionState getTo() {
        return to;
    }
}
