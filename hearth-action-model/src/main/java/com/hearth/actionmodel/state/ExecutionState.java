package com.hearth.actionmodel.state;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle state of an action node. {@link #QUEUED} is initial; {@link #SUCCESS}, {@link #FAILED}
 * and {@link #CANCELLED} are terminal.
 * <pre>
 * QUEUED -&gt; EXECUTING -&gt; SUCCESS | FAILED | RETRYING
 * RETRYING -&gt; EXECUTING
 * any non-terminal -&gt; CANCELLED
 * </pre>
 */
public enum ExecutionState {
    QUEUED,
    EXECUTING,
    /** Waiting out a backoff delay before the next attempt. */
    RETRYING,
    SUCCESS,
    FAILED,
    CANCELLED;

    private static final Map<ExecutionState, Set<ExecutionState>> ALLOWED = new EnumMap<>(ExecutionState.class);

    static {
        ALLOWED.put(QUEUED, EnumSet.of(EXECUTING, CANCELLED));
        ALLOWED.put(EXECUTING, EnumSet.of(SUCCESS, FAILED, RETRYING, CANCELLED));
        ALLOWED.put(RETRYING, EnumSet.of(EXECUTING, CANCELLED));
        ALLOWED.put(SUCCESS, EnumSet.noneOf(ExecutionState.class));
        ALLOWED.put(FAILED, EnumSet.noneOf(ExecutionState.class));
        ALLOWED.put(CANCELLED, EnumSet.noneOf(ExecutionState.class));
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(ExecutionState target) {
        return target != null && ALLOWED.get(this).contains(target);
    }
}
