package com.hearth.actionmodel.node;

import com.hearth.actionmodel.state.ExecutionState;
import com.hearth.actionmodel.state.ExecutionStateMachine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Node in an action tree: a leaf ({@link ServiceCallNode}, {@link DelayNode}) or a composite
 * ({@link SequenceNode}, {@link ParallelNode}, {@link RepeatNode}, {@link ChooseNode}).
 * <p>
 * Definition fields are immutable. Runtime fields (state, attempt count) are mutated only by the executor,
 * once per run: parsing the same document again yields a new tree with new ids.
 * A composite owns its children; no node is shared between trees.
 */
public abstract sealed class ActionNode
        permits ServiceCallNode, DelayNode, SequenceNode, ParallelNode, RepeatNode, ChooseNode {

    private final String id;
    private final String alias;
    private final String parentId;
    private final boolean continueOnError;
    private final ExecutionStateMachine stateMachine;
    private final AtomicInteger attemptCount = new AtomicInteger();

    protected ActionNode(String id, String alias, String parentId, boolean continueOnError) {
        this.id = id != null && !id.isBlank() ? id : newId();
        this.alias = alias != null && !alias.isBlank() ? alias.trim() : null;
        this.parentId = parentId;
        this.continueOnError = continueOnError;
        this.stateMachine = new ExecutionStateMachine(this.id);
    }

    /** Fresh unique node id. */
    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public abstract ActionKind getKind();

    /** Direct children in declared order; empty for leaves. Unmodifiable. */
    public abstract List<ActionNode> getChildren();

    /**
     * Deep copy of this subtree with new ids everywhere and runtime state reset.
     *
     * @param newParentId parent id for the copy's root; null for a top-level copy
     */
    public abstract ActionNode copyWithNewIds(String newParentId);

    /** Kind-specific definition fields, without ids; used by {@link #toStructureMap()}. */
    protected abstract void describeFields(Map<String, Object> out);

    public String getId() {
        return id;
    }

    /** Optional label from the document ({@code alias:}); null when absent. */
    public String getAlias() {
        return alias;
    }

    /** Id of the enclosing composite, or null at top level. */
    public String getParentId() {
        return parentId;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    /** Whether a failure of this node counts against its enclosing sequence and the run. */
    public boolean isRequired() {
        return !continueOnError;
    }

    public boolean isLeaf() {
        return getKind().isLeaf();
    }

    public ExecutionStateMachine getStateMachine() {
        return stateMachine;
    }

    public ExecutionState getState() {
        return stateMachine.getState();
    }

    public int getAttemptCount() {
        return attemptCount.get();
    }

    /** Records one more gateway dispatch and returns the new count. */
    public int incrementAttemptCount() {
        return attemptCount.incrementAndGet();
    }

    /** Label for logs: alias when present, otherwise kind and id. */
    public String describe() {
        return alias != null ? alias + " (" + id + ")" : getKind().getTypeName() + " (" + id + ")";
    }

    /**
     * Structural view of the subtree: kind, alias, flags, kind-specific fields and children, without ids or
     * runtime state. Two parses of the same document give equal maps.
     */
    public Map<String, Object> toStructureMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("kind", getKind().getTypeName());
        if (alias != null) out.put("alias", alias);
        if (continueOnError) out.put("continueOnError", true);
        describeFields(out);
        return out;
    }

    static List<ActionNode> copyAll(List<ActionNode> nodes, String newParentId) {
        return nodes.stream().map(n -> n.copyWithNewIds(newParentId)).toList();
    }

    static List<Map<String, Object>> structureOf(List<ActionNode> nodes) {
        return nodes.stream().map(ActionNode::toStructureMap).toList();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", state=" + getState() + "}";
    }
}
