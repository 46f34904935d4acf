package com.hearth.actionmodel.node;

/**
 * Kind of an action node. Leaves are dispatched to workers; composites only order and group their children.
 *
 * @see ActionNode#getKind()
 */
public enum ActionKind {
    SERVICE_CALL(true),
    DELAY(true),
    SEQUENCE(false),
    PARALLEL(false),
    REPEAT(false),
    CHOOSE(false);

    private final boolean leaf;

    ActionKind(boolean leaf) {
        this.leaf = leaf;
    }

    public boolean isLeaf() {
        return leaf;
    }

    /** Lower-case name as used in automation documents and metric tags (e.g. {@code service_call}). */
    public String getTypeName() {
        return name().toLowerCase();
    }
}
