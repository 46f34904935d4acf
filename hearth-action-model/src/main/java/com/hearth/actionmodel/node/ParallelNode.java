package com.hearth.actionmodel.node;

import java.util.List;
import java.util.Map;

/**
 * Children are started together with no ordering between siblings. Terminal once every child is terminal;
 * succeeds when every required child succeeded.
 */
public final class ParallelNode extends ActionNode {

    private final List<ActionNode> children;

    public ParallelNode(String id, String alias, String parentId, boolean continueOnError, List<ActionNode> children) {
        super(id, alias, parentId, continueOnError);
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    @Override
    public ActionKind getKind() {
        return ActionKind.PARALLEL;
    }

    /** Children in document order; the order carries no execution meaning. */
    @Override
    public List<ActionNode> getChildren() {
        return children;
    }

    @Override
    public ParallelNode copyWithNewIds(String newParentId) {
        String copyId = newId();
        return new ParallelNode(copyId, getAlias(), newParentId, isContinueOnError(), copyAll(children, copyId));
    }

    @Override
    protected void describeFields(Map<String, Object> out) {
        out.put("children", structureOf(children));
    }
}
