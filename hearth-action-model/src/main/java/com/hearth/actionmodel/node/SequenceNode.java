package com.hearth.actionmodel.node;

import java.util.List;
import java.util.Map;

/**
 * Children run strictly in declared order; child k+1 is dispatched only after child k is terminal.
 * A required child's failure aborts the remaining siblings.
 */
public final class SequenceNode extends ActionNode {

    private final List<ActionNode> children;

    public SequenceNode(String id, String alias, String parentId, boolean continueOnError, List<ActionNode> children) {
        super(id, alias, parentId, continueOnError);
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    @Override
    public ActionKind getKind() {
        return ActionKind.SEQUENCE;
    }

    @Override
    public List<ActionNode> getChildren() {
        return children;
    }

    @Override
    public SequenceNode copyWithNewIds(String newParentId) {
        String copyId = newId();
        return new SequenceNode(copyId, getAlias(), newParentId, isContinueOnError(), copyAll(children, copyId));
    }

    @Override
    protected void describeFields(Map<String, Object> out) {
        out.put("children", structureOf(children));
    }
}
