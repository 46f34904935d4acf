package com.hearth.actionmodel.node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conditional branching: the first branch whose condition holds runs; otherwise the default branch, if any.
 */
public final class ChooseNode extends ActionNode {

    /** One {@code conditions} / {@code sequence} pair. */
    public record ChooseBranch(Object condition, ActionNode node) {
        public ChooseBranch {
            Objects.requireNonNull(node, "node");
        }
    }

    private final List<ChooseBranch> branches;
    private final ActionNode defaultBranch;

    public ChooseNode(String id, String alias, String parentId, boolean continueOnError,
                      List<ChooseBranch> branches, ActionNode defaultBranch) {
        super(id, alias, parentId, continueOnError);
        this.branches = branches != null ? List.copyOf(branches) : List.of();
        this.defaultBranch = defaultBranch;
    }

    @Override
    public ActionKind getKind() {
        return ActionKind.CHOOSE;
    }

    /** Branch nodes in declared order, followed by the default branch when present. */
    @Override
    public List<ActionNode> getChildren() {
        List<ActionNode> out = new ArrayList<>(branches.size() + 1);
        for (ChooseBranch b : branches) {
            out.add(b.node());
        }
        if (defaultBranch != null) out.add(defaultBranch);
        return List.copyOf(out);
    }

    @Override
    public ChooseNode copyWithNewIds(String newParentId) {
        String copyId = newId();
        List<ChooseBranch> copies = new ArrayList<>(branches.size());
        for (ChooseBranch b : branches) {
            copies.add(new ChooseBranch(b.condition(), b.node().copyWithNewIds(copyId)));
        }
        ActionNode defaultCopy = defaultBranch != null ? defaultBranch.copyWithNewIds(copyId) : null;
        return new ChooseNode(copyId, getAlias(), newParentId, isContinueOnError(), copies, defaultCopy);
    }

    @Override
    protected void describeFields(Map<String, Object> out) {
        List<Map<String, Object>> described = new ArrayList<>();
        for (ChooseBranch b : branches) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("conditions", b.condition());
            m.put("sequence", b.node().toStructureMap());
            described.add(m);
        }
        out.put("choose", described);
        if (defaultBranch != null) out.put("default", defaultBranch.toStructureMap());
    }

    public List<ChooseBranch> getBranches() {
        return branches;
    }

    /** Null when the document has no {@code default:}. */
    public ActionNode getDefaultBranch() {
        return defaultBranch;
    }
}
