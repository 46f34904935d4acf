package com.hearth.actionmodel.node;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs its body several times. Exactly one of {@code count}, {@code whileCondition} and {@code untilCondition}
 * is set. Every iteration runs on a fresh copy of {@link #getTemplate()}, so each iteration has its own ids.
 */
public final class RepeatNode extends ActionNode {

    private final Integer count;
    private final Object whileCondition;
    private final Object untilCondition;
    private final ActionNode template;

    private RepeatNode(String id, String alias, String parentId, boolean continueOnError,
                       Integer count, Object whileCondition, Object untilCondition, ActionNode template) {
        super(id, alias, parentId, continueOnError);
        this.count = count;
        this.whileCondition = whileCondition;
        this.untilCondition = untilCondition;
        this.template = Objects.requireNonNull(template, "template");
        int modes = (count != null ? 1 : 0) + (whileCondition != null ? 1 : 0) + (untilCondition != null ? 1 : 0);
        if (modes != 1) {
            throw new IllegalArgumentException("repeat needs exactly one of count, while, until");
        }
        if (count != null && count < 1) {
            throw new IllegalArgumentException("repeat count must be positive: " + count);
        }
    }

    public static RepeatNode count(String id, String alias, String parentId, boolean continueOnError,
                                   int count, ActionNode template) {
        return new RepeatNode(id, alias, parentId, continueOnError, count, null, null, template);
    }

    public static RepeatNode whileLoop(String id, String alias, String parentId, boolean continueOnError,
                                       Object condition, ActionNode template) {
        return new RepeatNode(id, alias, parentId, continueOnError, null,
                Objects.requireNonNull(condition, "condition"), null, template);
    }

    public static RepeatNode untilLoop(String id, String alias, String parentId, boolean continueOnError,
                                       Object condition, ActionNode template) {
        return new RepeatNode(id, alias, parentId, continueOnError, null, null,
                Objects.requireNonNull(condition, "condition"), template);
    }

    @Override
    public ActionKind getKind() {
        return ActionKind.REPEAT;
    }

    /** The body template only; iteration copies are created by {@link #newIteration()}. */
    @Override
    public List<ActionNode> getChildren() {
        return List.of(template);
    }

    @Override
    public RepeatNode copyWithNewIds(String newParentId) {
        String copyId = newId();
        return new RepeatNode(copyId, getAlias(), newParentId, isContinueOnError(),
                count, whileCondition, untilCondition, template.copyWithNewIds(copyId));
    }

    /** Fresh copy of the body with new ids, parented to this node. */
    public ActionNode newIteration() {
        return template.copyWithNewIds(getId());
    }

    @Override
    protected void describeFields(Map<String, Object> out) {
        Map<String, Object> mode = new LinkedHashMap<>();
        if (count != null) mode.put("count", count);
        if (whileCondition != null) mode.put("while", whileCondition);
        if (untilCondition != null) mode.put("until", untilCondition);
        out.put("repeat", mode);
        out.put("sequence", template.toStructureMap());
    }

    /** Iteration count, or null when the loop is condition-driven. */
    public Integer getCount() {
        return count;
    }

    /** Checked before each iteration; null unless this is a while loop. */
    public Object getWhileCondition() {
        return whileCondition;
    }

    /** Checked after each iteration; null unless this is an until loop. */
    public Object getUntilCondition() {
        return untilCondition;
    }

    public ActionNode getTemplate() {
        return template;
    }
}
