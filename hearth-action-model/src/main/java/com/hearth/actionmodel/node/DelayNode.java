package com.hearth.actionmodel.node;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Leaf that waits for a fixed time span, suspending only its own branch. */
public final class DelayNode extends ActionNode {

    private final Duration duration;

    public DelayNode(String id, String alias, String parentId, boolean continueOnError, Duration duration) {
        super(id, alias, parentId, continueOnError);
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("delay duration must not be negative: " + duration);
        }
        this.duration = duration;
    }

    @Override
    public ActionKind getKind() {
        return ActionKind.DELAY;
    }

    @Override
    public List<ActionNode> getChildren() {
        return List.of();
    }

    @Override
    public DelayNode copyWithNewIds(String newParentId) {
        return new DelayNode(newId(), getAlias(), newParentId, isContinueOnError(), duration);
    }

    @Override
    protected void describeFields(Map<String, Object> out) {
        out.put("durationMs", duration.toMillis());
    }

    public Duration getDuration() {
        return duration;
    }
}
