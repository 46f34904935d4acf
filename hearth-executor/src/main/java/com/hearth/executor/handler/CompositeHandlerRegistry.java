package com.hearth.executor.handler;

import com.hearth.actionmodel.node.ActionKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Single responsibility: map ActionKind to CompositeHandler.
 */
public final class CompositeHandlerRegistry {

    private final Map<ActionKind, CompositeHandler> handlers = new EnumMap<>(ActionKind.class);

    public CompositeHandlerRegistry(List<CompositeHandler> handlerList) {
        for (CompositeHandler handler : handlerList) {
            for (ActionKind kind : handler.supportedKinds()) {
                if (kind.isLeaf()) {
                    throw new IllegalArgumentException("Leaf kind cannot have a composite handler: " + kind);
                }
                handlers.put(kind, handler);
            }
        }
    }

    /** Registry with the sequence, parallel, repeat and choose handlers. */
    public static CompositeHandlerRegistry defaults() {
        return new CompositeHandlerRegistry(List.of(
                new SequenceHandler(),
                new ParallelHandler(),
                new RepeatHandler(),
                new ChooseHandler()));
    }

    /**
     * @throws IllegalStateException when no handler is registered for {@code kind}
     */
    public CompositeHandler forKind(ActionKind kind) {
        CompositeHandler handler = handlers.get(kind);
        if (handler == null) {
            throw new IllegalStateException("No composite handler for kind " + kind);
        }
        return handler;
    }
}
