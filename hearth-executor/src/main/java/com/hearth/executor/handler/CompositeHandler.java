package com.hearth.executor.handler;

import com.hearth.actionmodel.node.ActionKind;
import com.hearth.actionmodel.node.ActionNode;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Single responsibility: drive the children of one or more composite kinds.
 * Handlers never touch the composite's own state; the executor moves it to EXECUTING before
 * {@link #run} and to SUCCESS or FAILED from the returned future.
 */
public interface CompositeHandler {

    /** Kinds this handler accepts. Used by {@link CompositeHandlerRegistry}. */
    Set<ActionKind> supportedKinds();

    /**
     * @return completes with true when the composite succeeded; never completes exceptionally for child failures
     */
    CompletableFuture<Boolean> run(ActionNode node, Map<String, Object> variables, HandlerContext ctx);
}
