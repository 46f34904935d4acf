package com.hearth.executor.handler;

import com.hearth.actionmodel.node.ActionNode;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one child node to a terminal state. The future completes with true when the child succeeded.
 */
@FunctionalInterface
public interface ChildNodeRunner {

    CompletableFuture<Boolean> run(ActionNode child, Map<String, Object> variables);
}
