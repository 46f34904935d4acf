package com.hearth.executor.handler;

import com.hearth.actionmodel.node.ActionKind;
import com.hearth.actionmodel.node.ActionNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Starts every child at once and waits for all of them. Succeeds when every required child succeeded.
 */
public final class ParallelHandler implements CompositeHandler {

    @Override
    public Set<ActionKind> supportedKinds() {
        return Set.of(ActionKind.PARALLEL);
    }

    @Override
    public CompletableFuture<Boolean> run(ActionNode node, Map<String, Object> variables, HandlerContext ctx) {
        List<ActionNode> children = node.getChildren();
        List<CompletableFuture<Boolean>> futures = new ArrayList<>(children.size());
        for (ActionNode child : children) {
            futures.add(ctx.runChild(child, variables));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).thenApply(v -> {
            boolean ok = true;
            for (int i = 0; i < children.size(); i++) {
                if (!futures.get(i).join() && children.get(i).isRequired()) {
                    ok = false;
                }
            }
            return ok;
        });
    }
}
