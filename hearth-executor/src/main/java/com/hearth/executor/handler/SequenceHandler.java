package com.hearth.executor.handler;

import com.hearth.actionmodel.node.ActionKind;
import com.hearth.actionmodel.node.ActionNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Runs children one after another. A required child's failure aborts the rest; the aborted siblings
 * are never dispatched and stay QUEUED.
 */
public final class SequenceHandler implements CompositeHandler {

    private static final Logger log = LoggerFactory.getLogger(SequenceHandler.class);

    @Override
    public Set<ActionKind> supportedKinds() {
        return Set.of(ActionKind.SEQUENCE);
    }

    @Override
    public CompletableFuture<Boolean> run(ActionNode node, Map<String, Object> variables, HandlerContext ctx) {
        return runFrom(node, node.getChildren(), 0, variables, ctx);
    }

    private CompletableFuture<Boolean> runFrom(ActionNode parent, List<ActionNode> children, int index,
                                               Map<String, Object> variables, HandlerContext ctx) {
        if (index >= children.size()) {
            return CompletableFuture.completedFuture(true);
        }
        ActionNode child = children.get(index);
        return ctx.runChild(child, variables).thenCompose(ok -> {
            if (!ok && child.isRequired()) {
                if (log.isDebugEnabled()) {
                    log.debug("Sequence aborted | runId={} | sequenceId={} | failedChild={} | skipped={}",
                            ctx.getRunId(), parent.getId(), child.describe(), children.size() - index - 1);
                }
                return CompletableFuture.completedFuture(false);
            }
            return runFrom(parent, children, index + 1, variables, ctx);
        });
    }
}
