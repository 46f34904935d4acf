package com.hearth.executor.handler;

import com.hearth.actionmodel.error.InvalidActionException;
import com.hearth.actionmodel.node.ActionKind;
import com.hearth.actionmodel.node.ActionNode;
import com.hearth.actionmodel.node.ActionTrees;
import com.hearth.actionmodel.node.ChooseNode;
import com.hearth.actionmodel.state.ExecutionState;
import com.hearth.actionmodel.state.ExecutionStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Evaluates branch conditions in order and runs the first branch that holds, else the default.
 * Branches that were not selected are moved to SUCCESS without running and produce no result.
 * A condition that cannot be evaluated fails the choose and is recorded as a run-level error.
 */
public final class ChooseHandler implements CompositeHandler {

    private static final Logger log = LoggerFactory.getLogger(ChooseHandler.class);

    @Override
    public Set<ActionKind> supportedKinds() {
        return Set.of(ActionKind.CHOOSE);
    }

    @Override
    public CompletableFuture<Boolean> run(ActionNode node, Map<String, Object> variables, HandlerContext ctx) {
        ChooseNode choose = (ChooseNode) node;
        ActionNode selected = null;
        int branchIndex = 0;
        for (ChooseNode.ChooseBranch branch : choose.getBranches()) {
            boolean holds;
            try {
                holds = ctx.evaluateCondition(branch.condition(), variables);
            } catch (InvalidActionException e) {
                log.warn("Choose condition failed | runId={} | chooseId={} | branch={} | reason={}",
                        ctx.getRunId(), choose.getId(), branchIndex, e.getReason());
                ctx.recordError("choose " + choose.describe() + " condition " + branchIndex
                        + " failed: " + e.getReason());
                return CompletableFuture.completedFuture(false);
            }
            if (holds) {
                selected = branch.node();
                break;
            }
            branchIndex++;
        }
        if (selected == null) {
            selected = choose.getDefaultBranch();
        }
        if (log.isDebugEnabled()) {
            log.debug("Choose resolved | runId={} | chooseId={} | selected={}",
                    ctx.getRunId(), choose.getId(), selected != null ? selected.getId() : "none");
        }
        for (ActionNode child : choose.getChildren()) {
            if (child != selected) {
                markSkipped(child);
            }
        }
        if (selected == null) {
            return CompletableFuture.completedFuture(true);
        }
        ActionNode chosen = selected;
        return ctx.runChild(chosen, variables).thenApply(ok -> ok || !chosen.isRequired());
    }

    /** Synthetic no-op success for every node of an unselected branch. */
    static void markSkipped(ActionNode branch) {
        ActionTrees.walk(List.of(branch), n -> {
            ExecutionStateMachine sm = n.getStateMachine();
            if (sm.getState() == ExecutionState.QUEUED && sm.transitionIfActive(ExecutionState.EXECUTING)) {
                sm.transitionIfActive(ExecutionState.SUCCESS);
            }
        });
    }
}
