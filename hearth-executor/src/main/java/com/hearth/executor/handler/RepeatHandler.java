package com.hearth.executor.handler;

import com.hearth.actionmodel.error.InvalidActionException;
import com.hearth.actionmodel.node.ActionKind;
import com.hearth.actionmodel.node.ActionNode;
import com.hearth.actionmodel.node.RepeatNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a fresh copy of the repeat body per iteration.
 * <ul>
 *   <li>count: exactly N iterations</li>
 *   <li>while: condition checked before each iteration</li>
 *   <li>until: condition checked after each iteration</li>
 * </ul>
 * Each iteration sees {@code repeat.index} (1-based), {@code repeat.first} and, for counted loops,
 * {@code repeat.last}. A failed required iteration stops the loop and fails the repeat. Condition loops stop
 * at {@link HandlerContext#getMaxRepeatIterations()}.
 */
public final class RepeatHandler implements CompositeHandler {

    private static final Logger log = LoggerFactory.getLogger(RepeatHandler.class);

    static final String REPEAT_VARIABLE = "repeat";

    @Override
    public Set<ActionKind> supportedKinds() {
        return Set.of(ActionKind.REPEAT);
    }

    @Override
    public CompletableFuture<Boolean> run(ActionNode node, Map<String, Object> variables, HandlerContext ctx) {
        return iterate((RepeatNode) node, 0, variables, ctx);
    }

    private CompletableFuture<Boolean> iterate(RepeatNode node, int index, Map<String, Object> variables,
                                               HandlerContext ctx) {
        if (ctx.isCancelled()) {
            return CompletableFuture.completedFuture(false);
        }
        Integer count = node.getCount();
        if (count != null && index >= count) {
            return CompletableFuture.completedFuture(true);
        }
        if (count == null && index >= ctx.getMaxRepeatIterations()) {
            log.warn("Repeat iteration cap reached | runId={} | repeatId={} | cap={}",
                    ctx.getRunId(), node.getId(), ctx.getMaxRepeatIterations());
            return CompletableFuture.completedFuture(true);
        }
        Map<String, Object> iterationVars = iterationVariables(variables, index, count);
        if (node.getWhileCondition() != null) {
            Optional<Boolean> proceed = evaluate(node, "while", node.getWhileCondition(), iterationVars, ctx);
            if (proceed.isEmpty()) {
                return CompletableFuture.completedFuture(false);
            }
            if (!proceed.get()) {
                return CompletableFuture.completedFuture(true);
            }
        }
        ActionNode iteration = node.newIteration();
        ctx.track(iteration);
        if (log.isDebugEnabled()) {
            log.debug("Repeat iteration | runId={} | repeatId={} | index={} | iterationId={}",
                    ctx.getRunId(), node.getId(), index + 1, iteration.getId());
        }
        return ctx.runChild(iteration, iterationVars).thenCompose(ok -> {
            if (!ok && iteration.isRequired()) {
                return CompletableFuture.completedFuture(false);
            }
            if (node.getUntilCondition() != null) {
                Optional<Boolean> done = evaluate(node, "until", node.getUntilCondition(), iterationVars, ctx);
                if (done.isEmpty()) {
                    return CompletableFuture.completedFuture(false);
                }
                if (done.get()) {
                    return CompletableFuture.completedFuture(true);
                }
            }
            return iterate(node, index + 1, variables, ctx);
        });
    }

    /** Empty when the condition could not be evaluated; the failure is recorded on the run. */
    private static Optional<Boolean> evaluate(RepeatNode node, String mode, Object condition,
                                              Map<String, Object> variables, HandlerContext ctx) {
        try {
            return Optional.of(ctx.evaluateCondition(condition, variables));
        } catch (InvalidActionException e) {
            String message = "repeat " + node.describe() + " " + mode + " condition failed: " + e.getReason();
            log.warn("Repeat condition failed | runId={} | repeatId={} | mode={} | reason={}",
                    ctx.getRunId(), node.getId(), mode, e.getReason());
            ctx.recordError(message);
            return Optional.empty();
        }
    }

    private static Map<String, Object> iterationVariables(Map<String, Object> variables, int index, Integer count) {
        Map<String, Object> repeat = new LinkedHashMap<>();
        repeat.put("index", index + 1);
        repeat.put("first", index == 0);
        if (count != null) {
            repeat.put("last", index + 1 == count);
        }
        Map<String, Object> out = new LinkedHashMap<>(variables);
        out.put(REPEAT_VARIABLE, repeat);
        return out;
    }
}
