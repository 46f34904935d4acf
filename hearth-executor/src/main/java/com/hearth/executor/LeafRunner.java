package com.hearth.executor;

import com.hearth.actionmodel.error.InvalidActionException;
import com.hearth.actionmodel.error.RetryExhaustedException;
import com.hearth.actionmodel.error.ServiceCallException;
import com.hearth.actionmodel.node.ActionNode;
import com.hearth.actionmodel.node.DelayNode;
import com.hearth.actionmodel.node.ServiceCallNode;
import com.hearth.actionmodel.result.ErrorKind;
import com.hearth.actionmodel.state.ExecutionState;
import com.hearth.executor.metrics.ActionExecutorMetrics;
import com.hearth.executor.retry.AttemptOutcome;
import com.hearth.executor.retry.RetryPolicy;
import com.hearth.gateway.GatewayOutcome;
import com.hearth.gateway.ServiceCallGateway;
import com.hearth.template.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Executes one dequeued leaf attempt on a worker thread. Waits (delays, backoff) are handed to the timer;
 * the gateway call runs on a call thread bounded by the per-action timeout.
 */
final class LeafRunner {

    private static final Logger log = LoggerFactory.getLogger(LeafRunner.class);

    private final ServiceCallGateway gateway;
    private final TemplateRenderer renderer;
    private final ScheduledExecutorService timer;
    private final ExecutorService callExecutor;
    private final ActionExecutorMetrics metrics;
    private final Consumer<LeafTask> requeue;

    LeafRunner(ServiceCallGateway gateway, TemplateRenderer renderer, ScheduledExecutorService timer,
               ExecutorService callExecutor, ActionExecutorMetrics metrics, Consumer<LeafTask> requeue) {
        this.gateway = gateway;
        this.renderer = renderer;
        this.timer = timer;
        this.callExecutor = callExecutor;
        this.metrics = metrics;
        this.requeue = requeue;
    }

    void run(LeafTask task) {
        if (!task.begin()) {
            return;
        }
        ActionNode node = task.getNode();
        switch (node.getKind()) {
            case DELAY -> runDelay(task, (DelayNode) node);
            case SERVICE_CALL -> runServiceCall(task, (ServiceCallNode) node);
            default -> task.fail(new IllegalStateException("Not a leaf: " + node.describe()));
        }
    }

    private void runDelay(LeafTask task, DelayNode node) {
        node.incrementAttemptCount();
        long ms = node.getDuration().toMillis();
        if (log.isDebugEnabled()) {
            log.debug("Delay started | runId={} | actionId={} | durationMs={}", task.getRun().getRunId(), node.getId(), ms);
        }
        schedule(task, () -> task.complete(ExecutionState.SUCCESS, null, null, null), ms);
    }

    private void runServiceCall(LeafTask task, ServiceCallNode node) {
        RunState run = task.getRun();
        Map<String, Object> data;
        Set<String> target;
        try {
            data = renderData(node, task.getVariables());
            target = renderTarget(node, task.getVariables());
        } catch (InvalidActionException e) {
            log.warn("Service call render failed | runId={} | actionId={} | action={} | reason={}",
                    run.getRunId(), node.getId(), node.getAction(), e.getReason());
            task.complete(ExecutionState.FAILED, ErrorKind.INVALID_ACTION, e.getMessage(), null);
            return;
        }

        int attempt = node.incrementAttemptCount();
        if (log.isDebugEnabled()) {
            log.debug("Service call attempt | runId={} | actionId={} | action={} | attempt={} | target={}",
                    run.getRunId(), node.getId(), node.getAction(), attempt, target);
        }
        AttemptOutcome outcome = callGateway(task, node, target, data, run.getOptions().getPerActionTimeout());
        if (outcome == null) {
            return;
        }
        metrics.recordAttempt(node.getDomain(), node.getService(), outcome.getKind());

        RetryPolicy policy = run.getRetryPolicy();
        if (outcome.isSuccess()) {
            task.complete(ExecutionState.SUCCESS, null, null, outcome.getResponse());
        } else if (policy.shouldRetry(outcome, attempt)) {
            if (!task.toRetrying()) {
                return;
            }
            Duration backoff = policy.backoffDelay(attempt);
            log.info("Service call retry scheduled | runId={} | actionId={} | action={} | attempt={} | backoffMs={} | error={}",
                    run.getRunId(), node.getId(), node.getAction(), attempt, backoff.toMillis(), outcome.getMessage());
            schedule(task, () -> requeue.accept(task), backoff.toMillis());
        } else if (outcome.isRetryable()) {
            RetryExhaustedException error = new RetryExhaustedException(attempt, outcome.getMessage());
            log.warn("Service call retries exhausted | runId={} | actionId={} | action={} | attempts={}",
                    run.getRunId(), node.getId(), node.getAction(), attempt);
            task.complete(ExecutionState.FAILED, ErrorKind.RETRY_EXHAUSTED, error.getMessage(), null);
        } else {
            ServiceCallException error = new ServiceCallException(node.getDomain(), node.getService(), outcome.getMessage());
            log.warn("Service call failed | runId={} | actionId={} | action={} | error={}",
                    run.getRunId(), node.getId(), node.getAction(), outcome.getMessage());
            task.complete(ExecutionState.FAILED, ErrorKind.SERVICE_CALL, error.getMessage(), null);
        }
    }

    /** Null when the leaf was cancelled during the call. */
    private AttemptOutcome callGateway(LeafTask task, ServiceCallNode node, Set<String> target,
                                       Map<String, Object> data, Duration timeout) {
        Future<GatewayOutcome> future;
        try {
            future = callExecutor.submit(() -> gateway.invoke(node.getDomain(), node.getService(), target, data));
        } catch (RejectedExecutionException e) {
            log.warn("Service call rejected, executor stopping | actionId={}", node.getId());
            task.cancel();
            return null;
        }
        if (!task.setInFlight(future)) {
            return null;
        }
        try {
            GatewayOutcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return outcome != null ? AttemptOutcome.from(outcome) : AttemptOutcome.fatal("gateway returned no outcome");
        } catch (TimeoutException e) {
            future.cancel(true);
            return AttemptOutcome.retryable("timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Gateway threw | actionId={} | action={} | error={}", node.getId(), node.getAction(), cause.toString());
            return AttemptOutcome.retryable("gateway error: " + cause);
        } catch (CancellationException e) {
            task.cancel();
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            task.cancel();
            return null;
        } finally {
            task.clearInFlight();
        }
    }

    private Map<String, Object> renderData(ServiceCallNode node, Map<String, Object> variables) {
        Object rendered = renderer.render(node.getData(), variables);
        if (!(rendered instanceof Map)) {
            throw new InvalidActionException(String.valueOf(node.getData()), "data must render to a mapping");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) rendered).entrySet()) {
            out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }

    /** Renders each target id; a rendered list or comma-separated string expands to several ids. */
    private Set<String> renderTarget(ServiceCallNode node, Map<String, Object> variables) {
        Set<String> out = new LinkedHashSet<>();
        for (String id : node.getTarget()) {
            Object rendered = renderer.render(id, variables);
            if (rendered instanceof Collection) {
                for (Object item : (Collection<?>) rendered) {
                    addIds(out, item);
                }
            } else {
                addIds(out, rendered);
            }
        }
        return out;
    }

    private static void addIds(Set<String> out, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Map) {
            throw new InvalidActionException(String.valueOf(value), "target entity id must not be a mapping");
        }
        for (String part : String.valueOf(value).split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
    }

    private void schedule(LeafTask task, Runnable action, long delayMs) {
        try {
            ScheduledFuture<?> future = timer.schedule(action, delayMs, TimeUnit.MILLISECONDS);
            task.setScheduled(future);
        } catch (RejectedExecutionException e) {
            log.warn("Timer rejected task, executor stopping | actionId={}", task.getNode().getId());
            task.cancel();
        }
    }
}
