package com.hearth.executor;

import com.hearth.actionmodel.error.RunDeadlineExceededException;
import com.hearth.actionmodel.node.ActionNode;
import com.hearth.actionmodel.result.ActionExecutionSummary;
import com.hearth.actionmodel.state.ExecutionState;
import com.hearth.actionmodel.state.ExecutionStateMachine;
import com.hearth.executor.handler.CompositeHandlerRegistry;
import com.hearth.executor.handler.HandlerContext;
import com.hearth.executor.metrics.ActionExecutorMetrics;
import com.hearth.gateway.ServiceCallGateway;
import com.hearth.template.ConditionEvaluator;
import com.hearth.template.PlaceholderTemplateRenderer;
import com.hearth.template.TemplateRenderer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes parsed action trees. Ready leaves go through one bounded FIFO queue drained by a fixed pool of
 * worker threads; delays, retry backoff and run deadlines are timer callbacks, so no worker sleeps.
 * Composite nodes are driven by {@link com.hearth.executor.handler.CompositeHandler}s without occupying a worker.
 * <p>
 * Leaf failures never throw: they end up as results in the returned {@link ActionExecutionSummary}.
 * Several {@code execute} calls may run concurrently and share the pool.
 *
 * <pre>
 * try (ActionExecutor executor = ActionExecutor.builder().gateway(gateway).build()) {
 *     executor.start();
 *     ActionExecutionSummary summary = executor.execute(nodes, Map.of());
 * }
 * </pre>
 */
public final class ActionExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    /** Key in the run context whose value becomes the summary's correlation id. */
    public static final String CORRELATION_ID_KEY = "correlation_id";

    private static final long POLL_MS = 100;
    private static final long REQUEUE_RETRY_MS = 10;
    private static final long WORKER_JOIN_TIMEOUT_MS = 30_000;

    private final ConditionEvaluator conditionEvaluator;
    private final ExecutionOptions options;
    private final ActionExecutorMetrics metrics;
    private final CompositeHandlerRegistry handlers;
    private final BlockingQueue<LeafTask> queue;
    private final ScheduledExecutorService timer;
    private final ExecutorService callExecutor;
    private final LeafRunner leafRunner;
    private final List<Thread> workers = new ArrayList<>();
    private final Set<RunState> activeRuns = ConcurrentHashMap.newKeySet();
    private final Object lifecycleLock = new Object();

    private volatile boolean running;
    private boolean started;
    private boolean shutdown;

    private ActionExecutor(Builder b) {
        ServiceCallGateway gateway = Objects.requireNonNull(b.gateway, "gateway");
        TemplateRenderer renderer = b.renderer != null ? b.renderer : PlaceholderTemplateRenderer.strict();
        this.conditionEvaluator = new ConditionEvaluator(renderer);
        this.options = b.options != null ? b.options : ExecutionOptions.defaults();
        this.metrics = new ActionExecutorMetrics(b.meterRegistry);
        this.handlers = b.handlers != null ? b.handlers : CompositeHandlerRegistry.defaults();
        this.queue = new ArrayBlockingQueue<>(options.getQueueCapacity());
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "hearth-timer"));
        this.callExecutor = Executors.newCachedThreadPool(daemonThreads("hearth-call"));
        this.leafRunner = new LeafRunner(gateway, renderer, timer, callExecutor, metrics, this::enqueue);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Spawns the worker threads. Calling it again on a running executor logs a warning and does nothing.
     *
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (shutdown) {
                throw new IllegalStateException("ActionExecutor has been shut down");
            }
            if (started) {
                log.warn("ActionExecutor already started | workers={}", workers.size());
                return;
            }
            started = true;
            running = true;
            for (int i = 0; i < options.getNumWorkers(); i++) {
                Thread worker = new Thread(this::workerLoop, "hearth-worker-" + (i + 1));
                worker.setDaemon(true);
                worker.start();
                workers.add(worker);
            }
        }
        log.info("ActionExecutor started | workers={} | queueCapacity={}", options.getNumWorkers(), options.getQueueCapacity());
    }

    public boolean isRunning() {
        return running;
    }

    public ExecutionOptions getOptions() {
        return options;
    }

    public MeterRegistry getMeterRegistry() {
        return metrics.getRegistry();
    }

    /** Executes with the executor's own options. */
    public ActionExecutionSummary execute(List<? extends ActionNode> nodes, Map<String, Object> context) {
        return execute(nodes, context, options);
    }

    /**
     * Runs {@code nodes} in declared order and blocks until every one of them is terminal.
     * A failed top-level node does not stop later top-level nodes.
     *
     * @param context template variables; null means none
     * @param runOptions per-run retry, timeout, deadline and repeat settings ({@code numWorkers} and
     *                   {@code queueCapacity} are ignored here)
     * @throws IllegalStateException       when the executor is not running
     * @throws IllegalArgumentException    when a node has already been executed
     * @throws RunDeadlineExceededException when the deadline expired before any leaf was dispatched
     */
    public ActionExecutionSummary execute(List<? extends ActionNode> nodes, Map<String, Object> context,
                                          ExecutionOptions runOptions) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(runOptions, "runOptions");
        for (ActionNode node : nodes) {
            Objects.requireNonNull(node, "nodes must not contain null");
            if (node.getState() != ExecutionState.QUEUED) {
                throw new IllegalArgumentException("Node already executed: " + node.describe() + " is " + node.getState());
            }
        }
        if (!running) {
            throw new IllegalStateException("ActionExecutor is not running");
        }
        Map<String, Object> variables = Collections.unmodifiableMap(
                context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>());

        String runId = UUID.randomUUID().toString();
        Object correlation = variables.get(CORRELATION_ID_KEY);
        String correlationId = correlation != null ? String.valueOf(correlation) : runId;
        RunState run = new RunState(runId, correlationId, runOptions);
        for (ActionNode node : nodes) {
            run.track(node);
        }
        run.setHandlerContext(new HandlerContext(runId,
                (child, vars) -> runNode(child, run, vars),
                conditionEvaluator,
                run::addError,
                run::track,
                run::isCancelled,
                runOptions.getMaxRepeatIterations()));
        activeRuns.add(run);
        log.info("Run started | runId={} | correlationId={} | nodes={} | deadline={}",
                runId, correlationId, nodes.size(), runOptions.getRunDeadline());

        boolean ok;
        try {
            scheduleDeadline(run);
            ok = runTopLevel(List.copyOf(nodes), 0, run, variables).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run interrupted | runId={}", runId);
            run.cancel(false);
            ok = false;
        } catch (ExecutionException e) {
            run.cancel(false);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Run failed internally | runId={} | error={}", runId, cause.toString(), cause);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Run " + runId + " failed", cause);
        } finally {
            run.clearDeadline();
            activeRuns.remove(run);
        }

        if (run.isDeadlineExpired() && run.getDispatchedCount() == 0) {
            metrics.recordRun(false);
            log.warn("Run deadline exceeded before any action started | runId={}", runId);
            throw new RunDeadlineExceededException(runId, runOptions.getRunDeadline());
        }
        Duration total = Duration.between(run.getStartedAt(), Instant.now());
        ActionExecutionSummary summary = new ActionExecutionSummary(runId, run.snapshotResults(), ok, total,
                correlationId, run.snapshotErrors(), run.isCancelled());
        metrics.recordRun(summary.isOverallSuccess());
        log.info("Run finished | runId={} | success={} | results={} | failed={} | cancelled={} | durationMs={}",
                runId, summary.isOverallSuccess(), summary.getResults().size(), summary.getFailedCount(),
                summary.isCancelled(), total.toMillis());
        return summary;
    }

    private void scheduleDeadline(RunState run) {
        Duration deadline = run.getOptions().getRunDeadline();
        if (deadline == null) {
            return;
        }
        try {
            run.setDeadlineFuture(timer.schedule(() -> run.cancel(true), deadline.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("ActionExecutor is shutting down", e);
        }
    }

    /**
     * Runs top-level nodes in declared order. A required node's failure aborts the rest, which stay
     * QUEUED and produce no result.
     */
    private CompletableFuture<Boolean> runTopLevel(List<ActionNode> nodes, int index, RunState run,
                                                  Map<String, Object> variables) {
        if (index >= nodes.size()) {
            return CompletableFuture.completedFuture(true);
        }
        ActionNode node = nodes.get(index);
        return runNode(node, run, variables).thenCompose(success -> {
            if (!success && node.isRequired()) {
                log.info("Run aborted after failed action | runId={} | failed={} | skipped={}",
                        run.getRunId(), node.describe(), nodes.size() - index - 1);
                return CompletableFuture.completedFuture(false);
            }
            return runTopLevel(nodes, index + 1, run, variables);
        });
    }

    /** Drives one node to a terminal state; the future completes with true on success. */
    private CompletableFuture<Boolean> runNode(ActionNode node, RunState run, Map<String, Object> variables) {
        if (run.isCancelled()) {
            node.getStateMachine().cancel();
            return CompletableFuture.completedFuture(false);
        }
        return switch (node.getKind()) {
            case SERVICE_CALL, DELAY -> runLeaf(node, run, variables);
            case SEQUENCE, PARALLEL, REPEAT, CHOOSE -> runComposite(node, run, variables);
        };
    }

    private CompletableFuture<Boolean> runLeaf(ActionNode node, RunState run, Map<String, Object> variables) {
        LeafTask task = new LeafTask(node, run, variables, metrics);
        run.register(task);
        enqueue(task);
        return task.getCompletion();
    }

    private CompletableFuture<Boolean> runComposite(ActionNode node, RunState run, Map<String, Object> variables) {
        ExecutionStateMachine sm = node.getStateMachine();
        if (!sm.transitionIfActive(ExecutionState.EXECUTING)) {
            return CompletableFuture.completedFuture(false);
        }
        CompletableFuture<Boolean> handled;
        try {
            handled = handlers.forKind(node.getKind()).run(node, variables, run.getHandlerContext());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return handled.thenApply(ok -> {
            boolean moved = sm.transitionIfActive(ok ? ExecutionState.SUCCESS : ExecutionState.FAILED);
            if (log.isDebugEnabled()) {
                log.debug("Composite finished | runId={} | node={} | state={}", run.getRunId(), node.describe(), sm.getState());
            }
            return moved && ok;
        });
    }

    /** Hands a ready leaf to the workers; a full queue is retried shortly from the timer. */
    void enqueue(LeafTask task) {
        if (!running) {
            task.cancel();
            return;
        }
        if (queue.offer(task)) {
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("Work queue full, retrying | actionId={} | capacity={}", task.getNode().getId(), options.getQueueCapacity());
        }
        try {
            timer.schedule(() -> enqueue(task), REQUEUE_RETRY_MS, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            task.cancel();
        }
    }

    private void workerLoop() {
        while (running) {
            LeafTask task;
            try {
                task = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (task == null) {
                continue;
            }
            try {
                leafRunner.run(task);
            } catch (RuntimeException e) {
                log.error("Leaf execution failed internally | actionId={} | error={}", task.getNode().getId(), e.toString(), e);
                task.fail(e);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Worker stopped | thread={}", Thread.currentThread().getName());
        }
    }

    /**
     * Cancels active runs, drains the queue, waits (bounded) for the workers and stops the timer and call threads.
     * Idempotent.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            running = false;
        }
        for (RunState run : activeRuns) {
            run.cancel(false);
        }
        List<LeafTask> drained = new ArrayList<>();
        queue.drainTo(drained);
        for (LeafTask task : drained) {
            task.cancel();
        }
        long deadline = System.currentTimeMillis() + WORKER_JOIN_TIMEOUT_MS;
        for (Thread worker : workers) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            try {
                worker.join(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        timer.shutdownNow();
        callExecutor.shutdownNow();
        log.info("ActionExecutor stopped | drained={}", drained.size());
    }

    @Override
    public void close() {
        shutdown();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> daemon(r, prefix + "-" + counter.incrementAndGet());
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    public static final class Builder {
        private ServiceCallGateway gateway;
        private TemplateRenderer renderer;
        private ExecutionOptions options;
        private MeterRegistry meterRegistry;
        private CompositeHandlerRegistry handlers;

        public Builder gateway(ServiceCallGateway gateway) {
            this.gateway = gateway;
            return this;
        }

        /** Defaults to {@link PlaceholderTemplateRenderer#strict()}. */
        public Builder renderer(TemplateRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public Builder options(ExecutionOptions options) {
            this.options = options;
            return this;
        }

        /** Defaults to a private {@link io.micrometer.core.instrument.simple.SimpleMeterRegistry}. */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder compositeHandlers(CompositeHandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        public ActionExecutor build() {
            return new ActionExecutor(this);
        }
    }
}
