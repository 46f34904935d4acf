package com.hearth.actionmodel.result;

import com.hearth.actionmodel.state.ExecutionState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one run: results of the dispatched leaves in the order they finished, plus run-level flags.
 */
public final class ActionExecutionSummary {

    private final String runId;
    private final List<ActionExecutionResult> results;
    private final boolean overallSuccess;
    private final Duration totalDuration;
    private final String correlationId;
    private final List<String> errors;
    private final boolean cancelled;

    public ActionExecutionSummary(String runId, List<ActionExecutionResult> results, boolean overallSuccess,
                                  Duration totalDuration, String correlationId, List<String> errors,
                                  boolean cancelled) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.results = results != null ? List.copyOf(results) : List.of();
        this.overallSuccess = overallSuccess && !cancelled;
        this.totalDuration = totalDuration != null ? totalDuration : Duration.ZERO;
        this.correlationId = correlationId;
        this.errors = errors != null ? List.copyOf(errors) : List.of();
        this.cancelled = cancelled;
    }

    public String getRunId() {
        return runId;
    }

    public List<ActionExecutionResult> getResults() {
        return results;
    }

    public boolean isOverallSuccess() {
        return overallSuccess;
    }

    public Duration getTotalDuration() {
        return totalDuration;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    /** Run-level errors not tied to a single leaf, such as a condition that failed to evaluate. */
    public List<String> getErrors() {
        return errors;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public long getSuccessfulCount() {
        return results.stream().filter(ActionExecutionResult::isSuccess).count();
    }

    public long getFailedCount() {
        return results.stream().filter(r -> r.getState() == ExecutionState.FAILED).count();
    }

    public long getCancelledCount() {
        return results.stream().filter(r -> r.getState() == ExecutionState.CANCELLED).count();
    }

    /** Plain map/list view for JSON output. */
    public Map<String, Object> toExportMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("runId", runId);
        if (correlationId != null) m.put("correlationId", correlationId);
        m.put("overallSuccess", overallSuccess);
        m.put("cancelled", cancelled);
        m.put("totalDurationMs", totalDuration.toMillis());
        m.put("successful", getSuccessfulCount());
        m.put("failed", getFailedCount());
        m.put("cancelledActions", getCancelledCount());
        List<Map<String, Object>> exported = new ArrayList<>(results.size());
        for (ActionExecutionResult r : results) {
            exported.add(r.toExportMap());
        }
        m.put("results", exported);
        if (!errors.isEmpty()) m.put("errors", errors);
        return m;
    }

    @Override
    public String toString() {
        return "ActionExecutionSummary{runId=" + runId + ", overallSuccess=" + overallSuccess
                + ", results=" + results.size() + ", cancelled=" + cancelled + "}";
    }
}
