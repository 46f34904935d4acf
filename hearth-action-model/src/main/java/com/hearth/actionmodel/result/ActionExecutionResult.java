package com.hearth.actionmodel.result;

import com.hearth.actionmodel.node.ActionKind;
import com.hearth.actionmodel.state.ExecutionState;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal outcome of one dispatched leaf. Immutable.
 */
public final class ActionExecutionResult {

    private final String actionId;
    private final String alias;
    private final ActionKind kind;
    private final ExecutionState state;
    private final boolean success;
    private final ErrorKind errorKind;
    private final String errorDetail;
    private final int attemptsUsed;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Duration duration;
    private final Object response;

    private ActionExecutionResult(Builder b) {
        this.actionId = Objects.requireNonNull(b.actionId, "actionId");
        this.alias = b.alias;
        this.kind = Objects.requireNonNull(b.kind, "kind");
        this.state = Objects.requireNonNull(b.state, "state");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("result state must be terminal: " + state);
        }
        this.success = state == ExecutionState.SUCCESS;
        this.errorKind = success ? null : b.errorKind;
        this.errorDetail = b.errorDetail;
        this.attemptsUsed = b.attemptsUsed;
        this.startedAt = b.startedAt;
        this.finishedAt = b.finishedAt;
        this.duration = b.startedAt != null && b.finishedAt != null
                ? Duration.between(b.startedAt, b.finishedAt)
                : Duration.ZERO;
        this.response = success ? b.response : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getActionId() {
        return actionId;
    }

    public String getAlias() {
        return alias;
    }

    public ActionKind getKind() {
        return kind;
    }

    public ExecutionState getState() {
        return state;
    }

    public boolean isSuccess() {
        return success;
    }

    /** Null on success. */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    /** Gateway dispatches made for this leaf; 0 for delays. */
    public int getAttemptsUsed() {
        return attemptsUsed;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration getDuration() {
        return duration;
    }

    /** Platform response body of the successful attempt, when it returned one. */
    public Object getResponse() {
        return response;
    }

    public Map<String, Object> toExportMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("actionId", actionId);
        if (alias != null) m.put("alias", alias);
        m.put("kind", kind.getTypeName());
        m.put("state", state.name());
        m.put("success", success);
        if (errorKind != null) m.put("errorKind", errorKind.name());
        if (errorDetail != null) m.put("errorDetail", errorDetail);
        m.put("attemptsUsed", attemptsUsed);
        if (startedAt != null) m.put("startedAt", startedAt.toString());
        if (finishedAt != null) m.put("finishedAt", finishedAt.toString());
        m.put("durationMs", duration.toMillis());
        if (response != null) m.put("response", response);
        return m;
    }

    @Override
    public String toString() {
        return "ActionExecutionResult{actionId=" + actionId + ", kind=" + kind + ", state=" + state
                + ", errorKind=" + errorKind + ", attemptsUsed=" + attemptsUsed + "}";
    }

    public static final class Builder {
        private String actionId;
        private String alias;
        private ActionKind kind;
        private ExecutionState state;
        private ErrorKind errorKind;
        private String errorDetail;
        private int attemptsUsed;
        private Instant startedAt;
        private Instant finishedAt;
        private Object response;

        public Builder actionId(String actionId) {
            this.actionId = actionId;
            return this;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder kind(ActionKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder state(ExecutionState state) {
            this.state = state;
            return this;
        }

        public Builder errorKind(ErrorKind errorKind) {
            this.errorKind = errorKind;
            return this;
        }

        public Builder errorDetail(String errorDetail) {
            this.errorDetail = errorDetail;
            return this;
        }

        public Builder attemptsUsed(int attemptsUsed) {
            this.attemptsUsed = attemptsUsed;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder response(Object response) {
            this.response = response;
            return this;
        }

        public ActionExecutionResult build() {
            return new ActionExecutionResult(this);
        }
    }
}
