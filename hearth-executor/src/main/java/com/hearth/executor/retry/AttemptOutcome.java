package com.hearth.executor.retry;

import com.hearth.gateway.GatewayOutcome;

import java.util.Locale;

/** Classification of one service-call attempt. */
public final class AttemptOutcome {

    public enum Kind {
        SUCCESS,
        RETRYABLE_FAILURE,
        FATAL_FAILURE;

        /** Lower-case tag value for metrics. */
        public String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;
    private final Object response;
    private final String message;

    private AttemptOutcome(Kind kind, Object response, String message) {
        this.kind = kind;
        this.response = response;
        this.message = message;
    }

    public static AttemptOutcome success(Object response) {
        return new AttemptOutcome(Kind.SUCCESS, response, null);
    }

    public static AttemptOutcome retryable(String message) {
        return new AttemptOutcome(Kind.RETRYABLE_FAILURE, null, message);
    }

    public static AttemptOutcome fatal(String message) {
        return new AttemptOutcome(Kind.FATAL_FAILURE, null, message);
    }

    public static AttemptOutcome from(GatewayOutcome outcome) {
        if (outcome.isSuccess()) {
            return success(outcome.getResponse());
        }
        String message = outcome.getMessage() != null ? outcome.getMessage() : "service call failed";
        return outcome.isRetryable() ? retryable(message) : fatal(message);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE_FAILURE;
    }

    public Object getResponse() {
        return response;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "AttemptOutcome{" + kind + (message != null ? ", message=" + message : "") + "}";
    }
}
