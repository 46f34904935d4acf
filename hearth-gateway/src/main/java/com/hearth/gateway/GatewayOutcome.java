package com.hearth.gateway;

import java.util.OptionalInt;

/** Result of a single gateway call: success with an optional response, or a failure that may be retried. */
public final class GatewayOutcome {

    private final boolean success;
    private final boolean retryable;
    private final Object response;
    private final String message;
    private final Integer statusCode;

    private GatewayOutcome(boolean success, boolean retryable, Object response, String message, Integer statusCode) {
        this.success = success;
        this.retryable = retryable;
        this.response = response;
        this.message = message;
        this.statusCode = statusCode;
    }

    public static GatewayOutcome success(Object response) {
        return new GatewayOutcome(true, false, response, null, null);
    }

    public static GatewayOutcome success(Object response, int statusCode) {
        return new GatewayOutcome(true, false, response, null, statusCode);
    }

    public static GatewayOutcome failure(boolean retryable, String message) {
        return new GatewayOutcome(false, retryable, null, message, null);
    }

    public static GatewayOutcome failure(boolean retryable, String message, int statusCode) {
        return new GatewayOutcome(false, retryable, null, message, statusCode);
    }

    public boolean isSuccess() {
        return success;
    }

    /** Always false on success. */
    public boolean isRetryable() {
        return retryable;
    }

    public Object getResponse() {
        return response;
    }

    public String getMessage() {
        return message;
    }

    /** HTTP status when the call reached the platform. */
    public OptionalInt getStatusCode() {
        return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }

    @Override
    public String toString() {
        return success
                ? "GatewayOutcome{success, status=" + statusCode + "}"
                : "GatewayOutcome{failure, retryable=" + retryable + ", status=" + statusCode + ", message=" + message + "}";
    }
}
