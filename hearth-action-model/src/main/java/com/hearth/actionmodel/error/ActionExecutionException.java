package com.hearth.actionmodel.error;

/**
 * Base of the action error taxonomy. Never thrown directly; see the subclasses for the concrete cases.
 */
public abstract class ActionExecutionException extends RuntimeException {

    protected ActionExecutionException(String message) {
        super(message);
    }

    protected ActionExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
