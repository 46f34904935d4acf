package com.hearth.actionmodel.error;

/**
 * Thrown for a structurally invalid action: bad {@code domain.service} reference, unreadable delay,
 * repeat without template or bound, or a template/condition that cannot be resolved at run time.
 */
public final class InvalidActionException extends ActionExecutionException {

    private final String fragment;
    private final String reason;

    public InvalidActionException(String reason) {
        this(null, reason);
    }

    public InvalidActionException(String fragment, String reason) {
        super(ActionParseException.formatMessage(fragment, reason));
        this.fragment = fragment;
        this.reason = reason;
    }

    public InvalidActionException(String fragment, String reason, Throwable cause) {
        super(ActionParseException.formatMessage(fragment, reason), cause);
        this.fragment = fragment;
        this.reason = reason;
    }

    public String getFragment() {
        return fragment;
    }

    public String getReason() {
        return reason;
    }
}
