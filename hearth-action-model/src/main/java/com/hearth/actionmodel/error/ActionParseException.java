package com.hearth.actionmodel.error;

/**
 * Thrown when an automation definition cannot be read as a list of actions
 * (unreadable document text, no recognized top-level key, wrong top-level type).
 */
public final class ActionParseException extends ActionExecutionException {

    private final String fragment;
    private final String reason;

    public ActionParseException(String fragment, String reason) {
        super(formatMessage(fragment, reason));
        this.fragment = fragment;
        this.reason = reason;
    }

    public ActionParseException(String fragment, String reason, Throwable cause) {
        super(formatMessage(fragment, reason), cause);
        this.fragment = fragment;
        this.reason = reason;
    }

    /** Offending part of the definition, rendered as text and truncated; may be null. */
    public String getFragment() {
        return fragment;
    }

    public String getReason() {
        return reason;
    }

    static String formatMessage(String fragment, String reason) {
        if (fragment == null || fragment.isBlank()) {
            return reason;
        }
        return reason + " | fragment=" + fragment;
    }
}
