package com.hearth.actionmodel.result;

/** Which failure class ended a leaf. Absent on successful results. */
public enum ErrorKind {
    /** The platform rejected the call and it was not retryable. */
    SERVICE_CALL,
    /** Every allowed attempt failed with a retryable error. */
    RETRY_EXHAUSTED,
    /** The node could not be executed as written, e.g. a template failed to render. */
    INVALID_ACTION,
    /** The run deadline expired or the executor shut down. */
    CANCELLED
}
