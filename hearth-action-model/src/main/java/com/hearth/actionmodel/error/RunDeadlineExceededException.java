package com.hearth.actionmodel.error;

import java.time.Duration;

/**
 * The run deadline expired before any action of the run could be dispatched,
 * so there is no meaningful partial summary to return.
 */
public final class RunDeadlineExceededException extends ActionExecutionException {

    private final String runId;
    private final Duration deadline;

    public RunDeadlineExceededException(String runId, Duration deadline) {
        super(String.format("Run %s made no progress before its deadline of %d ms", runId,
                deadline != null ? deadline.toMillis() : -1));
        this.runId = runId;
        this.deadline = deadline;
    }

    public String getRunId() {
        return runId;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
