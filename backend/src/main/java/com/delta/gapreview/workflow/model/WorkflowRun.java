package com.delta.gapreview.workflow.model;

import java.time.Instant;

/**
 * Latest snapshot of a run. {@code sequenceNo} is the number of the checkpoint this snapshot was
 * read from; the next checkpoint must carry {@code sequenceNo + 1}.
 */
public record WorkflowRun(
    String runId,
    RunState state,
    long sequenceNo,
    Instant createdAt,
    Instant updatedAt,
    String lastError,
    String failureReason,
    RunContext context
) {
    public WorkflowRun advance(RunState next, RunContext nextContext, Instant at) {
        return new WorkflowRun(runId, next, sequenceNo + 1, createdAt, at, lastError, failureReason, nextContext);
    }

    public WorkflowRun withFailure(String reason, String message) {
        return new WorkflowRun(runId, state, sequenceNo, createdAt, updatedAt, message, reason, context);
    }

    public WorkflowRun fail(String reason, String message, Instant at) {
        return new WorkflowRun(runId, RunState.FAILED, sequenceNo + 1, createdAt, at, message, reason, context);
    }
}
