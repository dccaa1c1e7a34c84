package com.delta.gapreview.workflow.model;

import java.time.Instant;

public record RunStatusResponse(
    String runId,
    RunState state,
    long sequenceNo,
    Instant createdAt,
    Instant updatedAt,
    String lastError,
    String failureReason,
    RunContext context
) {
    public static RunStatusResponse from(WorkflowRun run) {
        return new RunStatusResponse(
            run.runId(),
            run.state(),
            run.sequenceNo(),
            run.createdAt(),
            run.updatedAt(),
            run.lastError(),
            run.failureReason(),
            run.context()
        );
    }
}
