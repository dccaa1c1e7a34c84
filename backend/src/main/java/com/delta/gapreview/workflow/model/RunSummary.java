package com.delta.gapreview.workflow.model;

import java.time.Instant;

public record RunSummary(
    String runId,
    RunState state,
    long sequenceNo,
    Instant createdAt,
    Instant updatedAt,
    String failureReason
) {
}
