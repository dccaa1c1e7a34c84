package com.delta.gapreview.workflow.model;

import java.time.Instant;

public record CheckpointView(
    String runId,
    long sequenceNo,
    RunState state,
    String stepName,
    String lastError,
    String failureReason,
    Instant createdAt
) {
}
