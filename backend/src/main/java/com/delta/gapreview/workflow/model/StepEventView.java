package com.delta.gapreview.workflow.model;

import java.time.Instant;

public record StepEventView(
    long id,
    String runId,
    String stepName,
    String status,
    String detail,
    Long durationMs,
    Instant recordedAt
) {
}
