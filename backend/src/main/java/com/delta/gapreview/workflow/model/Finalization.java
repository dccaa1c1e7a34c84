package com.delta.gapreview.workflow.model;

import java.time.Instant;

public record Finalization(
    long documentRevision,
    int insertionsApplied,
    Double finalScore,
    Instant completedAt
) {
}
