package com.delta.gapreview.workflow.persistence;

import java.time.Instant;

public record SideEffectRecord(
    String effectKey,
    String runId,
    String stepName,
    String status,
    String resultJson,
    Instant claimedAt,
    Instant completedAt
) {
    public static final String CLAIMED = "CLAIMED";
    public static final String COMPLETED = "COMPLETED";

    public boolean isCompleted() {
        return COMPLETED.equals(status);
    }
}
