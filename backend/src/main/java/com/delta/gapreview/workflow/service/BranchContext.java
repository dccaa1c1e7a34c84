package com.delta.gapreview.workflow.service;

import java.time.Instant;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * What one branch needs from its run. {@code referenceTime} is the run's creation time, so ranking
 * does not drift between a run and its replay.
 */
public record BranchContext(
    String runId,
    Instant referenceTime,
    Map<String, Double> sourceBoosts,
    BooleanSupplier cancelled
) {
}
