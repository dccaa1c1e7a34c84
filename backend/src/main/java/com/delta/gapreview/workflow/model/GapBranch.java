package com.delta.gapreview.workflow.model;

import java.time.Instant;
import java.util.List;

/**
 * State of one fan-out unit. Results are set only when {@code DONE}; error only when {@code FAILED}.
 */
public record GapBranch(
    String runId,
    String gapId,
    BranchStatus status,
    List<GapResult> results,
    String error,
    String errorCode,
    Instant startedAt,
    Instant finishedAt
) {
    public GapBranch {
        results = results == null ? null : List.copyOf(results);
    }

    public static GapBranch pending(String runId, String gapId) {
        return new GapBranch(runId, gapId, BranchStatus.PENDING, null, null, null, null, null);
    }

    public GapBranch running(Instant at) {
        return new GapBranch(runId, gapId, BranchStatus.RUNNING, null, null, null, at, null);
    }

    public GapBranch done(List<GapResult> ranked, Instant at) {
        return new GapBranch(runId, gapId, BranchStatus.DONE, ranked, null, null, startedAt, at);
    }

    public GapBranch failed(String code, String message, Instant at) {
        return new GapBranch(runId, gapId, BranchStatus.FAILED, null, message, code, startedAt, at);
    }
}
