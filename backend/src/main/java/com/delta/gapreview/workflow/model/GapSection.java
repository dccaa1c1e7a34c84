package com.delta.gapreview.workflow.model;

import java.util.List;

public record GapSection(
    String gapId,
    String skill,
    String query,
    BranchStatus status,
    List<GapResult> results,
    String note
) {
    public static final String NO_RESULTS = "no results";
}
