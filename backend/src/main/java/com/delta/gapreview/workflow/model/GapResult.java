package com.delta.gapreview.workflow.model;

import java.time.Instant;

public record GapResult(
    int rank,
    double score,
    String itemId,
    String title,
    String sourceName,
    String url,
    Long durationSeconds,
    Instant publishedAt,
    String summary,
    String personalizationTip,
    TutorialAnalysis analysis
) {
}
