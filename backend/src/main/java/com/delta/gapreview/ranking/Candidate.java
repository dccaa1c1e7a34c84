package com.delta.gapreview.ranking;

import java.time.Instant;

/**
 * One rankable item with the raw signals the engine scores. Counts may be null when the source did
 * not report them; they are treated as zero.
 */
public record Candidate(
    String id,
    String title,
    String description,
    String sourceName,
    String sourceId,
    Long positiveCount,
    Long totalCount,
    Long durationSeconds,
    Instant publishedAt,
    String url
) {
    public long positives() {
        return positiveCount == null ? 0L : Math.max(0L, positiveCount);
    }

    public long total() {
        return totalCount == null ? 0L : Math.max(0L, totalCount);
    }
}
