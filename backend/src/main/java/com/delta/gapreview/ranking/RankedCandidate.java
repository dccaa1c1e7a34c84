package com.delta.gapreview.ranking;

public record RankedCandidate(
    Candidate candidate,
    double score,
    int rank,
    ScoreBreakdown breakdown
) {
}
