package com.delta.gapreview.ranking;

public record ScoreBreakdown(
    double wilsonLowerBound,
    double shrunkRatio,
    double quality,
    double velocity,
    double keywordBonus,
    double durationMultiplier,
    double recencyMultiplier,
    double topicMultiplier,
    double comparisonMultiplier,
    double preferenceBoost
) {
}
