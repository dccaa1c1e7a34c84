package com.delta.gapreview.ranking;

import com.delta.gapreview.config.ReviewProperties;

import java.util.List;
import java.util.Locale;

/**
 * Immutable copy of {@code review.ranking.*} taken when the engine is built.
 */
public record RankingWeights(
    double confidenceZ,
    double priorRatio,
    double priorWeight,
    double qualityWeight,
    double velocityWeight,
    int recencyThresholdDays,
    int recencyHalfLifeDays,
    double recencyFloor,
    long minDurationSeconds,
    long idealDurationSeconds,
    long durationSpanSeconds,
    double durationBase,
    double durationBonus,
    double keywordBonusPerHit,
    double keywordBonusCap,
    double phraseBonusPerHit,
    double phraseBonusCap,
    double topicBonus,
    double comparisonPenalty,
    double minBoost,
    double maxBoost,
    List<String> keywords
) {
    public RankingWeights {
        keywords = keywords == null
            ? List.of()
            : keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }

    public static RankingWeights from(ReviewProperties.Ranking ranking) {
        return new RankingWeights(
            ranking.getConfidenceZ(),
            ranking.getPriorRatio(),
            ranking.getPriorWeight(),
            ranking.getQualityWeight(),
            ranking.getVelocityWeight(),
            ranking.getRecencyThresholdDays(),
            ranking.getRecencyHalfLifeDays(),
            ranking.getRecencyFloor(),
            ranking.getMinDurationSeconds(),
            ranking.getIdealDurationSeconds(),
            ranking.getDurationSpanSeconds(),
            ranking.getDurationBase(),
            ranking.getDurationBonus(),
            ranking.getKeywordBonusPerHit(),
            ranking.getKeywordBonusCap(),
            ranking.getPhraseBonusPerHit(),
            ranking.getPhraseBonusCap(),
            ranking.getTopicBonus(),
            ranking.getComparisonPenalty(),
            ranking.getMinBoost(),
            ranking.getMaxBoost(),
            ranking.getKeywords()
        );
    }

    public static RankingWeights defaults() {
        return from(new ReviewProperties.Ranking());
    }
}
