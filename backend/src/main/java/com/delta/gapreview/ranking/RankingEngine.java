package com.delta.gapreview.ranking;

import com.delta.gapreview.config.ReviewProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores candidates for one topic and returns them best first. The engine holds no mutable state and
 * never reads the wall clock: identical inputs always produce identical output, tie order included.
 */
@Component
public class RankingEngine {
    private static final Pattern COMPARISON = Pattern.compile("\\b(vs|versus|compare|comparison)\\b");
    private static final double MIN_PRIOR = 0.001;
    private static final long UNKNOWN_AGE_DAYS = 365;

    private static final Comparator<RankedCandidate> ORDER = Comparator
        .comparingDouble(RankedCandidate::score).reversed()
        .thenComparing(r -> r.candidate().id());

    private final RankingWeights weights;

    @Autowired
    public RankingEngine(ReviewProperties properties) {
        this(RankingWeights.from(properties.getRanking()));
    }

    public RankingEngine(RankingWeights weights) {
        this.weights = weights;
    }

    public List<RankedCandidate> rank(List<Candidate> candidates, RankingPreferences preferences) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<Candidate> eligible = candidates.stream()
            .filter(c -> c != null && c.id() != null && !c.id().isBlank())
            .filter(this::passesHardFilter)
            .toList();
        if (eligible.isEmpty()) {
            return List.of();
        }
        double prior = Math.max(MIN_PRIOR, weights.priorRatio());

        List<RankedCandidate> scored = new ArrayList<>(eligible.size());
        for (Candidate candidate : eligible) {
            ScoreBreakdown breakdown = breakdown(candidate, preferences, prior);
            scored.add(new RankedCandidate(candidate, composite(breakdown), 0, breakdown));
        }
        scored.sort(ORDER);

        List<RankedCandidate> ranked = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (RankedCandidate entry : scored) {
            if (!seen.add(entry.candidate().id())) {
                continue;
            }
            if (preferences.limit() > 0 && ranked.size() >= preferences.limit()) {
                break;
            }
            ranked.add(new RankedCandidate(entry.candidate(), entry.score(), ranked.size() + 1, entry.breakdown()));
        }
        return List.copyOf(ranked);
    }

    public double clampBoost(double raw) {
        if (Double.isNaN(raw)) {
            return 1.0;
        }
        return Math.max(weights.minBoost(), Math.min(weights.maxBoost(), raw));
    }

    boolean passesHardFilter(Candidate candidate) {
        if (weights.minDurationSeconds() <= 0) {
            return true;
        }
        Long duration = candidate.durationSeconds();
        return duration != null && duration >= weights.minDurationSeconds();
    }

    private ScoreBreakdown breakdown(Candidate candidate, RankingPreferences preferences, double prior) {
        long positives = candidate.positives();
        long total = candidate.total();
        double wilson = WilsonScore.lowerBound(positives, total, weights.confidenceZ());
        double shrunk = WilsonScore.shrink(positives, total, prior, weights.priorWeight());
        double quality = weights.qualityWeight() * ((wilson + shrunk) / 2.0) / prior;

        long ageDays = ageDays(candidate.publishedAt(), preferences.referenceTime());
        double velocity = weights.velocityWeight() * Math.log10(1.0 + (double) total / Math.max(1L, ageDays));

        String text = searchableText(candidate);
        double keywordBonus = keywordBonus(text);
        double duration = durationMultiplier(candidate.durationSeconds());
        double recency = candidate.publishedAt() == null ? 1.0 : recencyMultiplier(ageDays);
        double topic = topicMultiplier(text, preferences.topic());
        double comparison = COMPARISON.matcher(text).find() ? 1.0 - weights.comparisonPenalty() : 1.0;
        double boost = clampBoost(preferences.rawBoostFor(candidate.sourceName()));

        return new ScoreBreakdown(
            wilson, shrunk, quality, velocity, keywordBonus, duration, recency, topic, comparison, boost);
    }

    private double composite(ScoreBreakdown b) {
        double base = b.quality() + b.velocity() + b.keywordBonus();
        return base * b.durationMultiplier() * b.recencyMultiplier() * b.topicMultiplier()
            * b.comparisonMultiplier() * b.preferenceBoost();
    }

    /**
     * Peaks at the ideal length and falls off linearly to the base multiplier one span away.
     */
    double durationMultiplier(Long durationSeconds) {
        if (durationSeconds == null) {
            return 1.0;
        }
        long deviation = Math.abs(durationSeconds - weights.idealDurationSeconds());
        double closeness = Math.max(0.0, 1.0 - (double) deviation / weights.durationSpanSeconds());
        return weights.durationBase() + weights.durationBonus() * closeness;
    }

    double recencyMultiplier(long ageDays) {
        long over = ageDays - weights.recencyThresholdDays();
        if (over <= 0) {
            return 1.0;
        }
        double decay = Math.exp(-Math.log(2) * over / weights.recencyHalfLifeDays());
        return Math.max(weights.recencyFloor(), decay);
    }

    private double keywordBonus(String text) {
        int wordHits = 0;
        int phraseHits = 0;
        for (String keyword : weights.keywords()) {
            boolean phrase = keyword.contains(" ");
            boolean hit = phrase
                ? text.contains(keyword)
                : Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(text).find();
            if (!hit) {
                continue;
            }
            if (phrase) {
                phraseHits++;
            } else {
                wordHits++;
            }
        }
        double words = Math.min(weights.keywordBonusCap(), wordHits * weights.keywordBonusPerHit());
        double phrases = Math.min(weights.phraseBonusCap(), phraseHits * weights.phraseBonusPerHit());
        return words + phrases;
    }

    private double topicMultiplier(String text, String topic) {
        if (topic == null || topic.isBlank()) {
            return 1.0;
        }
        return text.contains(topic.trim().toLowerCase(Locale.ROOT)) ? 1.0 + weights.topicBonus() : 1.0;
    }

    private static long ageDays(Instant publishedAt, Instant reference) {
        if (publishedAt == null) {
            return UNKNOWN_AGE_DAYS;
        }
        long days = Duration.between(publishedAt, reference).toDays();
        return Math.max(0L, days);
    }

    private static String searchableText(Candidate candidate) {
        String title = candidate.title() == null ? "" : candidate.title();
        String description = candidate.description() == null ? "" : candidate.description();
        return (title + " " + description).toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
