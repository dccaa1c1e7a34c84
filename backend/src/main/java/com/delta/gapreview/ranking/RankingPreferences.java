package com.delta.gapreview.ranking;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Caller-supplied ranking inputs. {@code referenceTime} anchors recency and velocity so repeated
 * ranking of the same candidates yields the same scores.
 */
public record RankingPreferences(
    Map<String, Double> sourceBoosts,
    String topic,
    Instant referenceTime,
    int limit
) {
    public RankingPreferences {
        Map<String, Double> normalized = new TreeMap<>();
        if (sourceBoosts != null) {
            sourceBoosts.forEach((name, boost) -> {
                if (name != null && boost != null) {
                    normalized.put(name.trim().toLowerCase(Locale.ROOT), boost);
                }
            });
        }
        sourceBoosts = Map.copyOf(normalized);
        if (referenceTime == null) {
            throw new IllegalArgumentException("referenceTime is required");
        }
    }

    public double rawBoostFor(String sourceName) {
        if (sourceName == null) {
            return 1.0;
        }
        Double boost = sourceBoosts.get(sourceName.trim().toLowerCase(Locale.ROOT));
        return boost == null ? 1.0 : boost;
    }
}
