package com.delta.gapreview.ranking;

public final class WilsonScore {
    private WilsonScore() {
    }

    /**
     * Lower bound of the Wilson score interval for {@code positives} out of {@code total}.
     */
    public static double lowerBound(long positives, long total, double z) {
        if (total <= 0) {
            return 0.0;
        }
        long pos = Math.min(Math.max(0L, positives), total);
        double n = total;
        double phat = pos / n;
        double z2 = z * z;
        double numerator = phat + z2 / (2 * n) - z * Math.sqrt((phat * (1 - phat) + z2 / (4 * n)) / n);
        return Math.max(0.0, numerator / (1 + z2 / n));
    }

    /**
     * Blend of the observed ratio with a prior, weighted as {@code priorWeight} pseudo-observations.
     */
    public static double shrink(long positives, long total, double prior, double priorWeight) {
        double denominator = Math.max(0L, total) + priorWeight;
        if (denominator <= 0) {
            return prior;
        }
        long pos = Math.min(Math.max(0L, positives), Math.max(0L, total));
        return (pos + prior * priorWeight) / denominator;
    }
}
