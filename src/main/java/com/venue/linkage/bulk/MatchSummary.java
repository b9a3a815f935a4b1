package com.venue.linkage.bulk;

import com.venue.linkage.core.model.MatchResult;

import java.util.List;
import java.util.Locale;

/**
 * Aggregate view of a matching run.
 *
 * @param total          number of probes
 * @param matched        probes with an accepted candidate
 * @param highConfidence matched probes whose combined score reached {@code threshold}
 * @param threshold      the combined score counted as high confidence
 */
public record MatchSummary(
        long total,
        long matched,
        long highConfidence,
        double threshold
) {
    /** Fraction of the score scale that counts as high confidence. */
    public static final double DEFAULT_HIGH_CONFIDENCE_FRACTION = 0.7;

    public MatchSummary {
        if (total < 0 || matched < 0 || highConfidence < 0) {
            throw new IllegalArgumentException("counts must be non-negative");
        }
        if (matched > total || highConfidence > matched) {
            throw new IllegalArgumentException("expected highConfidence <= matched <= total");
        }
    }

    /**
     * Summarizes results using {@link #DEFAULT_HIGH_CONFIDENCE_FRACTION} of the scale.
     *
     * @param scaleTotal the maximum combined score, i.e. the sum of the signal weights
     */
    public static MatchSummary of(List<? extends MatchResult<?, ?>> results, double scaleTotal) {
        return of(results, scaleTotal, DEFAULT_HIGH_CONFIDENCE_FRACTION);
    }

    public static MatchSummary of(List<? extends MatchResult<?, ?>> results, double scaleTotal, double fraction) {
        if (!(scaleTotal > 0.0) || Double.isInfinite(scaleTotal)) {
            throw new IllegalArgumentException("scaleTotal must be positive, got " + scaleTotal);
        }
        if (!(fraction >= 0.0 && fraction <= 1.0)) {
            throw new IllegalArgumentException("fraction must be between 0.0 and 1.0, got " + fraction);
        }
        double threshold = scaleTotal * fraction;
        long matched = 0;
        long high = 0;
        for (MatchResult<?, ?> result : results) {
            if (result.isMatched()) {
                matched++;
                if (result.combinedScore() >= threshold) {
                    high++;
                }
            }
        }
        return new MatchSummary(results.size(), matched, high, threshold);
    }

    public double matchRate() {
        return total == 0 ? 0.0 : (double) matched / total;
    }

    public double highConfidenceRate() {
        return total == 0 ? 0.0 : (double) highConfidence / total;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "MatchSummary{total=%d, matched=%d (%.1f%%), highConfidence=%d (%.1f%%, score>=%.2f)}",
                total, matched, matchRate() * 100, highConfidence, highConfidenceRate() * 100, threshold);
    }
}
