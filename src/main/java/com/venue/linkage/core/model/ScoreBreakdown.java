package com.venue.linkage.core.model;

import java.util.Locale;

/**
 * The three match signals for one probe/candidate pair and their weighted sum.
 *
 * @param distanceMeters great-circle distance, or null when either side lacks coordinates
 */
public record ScoreBreakdown(
        double nameScore,
        double distanceScore,
        double postcodeScore,
        double combinedScore,
        Double distanceMeters
) {
    private static final ScoreBreakdown EMPTY = new ScoreBreakdown(0.0, 0.0, 0.0, 0.0, null);

    public ScoreBreakdown {
        checkUnit(nameScore, "nameScore");
        checkUnit(distanceScore, "distanceScore");
        checkUnit(postcodeScore, "postcodeScore");
        if (!Double.isFinite(combinedScore) || combinedScore < 0.0) {
            throw new IllegalArgumentException("combinedScore must be finite and non-negative");
        }
    }

    /**
     * Breakdown used when no candidate survived pruning.
     */
    public static ScoreBreakdown empty() {
        return EMPTY;
    }

    public boolean hasDistance() {
        return distanceMeters != null;
    }

    private static void checkUnit(double value, String name) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "ScoreBreakdown{name=%.4f, distance=%.2f, postcode=%.1f, combined=%.4f, meters=%s}",
                nameScore, distanceScore, postcodeScore, combinedScore,
                distanceMeters != null ? String.format(Locale.ROOT, "%.1f", distanceMeters) : "n/a");
    }
}
