package com.venue.linkage.scoring;

import java.util.Arrays;

/**
 * Breakpoints of a piecewise-constant distance score.
 *
 * <p>A distance at or below {@code breakpoints[i]} (and above the previous breakpoint) scores
 * {@code scores[i]}; beyond the last breakpoint it scores {@code tailScore} up to the matching
 * cutoff, and 0.0 past the cutoff.</p>
 */
public record DistanceBuckets(double[] breakpoints, double[] scores, double tailScore) {

    public DistanceBuckets {
        if (breakpoints == null || scores == null) {
            throw new IllegalArgumentException("breakpoints and scores are required");
        }
        if (breakpoints.length != scores.length) {
            throw new IllegalArgumentException("breakpoints and scores must have the same length");
        }
        breakpoints = breakpoints.clone();
        scores = scores.clone();

        double previousBreakpoint = 0.0;
        double previousScore = 1.0;
        for (int i = 0; i < breakpoints.length; i++) {
            if (!Double.isFinite(breakpoints[i]) || breakpoints[i] <= previousBreakpoint) {
                throw new IllegalArgumentException("breakpoints must be positive and strictly ascending");
            }
            if (!(scores[i] >= 0.0 && scores[i] <= previousScore)) {
                throw new IllegalArgumentException("bucket scores must lie in [0, 1] and be non-increasing");
            }
            previousBreakpoint = breakpoints[i];
            previousScore = scores[i];
        }
        if (!(tailScore >= 0.0 && tailScore <= previousScore)) {
            throw new IllegalArgumentException("tailScore must lie in [0, last bucket score]");
        }
    }

    /**
     * 1.0 within 50 m, 0.7 within 150 m, 0.4 within 300 m, then 0.2 up to the cutoff.
     */
    public static DistanceBuckets defaults() {
        return new DistanceBuckets(new double[]{50.0, 150.0, 300.0}, new double[]{1.0, 0.7, 0.4}, 0.2);
    }

    @Override
    public double[] breakpoints() {
        return breakpoints.clone();
    }

    @Override
    public double[] scores() {
        return scores.clone();
    }

    double scoreWithin(double distanceMeters) {
        for (int i = 0; i < breakpoints.length; i++) {
            if (distanceMeters <= breakpoints[i]) {
                return scores[i];
            }
        }
        return tailScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DistanceBuckets that)) return false;
        return Double.compare(tailScore, that.tailScore) == 0
                && Arrays.equals(breakpoints, that.breakpoints)
                && Arrays.equals(scores, that.scores);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(breakpoints) + Arrays.hashCode(scores)) + Double.hashCode(tailScore);
    }

    @Override
    public String toString() {
        return "DistanceBuckets{breakpoints=" + Arrays.toString(breakpoints)
                + ", scores=" + Arrays.toString(scores)
                + ", tail=" + tailScore + '}';
    }
}
