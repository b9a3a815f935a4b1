package com.venue.linkage.scoring;

/**
 * Closeness falling linearly from 1.0 at zero distance to 0.0 at the cutoff.
 */
public class LinearDistanceScorer implements DistanceScorer {

    private final double maxDistanceMeters;

    public LinearDistanceScorer(double maxDistanceMeters) {
        if (!Double.isFinite(maxDistanceMeters) || maxDistanceMeters <= 0.0) {
            throw new IllegalArgumentException("maxDistanceMeters must be finite and positive");
        }
        this.maxDistanceMeters = maxDistanceMeters;
    }

    @Override
    public double score(Double distanceMeters) {
        if (distanceMeters == null) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - distanceMeters / maxDistanceMeters);
    }

    @Override
    public String getName() {
        return "Linear";
    }
}
