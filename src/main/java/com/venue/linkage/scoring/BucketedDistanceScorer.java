package com.venue.linkage.scoring;

/**
 * Piecewise-constant closeness score over {@link DistanceBuckets}, zero past the cutoff.
 */
public class BucketedDistanceScorer implements DistanceScorer {

    private final DistanceBuckets buckets;
    private final double maxDistanceMeters;

    public BucketedDistanceScorer(DistanceBuckets buckets, double maxDistanceMeters) {
        if (!Double.isFinite(maxDistanceMeters) || maxDistanceMeters <= 0.0) {
            throw new IllegalArgumentException("maxDistanceMeters must be finite and positive");
        }
        this.buckets = buckets;
        this.maxDistanceMeters = maxDistanceMeters;
    }

    @Override
    public double score(Double distanceMeters) {
        if (distanceMeters == null || distanceMeters > maxDistanceMeters) {
            return 0.0;
        }
        return buckets.scoreWithin(distanceMeters);
    }

    @Override
    public String getName() {
        return "Bucketed";
    }
}
