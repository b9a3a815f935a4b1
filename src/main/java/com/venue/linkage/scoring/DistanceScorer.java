package com.venue.linkage.scoring;

/**
 * Maps a great-circle distance to a closeness score in [0, 1].
 * Implementations must be non-increasing in distance.
 */
public interface DistanceScorer {

    /**
     * @param distanceMeters exact distance, or null when either position is missing
     * @return closeness score; 0.0 when the distance is unknown
     */
    double score(Double distanceMeters);

    String getName();
}
