package com.venue.linkage.scoring;

import com.venue.linkage.core.model.NormalizedVenue;
import com.venue.linkage.core.model.ScoreBreakdown;
import com.venue.linkage.geo.Haversine;
import com.venue.linkage.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the three match signals for a probe/candidate pair and fuses them with
 * {@link SignalWeights}: {@code combined = wName*name + wDistance*distance + wPostcode*postcode}.
 */
public class CompositeMatchScorer {
    private static final Logger log = LoggerFactory.getLogger(CompositeMatchScorer.class);

    private final SimilarityAlgorithm nameSimilarity;
    private final DistanceScorer distanceScorer;
    private final SignalWeights weights;

    public CompositeMatchScorer(SimilarityAlgorithm nameSimilarity, DistanceScorer distanceScorer,
                                SignalWeights weights) {
        this.nameSimilarity = nameSimilarity;
        this.distanceScorer = distanceScorer;
        this.weights = weights;
    }

    public ScoreBreakdown score(NormalizedVenue<?> probe, NormalizedVenue<?> candidate) {
        double nameScore = clampUnit(nameSimilarity.compute(probe.nameKey(), candidate.nameKey()));
        Double distanceMeters = Haversine.distanceOrNull(probe.coordinates(), candidate.coordinates());
        double distanceScore = clampUnit(distanceScorer.score(distanceMeters));
        double postcodeScore = PostcodeCorroboration.score(probe, candidate);
        double combined = weights.combine(nameScore, distanceScore, postcodeScore);

        ScoreBreakdown breakdown = new ScoreBreakdown(nameScore, distanceScore, postcodeScore,
                combined, distanceMeters);
        if (log.isTraceEnabled()) {
            log.trace("match.pair probe={} candidate={} {}", probe.id(), candidate.id(), breakdown);
        }
        return breakdown;
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
