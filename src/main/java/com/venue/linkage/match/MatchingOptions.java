package com.venue.linkage.match;

import com.venue.linkage.scoring.BucketedDistanceScorer;
import com.venue.linkage.scoring.CompositeMatchScorer;
import com.venue.linkage.scoring.DistanceBuckets;
import com.venue.linkage.scoring.DistanceScorer;
import com.venue.linkage.scoring.LinearDistanceScorer;
import com.venue.linkage.scoring.SignalWeights;
import com.venue.linkage.similarity.SequenceMatcherSimilarity;
import com.venue.linkage.similarity.SimilarityAlgorithm;
import com.venue.linkage.similarity.TokenSortRatioSimilarity;

import java.util.Objects;

/**
 * Configuration for a matching run: hard thresholds, signal weights, distance scoring
 * and execution settings.
 *
 * <p>The acceptance floor {@code minMatchScore} is expressed on the scale of the combined
 * score, which runs from 0 to {@link SignalWeights#total()}. Every value is validated when the
 * options are built, so a bad configuration fails before any record is processed.</p>
 */
public class MatchingOptions {

    private static final double DEFAULT_MAX_DISTANCE_METERS = 500.0;
    private static final double DEFAULT_MIN_MATCH_SCORE = 0.5;
    private static final long DEFAULT_TIMEOUT_MS = 600_000;
    private static final double SCALE_TOLERANCE = 1e-9;

    /**
     * How a great-circle distance is turned into a closeness score.
     */
    public enum DistanceScoring {
        BUCKETED,
        LINEAR
    }

    private final double maxDistanceMeters;
    private final double minMatchScore;
    private final double minNameScore;
    private final SignalWeights weights;
    private final DistanceScoring distanceScoring;
    private final DistanceBuckets distanceBuckets;
    private final SimilarityAlgorithm nameSimilarity;
    private final TieBreakPolicy tieBreakPolicy;
    private final double windowMargin;
    private final double fixedLatitudeWindow;
    private final double fixedLongitudeWindow;
    private final int workerThreads;
    private final long timeoutMs;

    private MatchingOptions(Builder builder) {
        this.maxDistanceMeters = builder.maxDistanceMeters;
        this.minMatchScore = builder.minMatchScore;
        this.minNameScore = builder.minNameScore;
        this.weights = builder.weights;
        this.distanceScoring = builder.distanceScoring;
        this.distanceBuckets = builder.distanceBuckets;
        this.nameSimilarity = builder.nameSimilarity;
        this.tieBreakPolicy = builder.tieBreakPolicy;
        this.windowMargin = builder.windowMargin;
        this.fixedLatitudeWindow = builder.fixedLatitudeWindow;
        this.fixedLongitudeWindow = builder.fixedLongitudeWindow;
        this.workerThreads = builder.workerThreads;
        this.timeoutMs = builder.timeoutMs;
    }

    public double getMaxDistanceMeters() {
        return maxDistanceMeters;
    }

    public double getMinMatchScore() {
        return minMatchScore;
    }

    public double getMinNameScore() {
        return minNameScore;
    }

    public SignalWeights getWeights() {
        return weights;
    }

    public DistanceScoring getDistanceScoring() {
        return distanceScoring;
    }

    public DistanceBuckets getDistanceBuckets() {
        return distanceBuckets;
    }

    public SimilarityAlgorithm getNameSimilarity() {
        return nameSimilarity;
    }

    public TieBreakPolicy getTieBreakPolicy() {
        return tieBreakPolicy;
    }

    public double getWindowMargin() {
        return windowMargin;
    }

    public double getFixedLatitudeWindow() {
        return fixedLatitudeWindow;
    }

    public double getFixedLongitudeWindow() {
        return fixedLongitudeWindow;
    }

    public boolean hasFixedWindow() {
        return fixedLatitudeWindow > 0.0 || fixedLongitudeWindow > 0.0;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public DistanceScorer createDistanceScorer() {
        return switch (distanceScoring) {
            case BUCKETED -> new BucketedDistanceScorer(distanceBuckets, maxDistanceMeters);
            case LINEAR -> new LinearDistanceScorer(maxDistanceMeters);
        };
    }

    public CompositeMatchScorer createScorer() {
        return new CompositeMatchScorer(nameSimilarity, createDistanceScorer(), weights);
    }

    /**
     * Unit scale: weights 0.7/0.2/0.1, floor 0.5, 500 m cutoff, bucketed distance,
     * token-sort name similarity.
     */
    public static MatchingOptions defaults() {
        return builder().build();
    }

    /**
     * Additive two-signal scale (total 2.0): gestalt name similarity plus linear closeness
     * within 120 m. Candidates need a name similarity of at least 0.70; the floor is the
     * same 0.70 on the combined scale.
     */
    public static MatchingOptions proximityFirst() {
        return proximityFirstBuilder().build();
    }

    /**
     * A builder preloaded with the {@link #proximityFirst()} settings, for callers that adjust
     * individual values.
     */
    public static Builder proximityFirstBuilder() {
        return builder()
                .weights(SignalWeights.nameAndProximity())
                .distanceScoring(DistanceScoring.LINEAR)
                .maxDistanceMeters(120.0)
                .minNameScore(0.70)
                .minMatchScore(0.70)
                .nameSimilarity(new SequenceMatcherSimilarity());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double maxDistanceMeters = DEFAULT_MAX_DISTANCE_METERS;
        private double minMatchScore = DEFAULT_MIN_MATCH_SCORE;
        private double minNameScore = 0.0;
        private SignalWeights weights = SignalWeights.defaultWeights();
        private DistanceScoring distanceScoring = DistanceScoring.BUCKETED;
        private DistanceBuckets distanceBuckets = DistanceBuckets.defaults();
        private SimilarityAlgorithm nameSimilarity = new TokenSortRatioSimilarity();
        private TieBreakPolicy tieBreakPolicy = TieBreakPolicy.FIRST_MAX;
        private double windowMargin = 1.05;
        private double fixedLatitudeWindow = 0.0;
        private double fixedLongitudeWindow = 0.0;
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private long timeoutMs = DEFAULT_TIMEOUT_MS;

        public Builder maxDistanceMeters(double maxDistanceMeters) {
            if (!Double.isFinite(maxDistanceMeters) || maxDistanceMeters <= 0.0) {
                throw new IllegalArgumentException("maxDistanceMeters must be finite and positive");
            }
            this.maxDistanceMeters = maxDistanceMeters;
            return this;
        }

        public Builder minMatchScore(double minMatchScore) {
            if (!Double.isFinite(minMatchScore) || minMatchScore < 0.0) {
                throw new IllegalArgumentException("minMatchScore must be finite and non-negative");
            }
            this.minMatchScore = minMatchScore;
            return this;
        }

        public Builder minNameScore(double minNameScore) {
            if (!(minNameScore >= 0.0 && minNameScore <= 1.0)) {
                throw new IllegalArgumentException("minNameScore must be between 0.0 and 1.0");
            }
            this.minNameScore = minNameScore;
            return this;
        }

        public Builder weights(SignalWeights weights) {
            this.weights = Objects.requireNonNull(weights, "weights is required");
            return this;
        }

        public Builder distanceScoring(DistanceScoring distanceScoring) {
            this.distanceScoring = Objects.requireNonNull(distanceScoring, "distanceScoring is required");
            return this;
        }

        public Builder distanceBuckets(DistanceBuckets distanceBuckets) {
            this.distanceBuckets = Objects.requireNonNull(distanceBuckets, "distanceBuckets is required");
            return this;
        }

        public Builder nameSimilarity(SimilarityAlgorithm nameSimilarity) {
            this.nameSimilarity = Objects.requireNonNull(nameSimilarity, "nameSimilarity is required");
            return this;
        }

        public Builder tieBreakPolicy(TieBreakPolicy tieBreakPolicy) {
            this.tieBreakPolicy = Objects.requireNonNull(tieBreakPolicy, "tieBreakPolicy is required");
            return this;
        }

        public Builder windowMargin(double windowMargin) {
            if (!Double.isFinite(windowMargin) || windowMargin < 1.0) {
                throw new IllegalArgumentException("windowMargin must be >= 1.0");
            }
            this.windowMargin = windowMargin;
            return this;
        }

        /**
         * Sets a fixed search window in degrees. The window actually used is never smaller than
         * the one derived from {@code maxDistanceMeters}, so a fixed window can widen but never
         * narrow the pruning.
         */
        public Builder fixedWindow(double latitudeDegrees, double longitudeDegrees) {
            if (!Double.isFinite(latitudeDegrees) || latitudeDegrees < 0.0
                    || !Double.isFinite(longitudeDegrees) || longitudeDegrees < 0.0) {
                throw new IllegalArgumentException("fixed window must be finite and non-negative");
            }
            this.fixedLatitudeWindow = latitudeDegrees;
            this.fixedLongitudeWindow = longitudeDegrees;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be positive");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("timeoutMs must be positive");
            }
            this.timeoutMs = timeoutMs;
            return this;
        }

        public MatchingOptions build() {
            // Tolerates rounding in the weight sum, e.g. 0.7 + 0.2 + 0.1
            if (minMatchScore > weights.total() + SCALE_TOLERANCE) {
                throw new IllegalArgumentException("minMatchScore " + minMatchScore
                        + " exceeds the combined-score scale " + weights.total());
            }
            return new MatchingOptions(this);
        }
    }

    @Override
    public String toString() {
        return "MatchingOptions{" +
                "maxDistanceMeters=" + maxDistanceMeters +
                ", minMatchScore=" + minMatchScore +
                ", minNameScore=" + minNameScore +
                ", weights=" + weights +
                ", distanceScoring=" + distanceScoring +
                ", nameSimilarity=" + nameSimilarity.getName() +
                ", tieBreakPolicy=" + tieBreakPolicy +
                ", workerThreads=" + workerThreads +
                ", timeoutMs=" + timeoutMs +
                '}';
    }
}
