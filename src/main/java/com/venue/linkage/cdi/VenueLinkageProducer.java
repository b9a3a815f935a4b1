package com.venue.linkage.cdi;

import com.venue.linkage.match.MatchingEngine;
import com.venue.linkage.match.MatchingOptions;
import com.venue.linkage.match.ParallelMatchingEngine;
import com.venue.linkage.match.TieBreakPolicy;
import com.venue.linkage.metrics.MetricsService;
import com.venue.linkage.metrics.MicrometerMetricsService;
import com.venue.linkage.metrics.NoOpMetricsService;
import com.venue.linkage.rules.VenueNormalizer;
import com.venue.linkage.scoring.DistanceBuckets;
import com.venue.linkage.scoring.SignalWeights;
import com.venue.linkage.similarity.IndelSimilarity;
import com.venue.linkage.similarity.SequenceMatcherSimilarity;
import com.venue.linkage.similarity.SimilarityAlgorithm;
import com.venue.linkage.similarity.TokenSortRatioSimilarity;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * CDI producer that wires the matching engine from MicroProfile Config properties.
 *
 * <p>A profile selects the starting point ({@code default} or {@code proximity-first});
 * any key set explicitly overrides the profile's value:</p>
 * <pre>
 * venue-linkage:
 *   matching:
 *     profile: default
 *     max-distance-meters: 500
 *     min-match-score: 0.5
 *     weights:
 *       name: 0.7
 *       distance: 0.2
 *       postcode: 0.1
 *     distance-buckets:
 *       breakpoints: 50,150,300
 *       scores: 1.0,0.7,0.4
 *       tail-score: 0.2
 *   parallel:
 *     workers: 8
 * </pre>
 *
 * <p>Invalid values are rejected when the options are produced, before any record is read.
 * When a Micrometer {@link MeterRegistry} bean exists, match metrics are published to it.</p>
 */
@ApplicationScoped
public class VenueLinkageProducer {

    private static final Logger log = LoggerFactory.getLogger(VenueLinkageProducer.class);

    static final String PROFILE_DEFAULT = "default";
    static final String PROFILE_PROXIMITY_FIRST = "proximity-first";

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.profile", defaultValue = PROFILE_DEFAULT)
    String profile;

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.max-distance-meters")
    Optional<Double> maxDistanceMeters;

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.min-match-score")
    Optional<Double> minMatchScore;

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.min-name-score")
    Optional<Double> minNameScore;

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.name-similarity")
    Optional<String> nameSimilarity;

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.tie-break")
    Optional<String> tieBreak;

    // ── Weights ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.weights.name")
    Optional<Double> nameWeight;

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.weights.distance")
    Optional<Double> distanceWeight;

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.weights.postcode")
    Optional<Double> postcodeWeight;

    // ── Distance buckets ──────────────────────────────────────

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.distance-buckets.breakpoints")
    Optional<List<Double>> bucketBreakpoints;

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.distance-buckets.scores")
    Optional<List<Double>> bucketScores;

    @Inject
    @ConfigProperty(name = "venue-linkage.matching.distance-buckets.tail-score")
    Optional<Double> bucketTailScore;

    // ── Parallel execution ────────────────────────────────────

    @Inject
    @ConfigProperty(name = "venue-linkage.parallel.workers")
    Optional<Integer> workers;

    @Inject
    @ConfigProperty(name = "venue-linkage.parallel.timeout-ms")
    Optional<Long> timeoutMs;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MatchingOptions matchingOptions() {
        MatchingOptions.Builder builder = baseBuilder(profile);
        MatchingOptions base = baseBuilder(profile).build();

        maxDistanceMeters.ifPresent(builder::maxDistanceMeters);
        minMatchScore.ifPresent(builder::minMatchScore);
        minNameScore.ifPresent(builder::minNameScore);
        nameSimilarity.ifPresent(name -> builder.nameSimilarity(similarityFor(name)));
        tieBreak.ifPresent(policy -> builder.tieBreakPolicy(tieBreakFor(policy)));

        if (nameWeight.isPresent() || distanceWeight.isPresent() || postcodeWeight.isPresent()) {
            SignalWeights weights = base.getWeights();
            builder.weights(new SignalWeights(
                    nameWeight.orElse(weights.nameWeight()),
                    distanceWeight.orElse(weights.distanceWeight()),
                    postcodeWeight.orElse(weights.postcodeWeight())));
        }

        if (bucketBreakpoints.isPresent() || bucketScores.isPresent() || bucketTailScore.isPresent()) {
            DistanceBuckets buckets = base.getDistanceBuckets();
            builder.distanceBuckets(new DistanceBuckets(
                    bucketBreakpoints.map(VenueLinkageProducer::toArray).orElse(buckets.breakpoints()),
                    bucketScores.map(VenueLinkageProducer::toArray).orElse(buckets.scores()),
                    bucketTailScore.orElse(buckets.tailScore())));
        }

        workers.ifPresent(builder::workerThreads);
        timeoutMs.ifPresent(builder::timeoutMs);

        MatchingOptions options = builder.build();
        log.info("Producing MatchingOptions: profile={} options={}", profile, options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Match metrics published to Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("No MeterRegistry available, match metrics disabled");
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public MatchingEngine matchingEngine(MatchingOptions options, MetricsService metrics) {
        return new MatchingEngine(options, new VenueNormalizer(), metrics);
    }

    @Produces
    @ApplicationScoped
    public ParallelMatchingEngine parallelMatchingEngine(MatchingEngine engine) {
        log.info("Producing ParallelMatchingEngine: workers={} timeoutMs={}",
                engine.getOptions().getWorkerThreads(), engine.getOptions().getTimeoutMs());
        return new ParallelMatchingEngine(engine);
    }

    public void closeParallelEngine(@Disposes ParallelMatchingEngine engine) {
        log.info("Closing ParallelMatchingEngine");
        engine.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    static MatchingOptions.Builder baseBuilder(String profile) {
        String key = profile == null ? PROFILE_DEFAULT : profile.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case PROFILE_DEFAULT:
                return MatchingOptions.builder();
            case PROFILE_PROXIMITY_FIRST:
                return MatchingOptions.proximityFirstBuilder();
            default:
                throw new IllegalArgumentException("Unknown matching profile '" + profile
                        + "', expected " + PROFILE_DEFAULT + " or " + PROFILE_PROXIMITY_FIRST);
        }
    }

    static SimilarityAlgorithm similarityFor(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "token-sort":
            case "tokensortratio":
                return new TokenSortRatioSimilarity();
            case "gestalt":
            case "sequencematcher":
                return new SequenceMatcherSimilarity();
            case "indel":
                return new IndelSimilarity();
            default:
                throw new IllegalArgumentException("Unknown name similarity '" + name
                        + "', expected token-sort, gestalt or indel");
        }
    }

    static TieBreakPolicy tieBreakFor(String name) {
        String key = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return TieBreakPolicy.valueOf(key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tie-break policy '" + name
                    + "', expected first-max or higher-name-score", e);
        }
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }
}
