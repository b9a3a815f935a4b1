package com.venue.linkage.match;

import com.venue.linkage.core.model.Coordinates;
import com.venue.linkage.core.model.MatchResult;
import com.venue.linkage.core.model.NormalizedVenue;
import com.venue.linkage.core.model.ScoreBreakdown;
import com.venue.linkage.core.model.VenueRecord;
import com.venue.linkage.geo.CandidateIndex;
import com.venue.linkage.geo.SearchWindow;
import com.venue.linkage.logging.LogContext;
import com.venue.linkage.metrics.MetricsService;
import com.venue.linkage.metrics.NoOpMetricsService;
import com.venue.linkage.rules.VenueNormalizer;
import com.venue.linkage.scoring.CompositeMatchScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Best-match search between a probe collection and a candidate collection.
 *
 * <p>For each probe the engine narrows the candidates to a bounding window around the probe's
 * position (or keeps all of them when the probe has no position), scores every survivor,
 * drops any whose exact distance exceeds {@code maxDistanceMeters}, keeps the best according to
 * the {@link TieBreakPolicy}, and accepts it when its combined score reaches
 * {@code minMatchScore}.</p>
 *
 * <p>The engine holds no mutable state and never modifies its inputs; a single instance may
 * serve many threads at once.</p>
 */
public class MatchingEngine {
    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);
    private static final int PROGRESS_INTERVAL = 500;

    private final MatchingOptions options;
    private final CompositeMatchScorer scorer;
    private final VenueNormalizer normalizer;
    private final MetricsService metrics;

    public MatchingEngine(MatchingOptions options) {
        this(options, new VenueNormalizer(), new NoOpMetricsService());
    }

    public MatchingEngine(MatchingOptions options, VenueNormalizer normalizer, MetricsService metrics) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.scorer = options.createScorer();
    }

    public MatchingOptions getOptions() {
        return options;
    }

    public VenueNormalizer getNormalizer() {
        return normalizer;
    }

    public MetricsService getMetrics() {
        return metrics;
    }

    /**
     * Normalizes the candidate collection and builds its read-only spatial index.
     */
    public <C extends VenueRecord> CandidateIndex<C> prepare(List<C> candidates) {
        return new CandidateIndex<>(normalizer.normalizeAll(candidates));
    }

    public <P extends VenueRecord, C extends VenueRecord> List<MatchResult<P, C>> matchAll(
            List<P> probes, List<C> candidates) {
        return matchAll(probes, candidates, ProgressCallback.NOOP);
    }

    /**
     * Matches every probe on the calling thread. Results are in probe order, one per probe.
     *
     * @throws CancellationException if the calling thread is interrupted between probes
     */
    public <P extends VenueRecord, C extends VenueRecord> List<MatchResult<P, C>> matchAll(
            List<P> probes, List<C> candidates, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        String runId = LogContext.generateRunId();

        try (LogContext ctx = LogContext.forMatchRun(runId)) {
            log.info("match.run.started probes={} candidates={} options={}",
                    probes.size(), candidates.size(), options);
            metrics.recordRunSize(probes.size());

            CandidateIndex<C> index = prepare(candidates);
            List<MatchResult<P, C>> results = new ArrayList<>(probes.size());
            long matched = 0;

            for (int i = 0; i < probes.size(); i++) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("match.run.interrupted processed={} total={}", i, probes.size());
                    throw new CancellationException("Match run interrupted after " + i + " probes");
                }

                MatchResult<P, C> result = match(normalizer.normalize(probes.get(i)), index);
                if (result.isMatched()) {
                    matched++;
                }
                results.add(result);

                if ((i + 1) % PROGRESS_INTERVAL == 0) {
                    log.info("match.run.progress processed={} total={} matched={}", i + 1, probes.size(), matched);
                    cb.onProgress(i + 1, probes.size(), "Matched " + (i + 1) + " probes");
                }
            }

            cb.onProgress(probes.size(), probes.size(), "Matching completed");
            log.info("match.run.completed total={} matched={}", probes.size(), matched);
            return Collections.unmodifiableList(results);
        }
    }

    /**
     * Finds the best candidate for one normalized probe.
     */
    public <P extends VenueRecord, C extends VenueRecord> MatchResult<P, C> match(
            NormalizedVenue<P> probe, CandidateIndex<C> index) {
        long start = System.nanoTime();

        List<NormalizedVenue<C>> pool = candidatePool(probe, index);
        metrics.recordCandidatePoolSize(pool.size());

        NormalizedVenue<C> best = null;
        ScoreBreakdown bestBreakdown = null;

        for (NormalizedVenue<C> candidate : pool) {
            ScoreBreakdown breakdown = scorer.score(probe, candidate);

            // Authoritative over the coarse window
            if (breakdown.hasDistance() && breakdown.distanceMeters() > options.getMaxDistanceMeters()) {
                continue;
            }
            if (breakdown.nameScore() < options.getMinNameScore()) {
                continue;
            }

            if (bestBreakdown == null || options.getTieBreakPolicy().prefers(breakdown, bestBreakdown)) {
                best = candidate;
                bestBreakdown = breakdown;
            }
        }

        MatchResult<P, C> result;
        if (best == null) {
            result = MatchResult.noCandidates(probe.source());
        } else if (bestBreakdown.combinedScore() >= options.getMinMatchScore()) {
            result = MatchResult.matched(probe.source(), best.source(), bestBreakdown);
        } else {
            result = MatchResult.unmatched(probe.source(), bestBreakdown);
        }

        if (log.isDebugEnabled()) {
            log.debug("match.probe probeId={} pool={} candidateId={} breakdown={}",
                    probe.id(), pool.size(), result.candidateId(), result.breakdown());
        }
        recordOutcome(result, Duration.ofNanos(System.nanoTime() - start));
        return result;
    }

    /**
     * Candidates worth scoring for the probe: every candidate when the probe has no position,
     * otherwise the positioned candidates inside the search window.
     */
    public <C extends VenueRecord> List<NormalizedVenue<C>> candidatePool(
            NormalizedVenue<?> probe, CandidateIndex<C> index) {
        if (index.isEmpty()) {
            return List.of();
        }
        if (!probe.hasCoordinates()) {
            return index.all();
        }
        return index.within(windowFor(probe.coordinates()));
    }

    SearchWindow windowFor(Coordinates center) {
        SearchWindow window = SearchWindow.around(center, options.getMaxDistanceMeters(), options.getWindowMargin());
        if (options.hasFixedWindow()) {
            window = window.union(new SearchWindow(center,
                    options.getFixedLatitudeWindow(), options.getFixedLongitudeWindow()));
        }
        return window;
    }

    private void recordOutcome(MatchResult<?, ?> result, Duration elapsed) {
        metrics.recordProbeDuration(result.isMatched(), elapsed);
        metrics.recordCombinedScore(result.combinedScore());
        if (result.isMatched()) {
            metrics.incrementMatched();
        } else {
            metrics.incrementUnmatched();
        }
    }
}
