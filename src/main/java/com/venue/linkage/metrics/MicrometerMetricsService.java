package com.venue.linkage.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code venue.match.duration} - Timer per probe search (tag: outcome=matched|unmatched)</li>
 *   <li>{@code venue.match.matched} - Counter</li>
 *   <li>{@code venue.match.unmatched} - Counter</li>
 *   <li>{@code venue.match.score} - DistributionSummary of best combined scores</li>
 *   <li>{@code venue.match.pool.size} - DistributionSummary of candidates surviving pruning</li>
 *   <li>{@code venue.match.run.size} - DistributionSummary of probes per run</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer matchedTimer;
    private final Timer unmatchedTimer;
    private final Counter matchedCounter;
    private final Counter unmatchedCounter;
    private final DistributionSummary scoreSummary;
    private final DistributionSummary poolSizeSummary;
    private final DistributionSummary runSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.matchedTimer = probeTimer(registry, "matched");
        this.unmatchedTimer = probeTimer(registry, "unmatched");
        this.matchedCounter = Counter.builder("venue.match.matched")
                .description("Probe venues bound to a candidate")
                .register(registry);
        this.unmatchedCounter = Counter.builder("venue.match.unmatched")
                .description("Probe venues left without a candidate")
                .register(registry);
        this.scoreSummary = DistributionSummary.builder("venue.match.score")
                .description("Best combined score per probe venue")
                .register(registry);
        this.poolSizeSummary = DistributionSummary.builder("venue.match.pool.size")
                .description("Candidates surviving spatial pruning per probe venue")
                .register(registry);
        this.runSizeSummary = DistributionSummary.builder("venue.match.run.size")
                .description("Probe venues per matching run")
                .register(registry);
    }

    private static Timer probeTimer(MeterRegistry registry, String outcome) {
        return Timer.builder("venue.match.duration")
                .description("Duration of a single best-match search")
                .tag("outcome", outcome)
                .register(registry);
    }

    @Override
    public void recordProbeDuration(boolean matched, Duration duration) {
        (matched ? matchedTimer : unmatchedTimer).record(duration);
    }

    @Override
    public void incrementMatched() {
        matchedCounter.increment();
    }

    @Override
    public void incrementUnmatched() {
        unmatchedCounter.increment();
    }

    @Override
    public void recordCombinedScore(double score) {
        scoreSummary.record(score);
    }

    @Override
    public void recordCandidatePoolSize(int size) {
        poolSizeSummary.record(size);
    }

    @Override
    public void recordRunSize(int probes) {
        runSizeSummary.record(probes);
    }
}
