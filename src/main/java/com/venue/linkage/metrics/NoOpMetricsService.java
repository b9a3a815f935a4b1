package com.venue.linkage.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordProbeDuration(boolean matched, Duration duration) {
    }

    @Override
    public void incrementMatched() {
    }

    @Override
    public void incrementUnmatched() {
    }

    @Override
    public void recordCombinedScore(double score) {
    }

    @Override
    public void recordCandidatePoolSize(int size) {
    }

    @Override
    public void recordRunSize(int probes) {
    }
}
