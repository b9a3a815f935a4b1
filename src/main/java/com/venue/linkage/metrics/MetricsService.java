package com.venue.linkage.metrics;

import java.time.Duration;

/**
 * Interface for recording matching metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordProbeDuration(boolean matched, Duration duration);

    void incrementMatched();

    void incrementUnmatched();

    void recordCombinedScore(double score);

    void recordCandidatePoolSize(int size);

    void recordRunSize(int probes);
}
