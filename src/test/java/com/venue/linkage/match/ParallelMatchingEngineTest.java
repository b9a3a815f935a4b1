package com.venue.linkage.match;

import com.venue.linkage.core.model.HygieneEstablishment;
import com.venue.linkage.core.model.MatchResult;
import com.venue.linkage.core.model.NormalizedVenue;
import com.venue.linkage.core.model.PlaceListing;
import com.venue.linkage.core.model.VenueRecord;
import com.venue.linkage.geo.CandidateIndex;
import com.venue.linkage.metrics.MicrometerMetricsService;
import com.venue.linkage.rules.VenueNormalizer;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParallelMatchingEngine Tests")
class ParallelMatchingEngineTest {

    private MatchingEngine engine;
    private ParallelMatchingEngine parallel;

    @BeforeEach
    void setUp() {
        engine = new MatchingEngine(MatchingOptions.defaults());
        parallel = new ParallelMatchingEngine(engine, 4, 30_000);
    }

    @AfterEach
    void tearDown() {
        parallel.close();
    }

    @Test
    @DisplayName("Parallel results equal sequential results in probe order")
    void matchesSequential() {
        Random random = new Random(23);
        List<PlaceListing> probes = MatchingEngineTest.randomPlaces(random, 1_000);
        List<HygieneEstablishment> candidates = MatchingEngineTest.randomEstablishments(random, 2_000);

        List<MatchResult<PlaceListing, HygieneEstablishment>> sequential = engine.matchAll(probes, candidates);
        List<MatchResult<PlaceListing, HygieneEstablishment>> concurrent = parallel.matchAll(probes, candidates);

        assertEquals(sequential, concurrent);
        for (int i = 0; i < probes.size(); i++) {
            assertSame(probes.get(i), concurrent.get(i).probe());
        }
    }

    @Test
    @DisplayName("Fewer probes than workers still yields one result per probe")
    void fewProbes() {
        Random random = new Random(29);
        List<PlaceListing> probes = MatchingEngineTest.randomPlaces(random, 3);
        List<HygieneEstablishment> candidates = MatchingEngineTest.randomEstablishments(random, 50);

        assertEquals(engine.matchAll(probes, candidates), parallel.matchAll(probes, candidates));
    }

    @Test
    @DisplayName("No probes gives an empty result")
    void noProbes() {
        List<MatchResult<PlaceListing, HygieneEstablishment>> results =
                parallel.matchAll(List.<PlaceListing>of(), List.<HygieneEstablishment>of());
        assertTrue(results.isEmpty());
    }

    @Test
    @DisplayName("Async run completes with the same results")
    void async() throws Exception {
        Random random = new Random(31);
        List<PlaceListing> probes = MatchingEngineTest.randomPlaces(random, 200);
        List<HygieneEstablishment> candidates = MatchingEngineTest.randomEstablishments(random, 400);

        CompletableFuture<List<MatchResult<PlaceListing, HygieneEstablishment>>> future =
                parallel.matchAllAsync(probes, candidates);

        assertEquals(engine.matchAll(probes, candidates), future.get(30, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("A failing probe fails the whole run")
    void failurePropagates() {
        MatchingOptions options = MatchingOptions.defaults();
        MatchingEngine failing = new MatchingEngine(options) {
            @Override
            public <P extends VenueRecord, C extends VenueRecord> MatchResult<P, C> match(
                    NormalizedVenue<P> probe, CandidateIndex<C> index) {
                throw new IllegalStateException("boom");
            }
        };

        try (ParallelMatchingEngine broken = new ParallelMatchingEngine(failing, 2, 30_000)) {
            List<PlaceListing> probes = MatchingEngineTest.randomPlaces(new Random(1), 10);
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> broken.matchAll(probes, List.<HygieneEstablishment>of()));
            assertTrue(e.getMessage().contains("boom"));

            CompletableFuture<List<MatchResult<PlaceListing, HygieneEstablishment>>> future =
                    broken.matchAllAsync(probes, List.of());
            CompletionException completion = assertThrows(CompletionException.class, future::join);
            assertInstanceOf(IllegalStateException.class, completion.getCause());
        }
    }

    @Test
    @DisplayName("Should record the run size once per parallel run")
    void runSizeMetric() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MatchingEngine metered = new MatchingEngine(MatchingOptions.defaults(), new VenueNormalizer(),
                new MicrometerMetricsService(registry));
        Random random = new Random(11);
        List<PlaceListing> probes = MatchingEngineTest.randomPlaces(random, 120);
        List<HygieneEstablishment> candidates = MatchingEngineTest.randomEstablishments(random, 80);

        try (ParallelMatchingEngine meteredParallel = new ParallelMatchingEngine(metered, 3, 30_000)) {
            meteredParallel.matchAll(probes, candidates);
        }

        DistributionSummary runSize = registry.find("venue.match.run.size").summary();
        assertNotNull(runSize);
        assertEquals(1, runSize.count());
        assertEquals(120.0, runSize.totalAmount(), 0.0);
        assertEquals(120, registry.find("venue.match.pool.size").summary().count());
    }

    @Test
    @DisplayName("Should reject a non-positive worker count")
    void invalidWorkers() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelMatchingEngine(engine, 0, 1_000));
    }
}
