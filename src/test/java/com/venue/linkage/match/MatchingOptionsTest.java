package com.venue.linkage.match;

import com.venue.linkage.scoring.BucketedDistanceScorer;
import com.venue.linkage.scoring.LinearDistanceScorer;
import com.venue.linkage.scoring.SignalWeights;
import com.venue.linkage.similarity.SequenceMatcherSimilarity;
import com.venue.linkage.similarity.TokenSortRatioSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchingOptionsTest {

    @Test
    @DisplayName("Default options should use the unit scale")
    void testDefaults() {
        MatchingOptions options = MatchingOptions.defaults();

        assertEquals(500.0, options.getMaxDistanceMeters());
        assertEquals(0.5, options.getMinMatchScore());
        assertEquals(0.0, options.getMinNameScore());
        assertEquals(SignalWeights.defaultWeights(), options.getWeights());
        assertEquals(MatchingOptions.DistanceScoring.BUCKETED, options.getDistanceScoring());
        assertInstanceOf(TokenSortRatioSimilarity.class, options.getNameSimilarity());
        assertInstanceOf(BucketedDistanceScorer.class, options.createDistanceScorer());
        assertEquals(TieBreakPolicy.FIRST_MAX, options.getTieBreakPolicy());
        assertFalse(options.hasFixedWindow());
        assertTrue(options.getWorkerThreads() > 0);
    }

    @Test
    @DisplayName("Proximity-first options should use the additive scale")
    void testProximityFirst() {
        MatchingOptions options = MatchingOptions.proximityFirst();

        assertEquals(120.0, options.getMaxDistanceMeters());
        assertEquals(0.70, options.getMinMatchScore());
        assertEquals(0.70, options.getMinNameScore());
        assertEquals(2.0, options.getWeights().total());
        assertInstanceOf(SequenceMatcherSimilarity.class, options.getNameSimilarity());
        assertInstanceOf(LinearDistanceScorer.class, options.createDistanceScorer());
    }

    @Test
    @DisplayName("Should build with custom values")
    void testCustomValues() {
        MatchingOptions options = MatchingOptions.builder()
                .maxDistanceMeters(250.0)
                .minMatchScore(1.4)
                .weights(SignalWeights.nameAndProximity())
                .tieBreakPolicy(TieBreakPolicy.HIGHER_NAME_SCORE)
                .fixedWindow(0.0015, 0.0025)
                .workerThreads(3)
                .timeoutMs(1_000)
                .build();

        assertEquals(250.0, options.getMaxDistanceMeters());
        assertEquals(1.4, options.getMinMatchScore());
        assertEquals(TieBreakPolicy.HIGHER_NAME_SCORE, options.getTieBreakPolicy());
        assertTrue(options.hasFixedWindow());
        assertEquals(0.0025, options.getFixedLongitudeWindow());
        assertEquals(3, options.getWorkerThreads());
        assertEquals(1_000, options.getTimeoutMs());
    }

    @Test
    @DisplayName("A floor equal to the full scale is allowed")
    void testFloorAtScale() {
        assertDoesNotThrow(() -> MatchingOptions.builder().minMatchScore(1.0).build());
    }

    @Test
    @DisplayName("Should reject a floor above the combined-score scale")
    void testFloorAboveScale() {
        MatchingOptions.Builder builder = MatchingOptions.builder().minMatchScore(1.4);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(e.getMessage().contains("minMatchScore"));
    }

    @Test
    @DisplayName("Should reject invalid values before any record is processed")
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().maxDistanceMeters(0));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().maxDistanceMeters(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().minMatchScore(-0.1));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().minMatchScore(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().minNameScore(1.1));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().windowMargin(0.9));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().fixedWindow(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().workerThreads(0));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().timeoutMs(0));
        assertThrows(NullPointerException.class, () -> MatchingOptions.builder().weights(null));
    }
}
