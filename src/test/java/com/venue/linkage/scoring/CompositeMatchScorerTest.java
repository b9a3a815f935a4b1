package com.venue.linkage.scoring;

import com.venue.linkage.core.model.HygieneEstablishment;
import com.venue.linkage.core.model.NormalizedVenue;
import com.venue.linkage.core.model.PlaceListing;
import com.venue.linkage.core.model.ScoreBreakdown;
import com.venue.linkage.rules.VenueNormalizer;
import com.venue.linkage.similarity.SimilarityAlgorithm;
import com.venue.linkage.similarity.TokenSortRatioSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Match scoring Tests")
class CompositeMatchScorerTest {

    private final VenueNormalizer normalizer = new VenueNormalizer();

    private final PlaceListing crownPlace = PlaceListing.builder()
            .id("p1")
            .name("The Crown & Anchor LTD")
            .address("1 SW1A 1AA")
            .coordinates(51.5007, -0.1246)
            .build();

    private final HygieneEstablishment crownEstablishment = HygieneEstablishment.builder()
            .id("F1")
            .name("THE CROWN AND ANCHOR")
            .postcode("SW1A1AA")
            .coordinates(51.5008, -0.1247)
            .build();

    @Nested
    @DisplayName("SignalWeights")
    class WeightTests {

        @Test
        @DisplayName("Default weights form a unit scale")
        void defaultWeights() {
            SignalWeights weights = SignalWeights.defaultWeights();
            assertEquals(1.0, weights.total(), 1e-12);
            assertEquals(0.7 * 0.5 + 0.2 * 0.4, weights.combine(0.5, 0.4, 0.0), 1e-12);
        }

        @Test
        @DisplayName("Name-and-proximity weights form an additive 2.0 scale")
        void additiveWeights() {
            SignalWeights weights = SignalWeights.nameAndProximity();
            assertEquals(2.0, weights.total(), 0.0);
            assertEquals(1.5, weights.combine(0.8, 0.7, 1.0), 1e-12);
        }

        @Test
        @DisplayName("Should reject negative, non-finite or all-zero weights")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new SignalWeights(-0.1, 0.5, 0.5));
            assertThrows(IllegalArgumentException.class, () -> new SignalWeights(Double.NaN, 0.5, 0.5));
            assertThrows(IllegalArgumentException.class, () -> new SignalWeights(0.5, Double.POSITIVE_INFINITY, 0.5));
            assertThrows(IllegalArgumentException.class, () -> new SignalWeights(0.0, 0.0, 0.0));
        }
    }

    @Nested
    @DisplayName("PostcodeCorroboration")
    class PostcodeTests {

        @Test
        @DisplayName("Postcode inside the other side's address corroborates in either direction")
        void substringMatch() {
            NormalizedVenue<PlaceListing> place = normalizer.normalize(crownPlace);
            NormalizedVenue<HygieneEstablishment> establishment = normalizer.normalize(crownEstablishment);

            assertEquals(1.0, PostcodeCorroboration.score(place, establishment), 0.0);
            assertEquals(1.0, PostcodeCorroboration.score(establishment, place), 0.0);
        }

        @Test
        @DisplayName("A different postcode does not corroborate")
        void mismatch() {
            HygieneEstablishment other = HygieneEstablishment.builder().id("F2").postcode("N1 1AA").build();
            assertEquals(0.0, PostcodeCorroboration.score(
                    normalizer.normalize(crownPlace), normalizer.normalize(other)), 0.0);
        }

        @Test
        @DisplayName("An address containing the postcode does not count the other way round")
        void directionMatters() {
            PlaceListing shortAddress = PlaceListing.builder().id("p2").address("SW1A").build();
            HygieneEstablishment establishment = HygieneEstablishment.builder().id("F3").postcode("SW1A 1AA").build();

            assertEquals(0.0, PostcodeCorroboration.score(
                    normalizer.normalize(shortAddress), normalizer.normalize(establishment)), 0.0);
        }

        @Test
        @DisplayName("Empty locator on either side scores zero")
        void emptyLocator() {
            HygieneEstablishment noPostcode = HygieneEstablishment.builder().id("F4").build();
            PlaceListing noAddress = PlaceListing.builder().id("p3").build();

            assertEquals(0.0, PostcodeCorroboration.score(
                    normalizer.normalize(crownPlace), normalizer.normalize(noPostcode)), 0.0);
            assertEquals(0.0, PostcodeCorroboration.score(
                    normalizer.normalize(noAddress), normalizer.normalize(crownEstablishment)), 0.0);
        }

        @Test
        @DisplayName("Two records of the same kind corroborate on containment")
        void sameKind() {
            HygieneEstablishment a = HygieneEstablishment.builder().id("A").postcode("SW1A 1AA").build();
            HygieneEstablishment b = HygieneEstablishment.builder().id("B").postcode("sw1a1aa").build();

            assertEquals(1.0, PostcodeCorroboration.score(normalizer.normalize(a), normalizer.normalize(b)), 0.0);
        }
    }

    @Nested
    @DisplayName("CompositeMatchScorer")
    class ScorerTests {

        private final CompositeMatchScorer scorer = new CompositeMatchScorer(new TokenSortRatioSimilarity(),
                new BucketedDistanceScorer(DistanceBuckets.defaults(), 500.0), SignalWeights.defaultWeights());

        @Test
        @DisplayName("Identical name, nearby and same postcode scores the full scale")
        void perfectPair() {
            ScoreBreakdown breakdown = scorer.score(
                    normalizer.normalize(crownPlace), normalizer.normalize(crownEstablishment));

            assertEquals(1.0, breakdown.nameScore(), 0.0);
            assertEquals(1.0, breakdown.distanceScore(), 0.0);
            assertEquals(1.0, breakdown.postcodeScore(), 0.0);
            assertEquals(1.0, breakdown.combinedScore(), 1e-9);
            assertTrue(breakdown.distanceMeters() > 12.0 && breakdown.distanceMeters() < 14.0);
        }

        @Test
        @DisplayName("Missing coordinates force a zero distance score and no distance")
        void missingCoordinates() {
            PlaceListing noPosition = PlaceListing.builder()
                    .id("p9")
                    .name("The Crown & Anchor")
                    .address("1 SW1A 1AA")
                    .build();

            ScoreBreakdown breakdown = scorer.score(
                    normalizer.normalize(noPosition), normalizer.normalize(crownEstablishment));

            assertNull(breakdown.distanceMeters());
            assertFalse(breakdown.hasDistance());
            assertEquals(0.0, breakdown.distanceScore(), 0.0);
            assertEquals(0.8, breakdown.combinedScore(), 1e-9);
        }

        @Test
        @DisplayName("Out-of-range similarity values are clamped")
        void clampsSimilarity() {
            SimilarityAlgorithm broken = mock(SimilarityAlgorithm.class);
            when(broken.compute(anyString(), anyString())).thenReturn(1.5);
            CompositeMatchScorer clamping = new CompositeMatchScorer(broken,
                    new LinearDistanceScorer(120.0), SignalWeights.nameAndProximity());

            ScoreBreakdown breakdown = clamping.score(
                    normalizer.normalize(crownPlace), normalizer.normalize(crownEstablishment));

            assertEquals(1.0, breakdown.nameScore(), 0.0);
            assertTrue(breakdown.combinedScore() <= 2.0);
        }
    }
}
