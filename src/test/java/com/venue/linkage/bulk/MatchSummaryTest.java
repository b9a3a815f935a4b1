package com.venue.linkage.bulk;

import com.venue.linkage.core.model.HygieneEstablishment;
import com.venue.linkage.core.model.MatchResult;
import com.venue.linkage.core.model.PlaceListing;
import com.venue.linkage.core.model.ScoreBreakdown;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatchSummaryTest {

    private static final HygieneEstablishment CANDIDATE = HygieneEstablishment.builder().id("F1").build();

    @Test
    @DisplayName("Should count matches and high-confidence matches on the unit scale")
    void testUnitScale() {
        List<MatchResult<PlaceListing, HygieneEstablishment>> results = List.of(
                matched("p1", 0.95),
                matched("p2", 0.7),
                matched("p3", 0.55),
                MatchResult.unmatched(place("p4"), new ScoreBreakdown(0.1, 0.0, 0.0, 0.07, null)));

        MatchSummary summary = MatchSummary.of(results, 1.0);

        assertEquals(4, summary.total());
        assertEquals(3, summary.matched());
        assertEquals(2, summary.highConfidence());
        assertEquals(0.75, summary.matchRate(), 1e-12);
        assertEquals(0.7, summary.threshold(), 1e-12);
    }

    @Test
    @DisplayName("On the additive 2.0 scale the high-confidence line is 1.4")
    void testAdditiveScale() {
        List<MatchResult<PlaceListing, HygieneEstablishment>> results = List.of(
                matched("p1", 1.9),
                matched("p2", 1.3));

        MatchSummary summary = MatchSummary.of(results, 2.0);

        assertEquals(1.4, summary.threshold(), 1e-12);
        assertEquals(1, summary.highConfidence());
    }

    @Test
    @DisplayName("An empty run has zero rates")
    void testEmpty() {
        MatchSummary summary = MatchSummary.of(List.of(), 1.0, 0.9);
        assertEquals(0, summary.total());
        assertEquals(0.0, summary.matchRate());
        assertTrue(summary.toString().contains("total=0"));
    }

    @Test
    @DisplayName("Should reject an invalid scale or fraction")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> MatchSummary.of(List.of(), 0.0));
        assertThrows(IllegalArgumentException.class, () -> MatchSummary.of(List.of(), 1.0, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new MatchSummary(1, 2, 0, 0.5));
    }

    private static MatchResult<PlaceListing, HygieneEstablishment> matched(String id, double combined) {
        return MatchResult.matched(place(id), CANDIDATE, new ScoreBreakdown(1.0, 1.0, 1.0, combined, 10.0));
    }

    private static PlaceListing place(String id) {
        return PlaceListing.builder().id(id).build();
    }
}
