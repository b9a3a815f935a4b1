package com.venue.linkage.core.model;

import java.util.Objects;

/**
 * Outcome of the best-match search for one probe venue.
 *
 * <p>{@code candidate} is non-null only when the best candidate reached the acceptance floor
 * within the distance cutoff. An unmatched result still carries the best breakdown seen,
 * for diagnostics, or {@link ScoreBreakdown#empty()} when no candidate survived pruning.</p>
 */
public record MatchResult<P extends VenueRecord, C extends VenueRecord>(
        P probe,
        C candidate,
        ScoreBreakdown breakdown
) {
    public MatchResult {
        Objects.requireNonNull(probe, "probe is required");
        Objects.requireNonNull(breakdown, "breakdown is required");
    }

    public static <P extends VenueRecord, C extends VenueRecord> MatchResult<P, C> matched(
            P probe, C candidate, ScoreBreakdown breakdown) {
        Objects.requireNonNull(candidate, "candidate is required for a match");
        return new MatchResult<>(probe, candidate, breakdown);
    }

    public static <P extends VenueRecord, C extends VenueRecord> MatchResult<P, C> unmatched(
            P probe, ScoreBreakdown bestSeen) {
        return new MatchResult<>(probe, null, bestSeen);
    }

    public static <P extends VenueRecord, C extends VenueRecord> MatchResult<P, C> noCandidates(P probe) {
        return new MatchResult<>(probe, null, ScoreBreakdown.empty());
    }

    public String probeId() {
        return probe.id();
    }

    /**
     * Returns the matched candidate's id, or null when unmatched.
     */
    public String candidateId() {
        return candidate != null ? candidate.id() : null;
    }

    public boolean isMatched() {
        return candidate != null;
    }

    public double combinedScore() {
        return breakdown.combinedScore();
    }

    public double nameScore() {
        return breakdown.nameScore();
    }

    public Double distanceMeters() {
        return breakdown.distanceMeters();
    }
}
