package com.venue.linkage.match;

import com.venue.linkage.core.model.ScoreBreakdown;

/**
 * Decides whether a newly scored candidate displaces the current best.
 * Candidates are visited in candidate-collection order, so every policy is deterministic.
 */
public enum TieBreakPolicy {

    /** Strictly higher combined score wins; on a tie the earlier candidate is kept. */
    FIRST_MAX {
        @Override
        boolean prefers(ScoreBreakdown challenger, ScoreBreakdown incumbent) {
            return challenger.combinedScore() > incumbent.combinedScore();
        }
    },

    /** As {@link #FIRST_MAX}, but an equal combined score with a higher name score wins. */
    HIGHER_NAME_SCORE {
        @Override
        boolean prefers(ScoreBreakdown challenger, ScoreBreakdown incumbent) {
            if (challenger.combinedScore() != incumbent.combinedScore()) {
                return challenger.combinedScore() > incumbent.combinedScore();
            }
            return challenger.nameScore() > incumbent.nameScore();
        }
    };

    abstract boolean prefers(ScoreBreakdown challenger, ScoreBreakdown incumbent);
}
