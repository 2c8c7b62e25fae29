package org.Aayush.alns.core;

/**
 * Classification of one destroy/repair iteration, used to pick the score reward.
 */
public enum IterationOutcome {
    /** Accepted and better than the best solution seen so far. */
    NEW_BEST,
    /** Accepted and better than the current solution, but not than the best. */
    IMPROVING,
    /** Accepted without improving on the current solution. */
    ACCEPTED,
    /** Discarded by the acceptance criterion. Scores are left untouched. */
    REJECTED;

    /**
     * @return true when this outcome updates the scores of the operators used.
     */
    public boolean rewardsOperators() {
        return this != REJECTED;
    }
}
