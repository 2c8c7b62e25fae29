package org.Aayush.alns.acceptance;

import org.Aayush.alns.core.AlgorithmStatus;
import org.Aayush.alns.solution.AlnsSolution;

/**
 * Decides whether the candidate of the current iteration replaces the current solution.
 *
 * @param <S> solution type.
 */
@FunctionalInterface
public interface AcceptanceCriterion<S extends AlnsSolution<S>> {

    /**
     * @param status run state holding candidate, current and best solutions plus counters.
     * @return true iff the candidate should become the current solution.
     */
    boolean accept(AlgorithmStatus<S> status);
}
