package org.Aayush.alns.acceptance;

import org.Aayush.alns.core.AlgorithmStatus;
import org.Aayush.alns.solution.AlnsSolution;

/**
 * Accepts every candidate. Default criterion of the solver.
 */
public final class AcceptAllCriterion<S extends AlnsSolution<S>> implements AcceptanceCriterion<S> {

    @Override
    public boolean accept(AlgorithmStatus<S> status) {
        return true;
    }
}
