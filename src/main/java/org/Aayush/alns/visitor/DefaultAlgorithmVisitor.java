package org.Aayush.alns.visitor;

import org.Aayush.alns.core.AlgorithmStatus;
import org.Aayush.alns.solution.AlnsSolution;

/**
 * Never stops the search. Callers relying on it must stop the run some other way,
 * for example by throwing from an operator.
 */
public final class DefaultAlgorithmVisitor<S extends AlnsSolution<S>> implements AlgorithmVisitor<S> {

    @Override
    public boolean onIterationEnd(AlgorithmStatus<S> status) {
        return true;
    }
}
