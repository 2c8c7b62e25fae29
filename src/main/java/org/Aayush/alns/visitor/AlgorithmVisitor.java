package org.Aayush.alns.visitor;

import org.Aayush.alns.core.AlgorithmStatus;
import org.Aayush.alns.solution.AlnsSolution;

/**
 * Callback invoked at the end of every ALNS iteration.
 *
 * <p>The visitor is the only way to stop the search. It may also inspect the status,
 * collect statistics or improve the best/current solutions in place (for example with a
 * local search).</p>
 *
 * @param <S> solution type.
 */
@FunctionalInterface
public interface AlgorithmVisitor<S extends AlnsSolution<S>> {

    /**
     * @param status run state after the iteration's acceptance decision.
     * @return false iff the search should stop.
     */
    boolean onIterationEnd(AlgorithmStatus<S> status);
}
