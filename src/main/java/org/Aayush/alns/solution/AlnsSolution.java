package org.Aayush.alns.solution;

/**
 * Problem-specific solution contract consumed by the ALNS engine.
 *
 * <p>The engine only ever reads {@link #cost()} and calls {@link #copy()}. Lower cost
 * is better; maximisation problems should negate their objective.</p>
 *
 * @param <S> concrete self type.
 */
public interface AlnsSolution<S extends AlnsSolution<S>> {

    /**
     * @return objective value of this solution (lower is better).
     */
    double cost();

    /**
     * Returns an independent copy.
     *
     * <p>Mutating the copy must never be visible through this instance, since the
     * engine keeps best, current and candidate solutions alive at the same time.</p>
     *
     * @return deep copy of this solution.
     */
    S copy();
}
