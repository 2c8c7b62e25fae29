package org.Aayush.alns.operator;

/**
 * Destroy operator: removes or perturbs part of a solution in place.
 *
 * <p>Implementations may keep internal state (for example their own random source)
 * and are invoked repeatedly across iterations.</p>
 *
 * @param <S> solution type.
 */
@FunctionalInterface
public interface DestroyMethod<S> {

    /**
     * Destroys the given solution in place.
     *
     * @param solution candidate solution owned by the engine for this iteration.
     */
    void destroy(S solution);
}
