package org.Aayush.alns.operator;

/**
 * Repair operator: restores a destroyed solution in place.
 *
 * @param <S> solution type.
 */
@FunctionalInterface
public interface RepairMethod<S> {

    /**
     * Repairs the given solution in place.
     *
     * @param solution candidate solution previously handled by a destroy method.
     */
    void repair(S solution);
}
