package org.Aayush.alns.testutil;

import org.Aayush.alns.solution.AlnsSolution;

/**
 * Minimal mutable solution whose cost is a single value.
 */
public final class CostSolution implements AlnsSolution<CostSolution> {
    private double value;
    private int copies;

    public CostSolution(double value) {
        this.value = value;
    }

    @Override
    public double cost() {
        return value;
    }

    @Override
    public CostSolution copy() {
        copies++;
        return new CostSolution(value);
    }

    public void add(double delta) {
        value += delta;
    }

    public void set(double value) {
        this.value = value;
    }

    /**
     * @return number of times {@link #copy()} was called on this instance.
     */
    public int copies() {
        return copies;
    }
}
