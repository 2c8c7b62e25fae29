package org.Aayush.alns.testutil;

import org.Aayush.alns.core.AlgorithmStatus;
import org.Aayush.alns.visitor.AlgorithmVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Test visitor that stops once the iteration counter reaches a value and records what it saw.
 */
public final class StopAfterVisitor implements AlgorithmVisitor<CostSolution> {
    private final long stopAtIteration;
    private final List<Long> iterations = new ArrayList<>();
    private final List<Double> elapsed = new ArrayList<>();
    private final List<double[]> bestAndCurrent = new ArrayList<>();
    private Consumer<AlgorithmStatus<CostSolution>> onVisit = status -> { };

    public StopAfterVisitor(long stopAtIteration) {
        this.stopAtIteration = stopAtIteration;
    }

    public StopAfterVisitor onVisit(Consumer<AlgorithmStatus<CostSolution>> onVisit) {
        this.onVisit = onVisit;
        return this;
    }

    @Override
    public boolean onIterationEnd(AlgorithmStatus<CostSolution> status) {
        iterations.add(status.getIterationNumber());
        elapsed.add(status.getElapsedTimeSec());
        bestAndCurrent.add(new double[]{status.getBestSolution().cost(), status.getCurrentSolution().cost()});
        onVisit.accept(status);
        return status.getIterationNumber() < stopAtIteration;
    }

    public List<Long> iterations() {
        return iterations;
    }

    public List<Double> elapsed() {
        return elapsed;
    }

    public List<double[]> bestAndCurrent() {
        return bestAndCurrent;
    }
}
