package org.Aayush.alns.core;

import lombok.Getter;
import org.Aayush.alns.acceptance.AcceptAllCriterion;
import org.Aayush.alns.acceptance.AcceptanceCriterion;
import org.Aayush.alns.operator.DestroyMethod;
import org.Aayush.alns.operator.RepairMethod;
import org.Aayush.alns.solution.AlnsSolution;
import org.Aayush.alns.visitor.AlgorithmVisitor;
import org.Aayush.alns.visitor.DefaultAlgorithmVisitor;
import org.apache.log4j.Logger;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Adaptive Large Neighbourhood Search solver.
 *
 * <p>Each iteration draws one destroy and one repair method by roulette wheel over their
 * scores, applies them (destroy first) to a copy of the current solution, asks the
 * {@link AcceptanceCriterion} whether the candidate replaces the current solution, rewards
 * the two methods when it does, and finally calls the {@link AlgorithmVisitor}. The search
 * runs until the visitor returns false. Lower cost is better.</p>
 *
 * <p>The status survives {@link #solve()}: calling it again resumes from the retained
 * best/current solutions, scores and counters. Use {@link #resetStatus(AlnsSolution)} to
 * start over.</p>
 *
 * <p>Single-threaded; not safe for concurrent use.</p>
 *
 * @param <S> solution type.
 */
public final class AlnsSolver<S extends AlnsSolution<S>> {
    private static final Logger LOG = Logger.getLogger(AlnsSolver.class);
    private static final double NANOS_PER_SECOND = 1_000_000_000.0d;

    /** Fixed selection seed, or null to seed from system entropy. */
    private final Long seed;

    @Getter
    private AlgorithmParams params;

    @Getter
    private AcceptanceCriterion<S> acceptanceCriterion = new AcceptAllCriterion<>();

    @Getter
    private AlgorithmVisitor<S> visitor = new DefaultAlgorithmVisitor<>();

    @Getter
    private final AlgorithmStatus<S> status;

    /**
     * Creates a solver whose operator selection is seeded from system entropy.
     *
     * @param params score adaptation parameters.
     * @param initialSolution starting solution.
     */
    public AlnsSolver(AlgorithmParams params, S initialSolution) {
        this(params, initialSolution, null);
    }

    /**
     * Creates a solver with a fixed selection seed.
     *
     * <p>Given the same seed and deterministic operators, the sequence of selected
     * operators is reproducible. {@link #resetStatus(AlnsSolution)} reseeds from it.</p>
     *
     * @param params score adaptation parameters.
     * @param initialSolution starting solution.
     * @param seed selection seed; null seeds from system entropy.
     */
    public AlnsSolver(AlgorithmParams params, S initialSolution, Long seed) {
        this.params = Objects.requireNonNull(params, "params").validated();
        this.seed = seed;
        this.status = new AlgorithmStatus<>(initialSolution, newRandom());
    }

    /**
     * Adds a destroy method with initial score 1.0.
     *
     * @return index of the method in the destroy pool.
     */
    public int addDestroyMethod(DestroyMethod<S> method) {
        return status.getDestroyMethods().register(method);
    }

    /**
     * Adds a repair method with initial score 1.0.
     *
     * @return index of the method in the repair pool.
     */
    public int addRepairMethod(RepairMethod<S> method) {
        return status.getRepairMethods().register(method);
    }

    public void setParams(AlgorithmParams params) {
        this.params = Objects.requireNonNull(params, "params").validated();
    }

    public void setAcceptanceCriterion(AcceptanceCriterion<S> acceptanceCriterion) {
        this.acceptanceCriterion = Objects.requireNonNull(acceptanceCriterion, "acceptanceCriterion");
    }

    public void setVisitor(AlgorithmVisitor<S> visitor) {
        this.visitor = Objects.requireNonNull(visitor, "visitor");
    }

    /**
     * Starts a fresh search from a new initial solution.
     *
     * <p>Iteration and elapsed time go back to zero, best/current/candidate become copies of
     * {@code initialSolution}, and every score returns to 1.0. Registered operators stay.</p>
     *
     * @param initialSolution new starting solution.
     */
    public void resetStatus(S initialSolution) {
        status.restart(initialSolution, newRandom());
    }

    /**
     * Runs the search until the visitor asks to stop.
     *
     * <p>Parameters, acceptance criterion and visitor are captured once per call.
     * Exceptions thrown by operators, the criterion or the visitor propagate unchanged;
     * best and current are only modified after a candidate has been accepted.</p>
     *
     * @return the status after the last iteration.
     * @throws AlnsException when no destroy or no repair method is registered.
     */
    public AlgorithmStatus<S> solve() {
        ensureOperatorsRegistered();
        status.prepareResume();

        AlgorithmParams runParams = params;
        AcceptanceCriterion<S> runAcceptance = acceptanceCriterion;
        AlgorithmVisitor<S> runVisitor = visitor;

        long startNanos = System.nanoTime();
        double startElapsedSec = status.getElapsedTimeSec();
        long startIteration = status.getIterationNumber();
        if (LOG.isDebugEnabled()) {
            LOG.debug("ALNS search starting at iteration " + startIteration
                    + " with " + status.getDestroyMethods().size() + " destroy and "
                    + status.getRepairMethods().size() + " repair methods, best cost "
                    + status.getBestSolution().cost());
        }

        while (true) {
            status.selectOperators();
            status.buildCandidate();

            IterationOutcome outcome = runAcceptance.accept(status)
                    ? status.commitCandidate()
                    : IterationOutcome.REJECTED;
            status.recordOutcome(outcome, runParams);

            if (!runVisitor.onIterationEnd(status)) {
                break;
            }

            double elapsedSec = startElapsedSec + (System.nanoTime() - startNanos) / NANOS_PER_SECOND;
            status.advance(elapsedSec);
        }

        LOG.info("ALNS search stopped at iteration " + status.getIterationNumber()
                + " after " + (status.getIterationNumber() - startIteration + 1) + " iterations, best cost "
                + status.getBestSolution().cost());
        return status;
    }

    private void ensureOperatorsRegistered() {
        if (status.getDestroyMethods().isEmpty()) {
            throw new AlnsException(
                    AlnsException.REASON_NO_DESTROY_METHODS,
                    "at least one destroy method must be registered before solving"
            );
        }
        if (status.getRepairMethods().isEmpty()) {
            throw new AlnsException(
                    AlnsException.REASON_NO_REPAIR_METHODS,
                    "at least one repair method must be registered before solving"
            );
        }
    }

    private SplittableRandom newRandom() {
        if (seed != null) {
            return new SplittableRandom(seed);
        }
        return new SplittableRandom(new SecureRandom().nextLong());
    }
}
