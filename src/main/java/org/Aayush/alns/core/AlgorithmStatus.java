package org.Aayush.alns.core;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import lombok.AccessLevel;
import lombok.Getter;
import org.Aayush.alns.operator.DestroyMethod;
import org.Aayush.alns.operator.RepairMethod;
import org.Aayush.alns.operator.ScoredOperatorPool;
import org.Aayush.alns.solution.AlnsSolution;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Mutable run state of one ALNS search.
 *
 * <p>Groups everything the solver touches during {@link AlnsSolver#solve()} so that it can
 * be handed to acceptance criteria and visitors: counters, the best/current/candidate
 * solutions, both operator pools with their scores, and the random source used for
 * roulette-wheel selection.</p>
 *
 * <p>Counters, scores and the latest-used indices are written only by the solver.
 * Visitors may replace the best and current solutions (for example after a local search)
 * and may register further operators through the pools.</p>
 *
 * @param <S> solution type.
 */
@Getter
public final class AlgorithmStatus<S extends AlnsSolution<S>> {
    public static final int NO_OPERATOR = -1;

    @Getter(AccessLevel.NONE)
    private SplittableRandom random;

    /** Zero-based index of the iteration in progress. */
    private long iterationNumber;

    /** Seconds of search time accumulated across {@code solve()} calls since the last reset. */
    private double elapsedTimeSec;

    private final ScoredOperatorPool<DestroyMethod<S>> destroyMethods = new ScoredOperatorPool<>();
    private final ScoredOperatorPool<RepairMethod<S>> repairMethods = new ScoredOperatorPool<>();

    private S bestSolution;
    private S currentSolution;

    /** Solution produced by destroy and repair during the latest iteration. */
    private S candidateSolution;

    private int latestDestroyId = NO_OPERATOR;
    private int latestRepairId = NO_OPERATOR;

    /** Outcome of the latest completed iteration, or null before the first one. */
    private IterationOutcome latestOutcome;

    /** True once the iteration at {@link #iterationNumber} has reached its visitor call. */
    @Getter(AccessLevel.NONE)
    private boolean iterationCompleted;

    /**
     * Builds the status used to start a search.
     *
     * @param initialSolution starting solution; copied into all three solution slots.
     * @param random random source owned by this status from now on.
     */
    public AlgorithmStatus(S initialSolution, SplittableRandom random) {
        restart(initialSolution, random);
    }

    public DoubleList getDestroyScores() {
        return destroyMethods.scores();
    }

    public DoubleList getRepairScores() {
        return repairMethods.scores();
    }

    /**
     * Replaces the best solution, for example with a locally optimised copy.
     */
    public void setBestSolution(S bestSolution) {
        this.bestSolution = Objects.requireNonNull(bestSolution, "bestSolution");
    }

    /**
     * Replaces the current solution the next iteration starts from.
     */
    public void setCurrentSolution(S currentSolution) {
        this.currentSolution = Objects.requireNonNull(currentSolution, "currentSolution");
    }

    /**
     * Clears counters, solutions and scores while keeping the registered operators.
     */
    void restart(S initialSolution, SplittableRandom random) {
        Objects.requireNonNull(initialSolution, "initialSolution");
        this.random = Objects.requireNonNull(random, "random");
        this.iterationNumber = 0L;
        this.elapsedTimeSec = 0.0d;
        this.bestSolution = initialSolution.copy();
        this.currentSolution = initialSolution.copy();
        this.candidateSolution = initialSolution.copy();
        this.latestDestroyId = NO_OPERATOR;
        this.latestRepairId = NO_OPERATOR;
        this.latestOutcome = null;
        this.iterationCompleted = false;
        destroyMethods.resetScores();
        repairMethods.resetScores();
    }

    /**
     * Draws the destroy and repair methods for this iteration and records their indices.
     */
    void selectOperators() {
        latestDestroyId = destroyMethods.select(random);
        latestRepairId = repairMethods.select(random);
    }

    /**
     * Copies the current solution into the candidate slot and applies the latest
     * destroy method followed by the latest repair method.
     */
    void buildCandidate() {
        candidateSolution = currentSolution.copy();
        destroyMethods.operator(latestDestroyId).destroy(candidateSolution);
        repairMethods.operator(latestRepairId).repair(candidateSolution);
    }

    /**
     * Commits an accepted candidate and returns how it compares to current and best.
     * Best and current receive their own copies; the candidate slot stays private to
     * the next iteration.
     */
    IterationOutcome commitCandidate() {
        double candidateCost = candidateSolution.cost();
        IterationOutcome outcome;
        if (candidateCost < currentSolution.cost()) {
            if (candidateCost < bestSolution.cost()) {
                bestSolution = candidateSolution.copy();
                outcome = IterationOutcome.NEW_BEST;
            } else {
                outcome = IterationOutcome.IMPROVING;
            }
        } else {
            outcome = IterationOutcome.ACCEPTED;
        }
        currentSolution = candidateSolution.copy();
        return outcome;
    }

    /**
     * Rewards the latest destroy and repair methods for an iteration outcome.
     */
    void recordOutcome(IterationOutcome outcome, AlgorithmParams params) {
        latestOutcome = outcome;
        iterationCompleted = true;
        if (!outcome.rewardsOperators()) {
            return;
        }
        double multiplier = params.multiplierFor(outcome);
        destroyMethods.updateScore(latestDestroyId, multiplier, params.getScoreDecay());
        repairMethods.updateScore(latestRepairId, multiplier, params.getScoreDecay());
    }

    /**
     * Moves to the next iteration.
     */
    void advance(double elapsedTimeSec) {
        this.elapsedTimeSec = Math.max(this.elapsedTimeSec, elapsedTimeSec);
        this.iterationNumber++;
        this.iterationCompleted = false;
    }

    /**
     * Skips past an iteration finished by a previous {@code solve()} call, so a resumed
     * search never reuses an iteration number.
     */
    void prepareResume() {
        if (iterationCompleted) {
            advance(elapsedTimeSec);
        }
    }
}
