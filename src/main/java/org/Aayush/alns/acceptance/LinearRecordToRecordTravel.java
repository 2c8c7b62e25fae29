package org.Aayush.alns.acceptance;

import lombok.Getter;
import org.Aayush.alns.core.AlgorithmStatus;
import org.Aayush.alns.solution.AlnsSolution;

import java.util.Objects;

/**
 * Record-to-record travel with a linearly shrinking threshold.
 *
 * <p>A candidate is accepted iff its gap to the best solution is at most the current
 * threshold. The threshold moves linearly from {@code startThreshold} to
 * {@code endThreshold} as the iteration count (or the elapsed time) approaches its limit,
 * and stays at {@code endThreshold} afterwards.</p>
 *
 * <p>The gap is relative, {@code (candidate - best) / candidate}, while the candidate cost
 * is positive. For zero or negative candidate costs the relative gap is undefined and the
 * absolute difference {@code candidate - best} is used instead.</p>
 *
 * @param <S> solution type.
 */
public final class LinearRecordToRecordTravel<S extends AlnsSolution<S>> implements AcceptanceCriterion<S> {

    @Getter
    private final RecordToRecordTravelConfig config;

    /**
     * Creates the criterion with default configuration.
     */
    public LinearRecordToRecordTravel() {
        this(RecordToRecordTravelConfig.defaults());
    }

    /**
     * @param config threshold schedule.
     */
    public LinearRecordToRecordTravel(RecordToRecordTravelConfig config) {
        this.config = Objects.requireNonNull(config, "config").validated();
    }

    @Override
    public boolean accept(AlgorithmStatus<S> status) {
        double threshold = threshold(status.getIterationNumber(), status.getElapsedTimeSec());
        double gap = gap(status.getCandidateSolution().cost(), status.getBestSolution().cost());
        return gap <= threshold;
    }

    /**
     * Returns the threshold in force for the given progress counters.
     *
     * @param iterationNumber current iteration.
     * @param elapsedTimeSec current elapsed time.
     * @return acceptance threshold.
     */
    public double threshold(long iterationNumber, double elapsedTimeSec) {
        double start = config.getStartThreshold();
        double end = config.getEndThreshold();
        if (start == end) {
            return start;
        }
        double progress = config.getMainTerminationCriterion() == MainTerminationCriterion.ITERATIONS
                ? (double) iterationNumber / config.getIterationsLimit()
                : elapsedTimeSec / config.getTimeLimitSec();
        progress = Math.min(1.0d, Math.max(0.0d, progress));
        if (Double.isInfinite(start) || Double.isInfinite(end)) {
            // Interpolating towards infinity is undefined; the infinite bound wins until the limit.
            if (progress <= 0.0d) {
                return start;
            }
            return progress >= 1.0d ? end : Math.max(start, end);
        }
        return start + (end - start) * progress;
    }

    /**
     * Returns the gap of a candidate to the best solution.
     *
     * @param candidateCost candidate cost.
     * @param bestCost best cost.
     * @return relative gap for positive candidate costs, absolute difference otherwise.
     */
    public static double gap(double candidateCost, double bestCost) {
        double difference = candidateCost - bestCost;
        if (candidateCost > 0.0d) {
            return difference / candidateCost;
        }
        return difference;
    }
}
