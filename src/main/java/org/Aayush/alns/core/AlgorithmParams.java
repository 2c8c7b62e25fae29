package org.Aayush.alns.core;

import lombok.Builder;
import lombok.Value;

/**
 * Score adaptation constants.
 *
 * <p>After an accepted iteration, the scores of the destroy and repair methods used
 * become {@code score * scoreDecay + (1 - scoreDecay) * multiplier}, where the
 * multiplier depends on the {@link IterationOutcome}. By convention
 * {@code newBestMultiplier >= newImprovingMultiplier >= newAcceptedMultiplier};
 * this ordering is not enforced.</p>
 */
@Value
@Builder(toBuilder = true)
public class AlgorithmParams {
    public static final double DEFAULT_SCORE_DECAY = 0.9d;
    public static final double DEFAULT_NEW_BEST_MULTIPLIER = 10.0d;
    public static final double DEFAULT_NEW_IMPROVING_MULTIPLIER = 4.0d;
    public static final double DEFAULT_NEW_ACCEPTED_MULTIPLIER = 1.5d;

    /**
     * Weight kept from score history on each update. Must lie strictly in (0, 1).
     */
    @Builder.Default
    double scoreDecay = DEFAULT_SCORE_DECAY;

    /**
     * Reward when the candidate became the new best solution.
     */
    @Builder.Default
    double newBestMultiplier = DEFAULT_NEW_BEST_MULTIPLIER;

    /**
     * Reward when the candidate improved on the current solution but not on the best.
     */
    @Builder.Default
    double newImprovingMultiplier = DEFAULT_NEW_IMPROVING_MULTIPLIER;

    /**
     * Reward when the candidate was accepted without improving on the current solution.
     */
    @Builder.Default
    double newAcceptedMultiplier = DEFAULT_NEW_ACCEPTED_MULTIPLIER;

    /**
     * Returns the documented default parameters.
     */
    public static AlgorithmParams defaults() {
        return AlgorithmParams.builder().build();
    }

    /**
     * Returns the reward multiplier for an outcome that updates scores.
     *
     * @param outcome iteration outcome.
     * @return configured multiplier.
     * @throws IllegalArgumentException for {@link IterationOutcome#REJECTED}.
     */
    public double multiplierFor(IterationOutcome outcome) {
        return switch (outcome) {
            case NEW_BEST -> newBestMultiplier;
            case IMPROVING -> newImprovingMultiplier;
            case ACCEPTED -> newAcceptedMultiplier;
            case REJECTED -> throw new IllegalArgumentException("rejected iterations carry no score multiplier");
        };
    }

    /**
     * Checks the hard constraints and returns this instance.
     *
     * @return this instance.
     * @throws AlnsException with {@link AlnsException#REASON_INVALID_PARAMS} on violation.
     */
    public AlgorithmParams validated() {
        if (!(scoreDecay > 0.0d && scoreDecay < 1.0d)) {
            throw new AlnsException(
                    AlnsException.REASON_INVALID_PARAMS,
                    "scoreDecay must be in (0, 1), got " + scoreDecay
            );
        }
        requirePositive("newBestMultiplier", newBestMultiplier);
        requirePositive("newImprovingMultiplier", newImprovingMultiplier);
        requirePositive("newAcceptedMultiplier", newAcceptedMultiplier);
        return this;
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new AlnsException(
                    AlnsException.REASON_INVALID_PARAMS,
                    name + " must be finite and > 0, got " + value
            );
        }
    }
}
