package org.Aayush.alns.operator;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Score-proportional (roulette-wheel) index selection.
 *
 * <p>Index {@code i} is drawn with probability {@code scores[i] / sum(scores)}.
 * Zero-score entries are never selected unless every score is zero, in which case
 * the draw is uniform.</p>
 */
@UtilityClass
public final class RouletteWheel {

    /**
     * Draws one index from a non-empty, non-negative score vector.
     *
     * @param scores selection weights.
     * @param random random source consumed by exactly one draw.
     * @return selected index in {@code [0, scores.size())}.
     * @throws IllegalArgumentException when scores are empty, negative or non-finite.
     */
    public static int select(DoubleList scores, SplittableRandom random) {
        Objects.requireNonNull(scores, "scores");
        Objects.requireNonNull(random, "random");
        int size = scores.size();
        if (size == 0) {
            throw new IllegalArgumentException("scores must be non-empty");
        }

        double total = 0.0d;
        double max = 0.0d;
        for (int i = 0; i < size; i++) {
            double score = scores.getDouble(i);
            if (!Double.isFinite(score) || score < 0.0d) {
                throw new IllegalArgumentException("score at index " + i + " must be finite and >= 0, got " + score);
            }
            total += score;
            max = Math.max(max, score);
        }

        if (total <= 0.0d) {
            return random.nextInt(size);
        }

        // Finite scores can still overflow the sum; weights relative to the largest score cannot.
        double divisor = 1.0d;
        if (!Double.isFinite(total)) {
            divisor = max;
            total = 0.0d;
            for (int i = 0; i < size; i++) {
                total += scores.getDouble(i) / divisor;
            }
        }

        double draw = random.nextDouble() * total;
        double cumulative = 0.0d;
        for (int i = 0; i < size; i++) {
            double score = scores.getDouble(i) / divisor;
            cumulative += score;
            if (score > 0.0d && cumulative >= draw) {
                return i;
            }
        }
        // Rounding can leave the running sum just below the draw.
        return size - 1;
    }
}
