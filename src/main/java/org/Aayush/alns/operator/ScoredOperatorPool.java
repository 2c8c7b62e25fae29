package org.Aayush.alns.operator;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Operators paired 1:1 with adaptive selection scores.
 *
 * <p>Indices are stable: an operator keeps the index returned by {@link #register(Object)}
 * for the lifetime of the pool. Scores start at {@link #INITIAL_SCORE} and are updated
 * with an exponential moving average of outcome multipliers.</p>
 *
 * <p>Not thread-safe. The owning solver mutates it from one thread.</p>
 *
 * @param <O> operator type ({@link DestroyMethod} or {@link RepairMethod}).
 */
public final class ScoredOperatorPool<O> {
    public static final double INITIAL_SCORE = 1.0d;

    private final List<O> operators = new ArrayList<>();
    private final DoubleArrayList scores = new DoubleArrayList();
    private final DoubleList scoresView = DoubleLists.unmodifiable(scores);

    /**
     * Appends an operator with the initial score.
     *
     * @param operator operator to own.
     * @return stable index of the operator.
     */
    public int register(O operator) {
        operators.add(Objects.requireNonNull(operator, "operator"));
        scores.add(INITIAL_SCORE);
        return operators.size() - 1;
    }

    /**
     * Selects an operator index by roulette wheel over current scores.
     *
     * @param random random source to consume.
     * @return selected operator index.
     * @throws IllegalStateException when the pool is empty.
     */
    public int select(SplittableRandom random) {
        if (operators.isEmpty()) {
            throw new IllegalStateException("cannot select from an empty operator pool");
        }
        return RouletteWheel.select(scores, random);
    }

    /**
     * Blends one outcome reward into an operator score.
     *
     * <p>{@code score = score * decay + (1 - decay) * multiplier}</p>
     *
     * @param index operator index.
     * @param multiplier reward for the latest outcome.
     * @param decay weight kept from score history, in (0, 1).
     */
    public void updateScore(int index, double multiplier, double decay) {
        checkIndex(index);
        double updated = scores.getDouble(index) * decay + (1.0d - decay) * multiplier;
        scores.set(index, updated);
    }

    /**
     * Restores every score to {@link #INITIAL_SCORE}. Registered operators are kept.
     */
    public void resetScores() {
        for (int i = 0; i < scores.size(); i++) {
            scores.set(i, INITIAL_SCORE);
        }
    }

    public O operator(int index) {
        checkIndex(index);
        return operators.get(index);
    }

    public double score(int index) {
        checkIndex(index);
        return scores.getDouble(index);
    }

    /**
     * @return read-only live view of the score vector, index-aligned with operators.
     */
    public DoubleList scores() {
        return scoresView;
    }

    public int size() {
        return operators.size();
    }

    public boolean isEmpty() {
        return operators.isEmpty();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= operators.size()) {
            throw new IndexOutOfBoundsException(
                    "operator index out of bounds: " + index + " [0, " + operators.size() + ")"
            );
        }
    }
}
