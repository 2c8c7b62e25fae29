package org.Aayush.alns.operator;

import org.Aayush.alns.testutil.CostSolution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ScoredOperatorPool Tests")
class ScoredOperatorPoolTest {

    @Test
    @DisplayName("Registration returns stable sequential indices with initial score 1.0")
    void testRegistration() {
        ScoredOperatorPool<DestroyMethod<CostSolution>> pool = new ScoredOperatorPool<>();
        DestroyMethod<CostSolution> first = s -> s.add(1.0);
        DestroyMethod<CostSolution> second = s -> s.add(2.0);

        assertEquals(0, pool.register(first));
        assertEquals(1, pool.register(second));
        assertEquals(2, pool.size());
        assertSame(first, pool.operator(0));
        assertSame(second, pool.operator(1));
        assertEquals(1.0, pool.score(0));
        assertEquals(1.0, pool.score(1));
    }

    @Test
    @DisplayName("Null operators are rejected")
    void testNullOperatorRejected() {
        ScoredOperatorPool<RepairMethod<CostSolution>> pool = new ScoredOperatorPool<>();
        assertThrows(NullPointerException.class, () -> pool.register(null));
        assertTrue(pool.isEmpty());
    }

    @Test
    @DisplayName("Score update blends history and reward as an exponential moving average")
    void testUpdateScoreFormula() {
        ScoredOperatorPool<RepairMethod<CostSolution>> pool = new ScoredOperatorPool<>();
        pool.register(s -> { });

        pool.updateScore(0, 10.0, 0.9);
        assertEquals(1.0 * 0.9 + 0.1 * 10.0, pool.score(0), 1e-12);

        pool.updateScore(0, 1.5, 0.9);
        assertEquals(1.9 * 0.9 + 0.1 * 1.5, pool.score(0), 1e-12);
    }

    @ParameterizedTest
    @CsvSource({
            "0.1, 1.0, 1.5",
            "0.5, 1.5, 4.0",
            "0.9, 4.0, 10.0",
            "0.99, 0.5, 0.5"
    })
    @DisplayName("Larger multiplier never yields a smaller score")
    void testUpdateScoreMonotonicInMultiplier(double decay, double smaller, double larger) {
        ScoredOperatorPool<DestroyMethod<CostSolution>> pool = new ScoredOperatorPool<>();
        pool.register(s -> { });
        pool.register(s -> { });

        pool.updateScore(0, smaller, decay);
        pool.updateScore(1, larger, decay);

        assertTrue(pool.score(1) >= pool.score(0));
    }

    @Test
    @DisplayName("Scores stay non-negative and bounded by the largest multiplier")
    void testScoresStayInRange() {
        ScoredOperatorPool<DestroyMethod<CostSolution>> pool = new ScoredOperatorPool<>();
        pool.register(s -> { });
        double[] rewards = {10.0, 4.0, 1.5};
        for (int i = 0; i < 1_000; i++) {
            pool.updateScore(0, rewards[i % rewards.length], 0.8);
            assertTrue(pool.score(0) >= 0.0);
            assertTrue(pool.score(0) <= 10.0);
        }
    }

    @Test
    @DisplayName("Reset restores initial scores and keeps operators")
    void testResetScores() {
        ScoredOperatorPool<DestroyMethod<CostSolution>> pool = new ScoredOperatorPool<>();
        pool.register(s -> { });
        pool.register(s -> { });
        pool.updateScore(0, 10.0, 0.5);
        pool.updateScore(1, 4.0, 0.5);

        pool.resetScores();

        assertEquals(2, pool.size());
        assertEquals(ScoredOperatorPool.INITIAL_SCORE, pool.score(0));
        assertEquals(ScoredOperatorPool.INITIAL_SCORE, pool.score(1));
    }

    @Test
    @DisplayName("Score view is read-only and tracks updates")
    void testScoresView() {
        ScoredOperatorPool<DestroyMethod<CostSolution>> pool = new ScoredOperatorPool<>();
        pool.register(s -> { });

        pool.updateScore(0, 3.0, 0.5);

        assertEquals(2.0, pool.scores().getDouble(0), 1e-12);
        assertThrows(UnsupportedOperationException.class, () -> pool.scores().set(0, 5.0));
    }

    @Test
    @DisplayName("Selection from empty pool and out-of-range indices fail")
    void testInvalidAccess() {
        ScoredOperatorPool<DestroyMethod<CostSolution>> pool = new ScoredOperatorPool<>();
        assertThrows(IllegalStateException.class, () -> pool.select(new SplittableRandom(1L)));
        assertThrows(IndexOutOfBoundsException.class, () -> pool.score(0));
        assertThrows(IndexOutOfBoundsException.class, () -> pool.updateScore(-1, 1.0, 0.5));
    }

    @Test
    @DisplayName("Higher-scored operator is selected more often")
    void testSelectionFollowsScores() {
        ScoredOperatorPool<DestroyMethod<CostSolution>> pool = new ScoredOperatorPool<>();
        pool.register(s -> { });
        pool.register(s -> { });
        for (int i = 0; i < 50; i++) {
            pool.updateScore(1, 10.0, 0.9);
        }

        SplittableRandom random = new SplittableRandom(11L);
        int[] hits = new int[2];
        for (int i = 0; i < 10_000; i++) {
            hits[pool.select(random)]++;
        }
        double expectedShare = pool.score(1) / (pool.score(0) + pool.score(1));
        assertEquals(expectedShare, hits[1] / 10_000.0, 0.02);
    }
}
