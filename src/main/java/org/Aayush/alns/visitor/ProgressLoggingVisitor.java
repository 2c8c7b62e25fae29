package org.Aayush.alns.visitor;

import lombok.Builder;
import lombok.Getter;
import org.Aayush.alns.core.AlgorithmStatus;
import org.Aayush.alns.solution.AlnsSolution;
import org.apache.log4j.Logger;

/**
 * Visitor that logs progress periodically and stops the search at an iteration or time limit.
 *
 * <p>Non-positive limits mean unbounded; a non-positive {@code logEvery} disables logging.
 * An optional delegate runs first on every iteration and can stop the search as well.</p>
 *
 * @param <S> solution type.
 */
@Getter
public final class ProgressLoggingVisitor<S extends AlnsSolution<S>> implements AlgorithmVisitor<S> {
    public static final long UNBOUNDED_ITERATIONS = Long.MAX_VALUE;
    public static final double UNBOUNDED_TIME_SEC = Double.POSITIVE_INFINITY;

    private static final Logger LOG = Logger.getLogger(ProgressLoggingVisitor.class);

    /** Log every this many completed iterations. */
    private final long logEvery;

    /** Number of completed iterations after which the search stops. */
    private final long iterationLimit;

    /** Elapsed seconds after which the search stops. */
    private final double timeLimitSec;

    private final AlgorithmVisitor<S> delegate;

    @Builder
    private ProgressLoggingVisitor(
            long logEvery,
            long iterationLimit,
            double timeLimitSec,
            AlgorithmVisitor<S> delegate
    ) {
        this.logEvery = Math.max(0L, logEvery);
        this.iterationLimit = iterationLimit <= 0L ? UNBOUNDED_ITERATIONS : iterationLimit;
        this.timeLimitSec = (Double.isNaN(timeLimitSec) || timeLimitSec <= 0.0d) ? UNBOUNDED_TIME_SEC : timeLimitSec;
        this.delegate = delegate == null ? new DefaultAlgorithmVisitor<>() : delegate;
    }

    /**
     * Creates a visitor that stops after {@code iterationLimit} iterations.
     */
    public static <S extends AlnsSolution<S>> ProgressLoggingVisitor<S> iterationLimited(long logEvery, long iterationLimit) {
        return ProgressLoggingVisitor.<S>builder()
                .logEvery(logEvery)
                .iterationLimit(iterationLimit)
                .build();
    }

    /**
     * Creates a visitor that stops once {@code timeLimitSec} seconds have elapsed.
     */
    public static <S extends AlnsSolution<S>> ProgressLoggingVisitor<S> timeLimited(long logEvery, double timeLimitSec) {
        return ProgressLoggingVisitor.<S>builder()
                .logEvery(logEvery)
                .timeLimitSec(timeLimitSec)
                .build();
    }

    @Override
    public boolean onIterationEnd(AlgorithmStatus<S> status) {
        boolean delegateContinues = delegate.onIterationEnd(status);
        long completed = status.getIterationNumber() + 1L;

        if (logEvery > 0L && completed % logEvery == 0L && LOG.isInfoEnabled()) {
            LOG.info("iteration " + completed
                    + " best " + status.getBestSolution().cost()
                    + " current " + status.getCurrentSolution().cost()
                    + " elapsed " + status.getElapsedTimeSec() + "s");
        }

        if (!delegateContinues) {
            LOG.debug("search stopped by delegate visitor at iteration " + completed);
            return false;
        }
        if (completed >= iterationLimit) {
            LOG.debug("iteration limit " + iterationLimit + " reached");
            return false;
        }
        if (status.getElapsedTimeSec() >= timeLimitSec) {
            LOG.debug("time limit " + timeLimitSec + "s reached after " + completed + " iterations");
            return false;
        }
        return true;
    }
}
