package org.Aayush.alns.acceptance;

import lombok.Builder;
import lombok.Value;
import org.Aayush.alns.core.AlnsException;

/**
 * Configuration for {@link LinearRecordToRecordTravel}.
 */
@Value
@Builder(toBuilder = true)
public class RecordToRecordTravelConfig {
    public static final long DEFAULT_ITERATIONS_LIMIT = 1_000_000L;
    public static final double DEFAULT_TIME_LIMIT_SEC = 3600.0d;
    public static final double DEFAULT_START_THRESHOLD = 0.1d;
    public static final double DEFAULT_END_THRESHOLD = 0.0d;

    /**
     * Whether the threshold decays with iterations or with elapsed time.
     */
    @Builder.Default
    MainTerminationCriterion mainTerminationCriterion = MainTerminationCriterion.ITERATIONS;

    /**
     * Iteration at which the threshold reaches {@link #endThreshold}.
     */
    @Builder.Default
    long iterationsLimit = DEFAULT_ITERATIONS_LIMIT;

    /**
     * Elapsed seconds at which the threshold reaches {@link #endThreshold}.
     */
    @Builder.Default
    double timeLimitSec = DEFAULT_TIME_LIMIT_SEC;

    /**
     * Accepted gap to the best solution at the start of the search.
     * {@link Double#POSITIVE_INFINITY} accepts everything.
     */
    @Builder.Default
    double startThreshold = DEFAULT_START_THRESHOLD;

    /**
     * Accepted gap to the best solution once the budget is spent.
     */
    @Builder.Default
    double endThreshold = DEFAULT_END_THRESHOLD;

    /**
     * Returns the documented default configuration.
     */
    public static RecordToRecordTravelConfig defaults() {
        return RecordToRecordTravelConfig.builder().build();
    }

    /**
     * Checks value ranges and returns this instance.
     *
     * @throws AlnsException with {@link AlnsException#REASON_INVALID_PARAMS} on violation.
     */
    public RecordToRecordTravelConfig validated() {
        if (mainTerminationCriterion == null) {
            throw invalid("mainTerminationCriterion must be provided");
        }
        if (iterationsLimit <= 0L) {
            throw invalid("iterationsLimit must be > 0, got " + iterationsLimit);
        }
        if (!Double.isFinite(timeLimitSec) || timeLimitSec <= 0.0d) {
            throw invalid("timeLimitSec must be finite and > 0, got " + timeLimitSec);
        }
        if (Double.isNaN(startThreshold) || startThreshold < 0.0d) {
            throw invalid("startThreshold must be >= 0, got " + startThreshold);
        }
        if (Double.isNaN(endThreshold) || endThreshold < 0.0d) {
            throw invalid("endThreshold must be >= 0, got " + endThreshold);
        }
        return this;
    }

    private static AlnsException invalid(String message) {
        return new AlnsException(AlnsException.REASON_INVALID_PARAMS, message);
    }
}
