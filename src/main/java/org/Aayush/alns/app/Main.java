package org.Aayush.alns.app;

import org.Aayush.alns.acceptance.LinearRecordToRecordTravel;
import org.Aayush.alns.acceptance.MainTerminationCriterion;
import org.Aayush.alns.acceptance.RecordToRecordTravelConfig;
import org.Aayush.alns.config.AlnsConfigLoader;
import org.Aayush.alns.core.AlgorithmParams;
import org.Aayush.alns.core.AlgorithmStatus;
import org.Aayush.alns.core.AlnsSolver;
import org.Aayush.alns.solution.AlnsSolution;
import org.Aayush.alns.visitor.ProgressLoggingVisitor;

import java.nio.file.Path;
import java.util.SplittableRandom;

/**
 * Smoke run of the ALNS engine on a one-dimensional price random walk.
 *
 * <p>The destroy method raises the price by a uniform amount in [0, 1), the repair method
 * lowers it by another one. Usage: {@code Main [config.json]}; without a file the built-in
 * defaults are used with a 10,000-iteration record-to-record travel schedule.</p>
 */
public class Main {
    static final double INITIAL_PRICE = 100.0d;
    static final long ITERATIONS = 10_000L;
    static final long LOG_EVERY = 1_000L;

    /**
     * Runs the sample search and prints the best price found.
     *
     * @param args optional JSON configuration path.
     */
    public static void main(String[] args) {
        AlgorithmParams params;
        RecordToRecordTravelConfig acceptanceConfig;
        if (args.length > 0) {
            Path configFile = Path.of(args[0]);
            params = AlnsConfigLoader.loadParams(configFile);
            acceptanceConfig = AlnsConfigLoader.loadRecordToRecordTravel(configFile);
        } else {
            params = AlgorithmParams.defaults();
            acceptanceConfig = RecordToRecordTravelConfig.builder()
                    .mainTerminationCriterion(MainTerminationCriterion.ITERATIONS)
                    .iterationsLimit(ITERATIONS)
                    .startThreshold(0.05d)
                    .endThreshold(0.0d)
                    .build();
        }

        AlgorithmStatus<Price> status = run(params, acceptanceConfig, 1L);
        System.out.println("iterations = " + (status.getIterationNumber() + 1));
        System.out.println("best price = " + status.getBestSolution().cost());
    }

    static AlgorithmStatus<Price> run(AlgorithmParams params, RecordToRecordTravelConfig acceptanceConfig, long seed) {
        AlnsSolver<Price> solver = new AlnsSolver<>(params, new Price(INITIAL_PRICE), seed);
        solver.setAcceptanceCriterion(new LinearRecordToRecordTravel<>(acceptanceConfig));
        solver.setVisitor(ProgressLoggingVisitor.iterationLimited(LOG_EVERY, acceptanceConfig.getIterationsLimit()));

        SplittableRandom destroyRandom = new SplittableRandom(seed + 1L);
        SplittableRandom repairRandom = new SplittableRandom(seed + 2L);
        solver.addDestroyMethod(price -> price.value += destroyRandom.nextDouble());
        solver.addRepairMethod(price -> price.value -= repairRandom.nextDouble());
        return solver.solve();
    }

    /**
     * Single-valued sample solution.
     */
    static final class Price implements AlnsSolution<Price> {
        double value;

        Price(double value) {
            this.value = value;
        }

        @Override
        public double cost() {
            return value;
        }

        @Override
        public Price copy() {
            return new Price(value);
        }
    }
}
