package org.Aayush.alns.core;

import org.Aayush.alns.acceptance.RecordToRecordTravelConfig;
import org.Aayush.alns.config.AlnsConfigLoader;
import org.Aayush.alns.testutil.CostSolution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.json.JSONException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AlnsException Tests")
class AlnsExceptionTest {

    private static AlnsException expectEngineFailure(String reasonCode, Executable action) {
        AlnsException ex = assertThrows(AlnsException.class, action);
        assertEquals(reasonCode, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[" + reasonCode + "] "), ex.getMessage());
        return ex;
    }

    @Nested
    @DisplayName("1. Engine Failure Modes")
    class FailureModeTests {

        @Test
        @DisplayName("Empty solver reports the destroy pool before the repair pool")
        void testMissingOperatorsReportedInOrder() {
            AlnsSolver<CostSolution> solver = new AlnsSolver<>(AlgorithmParams.defaults(), new CostSolution(5.0), 1L);

            expectEngineFailure(AlnsException.REASON_NO_DESTROY_METHODS, solver::solve);

            solver.addDestroyMethod(s -> s.add(1.0));
            expectEngineFailure(AlnsException.REASON_NO_REPAIR_METHODS, solver::solve);
        }

        @Test
        @DisplayName("Invalid score parameters and acceptance schedules share one reason code")
        void testInvalidParamsReasonCode() {
            AlgorithmParams badDecay = AlgorithmParams.builder().scoreDecay(1.0).build();
            RecordToRecordTravelConfig badLimit = RecordToRecordTravelConfig.builder().iterationsLimit(0L).build();

            expectEngineFailure(AlnsException.REASON_INVALID_PARAMS, badDecay::validated);
            expectEngineFailure(AlnsException.REASON_INVALID_PARAMS, badLimit::validated);
        }

        @Test
        @DisplayName("Malformed configuration keeps the parser failure as its cause")
        void testConfigUnreadableKeepsCause() {
            AlnsException ex = expectEngineFailure(
                    AlnsException.REASON_CONFIG_UNREADABLE,
                    () -> AlnsConfigLoader.parseRecordToRecordTravel("{\"acceptance\": ")
            );

            assertInstanceOf(JSONException.class, ex.getCause());
        }

        @Test
        @DisplayName("Operator failures are not wrapped in an engine failure")
        void testUserFailuresAreNotWrapped() {
            AlnsSolver<CostSolution> solver = new AlnsSolver<>(AlgorithmParams.defaults(), new CostSolution(5.0), 1L);
            IllegalArgumentException failure = new IllegalArgumentException("bad move");
            AtomicInteger repairs = new AtomicInteger();
            solver.addDestroyMethod(s -> {
                throw failure;
            });
            solver.addRepairMethod(s -> repairs.incrementAndGet());

            assertSame(failure, assertThrows(IllegalArgumentException.class, solver::solve));
            assertEquals(0, repairs.get());
        }

        @Test
        @DisplayName("Reason codes are distinct and carry the engine prefix")
        void testReasonCodesAreDistinct() {
            List<String> codes = List.of(
                    AlnsException.REASON_NO_DESTROY_METHODS,
                    AlnsException.REASON_NO_REPAIR_METHODS,
                    AlnsException.REASON_INVALID_PARAMS,
                    AlnsException.REASON_CONFIG_UNREADABLE
            );
            List<String> seen = new ArrayList<>();
            for (String code : codes) {
                assertTrue(code.startsWith("ALNS_"), code);
                assertFalse(seen.contains(code), "duplicate reason code " + code);
                seen.add(code);
            }
        }
    }

    @Nested
    @DisplayName("2. Construction")
    class ConstructionTests {

        @ParameterizedTest
        @ValueSource(strings = {"ALNS_NO_DESTROY_METHODS", "ALNS_INVALID_PARAMS"})
        @DisplayName("Message is prefixed with the bracketed reason code")
        void testMessagePrefix(String reasonCode) {
            IllegalStateException cause = new IllegalStateException("io");
            AlnsException ex = new AlnsException(reasonCode, "details", cause);

            assertEquals("[" + reasonCode + "] details", ex.getMessage());
            assertSame(cause, ex.getCause());
            assertNotSame(ex, ex.getCause());
        }

        @Test
        @DisplayName("Blank or missing reason codes are rejected")
        void testBlankReasonCodeRejected() {
            assertThrows(IllegalArgumentException.class, () -> new AlnsException(" ", "details"));
            assertThrows(NullPointerException.class, () -> new AlnsException(null, "details"));
            assertThrows(NullPointerException.class, () -> new AlnsException("ALNS_INVALID_PARAMS", null));
        }
    }
}
