package com.phillippitts.wfmparity.testutil;

import com.phillippitts.wfmparity.domain.CalculationResult;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.ExecutionUsage;
import com.phillippitts.wfmparity.domain.InputParameters;
import com.phillippitts.wfmparity.domain.StaffingMetrics;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Builders for calculation results with only the figures a test cares about.
 */
public final class TestResults {

    private TestResults() {}

    public static CalculationResult result(UUID jobId, EngineVariant variant, int agents, double serviceLevel) {
        return result(jobId, variant, agents, serviceLevel, Map.of());
    }

    public static CalculationResult result(UUID jobId, EngineVariant variant, int agents, double serviceLevel,
                                           Map<String, Double> skillCoverage) {
        StaffingMetrics metrics = new StaffingMetrics(100.0, 95.0, 5.0, serviceLevel, 12.0, 180.0, agents,
                85.0, 68.0);
        return new CalculationResult(UUID.randomUUID(), jobId, variant,
                variant == EngineVariant.REFERENCE ? "argus_v2.5" : "wfm_enterprise_v1.0",
                Instant.parse("2026-03-02T10:00:00Z"),
                InputParameters.of(Map.of("offered_calls", 100, "average_handle_time", 180)),
                metrics, skillCoverage, 10.0, 0.05, 0.2, 0.0,
                new ExecutionUsage(12, 1024, 3, true));
    }
}
