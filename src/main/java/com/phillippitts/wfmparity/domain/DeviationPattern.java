package com.phillippitts.wfmparity.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Running deviation statistics for a (scenario, metric, business unit) key.
 */
public record DeviationPattern(
        UUID id,
        ScenarioType scenarioType,
        String metricType,
        String businessUnit,
        double averageDeviation,
        double standardDeviation,
        double minDeviation,
        double maxDeviation,
        int sampleCount,
        double confidenceIntervalLower,
        double confidenceIntervalUpper,
        Instant lastUpdated
) {
}
