package com.phillippitts.wfmparity.service.maintenance;

import java.time.Instant;

/**
 * Rows removed by one retention pass.
 */
public record CleanupSummary(
        Instant ranAt,
        int accuracyMetrics,
        int performanceSamples,
        int confidenceScores,
        int resolvedPatterns
) {

    public int total() {
        return accuracyMetrics + performanceSamples + confidenceScores + resolvedPatterns;
    }
}
