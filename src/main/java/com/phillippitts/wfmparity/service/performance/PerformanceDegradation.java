package com.phillippitts.wfmparity.service.performance;

import com.phillippitts.wfmparity.domain.EngineVariant;

/**
 * Latest execution time of an operation compared with its trailing average.
 */
public record PerformanceDegradation(
        String operationType,
        EngineVariant algorithm,
        long latestMs,
        double averageMs,
        double ratio
) {
}
