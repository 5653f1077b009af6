package com.phillippitts.wfmparity.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Timing and resource sample for a single engine execution.
 */
public record PerformanceSample(
        UUID id,
        UUID jobId,
        EngineVariant algorithm,
        String operationType,
        long initializationMs,
        long dataPreparationMs,
        long calculationMs,
        long resultStorageMs,
        long totalExecutionMs,
        long memoryUsedBytes,
        int iterationCount,
        boolean convergenceAchieved,
        Instant recordedAt
) {
}
