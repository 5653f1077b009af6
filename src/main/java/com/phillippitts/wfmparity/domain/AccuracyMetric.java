package com.phillippitts.wfmparity.domain;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only accuracy sample.
 */
public record AccuracyMetric(
        UUID id,
        Instant measuredAt,
        String businessUnit,
        String projectCode,
        String intervalType,
        String metricType,
        Double referenceValue,
        Double candidateValue,
        Double absoluteDifference,
        Double percentageDifference,
        double confidenceScore,
        double dataQualityScore,
        boolean outlier,
        String sourceFile,
        String failureReason,
        Map<String, Object> metadata
) {

    public AccuracyMetric {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
