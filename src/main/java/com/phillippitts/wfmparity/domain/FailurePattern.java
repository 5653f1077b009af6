package com.phillippitts.wfmparity.domain;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A recurring failure mode. Identity is (pattern type, category, affected metrics); repeated
 * detections increment {@code occurrenceCount} instead of adding rows.
 *
 * @param occurrenceCount   number of mining passes that detected the pattern
 * @param windowSampleCount offending samples seen in the most recent detection window
 */
public record FailurePattern(
        UUID id,
        PatternType patternType,
        FailureCategory category,
        List<String> affectedMetrics,
        String businessUnit,
        String rootCause,
        Severity severity,
        int occurrenceCount,
        int windowSampleCount,
        ResolutionStatus resolutionStatus,
        String resolutionNote,
        Instant detectedAt,
        Instant lastOccurrence,
        Instant resolvedAt
) {

    public FailurePattern {
        affectedMetrics = affectedMetrics == null ? List.of() : List.copyOf(affectedMetrics);
    }
}
