package com.phillippitts.wfmparity.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A data-quality problem found in an input source, logged by ingestion or by the tracker.
 */
public record DataQualityIssue(
        UUID id,
        String sourceFile,
        String issueType,
        String columnName,
        int rowCount,
        IssueSeverity severity,
        String impactDescription,
        boolean autoCorrected,
        String correctionApplied,
        Instant detectedAt
) {

    public DataQualityIssue {
        Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        Objects.requireNonNull(issueType, "issueType must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }
}
