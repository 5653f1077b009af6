package com.phillippitts.wfmparity.presentation.dto;

import com.phillippitts.wfmparity.domain.DataQualityIssue;
import com.phillippitts.wfmparity.domain.IssueSeverity;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/v1/accuracy/data-quality-issues}. Severity defaults to WARNING and
 * row count to 1.
 */
public record DataQualityIssueRequest(
        @NotBlank(message = "source_file is required") String sourceFile,
        @NotBlank(message = "issue_type is required") String issueType,
        String columnName,
        @Min(value = 1, message = "row_count must be positive") Integer rowCount,
        String severity,
        String impactDescription,
        Boolean autoCorrected,
        String correctionApplied
) {

    /**
     * @throws IllegalArgumentException if the severity names no known level
     */
    public DataQualityIssue toIssue() {
        return new DataQualityIssue(null, sourceFile, issueType, columnName, rowCount == null ? 1 : rowCount,
                IssueSeverity.fromCode(severity), impactDescription, Boolean.TRUE.equals(autoCorrected),
                correctionApplied, null);
    }
}
