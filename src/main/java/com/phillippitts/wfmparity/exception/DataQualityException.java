package com.phillippitts.wfmparity.exception;

/**
 * Signals a non-fatal data-quality problem. Callers lower the confidence score and log an
 * issue instead of failing.
 */
public class DataQualityException extends ParityException {

    private final String issueType;

    public DataQualityException(String issueType, String message) {
        super(message);
        this.issueType = issueType;
    }

    public String getIssueType() {
        return issueType;
    }
}
