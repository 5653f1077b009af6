package com.phillippitts.wfmparity.exception;

import java.util.UUID;

/**
 * Thrown when a job cannot be compared because one side's result does not exist.
 */
public class ComparisonException extends ParityException {

    private final UUID jobId;

    public ComparisonException(UUID jobId, String reason) {
        super("Comparison skipped for job " + jobId + ": " + reason);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
