package com.phillippitts.wfmparity.exception;

import java.util.UUID;

public class JobNotFoundException extends ParityException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
