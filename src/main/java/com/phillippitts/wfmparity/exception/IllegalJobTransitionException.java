package com.phillippitts.wfmparity.exception;

import com.phillippitts.wfmparity.domain.JobStatus;

import java.util.UUID;

/**
 * Thrown when a job state change would violate the job lifecycle.
 */
public class IllegalJobTransitionException extends ParityException {

    private final UUID jobId;
    private final JobStatus from;
    private final JobStatus to;

    public IllegalJobTransitionException(UUID jobId, JobStatus from, JobStatus to) {
        super("Illegal transition for job " + jobId + ": " + from + " -> " + to);
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public UUID getJobId() {
        return jobId;
    }

    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }
}
