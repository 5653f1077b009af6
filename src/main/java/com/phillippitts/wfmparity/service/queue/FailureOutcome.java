package com.phillippitts.wfmparity.service.queue;

/**
 * What happened to a job after a failed attempt was recorded.
 */
public enum FailureOutcome {
    /** Back to PENDING with a backoff delay. */
    REQUEUED,
    /** Retries exhausted or not retryable; job is FAILED. */
    FAILED,
    /** The claim was no longer ours (lease reaped), nothing was written. */
    CLAIM_LOST
}
