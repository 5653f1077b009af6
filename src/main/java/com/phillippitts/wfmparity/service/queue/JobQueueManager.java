package com.phillippitts.wfmparity.service.queue;

import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.domain.JobStatus;
import com.phillippitts.wfmparity.domain.JobSubmission;
import com.phillippitts.wfmparity.exception.IllegalJobTransitionException;
import com.phillippitts.wfmparity.exception.InvalidJobInputException;
import com.phillippitts.wfmparity.exception.JobNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persistent work queue for comparison jobs.
 *
 * <p>Claims are atomic: a job is handed to exactly one worker, which holds it under a lease
 * identified by the job's claim token. Every state change after the claim is conditional on
 * that token, so a worker whose lease was reaped cannot overwrite the new owner's state.
 *
 * <p>Thread Safety: implementations are safe for concurrent use by several workers and
 * several processes sharing the database.
 */
public interface JobQueueManager {

    /**
     * Validates and enqueues a job as PENDING.
     *
     * @return id of the new job
     * @throws InvalidJobInputException if required inputs are missing or malformed
     */
    UUID submit(JobSubmission submission);

    /**
     * Claims up to {@code batchSize} due jobs, highest priority first then oldest first.
     *
     * @return claimed jobs, RUNNING with a fresh claim token and lease
     */
    List<Job> claimNext(int batchSize);

    /**
     * @throws JobNotFoundException if no such job exists
     */
    Job get(UUID jobId);

    /**
     * Job counts for every status, optionally for one project only.
     */
    Map<JobStatus, Long> statusCounts(String projectCode);

    /**
     * Records a persisted engine result on the claimed job.
     */
    void attachResult(Job claimed, EngineVariant variant, UUID resultId);

    /**
     * Marks a claimed job COMPLETED.
     *
     * @return false if the claim was lost before completion
     * @throws IllegalJobTransitionException if the job is not RUNNING
     */
    boolean complete(Job claimed, UUID referenceResultId, UUID candidateResultId, UUID comparisonId);

    /**
     * Records a failed attempt: requeues with backoff while retries are left, otherwise fails.
     */
    FailureOutcome recordFailure(Job claimed, Throwable error);

    /**
     * Fails a claimed job without retry.
     */
    FailureOutcome failPermanently(Job claimed, Throwable error);

    /**
     * Treats RUNNING jobs whose lease has expired as failed attempts.
     *
     * @return number of jobs requeued or failed
     */
    int reapExpiredLeases();
}
