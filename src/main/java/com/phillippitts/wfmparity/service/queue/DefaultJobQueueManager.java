package com.phillippitts.wfmparity.service.queue;

import com.phillippitts.wfmparity.config.properties.QueueProperties;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.InputParameters;
import com.phillippitts.wfmparity.domain.IntervalType;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.domain.JobStatus;
import com.phillippitts.wfmparity.domain.JobSubmission;
import com.phillippitts.wfmparity.domain.JobType;
import com.phillippitts.wfmparity.exception.IllegalJobTransitionException;
import com.phillippitts.wfmparity.exception.JobNotFoundException;
import com.phillippitts.wfmparity.repository.JobRepository;
import com.phillippitts.wfmparity.service.events.JobFailedEvent;
import com.phillippitts.wfmparity.service.metrics.ParityMetrics;
import com.phillippitts.wfmparity.util.ErrorDetails;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * JDBC-backed {@link JobQueueManager}.
 *
 * <p>Claiming selects more candidates than requested and races for each with a conditional
 * update; losing a race to another worker just moves on to the next candidate.
 */
@Service
public class DefaultJobQueueManager implements JobQueueManager {
    private static final Logger LOG = LogManager.getLogger(DefaultJobQueueManager.class);

    static final String LEASE_EXPIRED = "lease expired";

    private final JobRepository jobs;
    private final JobInputValidator validator;
    private final RetryBackoffPolicy backoff;
    private final QueueProperties properties;
    private final ApplicationEventPublisher publisher;
    private final ParityMetrics metrics;
    private final Clock clock;

    public DefaultJobQueueManager(JobRepository jobs,
                                  JobInputValidator validator,
                                  RetryBackoffPolicy backoff,
                                  QueueProperties properties,
                                  ApplicationEventPublisher publisher,
                                  ParityMetrics metrics,
                                  Clock clock) {
        this.jobs = Objects.requireNonNull(jobs);
        this.validator = Objects.requireNonNull(validator);
        this.backoff = Objects.requireNonNull(backoff);
        this.properties = Objects.requireNonNull(properties);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public UUID submit(JobSubmission submission) {
        Objects.requireNonNull(submission, "submission must not be null");
        validator.validate(submission);

        JobType type = validator.resolveType(submission);
        Instant now = clock.instant();
        LocalDate date = submission.calculationDate() != null
                ? submission.calculationDate()
                : LocalDate.ofInstant(now, clock.getZone());
        int priority = submission.priority() != null ? submission.priority() : properties.getDefaultPriority();

        Job job = new Job(UUID.randomUUID(), type, submission.target(), date,
                IntervalType.fromCode(submission.intervalType()),
                InputParameters.of(submission.inputParameters()),
                JobStatus.PENDING, priority, 0, properties.getMaxRetryCount(), now,
                null, null, null, null, null, null, null, null, null, null, null);
        jobs.insert(job);
        metrics.recordSubmitted(type);
        LOG.info("Submitted job {} type={} target={} date={} priority={}",
                job.id(), type, job.target(), date, priority);
        return job.id();
    }

    @Override
    public List<Job> claimNext(int batchSize) {
        if (batchSize <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        Instant leaseExpires = now.plus(properties.getLeaseDuration());
        List<UUID> candidates = jobs.findClaimCandidates(now, batchSize * properties.getClaimOverfetchFactor());

        List<Job> claimed = new ArrayList<>(batchSize);
        for (UUID id : candidates) {
            if (claimed.size() >= batchSize) {
                break;
            }
            UUID token = UUID.randomUUID();
            if (jobs.tryClaim(id, properties.getWorkerId(), token, now, leaseExpires)) {
                jobs.findById(id)
                        .filter(j -> token.equals(j.claimToken()))
                        .ifPresent(claimed::add);
            } else {
                LOG.debug("Lost claim race for job {}", id);
            }
        }
        if (!claimed.isEmpty()) {
            LOG.info("Claimed {} job(s) as {}", claimed.size(), properties.getWorkerId());
        }
        return claimed;
    }

    @Override
    public Job get(UUID jobId) {
        return jobs.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    public Map<JobStatus, Long> statusCounts(String projectCode) {
        return jobs.countByStatus(projectCode);
    }

    @Override
    public void attachResult(Job claimed, EngineVariant variant, UUID resultId) {
        if (!jobs.attachResult(claimed.id(), claimed.claimToken(), variant, resultId)) {
            LOG.warn("Could not attach {} result {} to job {}: claim no longer held",
                    variant.tag(), resultId, claimed.id());
        }
    }

    @Override
    public boolean complete(Job claimed, UUID referenceResultId, UUID candidateResultId, UUID comparisonId) {
        requireTransition(claimed, JobStatus.COMPLETED);
        boolean done = jobs.complete(claimed.id(), claimed.claimToken(),
                referenceResultId, candidateResultId, comparisonId, clock.instant());
        if (done) {
            metrics.recordCompleted();
            LOG.info("Job {} completed (comparison {})", claimed.id(), comparisonId);
        } else {
            LOG.warn("Job {} finished after its claim was lost; completion discarded", claimed.id());
        }
        return done;
    }

    @Override
    public FailureOutcome recordFailure(Job claimed, Throwable error) {
        return claimed.retriesLeft() ? requeue(claimed, error) : fail(claimed, error);
    }

    @Override
    public FailureOutcome failPermanently(Job claimed, Throwable error) {
        return fail(claimed, error);
    }

    @Override
    public int reapExpiredLeases() {
        Instant now = clock.instant();
        int reaped = 0;
        for (Job job : jobs.findExpiredLeases(now, properties.getBatchSize())) {
            LOG.warn("Lease of job {} held by {} expired at {}", job.id(), job.claimedBy(), job.leaseExpiresAt());
            if (recordFailure(job, new IllegalStateException(LEASE_EXPIRED)) != FailureOutcome.CLAIM_LOST) {
                reaped++;
            }
        }
        return reaped;
    }

    private FailureOutcome requeue(Job claimed, Throwable error) {
        requireTransition(claimed, JobStatus.PENDING);
        int retryCount = claimed.retryCount() + 1;
        Duration delay = backoff.delayFor(retryCount);
        Instant nextAttempt = clock.instant().plus(delay);
        boolean written = jobs.requeue(claimed.id(), claimed.claimToken(), retryCount, nextAttempt,
                ErrorDetails.message(error), ErrorDetails.describe(error));
        if (!written) {
            LOG.warn("Job {} could not be requeued: claim no longer held", claimed.id());
            return FailureOutcome.CLAIM_LOST;
        }
        metrics.recordRetry();
        LOG.warn("Job {} attempt {} failed, retrying in {}s: {}",
                claimed.id(), retryCount, delay.toSeconds(), ErrorDetails.message(error));
        return FailureOutcome.REQUEUED;
    }

    private FailureOutcome fail(Job claimed, Throwable error) {
        requireTransition(claimed, JobStatus.FAILED);
        int retryCount = claimed.retryCount() + 1;
        Instant now = clock.instant();
        String message = ErrorDetails.message(error);
        boolean written = jobs.fail(claimed.id(), claimed.claimToken(), retryCount, now,
                message, ErrorDetails.describe(error));
        if (!written) {
            LOG.warn("Job {} could not be failed: claim no longer held", claimed.id());
            return FailureOutcome.CLAIM_LOST;
        }
        metrics.recordFailed();
        LOG.error("Job {} failed permanently after {} attempt(s): {}", claimed.id(), retryCount, message);
        publisher.publishEvent(new JobFailedEvent(claimed.id(), claimed.target(), retryCount, message, now));
        return FailureOutcome.FAILED;
    }

    private static void requireTransition(Job job, JobStatus to) {
        if (!job.status().canTransitionTo(to)) {
            throw new IllegalJobTransitionException(job.id(), job.status(), to);
        }
    }
}
