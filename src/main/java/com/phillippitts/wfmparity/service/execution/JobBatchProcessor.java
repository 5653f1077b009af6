package com.phillippitts.wfmparity.service.execution;

import com.phillippitts.wfmparity.domain.ComparisonResult;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.exception.CalculationException;
import com.phillippitts.wfmparity.exception.ComparisonException;
import com.phillippitts.wfmparity.service.accuracy.AccuracyTracker;
import com.phillippitts.wfmparity.service.compare.ComparisonService;
import com.phillippitts.wfmparity.service.events.ComparisonSkippedEvent;
import com.phillippitts.wfmparity.service.execution.ParallelCalculationService.ResultPair;
import com.phillippitts.wfmparity.service.queue.FailureOutcome;
import com.phillippitts.wfmparity.service.queue.JobQueueManager;
import com.phillippitts.wfmparity.util.ErrorDetails;
import com.phillippitts.wfmparity.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Drives claimed jobs through calculation, comparison and accuracy tracking.
 *
 * <p>Pipeline per job:
 * <ol>
 *   <li><b>Calculate:</b> both engines in parallel; results of an earlier attempt are reused</li>
 *   <li><b>Compare:</b> exactly once per job, when both results exist</li>
 *   <li><b>Complete:</b> guarded by the job's claim token</li>
 *   <li><b>Track:</b> the comparison feeds the accuracy log; a tracking failure does not undo completion</li>
 * </ol>
 *
 * <p><b>Error Handling:</b> an engine failure counts as a failed attempt and is retried with
 * backoff. A missing side at comparison time fails the job outright and raises an operator
 * alert. Errors of one job never abort the rest of the batch.
 */
@Service
public class JobBatchProcessor {
    private static final Logger LOG = LogManager.getLogger(JobBatchProcessor.class);

    static final String JOB_ID_KEY = "jobId";

    private final JobQueueManager queue;
    private final ParallelCalculationService calculation;
    private final ComparisonService comparisons;
    private final AccuracyTracker tracker;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public JobBatchProcessor(JobQueueManager queue,
                             ParallelCalculationService calculation,
                             ComparisonService comparisons,
                             AccuracyTracker tracker,
                             ApplicationEventPublisher publisher,
                             Clock clock) {
        this.queue = Objects.requireNonNull(queue);
        this.calculation = Objects.requireNonNull(calculation);
        this.comparisons = Objects.requireNonNull(comparisons);
        this.tracker = Objects.requireNonNull(tracker);
        this.publisher = Objects.requireNonNull(publisher);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Claims up to {@code batchSize} due jobs and processes them one after another.
     */
    public BatchSummary processPendingJobs(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        List<Job> claimed = queue.claimNext(batchSize);
        if (claimed.isEmpty()) {
            return BatchSummary.empty();
        }

        int succeeded = 0;
        long totalMs = 0;
        for (Job job : claimed) {
            long t0 = System.nanoTime();
            ThreadContext.put(JOB_ID_KEY, job.id().toString());
            try {
                if (process(job)) {
                    succeeded++;
                }
            } catch (RuntimeException e) {
                LOG.error("Unexpected error while handling job {}", job.id(), e);
            } finally {
                totalMs += TimeUtils.elapsedMillis(t0);
                ThreadContext.remove(JOB_ID_KEY);
            }
        }

        BatchSummary summary = new BatchSummary(claimed.size(), succeeded, claimed.size() - succeeded,
                (double) totalMs / claimed.size());
        LOG.info("Processed {} job(s): {} succeeded, {} failed, avg {} ms", summary.processed(),
                summary.succeeded(), summary.failed(), Math.round(summary.avgExecutionTimeMs()));
        return summary;
    }

    private boolean process(Job job) {
        ResultPair pair = null;
        try {
            pair = calculation.calculateBoth(job);
            if (!pair.complete()) {
                throw new CalculationException(describe(pair.failures()));
            }
            ComparisonResult comparison = comparisons.compare(job.id());
            if (!queue.complete(job, pair.reference().id(), pair.candidate().id(), comparison.id())) {
                LOG.warn("Claim on job {} was lost before completion", job.id());
                return false;
            }
            track(job, comparison);
            return true;
        } catch (ComparisonException ce) {
            LOG.warn("Comparison skipped for job {}: {}", job.id(), ce.getMessage());
            queue.failPermanently(job, ce);
            publisher.publishEvent(new ComparisonSkippedEvent(job.id(), pair == null ? null : pair.survivor(),
                    ErrorDetails.message(ce), clock.instant()));
            return false;
        } catch (RuntimeException e) {
            FailureOutcome outcome = queue.recordFailure(job, e);
            LOG.warn("Attempt {} of job {} failed ({}): {}", job.retryCount() + 1, job.id(), outcome,
                    ErrorDetails.message(e));
            EngineVariant survivor = pair == null ? null : pair.survivor();
            if (outcome == FailureOutcome.FAILED && survivor != null) {
                publisher.publishEvent(new ComparisonSkippedEvent(job.id(), survivor,
                        "retries exhausted with only the " + survivor.tag() + " result", clock.instant()));
            }
            return false;
        }
    }

    private void track(Job job, ComparisonResult comparison) {
        try {
            tracker.consumeComparison(job, comparison);
        } catch (RuntimeException e) {
            LOG.error("Accuracy tracking failed for completed job {}", job.id(), e);
        }
    }

    private static String describe(Map<EngineVariant, String> failures) {
        if (failures.isEmpty()) {
            return "engine results incomplete";
        }
        return new TreeMap<>(failures).entrySet().stream()
                .map(e -> e.getKey().tag() + ": " + e.getValue())
                .collect(Collectors.joining("; "));
    }
}
