package com.phillippitts.wfmparity.service.queue;

import com.phillippitts.wfmparity.config.properties.QueueProperties;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.domain.JobStatus;
import com.phillippitts.wfmparity.domain.JobSubmission;
import com.phillippitts.wfmparity.domain.JobTarget;
import com.phillippitts.wfmparity.exception.IllegalJobTransitionException;
import com.phillippitts.wfmparity.exception.InvalidJobInputException;
import com.phillippitts.wfmparity.exception.JobNotFoundException;
import com.phillippitts.wfmparity.repository.JobRepository;
import com.phillippitts.wfmparity.service.events.JobFailedEvent;
import com.phillippitts.wfmparity.service.metrics.ParityMetrics;
import com.phillippitts.wfmparity.testutil.EventCapturingPublisher;
import com.phillippitts.wfmparity.testutil.MutableClock;
import com.phillippitts.wfmparity.testutil.TestDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultJobQueueManagerTest {

    private static final JobTarget TARGET = new JobTarget("ACME", "billing");
    private static final Map<String, Object> INPUTS = Map.of("offered_calls", 120, "average_handle_time", 240);

    private EmbeddedDatabase db;
    private MutableClock clock;
    private EventCapturingPublisher events;
    private SimpleMeterRegistry registry;
    private DefaultJobQueueManager queue;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        events = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        queue = newQueue(new JobRepository(TestDatabase.jdbc(db)), "test-worker");
    }

    private DefaultJobQueueManager newQueue(JobRepository repository, String workerId) {
        QueueProperties props = new QueueProperties(null, 3, Duration.ofMinutes(10), Duration.ofSeconds(30),
                Duration.ofMinutes(30), 10, 2, workerId);
        return new DefaultJobQueueManager(repository, new JobInputValidator(), new RetryBackoffPolicy(props),
                props, events, new ParityMetrics(registry), clock);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void submitStoresPendingJobWithDefaults() {
        UUID id = queue.submit(JobSubmission.of(TARGET, "30m", INPUTS));

        Job job = queue.get(id);
        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.priority()).isEqualTo(3);
        assertThat(job.maxRetryCount()).isEqualTo(3);
        assertThat(job.retryCount()).isZero();
        assertThat(job.inputParameters().number("offered_calls", 0)).isEqualTo(120.0);
        assertThat(registry.find("wfmparity.jobs.submitted").counter().count()).isEqualTo(1.0);
    }

    @Test
    void invalidSubmissionIsNotStored() {
        assertThatThrownBy(() -> queue.submit(JobSubmission.of(TARGET, "30m", Map.of("offered_calls", 10))))
                .isInstanceOf(InvalidJobInputException.class);
        assertThat(queue.statusCounts(null).get(JobStatus.PENDING)).isZero();
    }

    @Test
    void unknownJobIsNotFound() {
        assertThatThrownBy(() -> queue.get(UUID.randomUUID())).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void claimsByPriorityThenAge() {
        UUID low = submit(1);
        clock.advance(Duration.ofSeconds(1));
        UUID highOld = submit(5);
        clock.advance(Duration.ofSeconds(1));
        UUID highNew = submit(5);

        List<Job> claimed = queue.claimNext(2);

        assertThat(claimed).extracting(Job::id).containsExactly(highOld, highNew);
        assertThat(claimed).allSatisfy(j -> {
            assertThat(j.status()).isEqualTo(JobStatus.RUNNING);
            assertThat(j.claimToken()).isNotNull();
            assertThat(j.claimedBy()).isEqualTo("test-worker");
            assertThat(j.leaseExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(10)));
        });
        assertThat(queue.claimNext(5)).extracting(Job::id).containsExactly(low);
        assertThat(queue.claimNext(5)).isEmpty();
    }

    @Test
    void failedAttemptIsRequeuedWithBackoff() {
        UUID id = submit(3);
        Job claimed = queue.claimNext(1).get(0);

        assertThat(queue.recordFailure(claimed, new IllegalStateException("boom"))).isEqualTo(FailureOutcome.REQUEUED);

        Job requeued = queue.get(id);
        assertThat(requeued.status()).isEqualTo(JobStatus.PENDING);
        assertThat(requeued.retryCount()).isEqualTo(1);
        assertThat(requeued.nextAttemptAt()).isEqualTo(clock.instant().plusSeconds(30));
        assertThat(requeued.errorMessage()).contains("boom");
        assertThat(queue.claimNext(1)).isEmpty();

        clock.advance(Duration.ofSeconds(30));
        assertThat(queue.claimNext(1)).extracting(Job::id).containsExactly(id);
    }

    @Test
    void exhaustedRetriesFailTheJobAndPublishEvent() {
        UUID id = submit(3);
        for (int attempt = 1; attempt <= 3; attempt++) {
            Job claimed = queue.claimNext(1).get(0);
            FailureOutcome outcome = queue.recordFailure(claimed, new IllegalStateException("attempt " + attempt));
            assertThat(outcome).isEqualTo(attempt < 3 ? FailureOutcome.REQUEUED : FailureOutcome.FAILED);
            clock.advance(Duration.ofMinutes(30));
        }

        Job failed = queue.get(id);
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.retryCount()).isEqualTo(3);
        assertThat(events.ofType(JobFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.attempts()).isEqualTo(3));
    }

    @Test
    void completedJobCannotBeCompletedOrFailedAgain() {
        submit(3);
        Job claimed = queue.claimNext(1).get(0);
        assertThat(queue.complete(claimed, UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID())).isTrue();

        Job completed = queue.get(claimed.id());
        assertThat(completed.status()).isEqualTo(JobStatus.COMPLETED);
        assertThatThrownBy(() -> queue.recordFailure(completed, new IllegalStateException("late")))
                .isInstanceOf(IllegalJobTransitionException.class);
        assertThat(queue.claimNext(1)).isEmpty();
    }

    @Test
    void reaperRequeuesExpiredLeaseAndFencesTheOldOwner() {
        UUID id = submit(3);
        Job stale = queue.claimNext(1).get(0);

        clock.advance(Duration.ofMinutes(11));
        assertThat(queue.reapExpiredLeases()).isEqualTo(1);

        Job reaped = queue.get(id);
        assertThat(reaped.status()).isEqualTo(JobStatus.PENDING);
        assertThat(reaped.errorMessage()).contains(DefaultJobQueueManager.LEASE_EXPIRED);

        clock.advance(Duration.ofMinutes(1));
        Job reclaimed = queue.claimNext(1).get(0);
        assertThat(reclaimed.claimToken()).isNotEqualTo(stale.claimToken());

        assertThat(queue.complete(stale, UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID())).isFalse();
        assertThat(queue.get(id).status()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void attachResultRequiresCurrentClaim() {
        UUID id = submit(3);
        Job claimed = queue.claimNext(1).get(0);
        UUID resultId = UUID.randomUUID();

        queue.attachResult(claimed, EngineVariant.REFERENCE, resultId);

        assertThat(queue.get(id).referenceResultId()).isEqualTo(resultId);
    }

    @Test
    void statusCountsCoverEveryStatus() {
        submit(3);
        submit(3);
        queue.claimNext(1);

        Map<JobStatus, Long> counts = queue.statusCounts("ACME");
        assertThat(counts).containsEntry(JobStatus.PENDING, 1L).containsEntry(JobStatus.RUNNING, 1L)
                .containsEntry(JobStatus.COMPLETED, 0L).containsEntry(JobStatus.FAILED, 0L);
        assertThat(queue.statusCounts("OTHER").get(JobStatus.PENDING)).isZero();
    }

    @Test
    void concurrentWorkersNeverClaimTheSameJob() throws Exception {
        int jobCount = 200;
        for (int i = 0; i < jobCount; i++) {
            submit(3);
        }
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<UUID>>> results = new ArrayList<>();
        for (int w = 0; w < workers; w++) {
            DefaultJobQueueManager worker = newQueue(new JobRepository(TestDatabase.jdbc(db)), "worker-" + w);
            results.add(pool.submit(() -> {
                start.await();
                List<UUID> mine = new ArrayList<>();
                List<Job> batch;
                while (!(batch = worker.claimNext(5)).isEmpty()) {
                    batch.forEach(j -> mine.add(j.id()));
                }
                return mine;
            }));
        }

        start.countDown();
        List<UUID> claimed = new ArrayList<>();
        for (Future<List<UUID>> result : results) {
            claimed.addAll(result.get(30, TimeUnit.SECONDS));
        }
        pool.shutdown();

        assertThat(claimed).hasSize(jobCount).doesNotHaveDuplicates();
        assertThat(queue.statusCounts(null)).containsEntry(JobStatus.RUNNING, (long) jobCount)
                .containsEntry(JobStatus.PENDING, 0L);
    }

    @Test
    void jobTakenBetweenLookupAndClaimIsSkipped() {
        UUID contested = submit(5);
        UUID free = submit(3);
        DefaultJobQueueManager rival = newQueue(new JobRepository(TestDatabase.jdbc(db)), "rival");
        JobRepository racing = new JobRepository(TestDatabase.jdbc(db)) {
            @Override
            public List<UUID> findClaimCandidates(Instant now, int limit) {
                List<UUID> candidates = super.findClaimCandidates(now, limit);
                rival.claimNext(1);
                return candidates;
            }
        };

        List<Job> claimed = newQueue(racing, "slow-worker").claimNext(2);

        assertThat(claimed).extracting(Job::id).containsExactly(free);
        assertThat(queue.get(contested).claimedBy()).isEqualTo("rival");
    }

    private UUID submit(int priority) {
        return queue.submit(new JobSubmission(null, TARGET, null, "30m", INPUTS, priority));
    }
}
