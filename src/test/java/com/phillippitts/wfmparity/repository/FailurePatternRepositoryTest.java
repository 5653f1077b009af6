package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.FailurePattern;
import com.phillippitts.wfmparity.domain.PatternDetection;
import com.phillippitts.wfmparity.domain.PatternType;
import com.phillippitts.wfmparity.domain.ResolutionStatus;
import com.phillippitts.wfmparity.domain.Severity;
import com.phillippitts.wfmparity.testutil.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FailurePatternRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private EmbeddedDatabase db;
    private FailurePatternRepository patterns;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        patterns = new FailurePatternRepository(TestDatabase.jdbc(db));
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    private static PatternDetection detection(List<String> metrics) {
        return new PatternDetection(PatternType.HIGH_DEVIATION, metrics, "ACME",
                "sustained deviation", Severity.MEDIUM, 6);
    }

    @Test
    void metricOrderDoesNotSplitTheKey() {
        patterns.record(detection(List.of("occupancy", "agents_required")), NOW);
        FailurePattern p = patterns.record(detection(List.of("agents_required", "occupancy")), NOW);

        assertThat(p.occurrenceCount()).isEqualTo(2);
        assertThat(patterns.findActive()).hasSize(1);
    }

    @Test
    void concurrentDetectionsOfOnePatternAreAllCounted() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> done = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            done.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    patterns.record(detection(List.of("agents_required")), NOW);
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> f : done) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        FailurePattern p = patterns.findByKey(PatternType.HIGH_DEVIATION, "agents_required").orElseThrow();
        assertThat(p.occurrenceCount()).isEqualTo(threads * perThread);
        assertThat(p.resolutionStatus()).isEqualTo(ResolutionStatus.OPEN);
        assertThat(patterns.findActive()).hasSize(1);
    }
}
