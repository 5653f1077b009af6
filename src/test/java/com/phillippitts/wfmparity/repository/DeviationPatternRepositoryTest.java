package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.DeviationPattern;
import com.phillippitts.wfmparity.domain.ScenarioType;
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
import static org.assertj.core.api.Assertions.within;

class DeviationPatternRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private EmbeddedDatabase db;
    private DeviationPatternRepository patterns;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        patterns = new DeviationPatternRepository(TestDatabase.jdbc(db));
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void firstSampleCreatesPatternAndLaterSamplesFoldIn() {
        patterns.accumulate(ScenarioType.AGENT_CALCULATION, "agents_required", "ACME", 4.0, NOW);
        patterns.accumulate(ScenarioType.AGENT_CALCULATION, "agents_required", "ACME", 8.0, NOW);
        DeviationPattern p = patterns.accumulate(ScenarioType.AGENT_CALCULATION, "agents_required", "ACME", 3.0, NOW);

        assertThat(p.sampleCount()).isEqualTo(3);
        assertThat(p.averageDeviation()).isCloseTo(5.0, within(1e-9));
        assertThat(p.minDeviation()).isEqualTo(3.0);
        assertThat(p.maxDeviation()).isEqualTo(8.0);
    }

    @Test
    void concurrentSamplesOnOneKeyAreNotLost() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> done = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            // half the threads report 2.0, the other half 5.0
            double deviation = t % 2 == 0 ? 2.0 : 5.0;
            done.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    patterns.accumulate(ScenarioType.SERVICE_LEVEL, "service_level", "ACME", deviation, NOW);
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> f : done) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        DeviationPattern p = patterns.find(ScenarioType.SERVICE_LEVEL, "service_level", "ACME").orElseThrow();
        assertThat(p.sampleCount()).isEqualTo(threads * perThread);
        assertThat(p.averageDeviation()).isCloseTo(3.5, within(1e-6));
        assertThat(p.minDeviation()).isEqualTo(2.0);
        assertThat(p.maxDeviation()).isEqualTo(5.0);
        assertThat(patterns.findAll("ACME")).hasSize(1);
    }
}
