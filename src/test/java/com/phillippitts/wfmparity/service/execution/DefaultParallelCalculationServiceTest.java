package com.phillippitts.wfmparity.service.execution;

import com.phillippitts.wfmparity.config.properties.ComparisonProperties;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.service.execution.ParallelCalculationService.ResultPair;
import com.phillippitts.wfmparity.testutil.FakeStaffingCalculator;
import com.phillippitts.wfmparity.testutil.ParityFixture;
import com.phillippitts.wfmparity.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultParallelCalculationServiceTest {

    private final ParityFixture fx = new ParityFixture();
    private final FakeStaffingCalculator reference = new FakeStaffingCalculator(EngineVariant.REFERENCE, 25, 85.5);
    private final FakeStaffingCalculator candidate = new FakeStaffingCalculator(EngineVariant.CANDIDATE, 26, 84.2);

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private DefaultParallelCalculationService service(Executor executor, ComparisonProperties properties) {
        return new DefaultParallelCalculationService(reference, candidate, executor, fx.resultRepository,
                fx.queue, fx.performance, fx.metrics, properties);
    }

    @Test
    void bothEnginesSucceed() {
        Job job = fx.submitAndClaim();

        ResultPair pair = service(new SyncExecutor(), fx.comparisonProperties).calculateBoth(job);

        assertThat(pair.complete()).isTrue();
        assertThat(pair.failures()).isEmpty();
        assertThat(pair.reference().metrics().agentsRequired()).isEqualTo(25);
        assertThat(pair.candidate().metrics().agentsRequired()).isEqualTo(26);

        Job stored = fx.queue.get(job.id());
        assertThat(stored.referenceResultId()).isEqualTo(pair.reference().id());
        assertThat(stored.candidateResultId()).isEqualTo(pair.candidate().id());
        assertThat(fx.count("performance_samples")).isEqualTo(2);
        assertThat(fx.registry.find("wfmparity.engine.latency").tag("engine", "reference").timer().count())
                .isEqualTo(1L);
    }

    @Test
    void survivingResultIsPersistedWhenOtherEngineFails() {
        candidate.failing();
        Job job = fx.submitAndClaim();

        ResultPair pair = service(new SyncExecutor(), fx.comparisonProperties).calculateBoth(job);

        assertThat(pair.complete()).isFalse();
        assertThat(pair.survivor()).isEqualTo(EngineVariant.REFERENCE);
        assertThat(pair.failures()).containsOnlyKeys(EngineVariant.CANDIDATE);
        assertThat(pair.failures().get(EngineVariant.CANDIDATE)).contains("simulated failure");
        assertThat(fx.resultRepository.find(job.id(), EngineVariant.REFERENCE)).isPresent();
        assertThat(fx.registry.find("wfmparity.engine.failure").tag("reason", "calculation").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void retryReusesPersistedResult() {
        candidate.failing();
        Job job = fx.submitAndClaim();
        DefaultParallelCalculationService service = service(new SyncExecutor(), fx.comparisonProperties);
        ResultPair first = service.calculateBoth(job);

        candidate.recovering();
        ResultPair second = service.calculateBoth(job);

        assertThat(second.complete()).isTrue();
        assertThat(second.reference().id()).isEqualTo(first.reference().id());
        assertThat(reference.calls()).isEqualTo(1);
        assertThat(candidate.calls()).isEqualTo(2);
    }

    @Test
    void slowEngineTimesOut() {
        candidate.withDelay(2_000);
        Job job = fx.submitAndClaim();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            ResultPair pair = service(pool, new ComparisonProperties(null, null, null, 200L)).calculateBoth(job);

            assertThat(pair.reference()).isNotNull();
            assertThat(pair.candidate()).isNull();
            assertThat(pair.failures().get(EngineVariant.CANDIDATE)).contains("timed out");
        } finally {
            pool.shutdownNow();
        }
    }
}
