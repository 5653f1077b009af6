package com.phillippitts.wfmparity.service.performance;

import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.PerformanceSample;
import com.phillippitts.wfmparity.service.calc.EngineRun;
import com.phillippitts.wfmparity.service.events.AnomalyDetectedEvent;
import com.phillippitts.wfmparity.testutil.ParityFixture;
import com.phillippitts.wfmparity.testutil.TestResults;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PerformanceMonitorTest {

    private final ParityFixture fx = new ParityFixture();

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private PerformanceSample record(EngineVariant variant, long calculationMs) {
        UUID jobId = UUID.randomUUID();
        EngineRun run = new EngineRun(TestResults.result(jobId, variant, 25, 85.0), 2, 3, calculationMs);
        PerformanceSample sample = fx.performance.record(jobId, "erlang_c", run, 5);
        fx.clock.advance(Duration.ofMinutes(1));
        return sample;
    }

    @Test
    void sampleTotalsAllPhases() {
        PerformanceSample sample = record(EngineVariant.REFERENCE, 40);

        assertThat(sample.totalExecutionMs()).isEqualTo(50);
        assertThat(sample.iterationCount()).isEqualTo(3);
        assertThat(sample.convergenceAchieved()).isTrue();
        assertThat(fx.count("performance_samples")).isEqualTo(1);
    }

    @Test
    void slowRunAgainstBaselineRaisesAnomaly() {
        record(EngineVariant.CANDIDATE, 40);
        record(EngineVariant.CANDIDATE, 40);
        assertThat(fx.events.ofType(AnomalyDetectedEvent.class)).isEmpty();

        record(EngineVariant.CANDIDATE, 400);

        assertThat(fx.events.ofType(AnomalyDetectedEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.kind()).isEqualTo(AnomalyDetectedEvent.Kind.PERFORMANCE_DEGRADATION);
                    assertThat(e.key()).isEqualTo("candidate/erlang_c");
                });
    }

    @Test
    void baselineIsKeptPerEngine() {
        record(EngineVariant.REFERENCE, 40);
        record(EngineVariant.CANDIDATE, 400);

        assertThat(fx.events.ofType(AnomalyDetectedEvent.class)).isEmpty();
        assertThat(fx.performance.findDegradations(EngineVariant.CANDIDATE)).isEmpty();
    }

    @Test
    void degradationsCompareLatestWithWindowAverage() {
        record(EngineVariant.CANDIDATE, 40);
        record(EngineVariant.CANDIDATE, 40);
        record(EngineVariant.CANDIDATE, 40);
        record(EngineVariant.CANDIDATE, 400);

        assertThat(fx.performance.findDegradations(EngineVariant.CANDIDATE))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.operationType()).isEqualTo("erlang_c");
                    assertThat(d.latestMs()).isEqualTo(410);
                    assertThat(d.ratio()).isGreaterThan(2.0);
                });
        assertThat(fx.performance.findDegradations(EngineVariant.REFERENCE)).isEmpty();
    }
}
