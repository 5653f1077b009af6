package com.phillippitts.wfmparity.service.metrics;

import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.JobType;
import com.phillippitts.wfmparity.domain.Recommendation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ParityMetricsTest {

    private SimpleMeterRegistry registry;
    private ParityMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ParityMetrics(registry);
    }

    @Test
    void countsJobLifecycle() {
        metrics.recordSubmitted(JobType.ERLANG_C);
        metrics.recordSubmitted(JobType.MULTI_SKILL);
        metrics.recordRetry();
        metrics.recordCompleted();
        metrics.recordFailed();

        assertThat(registry.find("wfmparity.jobs.submitted").tag("type", "erlang_c").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("wfmparity.jobs.submitted").counters()).hasSize(2);
        assertThat(registry.find("wfmparity.jobs.retried").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("wfmparity.jobs.completed").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("wfmparity.jobs.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void recordsLatencyPerEngine() {
        metrics.recordEngineLatency(EngineVariant.REFERENCE, 120);
        metrics.recordEngineLatency(EngineVariant.REFERENCE, 80);
        metrics.recordEngineLatency(EngineVariant.CANDIDATE, 40);

        assertThat(registry.find("wfmparity.engine.latency").tag("engine", "reference").timer().count())
                .isEqualTo(2L);
        assertThat(registry.find("wfmparity.engine.latency").tag("engine", "reference").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
    }

    @Test
    void tagsFailuresByReason() {
        metrics.incrementEngineFailure(EngineVariant.CANDIDATE, "timeout");
        metrics.incrementEngineFailure(EngineVariant.CANDIDATE, "timeout");
        metrics.incrementEngineFailure(EngineVariant.CANDIDATE, "calculation");

        assertThat(registry.find("wfmparity.engine.failure").tags("engine", "candidate", "reason", "timeout")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    void countsComparisonsAndOutliers() {
        metrics.recordComparison(Recommendation.TRUSTED);
        metrics.incrementOutlier("service_level");

        assertThat(registry.find("wfmparity.comparisons").tag("recommendation", "TRUSTED").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("wfmparity.accuracy.outliers").tag("metric", "service_level").counter().count())
                .isEqualTo(1.0);
    }
}
