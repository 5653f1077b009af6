package com.phillippitts.wfmparity.service.metrics;

import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.JobType;
import com.phillippitts.wfmparity.domain.Recommendation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the parity harness.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Job lifecycle counts (submitted, completed, retried, failed)</li>
 *   <li>Engine latency and failures per variant</li>
 *   <li>Comparison outcomes by recommendation</li>
 *   <li>Accuracy outliers</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ParityMetrics {

    private static final String METRIC_PREFIX = "wfmparity";

    private final MeterRegistry registry;

    public ParityMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSubmitted(JobType type) {
        Counter.builder(METRIC_PREFIX + ".jobs.submitted")
                .description("Jobs accepted into the queue")
                .tag("type", type.code())
                .register(registry)
                .increment();
    }

    public void recordCompleted() {
        Counter.builder(METRIC_PREFIX + ".jobs.completed")
                .description("Jobs completed with a comparison")
                .register(registry)
                .increment();
    }

    public void recordRetry() {
        Counter.builder(METRIC_PREFIX + ".jobs.retried")
                .description("Failed attempts scheduled for retry")
                .register(registry)
                .increment();
    }

    public void recordFailed() {
        Counter.builder(METRIC_PREFIX + ".jobs.failed")
                .description("Jobs failed permanently")
                .register(registry)
                .increment();
    }

    /**
     * Records engine latency.
     *
     * @param variant engine that ran
     * @param durationMs wall-clock duration in milliseconds
     */
    public void recordEngineLatency(EngineVariant variant, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".engine.latency")
                .description("Time taken by one staffing calculation")
                .tag("engine", variant.tag())
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * @param reason failure reason (timeout, calculation, error)
     */
    public void incrementEngineFailure(EngineVariant variant, String reason) {
        Counter.builder(METRIC_PREFIX + ".engine.failure")
                .description("Failed staffing calculations")
                .tag("engine", variant.tag())
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordComparison(Recommendation recommendation) {
        Counter.builder(METRIC_PREFIX + ".comparisons")
                .description("Comparisons by recommendation")
                .tag("recommendation", recommendation.name())
                .register(registry)
                .increment();
    }

    public void incrementOutlier(String metricType) {
        Counter.builder(METRIC_PREFIX + ".accuracy.outliers")
                .description("Accuracy samples flagged as outliers")
                .tag("metric", metricType)
                .register(registry)
                .increment();
    }
}
