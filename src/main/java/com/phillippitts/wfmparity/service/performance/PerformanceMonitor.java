package com.phillippitts.wfmparity.service.performance;

import com.phillippitts.wfmparity.config.properties.MiningProperties;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.ExecutionUsage;
import com.phillippitts.wfmparity.domain.PerformanceSample;
import com.phillippitts.wfmparity.repository.PerformanceSampleRepository;
import com.phillippitts.wfmparity.service.calc.EngineRun;
import com.phillippitts.wfmparity.service.events.AnomalyDetectedEvent;
import com.phillippitts.wfmparity.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Records per-execution timing samples and detects degradation against the trailing average.
 *
 * <p>An operation is degraded when its latest total execution time exceeds the configured
 * multiple of the trailing average. Degradation is reported as an
 * {@link AnomalyDetectedEvent}, never as an error.
 */
@Service
public class PerformanceMonitor {
    private static final Logger LOG = LogManager.getLogger(PerformanceMonitor.class);

    private final PerformanceSampleRepository samples;
    private final MiningProperties properties;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public PerformanceMonitor(PerformanceSampleRepository samples, MiningProperties properties,
                              ApplicationEventPublisher publisher, Clock clock) {
        this.samples = samples;
        this.properties = properties;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Stores a sample for one engine run and raises an anomaly event if it is degraded.
     *
     * @param operationType  what was calculated (the job type code)
     * @param resultStorageMs time spent persisting the result
     */
    public PerformanceSample record(UUID jobId, String operationType, EngineRun run, long resultStorageMs) {
        ExecutionUsage usage = run.result().usage();
        EngineVariant algorithm = run.result().variant();
        long total = run.initializationMs() + run.dataPreparationMs() + run.calculationMs() + resultStorageMs;
        Instant now = clock.instant();

        OptionalDouble baseline = samples.averageTotalSince(operationType, algorithm, windowStart(now));

        PerformanceSample sample = new PerformanceSample(UUID.randomUUID(), jobId, algorithm, operationType,
                run.initializationMs(), run.dataPreparationMs(), run.calculationMs(), resultStorageMs, total,
                usage.memoryUsedBytes(), usage.iterations(), usage.converged(), now);
        samples.insert(sample);

        if (baseline.isPresent()) {
            degradation(operationType, algorithm, total, baseline.getAsDouble())
                    .ifPresent(d -> publish(d, now));
        }
        return sample;
    }

    /**
     * Compares the latest sample of every operation type seen in the trailing window with its average.
     */
    public List<PerformanceDegradation> findDegradations(EngineVariant algorithm) {
        Instant since = windowStart(clock.instant());
        List<PerformanceDegradation> out = new ArrayList<>();
        for (String op : samples.findOperationTypesSince(algorithm, since)) {
            Optional<PerformanceSample> latest = samples.findLatest(op, algorithm);
            OptionalDouble avg = samples.averageTotalSince(op, algorithm, since);
            if (latest.isPresent() && avg.isPresent()) {
                degradation(op, algorithm, latest.get().totalExecutionMs(), avg.getAsDouble())
                        .ifPresent(out::add);
            }
        }
        return out;
    }

    private Optional<PerformanceDegradation> degradation(String op, EngineVariant algorithm,
                                                         long latestMs, double averageMs) {
        if (averageMs <= 0.0) {
            return Optional.empty();
        }
        double ratio = latestMs / averageMs;
        if (ratio > properties.getPerformanceRatio()) {
            return Optional.of(new PerformanceDegradation(op, algorithm, latestMs, averageMs, ratio));
        }
        return Optional.empty();
    }

    private void publish(PerformanceDegradation d, Instant now) {
        LOG.warn("Performance degradation for {} {}: {} ms vs {} ms average ({}x)",
                d.algorithm().tag(), d.operationType(), d.latestMs(), Math.round(d.averageMs()),
                String.format(Locale.ROOT, "%.1f", d.ratio()));
        publisher.publishEvent(new AnomalyDetectedEvent(AnomalyDetectedEvent.Kind.PERFORMANCE_DEGRADATION,
                d.algorithm().tag() + "/" + d.operationType(),
                String.format(Locale.ROOT, "latest %d ms is %.1fx the trailing average %.0f ms",
                        d.latestMs(), d.ratio(), d.averageMs()),
                now));
    }

    private Instant windowStart(Instant now) {
        return TimeUtils.daysBefore(now, properties.getPerformanceWindowDays());
    }
}
