package com.phillippitts.wfmparity.service.execution;

import com.phillippitts.wfmparity.config.properties.ComparisonProperties;
import com.phillippitts.wfmparity.domain.CalculationResult;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.exception.CalculationException;
import com.phillippitts.wfmparity.repository.CalculationResultRepository;
import com.phillippitts.wfmparity.service.calc.EngineRun;
import com.phillippitts.wfmparity.service.calc.StaffingCalculator;
import com.phillippitts.wfmparity.service.metrics.ParityMetrics;
import com.phillippitts.wfmparity.service.performance.PerformanceMonitor;
import com.phillippitts.wfmparity.service.queue.JobQueueManager;
import com.phillippitts.wfmparity.util.ErrorDetails;
import com.phillippitts.wfmparity.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default implementation of the dual-engine calculation service.
 *
 * <p>Key features:
 * <ul>
 *   <li><b>Parallel Execution:</b> both engines run simultaneously on {@code calcExecutor}</li>
 *   <li><b>Timeout Protection:</b> a configurable timeout prevents a stuck engine from holding the worker</li>
 *   <li><b>Partial Results:</b> a surviving result is persisted even when the other side fails</li>
 *   <li><b>Reuse:</b> results persisted by an earlier attempt are not recalculated</li>
 * </ul>
 *
 * <p><b>Error Handling:</b> engine failures are caught, logged and reported in the returned
 * pair; this service never throws for a failed engine.
 */
@Service
public class DefaultParallelCalculationService implements ParallelCalculationService {
    private static final Logger LOG = LogManager.getLogger(DefaultParallelCalculationService.class);

    private final StaffingCalculator reference;
    private final StaffingCalculator candidate;
    private final Executor executor;
    private final CalculationResultRepository results;
    private final JobQueueManager queue;
    private final PerformanceMonitor performance;
    private final ParityMetrics metrics;
    private final long timeoutMs;

    public DefaultParallelCalculationService(@Qualifier("referenceCalculator") StaffingCalculator reference,
                                             @Qualifier("candidateCalculator") StaffingCalculator candidate,
                                             @Qualifier("calcExecutor") Executor executor,
                                             CalculationResultRepository results,
                                             JobQueueManager queue,
                                             PerformanceMonitor performance,
                                             ParityMetrics metrics,
                                             ComparisonProperties properties) {
        this.reference = Objects.requireNonNull(reference);
        this.candidate = Objects.requireNonNull(candidate);
        this.executor = Objects.requireNonNull(executor);
        this.results = Objects.requireNonNull(results);
        this.queue = Objects.requireNonNull(queue);
        this.performance = Objects.requireNonNull(performance);
        this.metrics = Objects.requireNonNull(metrics);
        this.timeoutMs = properties.getCalculationTimeoutMs() <= 0 ? 30_000 : properties.getCalculationTimeoutMs();
    }

    @Override
    public ResultPair calculateBoth(Job claimed) {
        Objects.requireNonNull(claimed, "claimed");
        Map<EngineVariant, String> failures = new ConcurrentHashMap<>();

        CompletableFuture<CalculationResult> ref = start(claimed, reference, failures);
        CompletableFuture<CalculationResult> cand = start(claimed, candidate, failures);

        try {
            CompletableFuture.allOf(ref, cand).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Parallel calculation for job {} timed out after {} ms", claimed.id(), timeoutMs);
            timeOut(ref, EngineVariant.REFERENCE, failures);
            timeOut(cand, EngineVariant.CANDIDATE, failures);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException ee) {
            // Already handled per-engine; continue to collect results
        }

        CalculationResult r = getResultSilently(ref);
        CalculationResult c = getResultSilently(cand);
        Map<EngineVariant, String> missing = new EnumMap<>(EngineVariant.class);
        if (r == null) {
            missing.put(EngineVariant.REFERENCE, failures.getOrDefault(EngineVariant.REFERENCE, "no result"));
        }
        if (c == null) {
            missing.put(EngineVariant.CANDIDATE, failures.getOrDefault(EngineVariant.CANDIDATE, "no result"));
        }
        return new ResultPair(r, c, missing);
    }

    private CompletableFuture<CalculationResult> start(Job job, StaffingCalculator engine,
                                                       Map<EngineVariant, String> failures) {
        return results.find(job.id(), engine.variant())
                .map(existing -> {
                    LOG.info("Reusing {} result {} for job {}", engine.variant().tag(), existing.id(), job.id());
                    return CompletableFuture.completedFuture(existing);
                })
                .orElseGet(() -> CompletableFuture.supplyAsync(() -> runEngine(job, engine, failures), executor));
    }

    private void timeOut(CompletableFuture<CalculationResult> f, EngineVariant variant,
                         Map<EngineVariant, String> failures) {
        if (!f.isDone()) {
            f.cancel(true);
            failures.putIfAbsent(variant, "timed out after " + timeoutMs + " ms");
            metrics.incrementEngineFailure(variant, "timeout");
        }
    }

    private CalculationResult getResultSilently(CompletableFuture<CalculationResult> f) {
        try {
            return f.isDone() && !f.isCompletedExceptionally() && !f.isCancelled() ? f.get() : null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            return null;
        }
    }

    private CalculationResult runEngine(Job job, StaffingCalculator engine, Map<EngineVariant, String> failures) {
        EngineVariant variant = engine.variant();
        long t0 = System.nanoTime();
        try {
            EngineRun run = engine.calculate(job);
            long s0 = System.nanoTime();
            CalculationResult stored = results.insertIfAbsent(run.result());
            queue.attachResult(job, variant, stored.id());
            long storageMs = TimeUtils.elapsedMillis(s0);
            performance.record(job.id(), job.type().code(), run, storageMs);
            metrics.recordEngineLatency(variant, TimeUtils.elapsedMillis(t0));
            LOG.debug("{} calculated {} agents for job {} in {} ms", engine.algorithmVersion(),
                    stored.metrics().agentsRequired(), job.id(), TimeUtils.elapsedMillis(t0));
            return stored;
        } catch (CalculationException ce) {
            LOG.warn("{} failed for job {}: {}", engine.algorithmVersion(), job.id(), ce.getMessage());
            metrics.incrementEngineFailure(variant, "calculation");
            failures.put(variant, ErrorDetails.message(ce));
            return null;
        } catch (RuntimeException re) {
            LOG.error("{} unexpected error for job {}", engine.algorithmVersion(), job.id(), re);
            metrics.incrementEngineFailure(variant, "error");
            failures.put(variant, ErrorDetails.message(re));
            return null;
        }
    }
}
