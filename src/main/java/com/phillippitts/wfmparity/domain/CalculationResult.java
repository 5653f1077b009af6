package com.phillippitts.wfmparity.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable output of one engine for one job. Written once per (job, variant).
 *
 * @param skillCoverage     skill code to coverage percentage; empty for single-skill jobs
 * @param trafficIntensity  offered load in Erlangs
 * @param erlangBBlocking   Erlang-B blocking probability at the chosen staffing
 * @param erlangCDelay      probability that a call waits at the chosen staffing
 * @param shrinkageFactor   fraction of paid time unavailable for calls
 */
public record CalculationResult(
        UUID id,
        UUID jobId,
        EngineVariant variant,
        String algorithmVersion,
        Instant calculatedAt,
        InputParameters inputParameters,
        StaffingMetrics metrics,
        Map<String, Double> skillCoverage,
        double trafficIntensity,
        double erlangBBlocking,
        double erlangCDelay,
        double shrinkageFactor,
        ExecutionUsage usage
) {

    public CalculationResult {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(variant, "variant must not be null");
        Objects.requireNonNull(algorithmVersion, "algorithmVersion must not be null");
        Objects.requireNonNull(calculatedAt, "calculatedAt must not be null");
        Objects.requireNonNull(inputParameters, "inputParameters must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(usage, "usage must not be null");
        skillCoverage = skillCoverage == null ? Map.of() : Map.copyOf(skillCoverage);
    }
}
