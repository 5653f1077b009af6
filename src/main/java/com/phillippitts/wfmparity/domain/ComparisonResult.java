package com.phillippitts.wfmparity.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of comparing a job's two results. Created exactly once per job.
 *
 * @param agentsDiff            signed candidate minus reference agents
 * @param agentsDiffPct         percentage difference of agents required
 * @param calculationTimeDiffMs signed candidate minus reference calculation time
 * @param significantMetrics    metrics whose percentage difference exceeds the significance threshold
 */
public record ComparisonResult(
        UUID id,
        UUID jobId,
        UUID referenceResultId,
        UUID candidateResultId,
        Instant comparedAt,
        List<MetricDifference> metricDifferences,
        List<MetricDifference> skillCoverageDifferences,
        int agentsDiff,
        double agentsDiffPct,
        double serviceLevelDiff,
        double occupancyDiff,
        double waitTimeDiff,
        long calculationTimeDiffMs,
        boolean algorithmsAgree,
        List<String> significantMetrics,
        Recommendation recommendation
) {

    public ComparisonResult {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(referenceResultId, "referenceResultId must not be null");
        Objects.requireNonNull(candidateResultId, "candidateResultId must not be null");
        Objects.requireNonNull(comparedAt, "comparedAt must not be null");
        Objects.requireNonNull(recommendation, "recommendation must not be null");
        metricDifferences = metricDifferences == null ? List.of() : List.copyOf(metricDifferences);
        skillCoverageDifferences = skillCoverageDifferences == null ? List.of() : List.copyOf(skillCoverageDifferences);
        significantMetrics = significantMetrics == null ? List.of() : List.copyOf(significantMetrics);
    }

    public Optional<MetricDifference> difference(String metric) {
        return metricDifferences.stream().filter(d -> d.metric().equals(metric)).findFirst();
    }
}
