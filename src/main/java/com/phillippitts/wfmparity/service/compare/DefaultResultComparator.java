package com.phillippitts.wfmparity.service.compare;

import com.phillippitts.wfmparity.config.properties.ComparisonProperties;
import com.phillippitts.wfmparity.domain.CalculationResult;
import com.phillippitts.wfmparity.domain.ComparisonResult;
import com.phillippitts.wfmparity.domain.MetricDifference;
import com.phillippitts.wfmparity.domain.Recommendation;
import com.phillippitts.wfmparity.domain.StaffingMetrics;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Per-metric diff of two staffing results.
 *
 * <p>Agreement is decided on agents required alone; every metric (and every skill coverage)
 * above the significance threshold is listed as significant. A skill present on only one
 * side is compared against 0 coverage, which is a 100 % gap.
 */
@Component
public class DefaultResultComparator extends AbstractResultComparator {

    public static final String AGENTS_REQUIRED = "agents_required";
    public static final String SERVICE_LEVEL = "service_level";
    public static final String OCCUPANCY = "occupancy";
    public static final String AVERAGE_WAIT_TIME = "average_wait_time";
    public static final String OFFERED_CALLS = "offered_calls";
    public static final String HANDLED_CALLS = "handled_calls";
    public static final String ABANDONED_CALLS = "abandoned_calls";
    public static final String UTILIZATION = "utilization";

    static final String SKILL_PREFIX = "skill_coverage.";

    private final ComparisonProperties properties;
    private final Clock clock;

    public DefaultResultComparator(ComparisonProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    protected ComparisonResult doCompare(UUID jobId, CalculationResult reference, CalculationResult candidate) {
        StaffingMetrics ref = reference.metrics();
        StaffingMetrics cand = candidate.metrics();

        List<MetricDifference> diffs = List.of(
                MetricDifference.of(AGENTS_REQUIRED, ref.agentsRequired(), cand.agentsRequired()),
                MetricDifference.of(SERVICE_LEVEL, ref.serviceLevel(), cand.serviceLevel()),
                MetricDifference.of(OCCUPANCY, ref.occupancy(), cand.occupancy()),
                MetricDifference.of(AVERAGE_WAIT_TIME, ref.averageWaitTime(), cand.averageWaitTime()),
                MetricDifference.of(OFFERED_CALLS, ref.offeredCalls(), cand.offeredCalls()),
                MetricDifference.of(HANDLED_CALLS, ref.handledCalls(), cand.handledCalls()),
                MetricDifference.of(ABANDONED_CALLS, ref.abandonedCalls(), cand.abandonedCalls()),
                MetricDifference.of(UTILIZATION, ref.utilization(), cand.utilization()));
        List<MetricDifference> skillDiffs = skillDifferences(reference.skillCoverage(), candidate.skillCoverage());

        double threshold = properties.getSignificanceThresholdPct();
        List<String> significant = new ArrayList<>();
        for (MetricDifference d : diffs) {
            if (d.percentageDifference() > threshold) {
                significant.add(d.metric());
            }
        }
        for (MetricDifference d : skillDiffs) {
            if (d.percentageDifference() > threshold) {
                significant.add(d.metric());
            }
        }

        MetricDifference agents = diffs.get(0);
        boolean agree = agents.percentageDifference() <= properties.getAgreementTolerancePct();
        Recommendation recommendation = Recommendation.classify(agree, agents.percentageDifference(),
                properties.getReviewThresholdPct());

        return new ComparisonResult(
                UUID.randomUUID(),
                jobId,
                reference.id(),
                candidate.id(),
                clock.instant(),
                diffs,
                skillDiffs,
                cand.agentsRequired() - ref.agentsRequired(),
                agents.percentageDifference(),
                cand.serviceLevel() - ref.serviceLevel(),
                cand.occupancy() - ref.occupancy(),
                cand.averageWaitTime() - ref.averageWaitTime(),
                candidate.usage().calculationTimeMs() - reference.usage().calculationTimeMs(),
                agree,
                significant,
                recommendation);
    }

    private static List<MetricDifference> skillDifferences(Map<String, Double> ref, Map<String, Double> cand) {
        Set<String> skills = new LinkedHashSet<>(ref.keySet());
        skills.addAll(cand.keySet());
        List<MetricDifference> out = new ArrayList<>(skills.size());
        for (String skill : skills) {
            out.add(MetricDifference.of(SKILL_PREFIX + skill,
                    ref.getOrDefault(skill, 0.0), cand.getOrDefault(skill, 0.0)));
        }
        return out;
    }
}
