package com.phillippitts.wfmparity.domain;

/**
 * Agreement statistics over a set of comparisons.
 */
public record ComparisonSummary(
        String projectCode,
        long comparisons,
        long agreeing,
        double agreementRatePct,
        double averageAgentsDiffPct,
        double averageServiceLevelDiff
) {
}
