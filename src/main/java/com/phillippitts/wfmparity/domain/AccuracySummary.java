package com.phillippitts.wfmparity.domain;

import java.time.Instant;
import java.util.List;

/**
 * Current accuracy picture: per-key statistics since {@code since} and, for a single
 * business unit, the agreement statistics of its comparisons over the same window.
 */
public record AccuracySummary(
        Instant since,
        List<RollingConfidence> metrics,
        ComparisonSummary comparisons
) {

    public AccuracySummary {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }
}
