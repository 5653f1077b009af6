package com.phillippitts.wfmparity.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Accuracy aggregate for one (period, business unit, metric type).
 *
 * @param averageAccuracy {@code 100 - mean(pct_diff)}
 * @param accuracyTrend   second-half accuracy minus first-half accuracy
 * @param volatility      sample standard deviation of pct_diff
 */
public record HistoricalTrend(
        UUID id,
        LocalDate periodStart,
        LocalDate periodEnd,
        String businessUnit,
        String metricType,
        double averageAccuracy,
        double accuracyTrend,
        double volatility,
        int dataPoints,
        int anomalyCount,
        Double trendConfidence,
        Instant generatedAt
) {
}
