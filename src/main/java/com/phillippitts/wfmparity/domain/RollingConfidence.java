package com.phillippitts.wfmparity.domain;

/**
 * Confidence statistics of a (business unit, metric type) key over a trailing window.
 */
public record RollingConfidence(
        String businessUnit,
        String metricType,
        int samples,
        double averageConfidence,
        double minConfidence,
        double maxConfidence,
        double averagePercentageDifference,
        int outliers
) {
}
