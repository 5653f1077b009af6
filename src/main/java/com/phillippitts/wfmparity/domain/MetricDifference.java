package com.phillippitts.wfmparity.domain;

import com.phillippitts.wfmparity.util.Differences;

import java.util.Objects;

/**
 * One metric compared across engines.
 *
 * @param difference signed {@code candidate - reference}
 */
public record MetricDifference(
        String metric,
        double referenceValue,
        double candidateValue,
        double difference,
        double absoluteDifference,
        double percentageDifference
) {

    public MetricDifference {
        Objects.requireNonNull(metric, "metric must not be null");
    }

    public static MetricDifference of(String metric, double reference, double candidate) {
        return new MetricDifference(metric, reference, candidate,
                candidate - reference,
                Differences.absolute(reference, candidate),
                Differences.percentage(reference, candidate));
    }
}
