package com.phillippitts.wfmparity.domain;

import java.util.UUID;

/**
 * Result of recording an accuracy sample. Differences are null when a value was missing.
 */
public record TrackingOutcome(
        UUID metricId,
        Double absoluteDifference,
        Double percentageDifference,
        double confidenceScore,
        boolean outlier
) {
}
