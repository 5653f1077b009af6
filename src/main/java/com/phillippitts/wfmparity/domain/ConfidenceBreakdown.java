package com.phillippitts.wfmparity.domain;

/**
 * Factors behind a confidence score, each on a 0..100 scale.
 */
public record ConfidenceBreakdown(
        double baseConfidence,
        double historicalAccuracy,
        double dataQuality,
        double volumeFactor,
        double finalScore,
        int sampleSize
) {
}
