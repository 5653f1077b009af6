package com.phillippitts.wfmparity.domain;

/**
 * Cumulative bias of the candidate relative to mean absolute deviation.
 * Values far from zero indicate a systematic over- or under-estimate.
 */
public record TrackingSignal(
        String businessUnit,
        String metricType,
        int samples,
        double cumulativeBias,
        double meanAbsoluteDeviation,
        double signal
) {
}
