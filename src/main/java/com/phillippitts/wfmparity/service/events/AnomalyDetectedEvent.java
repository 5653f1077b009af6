package com.phillippitts.wfmparity.service.events;

import java.time.Instant;

/**
 * Emitted for anomalies that are reported but never treated as errors:
 * accuracy outliers and performance degradation.
 *
 * @param kind      {@link Kind} of anomaly
 * @param key       what the anomaly is about (metric key, operation type)
 * @param detail    human-readable description
 * @param timestamp when it was detected
 */
public record AnomalyDetectedEvent(
        Kind kind,
        String key,
        String detail,
        Instant timestamp
) {

    public enum Kind {
        ACCURACY_OUTLIER,
        PERFORMANCE_DEGRADATION
    }
}
