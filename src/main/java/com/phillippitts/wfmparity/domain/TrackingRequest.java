package com.phillippitts.wfmparity.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One reference/candidate measurement to record. Values may be null when a side did not
 * produce the metric; such samples carry a zero data-quality score.
 *
 * @param dataQualityScore caller's quality estimate in 0..100, or null for the default
 * @param metadata         free-form context; {@code source_file} and {@code has_mixed_types} are interpreted
 */
public record TrackingRequest(
        String businessUnit,
        String projectCode,
        String intervalType,
        String metricType,
        Double referenceValue,
        Double candidateValue,
        Double dataQualityScore,
        Map<String, Object> metadata
) {

    public TrackingRequest {
        Objects.requireNonNull(businessUnit, "businessUnit must not be null");
        Objects.requireNonNull(metricType, "metricType must not be null");
        Map<String, Object> copy = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        metadata = Collections.unmodifiableMap(copy);
    }

    public static TrackingRequest of(String businessUnit, String metricType, Double reference, Double candidate) {
        return new TrackingRequest(businessUnit, null, null, metricType, reference, candidate, null, Map.of());
    }

    public String sourceFile() {
        Object v = metadata.get("source_file");
        return v == null ? null : v.toString();
    }

    public boolean hasMixedTypes() {
        Object v = metadata.get("has_mixed_types");
        return v instanceof Boolean b ? b : v != null && "true".equalsIgnoreCase(v.toString());
    }
}
