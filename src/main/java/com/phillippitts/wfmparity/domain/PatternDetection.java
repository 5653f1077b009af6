package com.phillippitts.wfmparity.domain;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A single mining observation, before it is merged into a {@link FailurePattern}.
 */
public record PatternDetection(
        PatternType patternType,
        List<String> affectedMetrics,
        String businessUnit,
        String rootCause,
        Severity severity,
        int sampleCount
) {

    public PatternDetection {
        Objects.requireNonNull(patternType, "patternType must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        // Sorted so the dedup key does not depend on detection order
        affectedMetrics = List.copyOf(new TreeSet<>(affectedMetrics == null ? List.of() : affectedMetrics));
    }

    public String affectedMetricsKey() {
        return String.join(",", affectedMetrics);
    }
}
