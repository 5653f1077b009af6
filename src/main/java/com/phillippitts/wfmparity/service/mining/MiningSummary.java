package com.phillippitts.wfmparity.service.mining;

import com.phillippitts.wfmparity.domain.FailurePattern;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one mining pass.
 *
 * @param patterns every pattern recorded by the pass, as stored after the merge
 */
public record MiningSummary(
        Instant minedAt,
        int accuracyPatterns,
        int dataQualityPatterns,
        int performancePatterns,
        List<FailurePattern> patterns
) {

    public MiningSummary {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public int total() {
        return accuracyPatterns + dataQualityPatterns + performancePatterns;
    }
}
