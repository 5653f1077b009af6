package com.phillippitts.wfmparity.service.calc;

import com.phillippitts.wfmparity.domain.CalculationResult;

import java.util.Objects;

/**
 * A calculation result together with the phase timings the performance monitor records.
 */
public record EngineRun(
        CalculationResult result,
        long initializationMs,
        long dataPreparationMs,
        long calculationMs
) {

    public EngineRun {
        Objects.requireNonNull(result, "result must not be null");
    }
}
