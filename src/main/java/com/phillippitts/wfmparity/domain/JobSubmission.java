package com.phillippitts.wfmparity.domain;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

/**
 * Request to enqueue a job. {@code type}, {@code calculationDate} and {@code priority} may be
 * null and are then derived or defaulted by the queue manager.
 */
public record JobSubmission(
        JobType type,
        JobTarget target,
        LocalDate calculationDate,
        String intervalType,
        Map<String, Object> inputParameters,
        Integer priority
) {

    public JobSubmission {
        Objects.requireNonNull(target, "target must not be null");
        inputParameters = inputParameters == null ? Map.of() : inputParameters;
    }

    public static JobSubmission of(JobTarget target, String intervalType, Map<String, Object> inputParameters) {
        return new JobSubmission(null, target, null, intervalType, inputParameters, null);
    }
}
