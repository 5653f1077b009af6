package com.phillippitts.wfmparity.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/jobs}. {@code job_type} is derived when absent.
 */
public record SubmitJobRequest(
        String jobType,
        @NotBlank(message = "project_code is required") String projectCode,
        String queueCode,
        LocalDate calculationDate,
        @NotBlank(message = "interval_type is required") String intervalType,
        @NotNull(message = "input_parameters is required") Map<String, Object> inputParameters,
        @Min(value = 1, message = "priority must be between 1 and 5")
        @Max(value = 5, message = "priority must be between 1 and 5") Integer priority
) {
}
