package com.phillippitts.wfmparity.presentation.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * Inclusive UTC date range to aggregate.
 */
public record GenerateTrendsRequest(
        @NotNull(message = "start is required") LocalDate start,
        @NotNull(message = "end is required") LocalDate end
) {
}
