package com.phillippitts.wfmparity.presentation.dto;

import com.phillippitts.wfmparity.domain.TrackingRequest;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Body of {@code POST /api/v1/accuracy/track}.
 */
public record TrackRequest(
        @NotBlank(message = "business_unit is required") String businessUnit,
        String projectCode,
        String intervalType,
        @NotBlank(message = "metric_type is required") String metricType,
        Double referenceValue,
        Double candidateValue,
        @DecimalMin(value = "0.0", message = "data_quality_score must be between 0 and 100")
        @DecimalMax(value = "100.0", message = "data_quality_score must be between 0 and 100") Double dataQualityScore,
        Map<String, Object> metadata
) {

    public TrackingRequest toTrackingRequest() {
        return new TrackingRequest(businessUnit, projectCode, intervalType, metricType, referenceValue,
                candidateValue, dataQualityScore, metadata);
    }
}
