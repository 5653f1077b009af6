package com.phillippitts.wfmparity.domain;

import java.util.List;

/**
 * Service-level and volume trend of a project, with diagnostic correlations.
 *
 * <p>Correlations are informational only; nothing acts on them. They are null with fewer
 * than two periods or zero variance.
 */
public record OperationalTrendReport(
        String projectCode,
        List<OperationalPeriod> periods,
        TrendDirection serviceLevelDirection,
        double averageServiceLevelChange,
        double serviceLevelVolatility,
        Forecast serviceLevelForecast,
        Forecast volumeForecast,
        Double volumeServiceLevelCorrelation,
        Double handleTimeServiceLevelCorrelation
) {

    public OperationalTrendReport {
        periods = periods == null ? List.of() : List.copyOf(periods);
    }
}
