package com.phillippitts.wfmparity.service.calc;

import com.phillippitts.wfmparity.config.properties.AccuracyProperties;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.JobTarget;
import com.phillippitts.wfmparity.repository.CalculationResultRepository;
import com.phillippitts.wfmparity.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.OptionalDouble;

/**
 * Reads historical volume from the baseline results stored for the same target.
 */
@Component
class RecentResultsVolumeSource implements HistoricalVolumeSource {

    private final CalculationResultRepository results;
    private final AccuracyProperties properties;
    private final Clock clock;

    RecentResultsVolumeSource(CalculationResultRepository results, AccuracyProperties properties, Clock clock) {
        this.results = results;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public OptionalDouble averageOfferedCalls(JobTarget target) {
        return results.averageOfferedCalls(target, EngineVariant.REFERENCE,
                TimeUtils.daysBefore(clock.instant(), properties.getHistoricalWindowDays()));
    }
}
