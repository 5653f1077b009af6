package com.phillippitts.wfmparity.service.calc;

import com.phillippitts.wfmparity.domain.JobTarget;

import java.util.OptionalDouble;

/**
 * Supplies the recent average offered volume for a target.
 */
@FunctionalInterface
public interface HistoricalVolumeSource {

    /**
     * @return average offered calls over the recent window, or empty when there is no history
     */
    OptionalDouble averageOfferedCalls(JobTarget target);
}
