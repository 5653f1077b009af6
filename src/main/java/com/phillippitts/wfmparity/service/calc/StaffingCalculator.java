package com.phillippitts.wfmparity.service.calc;

import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.exception.CalculationException;

/**
 * Contract for staffing engines compared by the parity harness.
 * Implementations wrap one algorithm family behind a uniform interface so that the Reference
 * and the Candidate engine can run side by side over the same input snapshot.
 *
 * <p>Thread Safety: implementations must be safe for concurrent calculations; each call works
 * only on its own job.
 *
 * <p>Purity: given the same snapshot an engine returns the same staffing, except where it
 * consults historical data (see {@link CandidateStaffingCalculator}).
 */
public interface StaffingCalculator {

    /**
     * Computes staffing for the job's input snapshot.
     *
     * @param job claimed job; only its type, target, interval and input snapshot are read
     * @return the result (not yet persisted) with phase timings
     * @throws CalculationException if the inputs are unusable, the search does not converge,
     *                              or the arithmetic hits a singularity
     */
    EngineRun calculate(Job job);

    /**
     * @return which side of the comparison this engine is
     */
    EngineVariant variant();

    /**
     * @return version tag stored with every result (e.g. {@code argus_v2.5})
     */
    String algorithmVersion();
}
