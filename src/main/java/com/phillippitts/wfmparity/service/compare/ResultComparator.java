package com.phillippitts.wfmparity.service.compare;

import com.phillippitts.wfmparity.domain.CalculationResult;
import com.phillippitts.wfmparity.domain.ComparisonResult;
import com.phillippitts.wfmparity.exception.ComparisonException;

import java.util.UUID;

/**
 * Diffs the Reference and Candidate results of one job.
 */
public interface ResultComparator {

    /**
     * @param reference baseline result (may be null if that engine produced nothing)
     * @param candidate result under validation (may be null)
     * @return comparison, not yet persisted
     * @throws ComparisonException if either side is missing or the results belong to another job
     */
    ComparisonResult compare(UUID jobId, CalculationResult reference, CalculationResult candidate);
}
