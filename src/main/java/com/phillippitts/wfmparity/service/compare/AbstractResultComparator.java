package com.phillippitts.wfmparity.service.compare;

import com.phillippitts.wfmparity.domain.CalculationResult;
import com.phillippitts.wfmparity.domain.ComparisonResult;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.exception.ComparisonException;

import java.util.UUID;

/**
 * Abstract base class for comparators implementing the missing-side checks.
 *
 * <p>This class implements the Template Method pattern: {@link #compare} rejects incomplete
 * or mismatched pairs and delegates to {@link #doCompare} only when both results exist and
 * belong to the job.
 */
public abstract class AbstractResultComparator implements ResultComparator {

    @Override
    public final ComparisonResult compare(UUID jobId, CalculationResult reference, CalculationResult candidate) {
        if (reference == null && candidate == null) {
            throw new ComparisonException(jobId, "no results from either engine");
        }
        if (reference == null) {
            throw new ComparisonException(jobId, "reference result missing");
        }
        if (candidate == null) {
            throw new ComparisonException(jobId, "candidate result missing");
        }
        requireOwnership(jobId, reference, EngineVariant.REFERENCE);
        requireOwnership(jobId, candidate, EngineVariant.CANDIDATE);
        return doCompare(jobId, reference, candidate);
    }

    /**
     * Compares two results of the same job. Both parameters are never null.
     */
    protected abstract ComparisonResult doCompare(UUID jobId, CalculationResult reference,
                                                  CalculationResult candidate);

    private static void requireOwnership(UUID jobId, CalculationResult r, EngineVariant expected) {
        if (!jobId.equals(r.jobId()) || r.variant() != expected) {
            throw new ComparisonException(jobId, expected.tag() + " result " + r.id()
                    + " belongs to job " + r.jobId() + " as " + r.variant().tag());
        }
    }
}
