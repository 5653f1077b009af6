package com.phillippitts.wfmparity.service.execution;

import com.phillippitts.wfmparity.domain.CalculationResult;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.Job;

import java.util.Map;

/**
 * Runs the Reference and Candidate engines for one claimed job and persists each result once.
 */
public interface ParallelCalculationService {

    /**
     * Holds both persisted results (either may be null if that engine failed) and the
     * failure reason per missing side.
     */
    record ResultPair(CalculationResult reference, CalculationResult candidate, Map<EngineVariant, String> failures) {

        public ResultPair {
            failures = failures == null ? Map.of() : Map.copyOf(failures);
        }

        public boolean complete() {
            return reference != null && candidate != null;
        }

        /**
         * @return the only side with a result, or null when both or neither have one
         */
        public EngineVariant survivor() {
            if (reference != null && candidate == null) {
                return EngineVariant.REFERENCE;
            }
            if (candidate != null && reference == null) {
                return EngineVariant.CANDIDATE;
            }
            return null;
        }
    }

    /**
     * Calculates both sides concurrently. A result persisted by an earlier attempt is reused
     * instead of recalculated.
     */
    ResultPair calculateBoth(Job claimed);
}
