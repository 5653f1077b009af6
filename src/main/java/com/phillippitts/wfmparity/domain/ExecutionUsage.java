package com.phillippitts.wfmparity.domain;

/**
 * Resource usage of one engine run.
 *
 * @param calculationTimeMs wall-clock time spent in the calculation
 * @param memoryUsedBytes   heap growth observed across the run (best effort, never negative)
 * @param iterations        staffing levels evaluated before convergence
 * @param converged         whether the search met the service-level target
 */
public record ExecutionUsage(long calculationTimeMs, long memoryUsedBytes, int iterations, boolean converged) {
}
