package com.phillippitts.wfmparity.service.calc;

/**
 * Outcome of a staffing search.
 *
 * @param agents     smallest staffing the search accepted
 * @param iterations staffing levels evaluated
 * @param converged  whether the accepted staffing meets the target
 */
public record Staffing(int agents, int iterations, boolean converged) {
}
