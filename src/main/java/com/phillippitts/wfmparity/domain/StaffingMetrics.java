package com.phillippitts.wfmparity.domain;

/**
 * Core staffing outputs shared by both engines. Service level, occupancy and utilization are
 * percentages (0..100); times are seconds.
 */
public record StaffingMetrics(
        double offeredCalls,
        double handledCalls,
        double abandonedCalls,
        double serviceLevel,
        double averageWaitTime,
        double averageHandleTime,
        int agentsRequired,
        double occupancy,
        double utilization
) {
}
