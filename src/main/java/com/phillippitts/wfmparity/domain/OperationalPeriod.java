package com.phillippitts.wfmparity.domain;

import java.time.LocalDate;

/**
 * Reference-engine aggregates for one reporting period of a project.
 */
public record OperationalPeriod(
        LocalDate periodStart,
        int calculations,
        double totalCalls,
        double averageServiceLevel,
        double averageHandleTime,
        double averageAgents
) {
}
