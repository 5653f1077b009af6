package com.phillippitts.wfmparity.domain;

import java.time.Instant;

/**
 * Single-step least-squares projection of a metric against time.
 *
 * @param slope      change per second of epoch time
 * @param nextPeriod the instant the forecast applies to
 */
public record Forecast(
        String metric,
        double slope,
        double intercept,
        Instant nextPeriod,
        double nextValue,
        int points
) {
}
