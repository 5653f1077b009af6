package com.phillippitts.wfmparity.domain;

/**
 * Direction of an average period-over-period change.
 */
public enum TrendDirection {
    IMPROVING,
    DECLINING,
    STABLE;

    public static TrendDirection of(double averageChange) {
        if (averageChange > 1.0) {
            return IMPROVING;
        }
        if (averageChange < -1.0) {
            return DECLINING;
        }
        return STABLE;
    }
}
