package com.phillippitts.wfmparity.domain;

/**
 * Failure pattern severity, ordered from least to most severe.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Severity of a sustained deviation: CRITICAL above 25 %, HIGH above 15 %, otherwise MEDIUM.
     */
    public static Severity forAverageDeviation(double averagePct) {
        if (averagePct > 25.0) {
            return CRITICAL;
        }
        if (averagePct > 15.0) {
            return HIGH;
        }
        return MEDIUM;
    }

    public static Severity forIssueSeverity(IssueSeverity issueSeverity) {
        return switch (issueSeverity) {
            case INFO -> LOW;
            case WARNING -> MEDIUM;
            case ERROR -> HIGH;
            case CRITICAL -> CRITICAL;
        };
    }
}
