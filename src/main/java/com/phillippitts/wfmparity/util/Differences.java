package com.phillippitts.wfmparity.util;

/**
 * Difference arithmetic shared by the comparator and the accuracy tracker.
 */
public final class Differences {

    private Differences() {}

    public static double absolute(double reference, double candidate) {
        return Math.abs(reference - candidate);
    }

    /**
     * Absolute difference as a percentage of the reference magnitude.
     * Both zero gives 0; a zero reference against a non-zero candidate gives 100.
     */
    public static double percentage(double reference, double candidate) {
        double abs = absolute(reference, candidate);
        if (reference == 0.0) {
            return candidate == 0.0 ? 0.0 : 100.0;
        }
        return abs / Math.abs(reference) * 100.0;
    }

    public static double round(double value, int scale) {
        double f = Math.pow(10, scale);
        return Math.round(value * f) / f;
    }
}
