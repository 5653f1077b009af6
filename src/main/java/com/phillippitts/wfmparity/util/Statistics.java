package com.phillippitts.wfmparity.util;

import java.util.List;

/**
 * Descriptive statistics over small in-memory samples.
 */
public final class Statistics {

    private Statistics() {}

    /**
     * @return arithmetic mean, 0 for an empty sample
     */
    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation (n - 1 denominator); 0 with fewer than two values.
     */
    public static double sampleStdDev(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double ss = 0.0;
        for (double v : values) {
            ss += (v - mean) * (v - mean);
        }
        return Math.sqrt(ss / (n - 1));
    }

    /**
     * Pearson correlation coefficient of two equally long samples; 0 when either is constant
     * or fewer than two pairs exist.
     */
    public static double pearson(List<Double> x, List<Double> y) {
        if (x.size() != y.size()) {
            throw new IllegalArgumentException("samples differ in length: " + x.size() + " vs " + y.size());
        }
        int n = x.size();
        if (n < 2) {
            return 0.0;
        }
        double mx = mean(x);
        double my = mean(y);
        double sxy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x.get(i) - mx;
            double dy = y.get(i) - my;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0.0 || syy == 0.0) {
            return 0.0;
        }
        return sxy / Math.sqrt(sxx * syy);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
