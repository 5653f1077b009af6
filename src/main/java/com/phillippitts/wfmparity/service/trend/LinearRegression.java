package com.phillippitts.wfmparity.service.trend;

import com.phillippitts.wfmparity.util.Statistics;

import java.util.List;
import java.util.Optional;

/**
 * Ordinary least squares fit of {@code y = slope * x + intercept}.
 */
final class LinearRegression {

    record Fit(double slope, double intercept, int points) {

        double predict(double x) {
            return slope * x + intercept;
        }
    }

    private LinearRegression() {}

    /**
     * @return the fit, or empty without data. A single point, or constant x, gives a flat line
     *         through the mean.
     */
    static Optional<Fit> fit(List<Double> x, List<Double> y) {
        if (x.size() != y.size()) {
            throw new IllegalArgumentException("x and y differ in length: " + x.size() + " vs " + y.size());
        }
        if (x.isEmpty()) {
            return Optional.empty();
        }
        double mx = Statistics.mean(x);
        double my = Statistics.mean(y);
        double sxy = 0.0;
        double sxx = 0.0;
        for (int i = 0; i < x.size(); i++) {
            double dx = x.get(i) - mx;
            sxy += dx * (y.get(i) - my);
            sxx += dx * dx;
        }
        if (sxx == 0.0) {
            return Optional.of(new Fit(0.0, my, x.size()));
        }
        double slope = sxy / sxx;
        return Optional.of(new Fit(slope, my - slope * mx, x.size()));
    }
}
