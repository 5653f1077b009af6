package com.phillippitts.wfmparity.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds of the failure pattern miner.
 */
@ConfigurationProperties(prefix = "parity.mining")
@Validated
public class MiningProperties {

    /** Look-back window for accuracy and data-quality mining. */
    @Positive(message = "Window hours must be positive")
    private int windowHours = 24;

    /** Samples with pct_diff above this count towards a high-deviation pattern. */
    @Positive(message = "Deviation threshold must be positive")
    private double deviationThresholdPct = 10.0;

    /** A (metric, business unit) group needs more than this many offending samples. */
    @Positive(message = "Minimum deviation samples must be positive")
    private int minDeviationSamples = 5;

    /** An issue type needs more than this many issues in the window. */
    @Positive(message = "Minimum data-quality issues must be positive")
    private int minDataQualityIssues = 10;

    /** Latest/average execution time ratio above which performance has degraded. */
    @Positive(message = "Performance ratio must be positive")
    private double performanceRatio = 2.0;

    /** Trailing window for the execution time average. */
    @Positive(message = "Performance window days must be positive")
    private int performanceWindowDays = 7;

    public int getWindowHours() {
        return windowHours;
    }

    public void setWindowHours(int windowHours) {
        this.windowHours = windowHours;
    }

    public double getDeviationThresholdPct() {
        return deviationThresholdPct;
    }

    public void setDeviationThresholdPct(double deviationThresholdPct) {
        this.deviationThresholdPct = deviationThresholdPct;
    }

    public int getMinDeviationSamples() {
        return minDeviationSamples;
    }

    public void setMinDeviationSamples(int minDeviationSamples) {
        this.minDeviationSamples = minDeviationSamples;
    }

    public int getMinDataQualityIssues() {
        return minDataQualityIssues;
    }

    public void setMinDataQualityIssues(int minDataQualityIssues) {
        this.minDataQualityIssues = minDataQualityIssues;
    }

    public double getPerformanceRatio() {
        return performanceRatio;
    }

    public void setPerformanceRatio(double performanceRatio) {
        this.performanceRatio = performanceRatio;
    }

    public int getPerformanceWindowDays() {
        return performanceWindowDays;
    }

    public void setPerformanceWindowDays(int performanceWindowDays) {
        this.performanceWindowDays = performanceWindowDays;
    }
}
