package com.phillippitts.wfmparity.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Windows and thresholds of the accuracy tracker.
 */
@ConfigurationProperties(prefix = "parity.accuracy")
@Validated
public class AccuracyProperties {

    /** Trailing window for the outlier standard deviation. */
    @Positive(message = "Outlier window days must be positive")
    private int outlierWindowDays = 7;

    /** A sample is an outlier when its pct_diff exceeds this many standard deviations. */
    @Positive(message = "Outlier sigma must be positive")
    private double outlierSigma = 3.0;

    /** Trailing window used when deviation statistics are recomputed. */
    @Positive(message = "Statistics window days must be positive")
    private int statisticsWindowDays = 30;

    /** Deviation statistics are recomputed on every n-th sample of a key. */
    @Positive(message = "Recompute interval must be positive")
    private int recomputeEvery = 10;

    /** Trailing window of historical trends feeding the confidence score. */
    @Positive(message = "Historical window days must be positive")
    private int historicalWindowDays = 30;

    public int getOutlierWindowDays() {
        return outlierWindowDays;
    }

    public void setOutlierWindowDays(int outlierWindowDays) {
        this.outlierWindowDays = outlierWindowDays;
    }

    public double getOutlierSigma() {
        return outlierSigma;
    }

    public void setOutlierSigma(double outlierSigma) {
        this.outlierSigma = outlierSigma;
    }

    public int getStatisticsWindowDays() {
        return statisticsWindowDays;
    }

    public void setStatisticsWindowDays(int statisticsWindowDays) {
        this.statisticsWindowDays = statisticsWindowDays;
    }

    public int getRecomputeEvery() {
        return recomputeEvery;
    }

    public void setRecomputeEvery(int recomputeEvery) {
        this.recomputeEvery = recomputeEvery;
    }

    public int getHistoricalWindowDays() {
        return historicalWindowDays;
    }

    public void setHistoricalWindowDays(int historicalWindowDays) {
        this.historicalWindowDays = historicalWindowDays;
    }
}
