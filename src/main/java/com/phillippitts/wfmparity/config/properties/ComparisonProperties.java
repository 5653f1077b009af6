package com.phillippitts.wfmparity.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds (in percent) used when comparing Reference and Candidate results.
 */
@Validated
@ConfigurationProperties(prefix = "parity.comparison")
public class ComparisonProperties {

    /** Agents-required percentage difference at or below which the engines agree. */
    @Min(0)
    @Max(100)
    private final double agreementTolerancePct;

    /** Metrics whose percentage difference exceeds this are listed as significant. */
    @Min(0)
    private final double significanceThresholdPct;

    /** Above tolerance but at or below this, operators review parameters instead of results. */
    @Min(0)
    private final double reviewThresholdPct;

    /** Upper bound on waiting for both engines of a job. */
    private final long calculationTimeoutMs;

    @ConstructorBinding
    public ComparisonProperties(Double agreementTolerancePct, Double significanceThresholdPct,
                                Double reviewThresholdPct, Long calculationTimeoutMs) {
        this.agreementTolerancePct = agreementTolerancePct == null ? 5.0 : agreementTolerancePct;
        this.significanceThresholdPct = significanceThresholdPct == null ? 5.0 : significanceThresholdPct;
        this.reviewThresholdPct = reviewThresholdPct == null ? 10.0 : reviewThresholdPct;
        if (this.reviewThresholdPct < this.agreementTolerancePct) {
            throw new IllegalArgumentException(
                    "parity.comparison.review-threshold-pct must be >= agreement-tolerance-pct");
        }
        this.calculationTimeoutMs = calculationTimeoutMs == null || calculationTimeoutMs <= 0
                ? 30_000 : calculationTimeoutMs;
    }

    public static ComparisonProperties defaults() {
        return new ComparisonProperties(null, null, null, null);
    }

    public double getAgreementTolerancePct() {
        return agreementTolerancePct;
    }

    public double getSignificanceThresholdPct() {
        return significanceThresholdPct;
    }

    public double getReviewThresholdPct() {
        return reviewThresholdPct;
    }

    public long getCalculationTimeoutMs() {
        return calculationTimeoutMs;
    }
}
