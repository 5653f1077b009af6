package com.phillippitts.wfmparity.domain;

/**
 * Operator guidance derived from the headline (agents required) difference.
 */
public enum Recommendation {
    TRUSTED("Algorithms are in agreement. Results can be trusted."),
    REVIEW_PARAMETERS("Minor differences detected. Review calculation parameters."),
    MANUAL_REVIEW("Significant differences detected. Manual review required.");

    private final String text;

    Recommendation(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static Recommendation classify(boolean agree, double headlinePct, double reviewThresholdPct) {
        if (agree) {
            return TRUSTED;
        }
        return headlinePct <= reviewThresholdPct ? REVIEW_PARAMETERS : MANUAL_REVIEW;
    }
}
