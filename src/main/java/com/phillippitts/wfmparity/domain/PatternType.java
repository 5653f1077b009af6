package com.phillippitts.wfmparity.domain;

/**
 * Kinds of failure pattern the miner detects, with their stored codes.
 */
public enum PatternType {
    HIGH_DEVIATION("high_deviation", FailureCategory.ACCURACY),
    DATA_QUALITY("data_quality", FailureCategory.DATA_QUALITY),
    PERFORMANCE_DEGRADATION("performance_degradation", FailureCategory.PERFORMANCE);

    private final String code;
    private final FailureCategory category;

    PatternType(String code, FailureCategory category) {
        this.code = code;
        this.category = category;
    }

    public String code() {
        return code;
    }

    public FailureCategory category() {
        return category;
    }

    public static PatternType fromCode(String code) {
        for (PatternType t : values()) {
            if (t.code.equals(code)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown pattern type: " + code);
    }
}
