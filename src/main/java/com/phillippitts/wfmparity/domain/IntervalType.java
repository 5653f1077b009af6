package com.phillippitts.wfmparity.domain;

import java.util.Locale;

/**
 * Planning interval granularity. The interval length is the denominator of traffic intensity.
 */
public enum IntervalType {
    FIFTEEN_MINUTES("15m", 900, "15min"),
    THIRTY_MINUTES("30m", 1800, "30min"),
    ONE_HOUR("1h", 3600, "1hour");

    private final String code;
    private final int seconds;
    private final String alias;

    IntervalType(String code, int seconds, String alias) {
        this.code = code;
        this.seconds = seconds;
        this.alias = alias;
    }

    public String code() {
        return code;
    }

    public int seconds() {
        return seconds;
    }

    /**
     * @throws IllegalArgumentException for unknown interval codes
     */
    public static IntervalType fromCode(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (IntervalType t : values()) {
                if (t.code.equals(v) || t.alias.equals(v)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown interval type: " + value);
    }
}
