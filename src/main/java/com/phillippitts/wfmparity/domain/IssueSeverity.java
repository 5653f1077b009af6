package com.phillippitts.wfmparity.domain;

import java.util.Locale;

/** Severity reported with a data-quality issue. */
public enum IssueSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public static IssueSeverity fromCode(String value) {
        if (value == null) {
            return WARNING;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
