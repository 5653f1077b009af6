package com.phillippitts.wfmparity.domain;

import java.util.Locale;

/**
 * Kind of staffing calculation a job requests.
 */
public enum JobType {
    ERLANG_C("erlang_c"),
    MULTI_SKILL("multi_skill");

    private final String code;

    JobType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves a job type from its wire code or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no known type
     */
    public static JobType fromCode(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (JobType t : values()) {
                if (t.code.equals(v) || t.name().toLowerCase(Locale.ROOT).equals(v)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + value);
    }
}
