package com.phillippitts.wfmparity.domain;

import java.util.Locale;

/**
 * Which engine produced a calculation result.
 */
public enum EngineVariant {
    /** Legacy engine whose outputs are the baseline. */
    REFERENCE,
    /** New engine under validation. */
    CANDIDATE;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
