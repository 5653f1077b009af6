package com.phillippitts.wfmparity.domain;

import java.util.Locale;

/**
 * Scenario a metric belongs to, used to key deviation patterns.
 *
 * <p>Classification checks keywords in declaration order; the first match wins, so
 * {@code multi_skill_agents} classifies as {@link #AGENT_CALCULATION}.
 */
public enum ScenarioType {
    AGENT_CALCULATION("agent"),
    SERVICE_LEVEL("service_level"),
    OCCUPANCY("occupancy"),
    MULTI_SKILL("multi_skill"),
    GENERAL(null);

    private final String keyword;

    ScenarioType(String keyword) {
        this.keyword = keyword;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScenarioType classify(String metricType) {
        if (metricType == null) {
            return GENERAL;
        }
        String m = metricType.toLowerCase(Locale.ROOT);
        for (ScenarioType t : values()) {
            if (t.keyword != null && m.contains(t.keyword)) {
                return t;
            }
        }
        return GENERAL;
    }
}
