package com.phillippitts.wfmparity.domain;

import java.util.Objects;

/**
 * A skill a multi-skill job must staff, with its share of the offered traffic.
 *
 * @param skillCode   skill identifier
 * @param demandShare fraction of offered calls routed to this skill, in (0, 1]
 */
public record SkillRequirement(String skillCode, double demandShare) {

    public SkillRequirement {
        Objects.requireNonNull(skillCode, "skillCode must not be null");
        if (!(demandShare > 0.0) || demandShare > 1.0) {
            throw new IllegalArgumentException("demandShare must be in (0,1], got: " + demandShare);
        }
    }
}
