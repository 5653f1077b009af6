package com.phillippitts.wfmparity.service.calc;

import com.phillippitts.wfmparity.domain.SkillRequirement;

import java.util.List;

/**
 * Validated, unit-normalised engine inputs. Service-level target is a fraction in (0, 1).
 */
public record StaffingInputs(
        double offeredCalls,
        double averageHandleTime,
        int intervalSeconds,
        double serviceLevelTarget,
        double serviceLevelSeconds,
        double shrinkage,
        double averagePatienceSeconds,
        List<SkillRequirement> skills
) {

    public StaffingInputs {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }

    public double trafficIntensity() {
        return ErlangMath.trafficIntensity(offeredCalls, averageHandleTime, intervalSeconds);
    }

    public StaffingInputs withOfferedCalls(double calls) {
        return new StaffingInputs(calls, averageHandleTime, intervalSeconds, serviceLevelTarget,
                serviceLevelSeconds, shrinkage, averagePatienceSeconds, skills);
    }
}
