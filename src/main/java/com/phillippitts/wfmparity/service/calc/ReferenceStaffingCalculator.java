package com.phillippitts.wfmparity.service.calc;

import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.SkillRequirement;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Legacy engine reproducing the baseline staffing figures.
 *
 * <p>Searches upward one agent at a time from the smallest stable staffing
 * ({@code floor(A) + 1}) until the time-based service level meets the target.
 * Abandonment is the fixed fraction of calls that miss the service level.
 */
@Component("referenceCalculator")
public class ReferenceStaffingCalculator extends AbstractStaffingCalculator {

    public static final String VERSION = "argus_v2.5";

    /** Share of late calls the legacy model treats as abandoned. */
    static final double LATE_CALL_ABANDON_RATIO = 0.25;

    public ReferenceStaffingCalculator(Clock clock) {
        super(clock);
    }

    @Override
    public EngineVariant variant() {
        return EngineVariant.REFERENCE;
    }

    @Override
    public String algorithmVersion() {
        return VERSION;
    }

    @Override
    protected Staffing size(double load, StaffingInputs inputs) {
        if (load >= MAX_AGENTS) {
            return new Staffing(MAX_AGENTS, 0, false);
        }
        int iterations = 0;
        for (int n = (int) Math.floor(load) + 1; n <= MAX_AGENTS; n++) {
            iterations++;
            if (meetsTarget(n, load, inputs)) {
                return new Staffing(n, iterations, true);
            }
        }
        return new Staffing(MAX_AGENTS, iterations, false);
    }

    @Override
    protected double abandonedCalls(StaffingInputs inputs, int agents, double load,
                                    double delayProbability, double serviceLevel) {
        return inputs.offeredCalls() * (1.0 - serviceLevel) * LATE_CALL_ABANDON_RATIO;
    }

    @Override
    protected double allocationWeight(SkillRequirement skill, int requiredAgents) {
        return skill.demandShare();
    }
}
