package com.phillippitts.wfmparity.service.calc;

import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.InputParameters;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.domain.SkillRequirement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Engine under validation.
 *
 * <p>Seeds the search with a square-root staffing estimate plus a target-dependent correction,
 * floored by a load-dependent stability buffer, then searches upward only: the bound is grown
 * geometrically until the target is met and the smallest passing staffing is found by bisection.
 * The answer therefore never drops below the seed.
 *
 * <p>When the snapshot sets {@code blend_historical_volume}, offered calls are blended
 * 70/30 with the recent historical average for the same target.
 *
 * <p>Abandonment uses a patience model: a waiting caller abandons with probability
 * {@code W / (W + patience)} where {@code W = aht / (N - A)}.
 */
@Component("candidateCalculator")
public class CandidateStaffingCalculator extends AbstractStaffingCalculator {

    private static final Logger LOG = LogManager.getLogger(CandidateStaffingCalculator.class);

    public static final String VERSION = "wfm_enterprise_v1.0";

    static final double INPUT_VOLUME_WEIGHT = 0.7;
    static final double HISTORICAL_VOLUME_WEIGHT = 0.3;

    /** Loads up to this many Erlangs use the small-system seed. */
    static final double SMALL_SYSTEM_LOAD = 50.0;
    static final double SMALL_SYSTEM_BUFFER = 1.10;
    static final double MEDIUM_SYSTEM_LOAD = 200.0;
    static final double MEDIUM_SYSTEM_BUFFER = 1.01;
    static final double LARGE_SYSTEM_BUFFER = 1.02;

    static final double GROWTH_FACTOR = 1.5;

    private final HistoricalVolumeSource history;

    public CandidateStaffingCalculator(Clock clock, HistoricalVolumeSource history) {
        super(clock);
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    @Override
    public EngineVariant variant() {
        return EngineVariant.CANDIDATE;
    }

    @Override
    public String algorithmVersion() {
        return VERSION;
    }

    @Override
    protected StaffingInputs prepare(Job job, StaffingInputs inputs) {
        if (!job.inputParameters().flag(InputParameters.BLEND_HISTORICAL_VOLUME)) {
            return inputs;
        }
        OptionalDouble historical = history.averageOfferedCalls(job.target());
        if (historical.isEmpty()) {
            LOG.debug("No volume history for {}, using input volume", job.target());
            return inputs;
        }
        double blended = INPUT_VOLUME_WEIGHT * inputs.offeredCalls()
                + HISTORICAL_VOLUME_WEIGHT * historical.getAsDouble();
        LOG.debug("Blended offered calls for {}: {} -> {}", job.target(), inputs.offeredCalls(), blended);
        return inputs.withOfferedCalls(blended);
    }

    @Override
    protected Staffing size(double load, StaffingInputs inputs) {
        // a stable queue needs more than load agents
        if (load >= MAX_AGENTS) {
            return new Staffing(MAX_AGENTS, 0, false);
        }
        int seed = seed(load, inputs.serviceLevelTarget());
        if (seed > MAX_AGENTS) {
            return new Staffing(MAX_AGENTS, 0, false);
        }
        int iterations = 1;
        if (meetsTarget(seed, load, inputs)) {
            return new Staffing(seed, iterations, true);
        }

        int lo = seed + 1;
        int hi = seed;
        while (true) {
            int next = Math.min(MAX_AGENTS, Math.max(hi + 1, (int) Math.ceil(hi * GROWTH_FACTOR)));
            iterations++;
            if (meetsTarget(next, load, inputs)) {
                hi = next;
                break;
            }
            if (next == MAX_AGENTS) {
                return new Staffing(MAX_AGENTS, iterations, false);
            }
            lo = next + 1;
            hi = next;
        }

        // hi meets the target, everything below lo does not
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            iterations++;
            if (meetsTarget(mid, load, inputs)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return new Staffing(hi, iterations, true);
    }

    @Override
    protected double abandonedCalls(StaffingInputs inputs, int agents, double load,
                                    double delayProbability, double serviceLevel) {
        double expectedWait = inputs.averageHandleTime() / (agents - load);
        double abandonGivenWait = expectedWait / (expectedWait + inputs.averagePatienceSeconds());
        return inputs.offeredCalls() * delayProbability * abandonGivenWait;
    }

    @Override
    protected double allocationWeight(SkillRequirement skill, int requiredAgents) {
        return requiredAgents;
    }

    /**
     * Initial staffing estimate, never below the smallest stable staffing.
     */
    static int seed(double load, double serviceLevelTarget) {
        double beta = ErlangMath.probit(serviceLevelTarget);
        double squareRoot = load + beta * Math.sqrt(load);
        int estimate;
        if (load <= SMALL_SYSTEM_LOAD) {
            estimate = Math.max(
                    (int) Math.ceil(load * SMALL_SYSTEM_BUFFER),
                    (int) Math.ceil(squareRoot + correction(beta, serviceLevelTarget)));
        } else {
            double buffer = load < MEDIUM_SYSTEM_LOAD ? MEDIUM_SYSTEM_BUFFER : LARGE_SYSTEM_BUFFER;
            estimate = Math.max((int) Math.ceil(load * buffer), (int) Math.ceil(squareRoot));
        }
        return Math.max(estimate, (int) Math.floor(load) + 1);
    }

    /**
     * Second-order correction to the square-root rule for small systems.
     */
    static double correction(double beta, double epsilon) {
        double beta3 = beta * beta * beta;
        return beta / (1.0 - epsilon) * (0.5 * beta + beta3 / 6.0)
                + epsilon * (beta / 3.0 + beta3 / 6.0) / (1.0 - epsilon + beta * beta);
    }
}
