package com.phillippitts.wfmparity.service.calc;

import com.phillippitts.wfmparity.domain.CalculationResult;
import com.phillippitts.wfmparity.domain.ExecutionUsage;
import com.phillippitts.wfmparity.domain.InputParameters;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.domain.JobType;
import com.phillippitts.wfmparity.domain.SkillRequirement;
import com.phillippitts.wfmparity.domain.StaffingMetrics;
import com.phillippitts.wfmparity.exception.CalculationException;
import com.phillippitts.wfmparity.util.TimeUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Base class for staffing engines implementing input handling and the Erlang-C metric suite.
 *
 * <p>This class implements the Template Method pattern: {@link #calculate(Job)} reads and
 * validates the snapshot, lets the engine adjust it in {@link #prepare(Job, StaffingInputs)},
 * delegates the staffing search to {@link #size(double, StaffingInputs)} and derives every
 * reported metric from the chosen staffing.
 *
 * <p><b>Engine-specific hooks:</b>
 * <ul>
 *   <li>{@link #size(double, StaffingInputs)} - staffing search strategy</li>
 *   <li>{@link #abandonedCalls(StaffingInputs, int, double, double, double)} - abandonment model</li>
 *   <li>{@link #allocationWeight(SkillRequirement, int)} - how pooled staff is split across skills</li>
 * </ul>
 */
public abstract class AbstractStaffingCalculator implements StaffingCalculator {

    /** Staffing searches give up above this many agents. */
    public static final int MAX_AGENTS = 5_000;

    static final double DEFAULT_SERVICE_LEVEL_TARGET = 0.80;
    static final double DEFAULT_SERVICE_LEVEL_SECONDS = 20.0;
    static final double DEFAULT_PATIENCE_SECONDS = 120.0;

    private final Clock clock;

    protected AbstractStaffingCalculator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public final EngineRun calculate(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        Runtime rt = Runtime.getRuntime();
        long memBefore = rt.totalMemory() - rt.freeMemory();

        long t0 = System.nanoTime();
        StaffingInputs inputs = readInputs(job);
        long initMs = TimeUtils.elapsedMillis(t0);

        long t1 = System.nanoTime();
        StaffingInputs prepared = prepare(job, inputs);
        long prepMs = TimeUtils.elapsedMillis(t1);

        long t2 = System.nanoTime();
        CalculationResult result;
        try {
            result = compute(job, prepared, t2, memBefore);
        } catch (ArithmeticException e) {
            throw new CalculationException("Arithmetic singularity: " + e.getMessage(), variant(), e);
        }
        return new EngineRun(result, initMs, prepMs, TimeUtils.elapsedMillis(t2));
    }

    /**
     * Hook for engines that adjust inputs from other sources. Default: unchanged.
     */
    protected StaffingInputs prepare(Job job, StaffingInputs inputs) {
        return inputs;
    }

    /**
     * Searches the staffing for the given load.
     */
    protected abstract Staffing size(double load, StaffingInputs inputs);

    /**
     * Calls expected to abandon at the chosen staffing.
     *
     * @param delayProbability Erlang-C probability of waiting
     * @param serviceLevel     achieved service level as a fraction
     */
    protected abstract double abandonedCalls(StaffingInputs inputs, int agents, double load,
                                             double delayProbability, double serviceLevel);

    /**
     * Weight of a skill when the pooled staff is distributed across skills.
     *
     * @param requiredAgents staff the skill would need on its own
     */
    protected abstract double allocationWeight(SkillRequirement skill, int requiredAgents);

    protected final boolean meetsTarget(int agents, double load, StaffingInputs inputs) {
        return ErlangMath.serviceLevel(agents, load, inputs.averageHandleTime(), inputs.serviceLevelSeconds())
                >= inputs.serviceLevelTarget();
    }

    private CalculationResult compute(Job job, StaffingInputs in, long startNanos, long memBefore) {
        double load = in.trafficIntensity();
        if (!Double.isFinite(load)) {
            throw new ArithmeticException("traffic intensity is not finite");
        }

        StaffingMetrics metrics;
        Map<String, Double> coverage = Map.of();
        double blocking;
        double delay;
        Staffing staffing;

        if (load == 0.0) {
            staffing = new Staffing(0, 0, true);
            metrics = new StaffingMetrics(in.offeredCalls(), in.offeredCalls(), 0.0, 100.0, 0.0,
                    in.averageHandleTime(), 0, 0.0, 0.0);
            blocking = 0.0;
            delay = 0.0;
        } else {
            staffing = size(load, in);
            if (!staffing.converged()) {
                throw new CalculationException("Staffing search did not converge within "
                        + MAX_AGENTS + " agents (load " + load + " Erlangs)", variant());
            }
            int n = staffing.agents();
            delay = ErlangMath.erlangC(n, load);
            blocking = ErlangMath.erlangB(n, load);
            double sl = ErlangMath.serviceLevel(n, load, in.averageHandleTime(), in.serviceLevelSeconds());
            double asa = ErlangMath.averageSpeedOfAnswer(n, load, in.averageHandleTime());
            double occupancy = load / n * 100.0;
            double abandoned = Math.min(in.offeredCalls(), abandonedCalls(in, n, load, delay, sl));
            metrics = new StaffingMetrics(
                    in.offeredCalls(),
                    in.offeredCalls() - abandoned,
                    abandoned,
                    sl * 100.0,
                    asa,
                    in.averageHandleTime(),
                    n,
                    occupancy,
                    occupancy * (1.0 - in.shrinkage()));
        }
        if (!in.skills().isEmpty()) {
            coverage = skillCoverage(in, load, staffing.agents());
        }

        Runtime rt = Runtime.getRuntime();
        long memUsed = Math.max(0L, rt.totalMemory() - rt.freeMemory() - memBefore);
        return new CalculationResult(
                UUID.randomUUID(),
                job.id(),
                variant(),
                algorithmVersion(),
                clock.instant(),
                job.inputParameters(),
                metrics,
                coverage,
                load,
                blocking,
                delay,
                in.shrinkage(),
                new ExecutionUsage(TimeUtils.elapsedMillis(startNanos), memUsed,
                        staffing.iterations(), staffing.converged()));
    }

    /**
     * Sizes each skill on its own traffic share, distributes the pooled staff by
     * {@link #allocationWeight} (largest remainder) and reports allocated/required per skill.
     */
    private Map<String, Double> skillCoverage(StaffingInputs in, double load, int pooledAgents) {
        List<SkillRequirement> skills = in.skills();
        int[] required = new int[skills.size()];
        double[] weights = new double[skills.size()];
        double weightSum = 0.0;
        for (int i = 0; i < skills.size(); i++) {
            double skillLoad = load * skills.get(i).demandShare();
            if (skillLoad > 0.0) {
                Staffing s = size(skillLoad, in);
                if (!s.converged()) {
                    throw new CalculationException("Skill " + skills.get(i).skillCode()
                            + " staffing did not converge", variant());
                }
                required[i] = s.agents();
            }
            weights[i] = Math.max(0.0, allocationWeight(skills.get(i), required[i]));
            weightSum += weights[i];
        }

        int[] allocated = new int[skills.size()];
        if (weightSum > 0.0) {
            List<double[]> remainders = new ArrayList<>();
            int assigned = 0;
            for (int i = 0; i < skills.size(); i++) {
                double exact = pooledAgents * weights[i] / weightSum;
                allocated[i] = (int) Math.floor(exact);
                assigned += allocated[i];
                remainders.add(new double[]{i, exact - allocated[i]});
            }
            remainders.sort(Comparator.comparingDouble((double[] r) -> r[1]).reversed());
            for (int k = 0; k < pooledAgents - assigned && k < remainders.size(); k++) {
                allocated[(int) remainders.get(k)[0]]++;
            }
        }

        Map<String, Double> coverage = new LinkedHashMap<>();
        for (int i = 0; i < skills.size(); i++) {
            double pct = required[i] == 0 ? 100.0 : Math.min(100.0, allocated[i] * 100.0 / required[i]);
            coverage.put(skills.get(i).skillCode(), pct);
        }
        return coverage;
    }

    private StaffingInputs readInputs(Job job) {
        InputParameters p = job.inputParameters();
        double offered = require(p, InputParameters.OFFERED_CALLS);
        if (offered < 0) {
            throw new CalculationException("offered_calls must not be negative", variant());
        }
        double aht = require(p, InputParameters.AVERAGE_HANDLE_TIME);
        if (aht <= 0) {
            throw new CalculationException("average_handle_time must be positive", variant());
        }

        double target = p.number(InputParameters.SERVICE_LEVEL_TARGET, DEFAULT_SERVICE_LEVEL_TARGET);
        if (target > 1.0) {
            target = target / 100.0;
        }
        if (!(target > 0.0 && target < 1.0)) {
            throw new CalculationException("service_level_target must be between 0 and 100 exclusive", variant());
        }
        double answerSeconds = p.number(InputParameters.SERVICE_LEVEL_SECONDS, DEFAULT_SERVICE_LEVEL_SECONDS);
        if (answerSeconds < 0) {
            throw new CalculationException("service_level_seconds must not be negative", variant());
        }
        double shrinkage = p.number(InputParameters.SHRINKAGE, 0.0);
        if (shrinkage > 1.0) {
            shrinkage = shrinkage / 100.0;
        }
        if (shrinkage < 0.0 || shrinkage >= 1.0) {
            throw new CalculationException("shrinkage must be in [0,1)", variant());
        }
        double patience = p.number(InputParameters.AVERAGE_PATIENCE_SECONDS, DEFAULT_PATIENCE_SECONDS);
        if (patience <= 0) {
            throw new CalculationException("average_patience_seconds must be positive", variant());
        }

        List<SkillRequirement> skills;
        try {
            skills = normalise(p.skillRequirements());
        } catch (IllegalArgumentException e) {
            throw new CalculationException("Malformed skill_requirements: " + e.getMessage(), variant(), e);
        }
        if (job.type() == JobType.MULTI_SKILL && skills.isEmpty()) {
            throw new CalculationException("multi_skill job without skill_requirements", variant());
        }
        return new StaffingInputs(offered, aht, job.intervalType().seconds(), target, answerSeconds,
                shrinkage, patience, skills);
    }

    private double require(InputParameters p, String key) {
        OptionalDouble v = p.number(key);
        if (v.isEmpty() || !Double.isFinite(v.getAsDouble())) {
            throw new CalculationException(key + " is missing or not numeric", variant());
        }
        return v.getAsDouble();
    }

    private static List<SkillRequirement> normalise(List<SkillRequirement> skills) {
        double total = skills.stream().mapToDouble(SkillRequirement::demandShare).sum();
        if (skills.isEmpty() || Math.abs(total - 1.0) < 1e-9) {
            return skills;
        }
        List<SkillRequirement> out = new ArrayList<>(skills.size());
        for (SkillRequirement s : skills) {
            out.add(new SkillRequirement(s.skillCode(), s.demandShare() / total));
        }
        return out;
    }
}
