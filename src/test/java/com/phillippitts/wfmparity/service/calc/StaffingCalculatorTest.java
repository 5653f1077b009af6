package com.phillippitts.wfmparity.service.calc;

import com.phillippitts.wfmparity.domain.CalculationResult;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.IntervalType;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.domain.JobType;
import com.phillippitts.wfmparity.domain.StaffingMetrics;
import com.phillippitts.wfmparity.exception.CalculationException;
import com.phillippitts.wfmparity.testutil.MutableClock;
import com.phillippitts.wfmparity.testutil.TestJobs;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class StaffingCalculatorTest {

    // 100 calls of 180 s in 30 minutes: 10 Erlangs
    private static final Map<String, Object> TEN_ERLANGS = Map.of(
            "offered_calls", 100, "average_handle_time", 180,
            "service_level_target", 80, "service_level_seconds", 20);

    private final MutableClock clock = MutableClock.at("2026-03-02T10:00:00Z");
    private final ReferenceStaffingCalculator reference = new ReferenceStaffingCalculator(clock);
    private final CandidateStaffingCalculator candidate =
            new CandidateStaffingCalculator(clock, target -> OptionalDouble.empty());

    @Test
    void referenceFindsSmallestStaffingMeetingTarget() {
        CalculationResult r = reference.calculate(TestJobs.running(TEN_ERLANGS)).result();

        int n = r.metrics().agentsRequired();
        assertThat(r.trafficIntensity()).isCloseTo(10.0, within(1e-9));
        assertThat(ErlangMath.serviceLevel(n, 10.0, 180, 20)).isGreaterThanOrEqualTo(0.8);
        assertThat(ErlangMath.serviceLevel(n - 1, 10.0, 180, 20)).isLessThan(0.8);
        assertThat(r.variant()).isEqualTo(EngineVariant.REFERENCE);
        assertThat(r.algorithmVersion()).isEqualTo(ReferenceStaffingCalculator.VERSION);
        assertThat(r.usage().converged()).isTrue();
    }

    @Test
    void candidateNeverUnderstaffsAndMeetsTarget() {
        Job job = TestJobs.running(TEN_ERLANGS);
        int ref = reference.calculate(job).result().metrics().agentsRequired();
        CalculationResult c = candidate.calculate(job).result();

        assertThat(c.metrics().agentsRequired()).isGreaterThanOrEqualTo(ref);
        assertThat(c.metrics().serviceLevel()).isGreaterThanOrEqualTo(80.0);
        assertThat(c.metrics().agentsRequired())
                .isGreaterThanOrEqualTo(CandidateStaffingCalculator.seed(10.0, 0.8));
    }

    @Test
    void metricsAreConsistent() {
        StaffingMetrics m = reference.calculate(TestJobs.running(TEN_ERLANGS)).result().metrics();

        assertThat(m.occupancy()).isCloseTo(10.0 / m.agentsRequired() * 100.0, within(1e-9));
        assertThat(m.utilization()).isCloseTo(m.occupancy(), within(1e-9));
        assertThat(m.handledCalls() + m.abandonedCalls()).isCloseTo(m.offeredCalls(), within(1e-9));
        assertThat(m.averageWaitTime()).isPositive();
    }

    @Test
    void zeroLoadNeedsNoAgents() {
        CalculationResult r = candidate.calculate(TestJobs.running(
                Map.of("offered_calls", 0, "average_handle_time", 180))).result();

        assertThat(r.metrics().agentsRequired()).isZero();
        assertThat(r.metrics().serviceLevel()).isEqualTo(100.0);
    }

    @Test
    void nonPositiveHandleTimeIsRejected() {
        Job job = TestJobs.running(Map.of("offered_calls", 100, "average_handle_time", 0));

        assertThatThrownBy(() -> reference.calculate(job))
                .isInstanceOf(CalculationException.class)
                .hasMessageContaining("average_handle_time");
    }

    @Test
    void loadAboveAgentCapDoesNotConverge() {
        Job job = TestJobs.running(Map.of("offered_calls", 1_000_000, "average_handle_time", 600));

        assertThatThrownBy(() -> reference.calculate(job))
                .isInstanceOf(CalculationException.class)
                .hasMessageContaining("did not converge");
    }

    @Test
    void loadBeyondIntRangeFailsFastOnBothEngines() {
        // 10^12 calls of 3600 s in 30 minutes: 2 * 10^12 Erlangs
        Job job = TestJobs.running(Map.of("offered_calls", 1_000_000_000_000L, "average_handle_time", 3600));

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertThatThrownBy(() -> reference.calculate(job)).isInstanceOf(CalculationException.class)
                    .hasMessageContaining("did not converge");
            assertThatThrownBy(() -> candidate.calculate(job)).isInstanceOf(CalculationException.class)
                    .hasMessageContaining("did not converge");
        });
        assertThat(reference.size(3.0e9, null)).isEqualTo(new Staffing(AbstractStaffingCalculator.MAX_AGENTS, 0, false));
        assertThat(candidate.size(3.0e9, null)).isEqualTo(new Staffing(AbstractStaffingCalculator.MAX_AGENTS, 0, false));
    }

    @Test
    void candidateBlendsHistoricalVolumeWhenAsked() {
        CandidateStaffingCalculator blending = new CandidateStaffingCalculator(clock, target -> OptionalDouble.of(200));
        Job job = TestJobs.running(Map.of("offered_calls", 100, "average_handle_time", 180,
                "blend_historical_volume", true));

        CalculationResult r = blending.calculate(job).result();

        assertThat(r.metrics().offeredCalls()).isCloseTo(130.0, within(1e-9));
        assertThat(r.trafficIntensity()).isCloseTo(13.0, within(1e-9));
    }

    @Test
    void multiSkillReportsCoveragePerSkill() {
        Job job = TestJobs.running(JobType.MULTI_SKILL, IntervalType.THIRTY_MINUTES, Map.of(
                "offered_calls", 200, "average_handle_time", 180,
                "skill_requirements", List.of(
                        Map.of("skill_code", "billing", "demand_share", 0.75),
                        Map.of("skill_code", "sales", "demand_share", 0.25))));

        for (AbstractStaffingCalculator engine : List.of(reference, candidate)) {
            Map<String, Double> coverage = engine.calculate(job).result().skillCoverage();
            assertThat(coverage).containsOnlyKeys("billing", "sales");
            assertThat(coverage.values()).allSatisfy(v -> assertThat(v).isBetween(0.0, 100.0));
        }
    }

    @Test
    void seedIsAboveLoad() {
        assertThat(CandidateStaffingCalculator.seed(10.0, 0.8)).isGreaterThan(10);
        assertThat(CandidateStaffingCalculator.seed(300.0, 0.8)).isGreaterThanOrEqualTo(306);
    }
}
