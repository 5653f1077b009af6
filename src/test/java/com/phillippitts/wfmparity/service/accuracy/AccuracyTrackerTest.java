package com.phillippitts.wfmparity.service.accuracy;

import com.phillippitts.wfmparity.domain.AccuracySummary;
import com.phillippitts.wfmparity.domain.DeviationPattern;
import com.phillippitts.wfmparity.domain.ScenarioType;
import com.phillippitts.wfmparity.domain.TrackingOutcome;
import com.phillippitts.wfmparity.domain.TrackingRequest;
import com.phillippitts.wfmparity.service.events.AnomalyDetectedEvent;
import com.phillippitts.wfmparity.testutil.ParityFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AccuracyTrackerTest {

    private static final String BU = "ACME";
    private static final String AGENTS = "agents_required";

    private final ParityFixture fx = new ParityFixture();

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private TrackingOutcome track(double reference, double candidate) {
        TrackingOutcome outcome = fx.tracker.track(TrackingRequest.of(BU, AGENTS, reference, candidate));
        fx.clock.advance(Duration.ofMinutes(1));
        return outcome;
    }

    @Test
    void firstSampleScoresFromDefaults() {
        TrackingOutcome outcome = track(100, 95);

        assertThat(outcome.absoluteDifference()).isEqualTo(5.0);
        assertThat(outcome.percentageDifference()).isCloseTo(5.0, within(1e-9));
        // 0.2*50 + 0.3*50 + 0.3*100 + 0.2*10
        assertThat(outcome.confidenceScore()).isCloseTo(57.0, within(1e-9));
        assertThat(outcome.outlier()).isFalse();
        assertThat(fx.count("accuracy_metrics")).isEqualTo(1);
        assertThat(fx.count("confidence_scores")).isEqualTo(1);
    }

    @Test
    void confidenceStaysWithinBounds() {
        for (int i = 0; i < 30; i++) {
            TrackingOutcome outcome = fx.tracker.track(new TrackingRequest(BU, null, null, AGENTS,
                    100.0, 100.0 + i, 250.0, Map.of()));
            assertThat(outcome.confidenceScore()).isBetween(0.0, 100.0);
        }
    }

    @Test
    void missingValueIsKeptAndLoggedAsDataQualityIssue() {
        TrackingOutcome outcome = fx.tracker.track(new TrackingRequest(BU, null, null, AGENTS, 100.0, null, null,
                Map.of("source_file", "forecast.xlsx")));

        assertThat(outcome.percentageDifference()).isNull();
        assertThat(outcome.absoluteDifference()).isNull();
        assertThat(fx.count("accuracy_metrics")).isEqualTo(1);
        assertThat(fx.jdbc.queryForObject("SELECT data_quality_score FROM accuracy_metrics", Double.class))
                .isZero();
        assertThat(fx.jdbc.queryForObject("SELECT failure_reason FROM accuracy_metrics", String.class))
                .isEqualTo("candidate value missing");
        assertThat(fx.jdbc.queryForObject("SELECT issue_type FROM data_quality_issues WHERE source_file = ?",
                String.class, "forecast.xlsx")).isEqualTo("missing_value");
        assertThat(fx.tracker.deviationPatterns(BU)).isEmpty();
    }

    @Test
    void noOutlierWithoutHistory() {
        assertThat(track(10, 50).outlier()).isFalse();
    }

    @Test
    void largeDeviationAgainstStableHistoryIsOutlier() {
        track(100, 101);
        track(100, 105);
        track(100, 101);
        track(100, 105);

        TrackingOutcome outcome = track(100, 150);

        assertThat(outcome.outlier()).isTrue();
        assertThat(fx.events.ofType(AnomalyDetectedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.kind()).isEqualTo(AnomalyDetectedEvent.Kind.ACCURACY_OUTLIER));
        assertThat(fx.registry.find("wfmparity.accuracy.outliers").counter().count()).isEqualTo(1.0);
    }

    @Test
    void deviationPatternKeepsRunningStatistics() {
        track(100, 102);
        track(100, 104);
        track(100, 106);

        DeviationPattern pattern = fx.tracker.deviationPatterns(BU).get(0);
        assertThat(pattern.scenarioType()).isEqualTo(ScenarioType.AGENT_CALCULATION);
        assertThat(pattern.sampleCount()).isEqualTo(3);
        assertThat(pattern.averageDeviation()).isCloseTo(4.0, within(1e-9));
        assertThat(pattern.minDeviation()).isCloseTo(2.0, within(1e-9));
        assertThat(pattern.maxDeviation()).isCloseTo(6.0, within(1e-9));
    }

    @Test
    void spreadIsRecomputedEveryConfiguredSample() {
        fx.accuracyProperties.setRecomputeEvery(4);
        track(100, 102);
        track(100, 104);
        track(100, 106);
        track(100, 108);

        DeviationPattern pattern = fx.tracker.deviationPatterns(BU).get(0);
        // sample sd of 2, 4, 6, 8
        assertThat(pattern.standardDeviation()).isCloseTo(2.582, within(1e-3));
        assertThat(pattern.confidenceIntervalLower()).isLessThan(5.0);
        assertThat(pattern.confidenceIntervalUpper()).isGreaterThan(5.0);
    }

    @Test
    void summaryAggregatesLastDay() {
        track(100, 110);
        track(100, 90);
        fx.tracker.track(TrackingRequest.of(BU, "service_level", 80.0, 80.0));

        AccuracySummary summary = fx.tracker.summary(null);

        assertThat(summary.comparisons()).isNull();
        assertThat(summary.metrics()).hasSize(2);
        assertThat(summary.metrics())
                .filteredOn(r -> r.metricType().equals(AGENTS))
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.samples()).isEqualTo(2);
                    assertThat(r.averagePercentageDifference()).isCloseTo(10.0, within(1e-9));
                });
        assertThat(fx.tracker.rollingConfidence(BU, AGENTS, 30)).hasSize(1);
    }
}
