package com.phillippitts.wfmparity.service.maintenance;

import com.phillippitts.wfmparity.domain.AccuracyMetric;
import com.phillippitts.wfmparity.domain.ConfidenceBreakdown;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.PatternDetection;
import com.phillippitts.wfmparity.domain.PatternType;
import com.phillippitts.wfmparity.domain.PerformanceSample;
import com.phillippitts.wfmparity.domain.Severity;
import com.phillippitts.wfmparity.testutil.ParityFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RetentionCleanupServiceTest {

    private final ParityFixture fx = new ParityFixture();
    private final RetentionCleanupService cleanup = new RetentionCleanupService(fx.accuracyRepository,
            fx.performanceRepository, fx.confidenceRepository, fx.patternRepository, fx.maintenanceProperties,
            fx.clock);

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private void rowsAt(Instant at) {
        fx.accuracyRepository.insert(new AccuracyMetric(UUID.randomUUID(), at, "ACME", null, null,
                "occupancy", 80.0, 81.0, 1.0, 1.25, 60.0, 100.0, false, null, null, Map.of()));
        fx.performanceRepository.insert(new PerformanceSample(UUID.randomUUID(), null, EngineVariant.REFERENCE,
                "erlang_c", 1, 1, 10, 1, 13, 0, 5, true, at));
        fx.confidenceRepository.insert("ACME", "occupancy",
                new ConfidenceBreakdown(50.0, 50.0, 100.0, 10.0, 57.0, 1), at);
    }

    @Test
    void removesRowsOlderThanRetention() {
        Instant now = fx.clock.instant();
        rowsAt(now.minus(Duration.ofDays(91)));
        rowsAt(now.minus(Duration.ofDays(89)));

        CleanupSummary summary = cleanup.cleanup();

        assertThat(summary.accuracyMetrics()).isEqualTo(1);
        assertThat(summary.performanceSamples()).isEqualTo(1);
        assertThat(summary.confidenceScores()).isEqualTo(1);
        assertThat(summary.total()).isEqualTo(3);
        assertThat(fx.count("accuracy_metrics")).isEqualTo(1);
        assertThat(fx.count("performance_samples")).isEqualTo(1);
        assertThat(fx.count("confidence_scores")).isEqualTo(1);
    }

    @Test
    void removesOnlyLongResolvedPatterns() {
        PatternDetection stale = new PatternDetection(PatternType.HIGH_DEVIATION, List.of("occupancy"), "ACME",
                "old", Severity.MEDIUM, 6);
        PatternDetection recent = new PatternDetection(PatternType.HIGH_DEVIATION, List.of("service_level"), "ACME",
                "new", Severity.MEDIUM, 6);
        PatternDetection open = new PatternDetection(PatternType.HIGH_DEVIATION, List.of("agents_required"), "ACME",
                "open", Severity.MEDIUM, 6);
        Instant now = fx.clock.instant();
        UUID staleId = fx.patternRepository.record(stale, now.minus(Duration.ofDays(60))).id();
        UUID recentId = fx.patternRepository.record(recent, now.minus(Duration.ofDays(60))).id();
        fx.patternRepository.record(open, now.minus(Duration.ofDays(60)));
        fx.patternRepository.resolve(staleId, null, now.minus(Duration.ofDays(31)));
        fx.patternRepository.resolve(recentId, null, now.minus(Duration.ofDays(2)));

        CleanupSummary summary = cleanup.cleanup();

        assertThat(summary.resolvedPatterns()).isEqualTo(1);
        assertThat(fx.patternRepository.findById(staleId)).isEmpty();
        assertThat(fx.patternRepository.findById(recentId)).isPresent();
        assertThat(fx.miner.listActive()).hasSize(1);
    }
}
