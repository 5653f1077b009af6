package com.phillippitts.wfmparity.service.maintenance;

import com.phillippitts.wfmparity.config.properties.MaintenanceProperties;
import com.phillippitts.wfmparity.repository.AccuracyMetricRepository;
import com.phillippitts.wfmparity.repository.ConfidenceScoreRepository;
import com.phillippitts.wfmparity.repository.FailurePatternRepository;
import com.phillippitts.wfmparity.repository.PerformanceSampleRepository;
import com.phillippitts.wfmparity.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Purges aged accuracy samples, performance samples, confidence history and resolved failure
 * patterns. Jobs, results and comparisons are never purged.
 *
 * <p>Errors propagate to the caller.
 */
@Service
public class RetentionCleanupService {
    private static final Logger LOG = LogManager.getLogger(RetentionCleanupService.class);

    private final AccuracyMetricRepository accuracyMetrics;
    private final PerformanceSampleRepository performanceSamples;
    private final ConfidenceScoreRepository confidenceScores;
    private final FailurePatternRepository failurePatterns;
    private final MaintenanceProperties properties;
    private final Clock clock;

    public RetentionCleanupService(AccuracyMetricRepository accuracyMetrics,
                                   PerformanceSampleRepository performanceSamples,
                                   ConfidenceScoreRepository confidenceScores,
                                   FailurePatternRepository failurePatterns,
                                   MaintenanceProperties properties,
                                   Clock clock) {
        this.accuracyMetrics = accuracyMetrics;
        this.performanceSamples = performanceSamples;
        this.confidenceScores = confidenceScores;
        this.failurePatterns = failurePatterns;
        this.properties = properties;
        this.clock = clock;
    }

    public CleanupSummary cleanup() {
        Instant now = clock.instant();
        Instant cutoff = TimeUtils.daysBefore(now, properties.getRetentionDays());
        Instant resolvedCutoff = TimeUtils.daysBefore(now, properties.getResolvedPatternRetentionDays());

        CleanupSummary summary = new CleanupSummary(now,
                accuracyMetrics.deleteOlderThan(cutoff),
                performanceSamples.deleteOlderThan(cutoff),
                confidenceScores.deleteOlderThan(cutoff),
                failurePatterns.deleteResolvedBefore(resolvedCutoff));
        LOG.info("Retention cleanup removed {} row(s): {} accuracy, {} performance, {} confidence, {} patterns",
                summary.total(), summary.accuracyMetrics(), summary.performanceSamples(),
                summary.confidenceScores(), summary.resolvedPatterns());
        return summary;
    }
}
