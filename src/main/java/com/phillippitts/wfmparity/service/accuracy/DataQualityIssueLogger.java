package com.phillippitts.wfmparity.service.accuracy;

import com.phillippitts.wfmparity.domain.DataQualityIssue;
import com.phillippitts.wfmparity.domain.IssueSeverity;
import com.phillippitts.wfmparity.exception.DataQualityException;
import com.phillippitts.wfmparity.repository.AccuracyMetricRepository;
import com.phillippitts.wfmparity.repository.DataQualityIssueRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Records data-quality issues and lowers the data-quality score of recent samples taken from
 * the same source.
 */
@Component
public class DataQualityIssueLogger {
    private static final Logger LOG = LogManager.getLogger(DataQualityIssueLogger.class);

    /** Samples from an affected source within this window are re-scored. */
    static final Duration RESCORE_WINDOW = Duration.ofHours(1);
    static final double RESCORE_FACTOR = 0.9;
    static final String UNKNOWN_SOURCE = "unknown";

    private final DataQualityIssueRepository issues;
    private final AccuracyMetricRepository metrics;
    private final Clock clock;

    public DataQualityIssueLogger(DataQualityIssueRepository issues, AccuracyMetricRepository metrics, Clock clock) {
        this.issues = issues;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Persists an issue reported by ingestion. Id and detection time are filled in when absent.
     */
    public DataQualityIssue log(DataQualityIssue issue) {
        DataQualityIssue stored = issue.id() != null && issue.detectedAt() != null ? issue : new DataQualityIssue(
                issue.id() != null ? issue.id() : UUID.randomUUID(),
                issue.sourceFile(), issue.issueType(), issue.columnName(), issue.rowCount(), issue.severity(),
                issue.impactDescription(), issue.autoCorrected(), issue.correctionApplied(),
                issue.detectedAt() != null ? issue.detectedAt() : clock.instant());
        issues.insert(stored);
        int rescored = metrics.scaleDataQuality(stored.sourceFile(),
                stored.detectedAt().minus(RESCORE_WINDOW), RESCORE_FACTOR);
        LOG.info("Data-quality issue {} ({}) in {}: {} row(s); re-scored {} recent sample(s)",
                stored.issueType(), stored.severity(), stored.sourceFile(), stored.rowCount(), rescored);
        return stored;
    }

    /**
     * Logs the issue carried by a non-fatal data-quality exception.
     */
    public DataQualityIssue log(DataQualityException e, String sourceFile, String column) {
        Instant now = clock.instant();
        return log(new DataQualityIssue(UUID.randomUUID(),
                sourceFile == null ? UNKNOWN_SOURCE : sourceFile,
                e.getIssueType(), column, 1, IssueSeverity.ERROR, e.getMessage(), false, null, now));
    }
}
