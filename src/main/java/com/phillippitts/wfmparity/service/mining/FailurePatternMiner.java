package com.phillippitts.wfmparity.service.mining;

import com.phillippitts.wfmparity.config.properties.MiningProperties;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.FailurePattern;
import com.phillippitts.wfmparity.domain.IssueSeverity;
import com.phillippitts.wfmparity.domain.PatternDetection;
import com.phillippitts.wfmparity.domain.PatternType;
import com.phillippitts.wfmparity.domain.Severity;
import com.phillippitts.wfmparity.exception.FailurePatternNotFoundException;
import com.phillippitts.wfmparity.repository.AccuracyMetricRepository;
import com.phillippitts.wfmparity.repository.AccuracyMetricRepository.DeviationGroup;
import com.phillippitts.wfmparity.repository.DataQualityIssueRepository;
import com.phillippitts.wfmparity.repository.DataQualityIssueRepository.IssueCount;
import com.phillippitts.wfmparity.repository.FailurePatternRepository;
import com.phillippitts.wfmparity.service.performance.PerformanceDegradation;
import com.phillippitts.wfmparity.service.performance.PerformanceMonitor;
import com.phillippitts.wfmparity.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Batch miner for recurring failure modes.
 *
 * <p>Each pass looks for:
 * <ul>
 *   <li><b>Accuracy:</b> metric/business-unit groups with more than {@code min-deviation-samples}
 *       samples above {@code deviation-threshold-pct} in the window</li>
 *   <li><b>Data quality:</b> issue types logged more than {@code min-data-quality-issues} times
 *       in the window, rated by their worst severity</li>
 *   <li><b>Performance:</b> Candidate operations whose latest run exceeds the trailing average
 *       by the configured ratio</li>
 * </ul>
 * Detections are merged into existing patterns by (type, category, affected metrics).
 *
 * <p>Errors propagate to the caller; a failed pass records nothing further.
 */
@Service
public class FailurePatternMiner {
    private static final Logger LOG = LogManager.getLogger(FailurePatternMiner.class);

    private final AccuracyMetricRepository metrics;
    private final DataQualityIssueRepository issues;
    private final FailurePatternRepository patterns;
    private final PerformanceMonitor performance;
    private final MiningProperties properties;
    private final Clock clock;

    public FailurePatternMiner(AccuracyMetricRepository metrics,
                               DataQualityIssueRepository issues,
                               FailurePatternRepository patterns,
                               PerformanceMonitor performance,
                               MiningProperties properties,
                               Clock clock) {
        this.metrics = metrics;
        this.issues = issues;
        this.patterns = patterns;
        this.performance = performance;
        this.properties = properties;
        this.clock = clock;
    }

    public MiningSummary mine() {
        Instant now = clock.instant();
        Instant since = TimeUtils.windowStart(now, Duration.ofHours(properties.getWindowHours()));

        List<FailurePattern> recorded = new ArrayList<>();
        int accuracy = record(accuracyDetections(since), now, recorded);
        int dataQuality = record(dataQualityDetections(since), now, recorded);
        int perf = record(performanceDetections(), now, recorded);

        LOG.info("Mining pass recorded {} accuracy, {} data-quality and {} performance pattern(s)",
                accuracy, dataQuality, perf);
        return new MiningSummary(now, accuracy, dataQuality, perf, recorded);
    }

    /**
     * Open patterns, most severe first, then most frequent.
     */
    public List<FailurePattern> listActive() {
        return patterns.findActive();
    }

    /**
     * Marks an open pattern resolved. Resolving an already resolved pattern changes nothing.
     *
     * @throws FailurePatternNotFoundException if no such pattern exists
     */
    public FailurePattern resolve(UUID patternId, String note) {
        FailurePattern existing = patterns.findById(patternId)
                .orElseThrow(() -> new FailurePatternNotFoundException(patternId));
        if (patterns.resolve(patternId, note, clock.instant())) {
            LOG.info("Failure pattern {} ({} {}) resolved", patternId,
                    existing.patternType().code(), existing.affectedMetrics());
        }
        return patterns.findById(patternId).orElseThrow(() -> new FailurePatternNotFoundException(patternId));
    }

    List<PatternDetection> accuracyDetections(Instant since) {
        List<PatternDetection> out = new ArrayList<>();
        for (DeviationGroup g : metrics.findHighDeviationGroups(
                properties.getDeviationThresholdPct(), since, properties.getMinDeviationSamples())) {
            out.add(new PatternDetection(PatternType.HIGH_DEVIATION, List.of(g.metricType()), g.businessUnit(),
                    String.format(Locale.ROOT, "Consistent deviation of %.1f%% detected", g.averagePct()),
                    Severity.forAverageDeviation(g.averagePct()), g.count()));
        }
        return out;
    }

    List<PatternDetection> dataQualityDetections(Instant since) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        Map<String, IssueSeverity> worst = new LinkedHashMap<>();
        for (IssueCount c : issues.countByTypeAndSeverity(since)) {
            totals.merge(c.issueType(), c.count(), Integer::sum);
            worst.merge(c.issueType(), c.severity(), (a, b) -> a.compareTo(b) >= 0 ? a : b);
        }
        List<PatternDetection> out = new ArrayList<>();
        totals.forEach((type, total) -> {
            if (total > properties.getMinDataQualityIssues()) {
                out.add(new PatternDetection(PatternType.DATA_QUALITY, List.of(type), null,
                        String.format(Locale.ROOT, "%d %s issues in the last %d hours", total, type, properties.getWindowHours()),
                        Severity.forIssueSeverity(worst.get(type)), total));
            }
        });
        return out;
    }

    List<PatternDetection> performanceDetections() {
        List<PatternDetection> out = new ArrayList<>();
        for (PerformanceDegradation d : performance.findDegradations(EngineVariant.CANDIDATE)) {
            out.add(new PatternDetection(PatternType.PERFORMANCE_DEGRADATION, List.of(d.operationType()), null,
                    String.format(Locale.ROOT, "Execution time %.1fx the %d-day average (%d ms vs %.0f ms)",
                            d.ratio(), properties.getPerformanceWindowDays(), d.latestMs(), d.averageMs()),
                    Severity.HIGH, 1));
        }
        return out;
    }

    private int record(List<PatternDetection> detections, Instant now, List<FailurePattern> sink) {
        for (PatternDetection d : detections) {
            FailurePattern p = patterns.record(d, now);
            LOG.debug("Pattern {} {} now seen {} time(s), severity {}",
                    p.patternType().code(), p.affectedMetrics(), p.occurrenceCount(), p.severity());
            sink.add(p);
        }
        return detections.size();
    }
}
