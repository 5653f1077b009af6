package com.phillippitts.wfmparity.service.accuracy;

import com.phillippitts.wfmparity.domain.AccuracyMetric;
import com.phillippitts.wfmparity.domain.AccuracySummary;
import com.phillippitts.wfmparity.domain.ComparisonResult;
import com.phillippitts.wfmparity.domain.ComparisonSummary;
import com.phillippitts.wfmparity.domain.ConfidenceBreakdown;
import com.phillippitts.wfmparity.domain.DeviationPattern;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.domain.JobType;
import com.phillippitts.wfmparity.domain.MetricDifference;
import com.phillippitts.wfmparity.domain.RollingConfidence;
import com.phillippitts.wfmparity.domain.TrackingOutcome;
import com.phillippitts.wfmparity.domain.TrackingRequest;
import com.phillippitts.wfmparity.exception.DataQualityException;
import com.phillippitts.wfmparity.repository.AccuracyMetricRepository;
import com.phillippitts.wfmparity.repository.ComparisonRepository;
import com.phillippitts.wfmparity.repository.ConfidenceScoreRepository;
import com.phillippitts.wfmparity.repository.DeviationPatternRepository;
import com.phillippitts.wfmparity.service.compare.DefaultResultComparator;
import com.phillippitts.wfmparity.service.events.AnomalyDetectedEvent;
import com.phillippitts.wfmparity.service.metrics.ParityMetrics;
import com.phillippitts.wfmparity.util.Differences;
import com.phillippitts.wfmparity.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Records reference/candidate accuracy samples and keeps the statistics derived from them.
 *
 * <p>Each sample gets a confidence score, an outlier flag and is folded into the key's
 * deviation pattern. Missing or non-finite values do not fail tracking: the sample is kept
 * with a zero data-quality score and a data-quality issue is logged.
 */
@Service
public class AccuracyTracker {
    private static final Logger LOG = LogManager.getLogger(AccuracyTracker.class);

    public static final String MULTI_SKILL_COVERAGE = "multi_skill_coverage";

    /** Comparison metrics turned into accuracy samples. */
    static final List<String> TRACKED_METRICS = List.of(
            DefaultResultComparator.AGENTS_REQUIRED,
            DefaultResultComparator.SERVICE_LEVEL,
            DefaultResultComparator.OCCUPANCY,
            DefaultResultComparator.AVERAGE_WAIT_TIME);

    static final Duration SUMMARY_WINDOW = Duration.ofHours(24);

    private final AccuracyMetricRepository metrics;
    private final ConfidenceScoreRepository confidenceScores;
    private final DeviationPatternRepository deviationPatterns;
    private final ComparisonRepository comparisons;
    private final ConfidenceScorer scorer;
    private final OutlierDetector outliers;
    private final DeviationPatternUpdater deviations;
    private final DataQualityIssueLogger issues;
    private final ApplicationEventPublisher publisher;
    private final ParityMetrics parityMetrics;
    private final Clock clock;

    public AccuracyTracker(AccuracyMetricRepository metrics,
                           ConfidenceScoreRepository confidenceScores,
                           DeviationPatternRepository deviationPatterns,
                           ComparisonRepository comparisons,
                           ConfidenceScorer scorer,
                           OutlierDetector outliers,
                           DeviationPatternUpdater deviations,
                           DataQualityIssueLogger issues,
                           ApplicationEventPublisher publisher,
                           ParityMetrics parityMetrics,
                           Clock clock) {
        this.metrics = metrics;
        this.confidenceScores = confidenceScores;
        this.deviationPatterns = deviationPatterns;
        this.comparisons = comparisons;
        this.scorer = scorer;
        this.outliers = outliers;
        this.deviations = deviations;
        this.issues = issues;
        this.publisher = publisher;
        this.parityMetrics = parityMetrics;
        this.clock = clock;
    }

    /**
     * Records one sample.
     *
     * @return differences (null when a value is missing), confidence and outlier flag
     */
    public TrackingOutcome track(TrackingRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Instant now = clock.instant();

        TrackingRequest screened = request;
        String failureReason = null;
        try {
            requireUsableValues(request);
        } catch (DataQualityException e) {
            LOG.warn("Data-quality problem in {} sample for {}: {}",
                    request.metricType(), request.businessUnit(), e.getMessage());
            issues.log(e, request.sourceFile(), request.metricType());
            screened = withoutUnusableValues(request);
            failureReason = e.getMessage();
        }

        Double ref = screened.referenceValue();
        Double cand = screened.candidateValue();
        Double abs = null;
        Double pct = null;
        if (ref != null && cand != null) {
            abs = Differences.absolute(ref, cand);
            pct = Differences.percentage(ref, cand);
        }

        ConfidenceBreakdown confidence = scorer.score(screened, now);
        confidenceScores.insert(screened.businessUnit(), screened.metricType(), confidence, now);
        boolean outlier = pct != null
                && outliers.isOutlier(screened.metricType(), screened.businessUnit(), pct, now);

        AccuracyMetric sample = new AccuracyMetric(UUID.randomUUID(), now, screened.businessUnit(),
                screened.projectCode(), screened.intervalType(), screened.metricType(), ref, cand, abs, pct,
                confidence.finalScore(), confidence.dataQuality(), outlier, screened.sourceFile(), failureReason,
                screened.metadata());
        metrics.insert(sample);

        if (pct != null) {
            deviations.update(screened.metricType(), screened.businessUnit(), pct, now);
        }
        if (outlier) {
            parityMetrics.incrementOutlier(screened.metricType());
            publisher.publishEvent(new AnomalyDetectedEvent(AnomalyDetectedEvent.Kind.ACCURACY_OUTLIER,
                    screened.businessUnit() + "/" + screened.metricType(),
                    String.format(Locale.ROOT, "percentage difference %.2f%% is an outlier", pct), now));
        }
        return new TrackingOutcome(sample.id(), abs, pct, confidence.finalScore(), outlier);
    }

    /**
     * Records one sample per tracked metric of a completed comparison, plus the mean skill
     * coverage for multi-skill jobs. The job's project is the business unit.
     */
    public List<TrackingOutcome> consumeComparison(Job job, ComparisonResult comparison) {
        String businessUnit = job.target().projectCode();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("job_id", job.id().toString());
        metadata.put("comparison_id", comparison.id().toString());
        metadata.put("recommendation", comparison.recommendation().name());
        if (job.target().queueCode() != null) {
            metadata.put("queue_code", job.target().queueCode());
        }

        List<TrackingOutcome> out = new ArrayList<>();
        for (String metric : TRACKED_METRICS) {
            comparison.difference(metric).ifPresent(d -> out.add(track(new TrackingRequest(businessUnit,
                    job.target().projectCode(), job.intervalType().code(), metric,
                    d.referenceValue(), d.candidateValue(), null, metadata))));
        }
        List<MetricDifference> skills = comparison.skillCoverageDifferences();
        if (job.type() == JobType.MULTI_SKILL && !skills.isEmpty()) {
            double refCoverage = skills.stream().mapToDouble(MetricDifference::referenceValue).average().orElse(0.0);
            double candCoverage = skills.stream().mapToDouble(MetricDifference::candidateValue).average().orElse(0.0);
            out.add(track(new TrackingRequest(businessUnit, job.target().projectCode(), job.intervalType().code(),
                    MULTI_SKILL_COVERAGE, refCoverage, candCoverage, null, metadata)));
        }
        LOG.debug("Tracked {} accuracy sample(s) for job {}", out.size(), job.id());
        return out;
    }

    /**
     * Confidence statistics per key over the trailing {@code days}; either filter may be null.
     */
    public List<RollingConfidence> rollingConfidence(String businessUnit, String metricType, int days) {
        return metrics.summarizeSince(TimeUtils.daysBefore(clock.instant(), days), businessUnit, metricType);
    }

    /**
     * Statistics of the last 24 hours. Comparison agreement is included when a business unit is given.
     */
    public AccuracySummary summary(String businessUnit) {
        Instant since = TimeUtils.windowStart(clock.instant(), SUMMARY_WINDOW);
        ComparisonSummary agreement = businessUnit == null ? null : comparisons.summarize(businessUnit, since);
        return new AccuracySummary(since, metrics.summarizeSince(since, businessUnit, null), agreement);
    }

    public List<DeviationPattern> deviationPatterns(String businessUnit) {
        return deviationPatterns.findAll(businessUnit);
    }

    private static void requireUsableValues(TrackingRequest r) {
        if (r.referenceValue() == null || r.candidateValue() == null) {
            throw new DataQualityException("missing_value",
                    (r.referenceValue() == null ? "reference" : "candidate") + " value missing");
        }
        if (!Double.isFinite(r.referenceValue()) || !Double.isFinite(r.candidateValue())) {
            throw new DataQualityException("non_finite_value", "value is not a finite number");
        }
    }

    private static TrackingRequest withoutUnusableValues(TrackingRequest r) {
        return new TrackingRequest(r.businessUnit(), r.projectCode(), r.intervalType(), r.metricType(),
                finiteOrNull(r.referenceValue()), finiteOrNull(r.candidateValue()),
                r.dataQualityScore(), r.metadata());
    }

    private static Double finiteOrNull(Double v) {
        return v == null || !Double.isFinite(v) ? null : v;
    }
}
