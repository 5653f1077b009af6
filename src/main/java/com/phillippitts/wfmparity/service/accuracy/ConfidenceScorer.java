package com.phillippitts.wfmparity.service.accuracy;

import com.phillippitts.wfmparity.config.properties.AccuracyProperties;
import com.phillippitts.wfmparity.domain.ConfidenceBreakdown;
import com.phillippitts.wfmparity.domain.TrackingRequest;
import com.phillippitts.wfmparity.repository.AccuracyMetricRepository;
import com.phillippitts.wfmparity.repository.HistoricalTrendRepository;
import com.phillippitts.wfmparity.util.Statistics;
import com.phillippitts.wfmparity.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Weighted confidence in an accuracy sample, 0..100.
 *
 * <pre>
 * 0.2 * base(50) + 0.3 * historical accuracy + 0.3 * data quality + 0.2 * volume factor
 * </pre>
 * Historical accuracy is the mean trend accuracy of the key over the historical window
 * (50 without history). The volume factor is {@code clamp(log10(n + 1) * 20, 10, 100)}
 * where n counts the key's samples in the window including the one being scored.
 */
@Component
public class ConfidenceScorer {

    static final double BASE_CONFIDENCE = 50.0;
    static final double DEFAULT_HISTORICAL_ACCURACY = 50.0;
    static final double FULL_DATA_QUALITY = 100.0;
    static final double MIXED_TYPES_CAP = 50.0;

    static final double BASE_WEIGHT = 0.2;
    static final double HISTORICAL_WEIGHT = 0.3;
    static final double DATA_QUALITY_WEIGHT = 0.3;
    static final double VOLUME_WEIGHT = 0.2;

    private final AccuracyMetricRepository metrics;
    private final HistoricalTrendRepository trends;
    private final AccuracyProperties properties;

    public ConfidenceScorer(AccuracyMetricRepository metrics, HistoricalTrendRepository trends,
                            AccuracyProperties properties) {
        this.metrics = metrics;
        this.trends = trends;
        this.properties = properties;
    }

    public ConfidenceBreakdown score(TrackingRequest request, Instant now) {
        Instant since = TimeUtils.daysBefore(now, properties.getHistoricalWindowDays());
        double historical = Statistics.clamp(
                trends.averageAccuracySince(request.metricType(), request.businessUnit(),
                                LocalDate.ofInstant(since, ZoneOffset.UTC))
                        .orElse(DEFAULT_HISTORICAL_ACCURACY),
                0.0, 100.0);
        double dataQuality = dataQuality(request);
        int samples = metrics.countSince(request.metricType(), request.businessUnit(), since) + 1;
        double volume = volumeFactor(samples);

        double score = Statistics.clamp(
                BASE_WEIGHT * BASE_CONFIDENCE
                        + HISTORICAL_WEIGHT * historical
                        + DATA_QUALITY_WEIGHT * dataQuality
                        + VOLUME_WEIGHT * volume,
                0.0, 100.0);
        return new ConfidenceBreakdown(BASE_CONFIDENCE, historical, dataQuality, volume, score, samples);
    }

    /**
     * Caller's score (default 100), 0 when a value is missing, capped for mixed-type sources.
     */
    static double dataQuality(TrackingRequest request) {
        if (request.referenceValue() == null || request.candidateValue() == null) {
            return 0.0;
        }
        double dq = request.dataQualityScore() == null
                ? FULL_DATA_QUALITY
                : Statistics.clamp(request.dataQualityScore(), 0.0, 100.0);
        return request.hasMixedTypes() ? Math.min(dq, MIXED_TYPES_CAP) : dq;
    }

    static double volumeFactor(int samples) {
        return Statistics.clamp(Math.log10(samples + 1.0) * 20.0, 10.0, 100.0);
    }
}
