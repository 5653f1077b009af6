package com.phillippitts.wfmparity.service.accuracy;

import com.phillippitts.wfmparity.config.properties.AccuracyProperties;
import com.phillippitts.wfmparity.repository.AccuracyMetricRepository;
import com.phillippitts.wfmparity.util.Statistics;
import com.phillippitts.wfmparity.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Flags a percentage difference that exceeds {@code sigma} standard deviations of the key's
 * recent samples. Never flags with fewer than two earlier samples.
 */
@Component
public class OutlierDetector {

    static final int MIN_SAMPLES = 2;

    private final AccuracyMetricRepository metrics;
    private final AccuracyProperties properties;

    public OutlierDetector(AccuracyMetricRepository metrics, AccuracyProperties properties) {
        this.metrics = metrics;
        this.properties = properties;
    }

    public boolean isOutlier(String metricType, String businessUnit, double percentageDifference, Instant now) {
        List<Double> recent = metrics.findPercentageDifferences(metricType, businessUnit,
                TimeUtils.daysBefore(now, properties.getOutlierWindowDays()));
        if (recent.size() < MIN_SAMPLES) {
            return false;
        }
        return percentageDifference > properties.getOutlierSigma() * Statistics.sampleStdDev(recent);
    }
}
