package com.phillippitts.wfmparity.service.accuracy;

import com.phillippitts.wfmparity.config.properties.AccuracyProperties;
import com.phillippitts.wfmparity.domain.DeviationPattern;
import com.phillippitts.wfmparity.domain.ScenarioType;
import com.phillippitts.wfmparity.repository.AccuracyMetricRepository;
import com.phillippitts.wfmparity.repository.DeviationPatternRepository;
import com.phillippitts.wfmparity.util.Statistics;
import com.phillippitts.wfmparity.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Maintains running deviation statistics per (scenario, metric, business unit).
 *
 * <p>Mean, min, max and count are folded in by one atomic upsert. Every
 * {@code recompute-every}-th sample the spread and the 95 % interval
 * {@code mean ± 1.96·sd/√n} are recomputed from the trailing statistics window.
 */
@Component
public class DeviationPatternUpdater {
    private static final Logger LOG = LogManager.getLogger(DeviationPatternUpdater.class);

    private final DeviationPatternRepository patterns;
    private final AccuracyMetricRepository metrics;
    private final AccuracyProperties properties;

    public DeviationPatternUpdater(DeviationPatternRepository patterns, AccuracyMetricRepository metrics,
                                   AccuracyProperties properties) {
        this.patterns = patterns;
        this.metrics = metrics;
        this.properties = properties;
    }

    public DeviationPattern update(String metricType, String businessUnit, double deviation, Instant now) {
        ScenarioType scenario = ScenarioType.classify(metricType);
        DeviationPattern pattern = patterns.accumulate(scenario, metricType, businessUnit, deviation, now);
        if (pattern.sampleCount() % properties.getRecomputeEvery() == 0) {
            pattern = recomputeSpread(pattern, now);
        }
        return pattern;
    }

    private DeviationPattern recomputeSpread(DeviationPattern p, Instant now) {
        List<Double> window = metrics.findPercentageDifferences(p.metricType(), p.businessUnit(),
                TimeUtils.daysBefore(now, properties.getStatisticsWindowDays()));
        if (window.size() < 2) {
            return p;
        }
        double mean = Statistics.mean(window);
        double sd = Statistics.sampleStdDev(window);
        double half = DeviationPatternRepository.Z_95 * sd / Math.sqrt(window.size());
        patterns.updateSpread(p.scenarioType(), p.metricType(), p.businessUnit(), sd, mean - half, mean + half, now);
        LOG.debug("Recomputed spread for {}/{}: sd={} over {} samples",
                p.metricType(), p.businessUnit(), sd, window.size());
        return patterns.find(p.scenarioType(), p.metricType(), p.businessUnit()).orElse(p);
    }
}
