package com.phillippitts.wfmparity.service.trend;

import com.phillippitts.wfmparity.domain.AccuracyMetric;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.Forecast;
import com.phillippitts.wfmparity.domain.HistoricalTrend;
import com.phillippitts.wfmparity.domain.OperationalPeriod;
import com.phillippitts.wfmparity.domain.OperationalTrendReport;
import com.phillippitts.wfmparity.domain.TrackingSignal;
import com.phillippitts.wfmparity.domain.TrendDirection;
import com.phillippitts.wfmparity.repository.AccuracyMetricRepository;
import com.phillippitts.wfmparity.repository.CalculationResultRepository;
import com.phillippitts.wfmparity.repository.CalculationResultRepository.DatedFigures;
import com.phillippitts.wfmparity.repository.HistoricalTrendRepository;
import com.phillippitts.wfmparity.util.Statistics;
import com.phillippitts.wfmparity.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Accuracy trends, forecasts and operational trend analysis.
 *
 * <p>Trend generation is idempotent: regenerating a period overwrites the rows with the same
 * (period, business unit, metric) key. Forecasts are single-step least-squares projections
 * against epoch seconds, with no seasonality.
 */
@Service
public class TrendEngine {
    private static final Logger LOG = LogManager.getLogger(TrendEngine.class);

    private final AccuracyMetricRepository metrics;
    private final HistoricalTrendRepository trends;
    private final CalculationResultRepository results;
    private final Clock clock;

    public TrendEngine(AccuracyMetricRepository metrics, HistoricalTrendRepository trends,
                       CalculationResultRepository results, Clock clock) {
        this.metrics = metrics;
        this.trends = trends;
        this.results = results;
        this.clock = clock;
    }

    /**
     * Aggregates the samples measured on {@code start..end} (inclusive dates, UTC) into one
     * trend per (business unit, metric type).
     *
     * @return the stored trends
     */
    public List<HistoricalTrend> generateTrends(LocalDate start, LocalDate end) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
        LocalDate midpoint = start.plusDays(ChronoUnit.DAYS.between(start, end) / 2);
        Instant now = clock.instant();

        Map<String, List<AccuracyMetric>> groups = new LinkedHashMap<>();
        for (AccuracyMetric m : metrics.findBetween(startOfDay(start), startOfDay(end.plusDays(1)))) {
            groups.computeIfAbsent(m.businessUnit() + '\u0000' + m.metricType(), k -> new ArrayList<>()).add(m);
        }

        List<HistoricalTrend> out = new ArrayList<>();
        for (List<AccuracyMetric> group : groups.values()) {
            trendOf(group, start, end, midpoint, now).ifPresent(t -> {
                trends.upsert(t);
                out.add(t);
            });
        }
        LOG.info("Generated {} trend(s) for {}..{}", out.size(), start, end);
        return out;
    }

    public List<HistoricalTrend> listTrends(String businessUnit, String metricType) {
        return trends.find(businessUnit, metricType);
    }

    /**
     * Projects the key's average accuracy one period past its latest trend.
     */
    public Optional<Forecast> forecastAccuracy(String businessUnit, String metricType) {
        List<HistoricalTrend> history = trends.find(businessUnit, metricType);
        List<Double> x = new ArrayList<>();
        List<Double> y = new ArrayList<>();
        for (HistoricalTrend t : history) {
            x.add(epochSeconds(t.periodStart()));
            y.add(t.averageAccuracy());
        }
        return forecast(metricType, x, y);
    }

    /**
     * Reference results of a project aggregated per calculation date, with direction,
     * volatility, next-period forecasts and diagnostic correlations.
     */
    public OperationalTrendReport operationalTrends(String projectCode, LocalDate from, LocalDate to) {
        TreeMap<LocalDate, List<DatedFigures>> byDay = new TreeMap<>();
        for (DatedFigures f : results.findDatedFigures(projectCode, EngineVariant.REFERENCE, from, to)) {
            byDay.computeIfAbsent(f.calculationDate(), d -> new ArrayList<>()).add(f);
        }

        List<OperationalPeriod> periods = new ArrayList<>();
        byDay.forEach((day, figures) -> periods.add(new OperationalPeriod(day, figures.size(),
                figures.stream().mapToDouble(DatedFigures::offeredCalls).sum(),
                figures.stream().mapToDouble(DatedFigures::serviceLevel).average().orElse(0.0),
                figures.stream().mapToDouble(DatedFigures::averageHandleTime).average().orElse(0.0),
                figures.stream().mapToDouble(DatedFigures::agentsRequired).average().orElse(0.0))));

        List<Double> x = new ArrayList<>();
        List<Double> sl = new ArrayList<>();
        List<Double> volume = new ArrayList<>();
        List<Double> aht = new ArrayList<>();
        for (OperationalPeriod p : periods) {
            x.add(epochSeconds(p.periodStart()));
            sl.add(p.averageServiceLevel());
            volume.add(p.totalCalls());
            aht.add(p.averageHandleTime());
        }

        double avgChange = 0.0;
        if (sl.size() >= 2) {
            avgChange = (sl.get(sl.size() - 1) - sl.get(0)) / (sl.size() - 1);
        }
        return new OperationalTrendReport(projectCode, periods, TrendDirection.of(avgChange), avgChange,
                Statistics.sampleStdDev(sl),
                forecast("service_level", x, sl).orElse(null),
                forecast("offered_calls", x, volume).orElse(null),
                correlation(volume, sl),
                correlation(aht, sl));
    }

    /**
     * Cumulative candidate bias over the trailing {@code days}, relative to mean absolute error.
     */
    public TrackingSignal trackingSignal(String businessUnit, String metricType, int days) {
        double bias = 0.0;
        double absolute = 0.0;
        int n = 0;
        for (AccuracyMetric m : metrics.findByKeySince(businessUnit, metricType,
                TimeUtils.daysBefore(clock.instant(), days))) {
            if (m.referenceValue() == null || m.candidateValue() == null) {
                continue;
            }
            double error = m.candidateValue() - m.referenceValue();
            bias += error;
            absolute += Math.abs(error);
            n++;
        }
        double mad = n == 0 ? 0.0 : absolute / n;
        double signal = mad == 0.0 ? 0.0 : bias / mad;
        return new TrackingSignal(businessUnit, metricType, n, bias, mad, signal);
    }

    private Optional<HistoricalTrend> trendOf(List<AccuracyMetric> group, LocalDate start, LocalDate end,
                                              LocalDate midpoint, Instant now) {
        List<Double> pct = new ArrayList<>();
        List<Double> firstHalf = new ArrayList<>();
        List<Double> secondHalf = new ArrayList<>();
        double confidenceSum = 0.0;
        int anomalies = 0;
        for (AccuracyMetric m : group) {
            confidenceSum += m.confidenceScore();
            if (m.outlier()) {
                anomalies++;
            }
            if (m.percentageDifference() == null) {
                continue;
            }
            pct.add(m.percentageDifference());
            LocalDate day = LocalDate.ofInstant(m.measuredAt(), ZoneOffset.UTC);
            (day.isAfter(midpoint) ? secondHalf : firstHalf).add(m.percentageDifference());
        }
        AccuracyMetric first = group.get(0);
        if (pct.isEmpty()) {
            LOG.debug("No comparable samples for {}/{}, trend skipped", first.businessUnit(), first.metricType());
            return Optional.empty();
        }

        double trend = 0.0;
        if (pct.size() >= 2 && !firstHalf.isEmpty() && !secondHalf.isEmpty()) {
            trend = (100.0 - Statistics.mean(secondHalf)) - (100.0 - Statistics.mean(firstHalf));
        }
        return Optional.of(new HistoricalTrend(UUID.randomUUID(), start, end, first.businessUnit(),
                first.metricType(), 100.0 - Statistics.mean(pct), trend, Statistics.sampleStdDev(pct),
                group.size(), anomalies, confidenceSum / group.size(), now));
    }

    private static Optional<Forecast> forecast(String metric, List<Double> x, List<Double> y) {
        return LinearRegression.fit(x, y).map(fit -> {
            double next = x.size() >= 2
                    ? x.get(x.size() - 1) + (x.get(x.size() - 1) - x.get(0)) / (x.size() - 1)
                    : x.get(0);
            return new Forecast(metric, fit.slope(), fit.intercept(),
                    Instant.ofEpochSecond((long) next), fit.predict(next), fit.points());
        });
    }

    private static Double correlation(List<Double> a, List<Double> b) {
        if (a.size() < 2 || Statistics.sampleStdDev(a) == 0.0 || Statistics.sampleStdDev(b) == 0.0) {
            return null;
        }
        return Statistics.pearson(a, b);
    }

    private static Instant startOfDay(LocalDate day) {
        return day.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private static double epochSeconds(LocalDate day) {
        return day.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }
}
