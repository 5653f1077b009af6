package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.HistoricalTrend;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;

import static com.phillippitts.wfmparity.repository.JdbcSupport.date;
import static com.phillippitts.wfmparity.repository.JdbcSupport.id;
import static com.phillippitts.wfmparity.repository.JdbcSupport.instant;
import static com.phillippitts.wfmparity.repository.JdbcSupport.localDate;
import static com.phillippitts.wfmparity.repository.JdbcSupport.nullableDouble;
import static com.phillippitts.wfmparity.repository.JdbcSupport.ts;
import static com.phillippitts.wfmparity.repository.JdbcSupport.uuid;

/**
 * Per-period accuracy trends, unique on (period_start, period_end, business_unit, metric_type).
 */
@Repository
public class HistoricalTrendRepository {

    private static final RowMapper<HistoricalTrend> ROW_MAPPER = (rs, rowNum) -> new HistoricalTrend(
            uuid(rs, "id"),
            localDate(rs, "period_start"),
            localDate(rs, "period_end"),
            rs.getString("business_unit"),
            rs.getString("metric_type"),
            rs.getDouble("avg_accuracy"),
            rs.getDouble("accuracy_trend"),
            rs.getDouble("volatility"),
            rs.getInt("data_points"),
            rs.getInt("anomaly_count"),
            nullableDouble(rs, "trend_confidence"),
            instant(rs, "generated_at"));

    private final JdbcTemplate jdbc;

    public HistoricalTrendRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Inserts the trend, or overwrites the row with the same natural key.
     */
    public void upsert(HistoricalTrend t) {
        if (update(t)) {
            return;
        }
        try {
            jdbc.update("""
                    INSERT INTO historical_trends (id, period_start, period_end, business_unit, metric_type,
                        avg_accuracy, accuracy_trend, volatility, data_points, anomaly_count, trend_confidence,
                        generated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    id(t.id()), date(t.periodStart()), date(t.periodEnd()), t.businessUnit(), t.metricType(),
                    t.averageAccuracy(), t.accuracyTrend(), t.volatility(), t.dataPoints(), t.anomalyCount(),
                    t.trendConfidence(), ts(t.generatedAt()));
        } catch (DuplicateKeyException e) {
            update(t);
        }
    }

    /**
     * {@code generated_at} only moves when a figure changes, so regenerating unchanged data leaves
     * the row as it was.
     */
    private boolean update(HistoricalTrend t) {
        return jdbc.update("""
                UPDATE historical_trends
                SET generated_at = CASE
                        WHEN avg_accuracy = ? AND accuracy_trend = ? AND volatility = ? AND data_points = ?
                            AND anomaly_count = ? AND trend_confidence IS NOT DISTINCT FROM ?
                        THEN generated_at ELSE ? END,
                    avg_accuracy = ?, accuracy_trend = ?, volatility = ?, data_points = ?, anomaly_count = ?,
                    trend_confidence = ?
                WHERE period_start = ? AND period_end = ? AND business_unit = ? AND metric_type = ?
                """,
                t.averageAccuracy(), t.accuracyTrend(), t.volatility(), t.dataPoints(), t.anomalyCount(),
                t.trendConfidence(), ts(t.generatedAt()),
                t.averageAccuracy(), t.accuracyTrend(), t.volatility(), t.dataPoints(), t.anomalyCount(),
                t.trendConfidence(),
                date(t.periodStart()), date(t.periodEnd()), t.businessUnit(), t.metricType()) == 1;
    }

    public List<HistoricalTrend> find(String businessUnit, String metricType) {
        return jdbc.query("""
                SELECT * FROM historical_trends
                WHERE business_unit = ? AND metric_type = ?
                ORDER BY period_start ASC, period_end ASC
                """, ROW_MAPPER, businessUnit, metricType);
    }

    /**
     * Mean {@code avg_accuracy} of the key's trends whose period ended on or after {@code since}.
     */
    public OptionalDouble averageAccuracySince(String metricType, String businessUnit, LocalDate since) {
        Double avg = jdbc.queryForObject("""
                SELECT AVG(avg_accuracy) FROM historical_trends
                WHERE metric_type = ? AND business_unit = ? AND period_end >= ?
                """, Double.class, metricType, businessUnit, date(since));
        return avg == null ? OptionalDouble.empty() : OptionalDouble.of(avg);
    }
}
