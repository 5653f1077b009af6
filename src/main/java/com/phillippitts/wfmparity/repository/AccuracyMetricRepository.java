package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.AccuracyMetric;
import com.phillippitts.wfmparity.domain.RollingConfidence;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.phillippitts.wfmparity.repository.JdbcSupport.id;
import static com.phillippitts.wfmparity.repository.JdbcSupport.instant;
import static com.phillippitts.wfmparity.repository.JdbcSupport.nullableDouble;
import static com.phillippitts.wfmparity.repository.JdbcSupport.ts;
import static com.phillippitts.wfmparity.repository.JdbcSupport.uuid;

/**
 * Append-only accuracy log. Rows are only ever inserted, re-scored for data quality, or purged
 * by retention.
 */
@Repository
public class AccuracyMetricRepository {

    private static final RowMapper<AccuracyMetric> ROW_MAPPER = (rs, rowNum) -> new AccuracyMetric(
            uuid(rs, "id"),
            instant(rs, "measured_at"),
            rs.getString("business_unit"),
            rs.getString("project_code"),
            rs.getString("interval_type"),
            rs.getString("metric_type"),
            nullableDouble(rs, "reference_value"),
            nullableDouble(rs, "candidate_value"),
            nullableDouble(rs, "absolute_difference"),
            nullableDouble(rs, "percentage_difference"),
            rs.getDouble("confidence_score"),
            rs.getDouble("data_quality_score"),
            rs.getBoolean("is_outlier"),
            rs.getString("source_file"),
            rs.getString("failure_reason"),
            JsonColumns.readMap(rs.getString("metadata")));

    private final JdbcTemplate jdbc;

    public AccuracyMetricRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(AccuracyMetric m) {
        jdbc.update("""
                INSERT INTO accuracy_metrics (id, measured_at, business_unit, project_code, interval_type,
                    metric_type, reference_value, candidate_value, absolute_difference, percentage_difference,
                    confidence_score, data_quality_score, is_outlier, source_file, failure_reason, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                id(m.id()), ts(m.measuredAt()), m.businessUnit(), m.projectCode(), m.intervalType(),
                m.metricType(), m.referenceValue(), m.candidateValue(), m.absoluteDifference(),
                m.percentageDifference(), m.confidenceScore(), m.dataQualityScore(), m.outlier(),
                m.sourceFile(), m.failureReason(), JsonColumns.writeMap(m.metadata()));
    }

    /**
     * Non-null percentage differences recorded for the key since {@code since}.
     */
    public List<Double> findPercentageDifferences(String metricType, String businessUnit, Instant since) {
        return jdbc.queryForList("""
                SELECT percentage_difference FROM accuracy_metrics
                WHERE metric_type = ? AND business_unit = ? AND measured_at >= ?
                  AND percentage_difference IS NOT NULL
                """, Double.class, metricType, businessUnit, ts(since));
    }

    public int countSince(String metricType, String businessUnit, Instant since) {
        Integer n = jdbc.queryForObject("""
                SELECT COUNT(*) FROM accuracy_metrics
                WHERE metric_type = ? AND business_unit = ? AND measured_at >= ?
                """, Integer.class, metricType, businessUnit, ts(since));
        return n == null ? 0 : n;
    }

    public List<AccuracyMetric> findByKeySince(String businessUnit, String metricType, Instant since) {
        return jdbc.query("""
                SELECT * FROM accuracy_metrics
                WHERE business_unit = ? AND metric_type = ? AND measured_at >= ?
                ORDER BY measured_at ASC
                """, ROW_MAPPER, businessUnit, metricType, ts(since));
    }

    /**
     * Samples with {@code from <= measured_at < to}, oldest first.
     */
    public List<AccuracyMetric> findBetween(Instant from, Instant to) {
        return jdbc.query("""
                SELECT * FROM accuracy_metrics
                WHERE measured_at >= ? AND measured_at < ?
                ORDER BY measured_at ASC
                """, ROW_MAPPER, ts(from), ts(to));
    }

    public List<RollingConfidence> summarizeSince(Instant since, String businessUnit, String metricType) {
        StringBuilder where = new StringBuilder("measured_at >= ?");
        List<Object> args = new ArrayList<>();
        args.add(ts(since));
        if (businessUnit != null) {
            where.append(" AND business_unit = ?");
            args.add(businessUnit);
        }
        if (metricType != null) {
            where.append(" AND metric_type = ?");
            args.add(metricType);
        }
        return jdbc.query("""
                SELECT business_unit, metric_type, COUNT(*) AS samples,
                       AVG(confidence_score) AS avg_conf, MIN(confidence_score) AS min_conf,
                       MAX(confidence_score) AS max_conf,
                       COALESCE(AVG(percentage_difference), 0) AS avg_pct,
                       SUM(CASE WHEN is_outlier THEN 1 ELSE 0 END) AS outliers
                FROM accuracy_metrics
                WHERE %s
                GROUP BY business_unit, metric_type
                ORDER BY business_unit, metric_type
                """.formatted(where),
                (rs, rowNum) -> new RollingConfidence(
                        rs.getString("business_unit"),
                        rs.getString("metric_type"),
                        rs.getInt("samples"),
                        rs.getDouble("avg_conf"),
                        rs.getDouble("min_conf"),
                        rs.getDouble("max_conf"),
                        rs.getDouble("avg_pct"),
                        rs.getInt("outliers")),
                args.toArray());
    }

    /**
     * (metric, business unit) groups with more than {@code minCount} samples above {@code thresholdPct}.
     */
    public List<DeviationGroup> findHighDeviationGroups(double thresholdPct, Instant since, int minCount) {
        return jdbc.query("""
                SELECT metric_type, business_unit, COUNT(*) AS n, AVG(percentage_difference) AS avg_pct
                FROM accuracy_metrics
                WHERE percentage_difference > ? AND measured_at >= ?
                GROUP BY metric_type, business_unit
                HAVING COUNT(*) > ?
                ORDER BY metric_type, business_unit
                """,
                (rs, rowNum) -> new DeviationGroup(
                        rs.getString("metric_type"),
                        rs.getString("business_unit"),
                        rs.getInt("n"),
                        rs.getDouble("avg_pct")),
                thresholdPct, ts(since), minCount);
    }

    /**
     * Multiplies the data-quality score of samples from {@code sourceFile} recorded since {@code since}.
     *
     * @return rows re-scored
     */
    public int scaleDataQuality(String sourceFile, Instant since, double factor) {
        return jdbc.update("""
                UPDATE accuracy_metrics SET data_quality_score = data_quality_score * ?
                WHERE source_file = ? AND measured_at >= ?
                """, factor, sourceFile, ts(since));
    }

    public int deleteOlderThan(Instant cutoff) {
        return jdbc.update("DELETE FROM accuracy_metrics WHERE measured_at < ?", ts(cutoff));
    }

    public record DeviationGroup(String metricType, String businessUnit, int count, double averagePct) {
    }
}
