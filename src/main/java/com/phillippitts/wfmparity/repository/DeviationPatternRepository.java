package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.DeviationPattern;
import com.phillippitts.wfmparity.domain.ScenarioType;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.phillippitts.wfmparity.repository.JdbcSupport.id;
import static com.phillippitts.wfmparity.repository.JdbcSupport.instant;
import static com.phillippitts.wfmparity.repository.JdbcSupport.ts;
import static com.phillippitts.wfmparity.repository.JdbcSupport.uuid;

/**
 * Deviation statistics keyed by (scenario, metric, business unit).
 *
 * <p>The running aggregates are folded in by one UPDATE statement, so concurrent trackers never
 * lose an increment. The first sample of a key is inserted; if a concurrent tracker inserted it
 * first, the unique key rejects the insert and the UPDATE is retried.
 */
@Repository
public class DeviationPatternRepository {

    public static final double Z_95 = 1.96;

    private static final RowMapper<DeviationPattern> ROW_MAPPER = (rs, rowNum) -> new DeviationPattern(
            uuid(rs, "id"),
            ScenarioType.valueOf(rs.getString("scenario_type")),
            rs.getString("metric_type"),
            rs.getString("business_unit"),
            rs.getDouble("avg_deviation"),
            rs.getDouble("std_deviation"),
            rs.getDouble("min_deviation"),
            rs.getDouble("max_deviation"),
            rs.getInt("sample_count"),
            rs.getDouble("confidence_interval_lower"),
            rs.getDouble("confidence_interval_upper"),
            instant(rs, "last_updated"));

    private final JdbcTemplate jdbc;

    public DeviationPatternRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Folds one deviation into the key's running mean, min, max and count.
     *
     * @return the pattern after the update
     */
    public DeviationPattern accumulate(ScenarioType scenario, String metricType, String businessUnit,
                                       double deviation, Instant now) {
        if (!incrementExisting(scenario, metricType, businessUnit, deviation, now)) {
            try {
                jdbc.update("""
                        INSERT INTO deviation_patterns (id, scenario_type, metric_type, business_unit, avg_deviation,
                            std_deviation, min_deviation, max_deviation, sample_count, confidence_interval_lower,
                            confidence_interval_upper, last_updated)
                        VALUES (?, ?, ?, ?, ?, 0, ?, ?, 1, ?, ?, ?)
                        """,
                        id(UUID.randomUUID()), scenario.name(), metricType, businessUnit, deviation,
                        deviation, deviation, deviation - Z_95, deviation + Z_95, ts(now));
            } catch (DuplicateKeyException e) {
                incrementExisting(scenario, metricType, businessUnit, deviation, now);
            }
        }
        return find(scenario, metricType, businessUnit)
                .orElseThrow(() -> new IllegalStateException("Deviation pattern vanished: " + metricType));
    }

    private boolean incrementExisting(ScenarioType scenario, String metricType, String businessUnit,
                                      double deviation, Instant now) {
        return jdbc.update("""
                UPDATE deviation_patterns
                SET avg_deviation = (avg_deviation * sample_count + ?) / (sample_count + 1),
                    min_deviation = LEAST(min_deviation, ?),
                    max_deviation = GREATEST(max_deviation, ?),
                    sample_count = sample_count + 1,
                    last_updated = ?
                WHERE scenario_type = ? AND metric_type = ? AND business_unit = ?
                """,
                deviation, deviation, deviation, ts(now), scenario.name(), metricType, businessUnit) == 1;
    }

    public void updateSpread(ScenarioType scenario, String metricType, String businessUnit,
                             double stdDeviation, double lower, double upper, Instant now) {
        jdbc.update("""
                UPDATE deviation_patterns
                SET std_deviation = ?, confidence_interval_lower = ?, confidence_interval_upper = ?, last_updated = ?
                WHERE scenario_type = ? AND metric_type = ? AND business_unit = ?
                """,
                stdDeviation, lower, upper, ts(now), scenario.name(), metricType, businessUnit);
    }

    public Optional<DeviationPattern> find(ScenarioType scenario, String metricType, String businessUnit) {
        return jdbc.query("""
                SELECT * FROM deviation_patterns
                WHERE scenario_type = ? AND metric_type = ? AND business_unit = ?
                """, ROW_MAPPER, scenario.name(), metricType, businessUnit).stream().findFirst();
    }

    public List<DeviationPattern> findAll(String businessUnit) {
        if (businessUnit == null) {
            return jdbc.query("SELECT * FROM deviation_patterns ORDER BY business_unit, metric_type", ROW_MAPPER);
        }
        return jdbc.query("SELECT * FROM deviation_patterns WHERE business_unit = ? ORDER BY metric_type",
                ROW_MAPPER, businessUnit);
    }
}
