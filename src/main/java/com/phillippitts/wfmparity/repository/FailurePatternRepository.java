package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.FailureCategory;
import com.phillippitts.wfmparity.domain.FailurePattern;
import com.phillippitts.wfmparity.domain.PatternDetection;
import com.phillippitts.wfmparity.domain.PatternType;
import com.phillippitts.wfmparity.domain.ResolutionStatus;
import com.phillippitts.wfmparity.domain.Severity;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.phillippitts.wfmparity.repository.JdbcSupport.id;
import static com.phillippitts.wfmparity.repository.JdbcSupport.instant;
import static com.phillippitts.wfmparity.repository.JdbcSupport.ts;
import static com.phillippitts.wfmparity.repository.JdbcSupport.uuid;

/**
 * Failure patterns, deduplicated on (pattern type, category, affected metrics).
 */
@Repository
public class FailurePatternRepository {

    private static final String SEVERITY_RANK = """
            CASE severity WHEN 'CRITICAL' THEN 4 WHEN 'HIGH' THEN 3 WHEN 'MEDIUM' THEN 2 ELSE 1 END""";

    private static final RowMapper<FailurePattern> ROW_MAPPER = (rs, rowNum) -> new FailurePattern(
            uuid(rs, "id"),
            PatternType.fromCode(rs.getString("pattern_type")),
            FailureCategory.valueOf(rs.getString("failure_category")),
            splitMetrics(rs.getString("affected_metrics")),
            rs.getString("business_unit"),
            rs.getString("root_cause"),
            Severity.valueOf(rs.getString("severity")),
            rs.getInt("occurrence_count"),
            rs.getInt("window_sample_count"),
            ResolutionStatus.valueOf(rs.getString("resolution_status")),
            rs.getString("resolution_note"),
            instant(rs, "detected_at"),
            instant(rs, "last_occurrence"),
            instant(rs, "resolved_at"));

    private final JdbcTemplate jdbc;

    public FailurePatternRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Records a detection: a repeat increments the occurrence count, refreshes severity and root
     * cause, and reopens a resolved pattern; a first detection inserts the pattern.
     */
    public FailurePattern record(PatternDetection d, Instant now) {
        if (!incrementExisting(d, now)) {
            try {
                jdbc.update("""
                        INSERT INTO failure_patterns (id, pattern_type, failure_category, affected_metrics,
                            business_unit, root_cause, severity, occurrence_count, window_sample_count,
                            resolution_status, detected_at, last_occurrence)
                        VALUES (?, ?, ?, ?, ?, ?, ?, 1, ?, 'OPEN', ?, ?)
                        """,
                        id(UUID.randomUUID()), d.patternType().code(), d.patternType().category().name(),
                        d.affectedMetricsKey(), d.businessUnit(), d.rootCause(), d.severity().name(),
                        d.sampleCount(), ts(now), ts(now));
            } catch (DuplicateKeyException e) {
                incrementExisting(d, now);
            }
        }
        return findByKey(d.patternType(), d.affectedMetricsKey())
                .orElseThrow(() -> new IllegalStateException("Failure pattern vanished: " + d.patternType()));
    }

    private boolean incrementExisting(PatternDetection d, Instant now) {
        return jdbc.update("""
                UPDATE failure_patterns
                SET occurrence_count = occurrence_count + 1, window_sample_count = ?, severity = ?,
                    root_cause = ?, business_unit = ?, last_occurrence = ?,
                    resolution_status = 'OPEN', resolution_note = NULL, resolved_at = NULL
                WHERE pattern_type = ? AND failure_category = ? AND affected_metrics = ?
                """,
                d.sampleCount(), d.severity().name(), d.rootCause(), d.businessUnit(), ts(now),
                d.patternType().code(), d.patternType().category().name(), d.affectedMetricsKey()) == 1;
    }

    public Optional<FailurePattern> findByKey(PatternType type, String affectedMetricsKey) {
        return jdbc.query("""
                SELECT * FROM failure_patterns
                WHERE pattern_type = ? AND failure_category = ? AND affected_metrics = ?
                """, ROW_MAPPER, type.code(), type.category().name(), affectedMetricsKey).stream().findFirst();
    }

    public Optional<FailurePattern> findById(UUID patternId) {
        return jdbc.query("SELECT * FROM failure_patterns WHERE id = ?", ROW_MAPPER, id(patternId))
                .stream().findFirst();
    }

    /**
     * Open patterns, most severe first, then most frequent.
     */
    public List<FailurePattern> findActive() {
        return jdbc.query("""
                SELECT * FROM failure_patterns
                WHERE resolution_status = 'OPEN'
                ORDER BY %s DESC, occurrence_count DESC, last_occurrence DESC
                """.formatted(SEVERITY_RANK), ROW_MAPPER);
    }

    public boolean resolve(UUID patternId, String note, Instant now) {
        return jdbc.update("""
                UPDATE failure_patterns SET resolution_status = 'RESOLVED', resolution_note = ?, resolved_at = ?
                WHERE id = ? AND resolution_status = 'OPEN'
                """, note, ts(now), id(patternId)) == 1;
    }

    public int deleteResolvedBefore(Instant cutoff) {
        return jdbc.update(
                "DELETE FROM failure_patterns WHERE resolution_status = 'RESOLVED' AND resolved_at < ?",
                ts(cutoff));
    }

    private static List<String> splitMetrics(String key) {
        return key == null || key.isEmpty() ? List.of() : Arrays.asList(key.split(","));
    }
}
