package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.ComparisonResult;
import com.phillippitts.wfmparity.domain.ComparisonSummary;
import com.phillippitts.wfmparity.domain.Recommendation;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static com.phillippitts.wfmparity.repository.JdbcSupport.id;
import static com.phillippitts.wfmparity.repository.JdbcSupport.instant;
import static com.phillippitts.wfmparity.repository.JdbcSupport.ts;
import static com.phillippitts.wfmparity.repository.JdbcSupport.uuid;

/**
 * Write-once storage of comparisons, unique per job.
 */
@Repository
public class ComparisonRepository {

    private static final RowMapper<ComparisonResult> ROW_MAPPER = (rs, rowNum) -> new ComparisonResult(
            uuid(rs, "id"),
            uuid(rs, "job_id"),
            uuid(rs, "reference_result_id"),
            uuid(rs, "candidate_result_id"),
            instant(rs, "compared_at"),
            JsonColumns.readDifferences(rs.getString("metric_differences")),
            JsonColumns.readDifferences(rs.getString("skill_coverage_differences")),
            rs.getInt("agents_diff"),
            rs.getDouble("agents_diff_pct"),
            rs.getDouble("service_level_diff"),
            rs.getDouble("occupancy_diff"),
            rs.getDouble("wait_time_diff"),
            rs.getLong("calculation_time_diff_ms"),
            rs.getBoolean("algorithms_agree"),
            JsonColumns.readStrings(rs.getString("significant_differences")),
            Recommendation.valueOf(rs.getString("recommendation")));

    private final JdbcTemplate jdbc;

    public ComparisonRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Stores the comparison unless the job already has one; returns whichever is stored.
     */
    public ComparisonResult insertIfAbsent(ComparisonResult c) {
        try {
            jdbc.update("""
                    INSERT INTO comparisons (id, job_id, reference_result_id, candidate_result_id, compared_at,
                        agents_diff, agents_diff_pct, service_level_diff, occupancy_diff, wait_time_diff,
                        calculation_time_diff_ms, algorithms_agree, significant_differences, metric_differences,
                        skill_coverage_differences, recommendation)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    id(c.id()), id(c.jobId()), id(c.referenceResultId()), id(c.candidateResultId()),
                    ts(c.comparedAt()), c.agentsDiff(), c.agentsDiffPct(), c.serviceLevelDiff(),
                    c.occupancyDiff(), c.waitTimeDiff(), c.calculationTimeDiffMs(), c.algorithmsAgree(),
                    JsonColumns.writeStrings(c.significantMetrics()),
                    JsonColumns.writeDifferences(c.metricDifferences()),
                    JsonColumns.writeDifferences(c.skillCoverageDifferences()),
                    c.recommendation().name());
            return c;
        } catch (DuplicateKeyException e) {
            return findByJobId(c.jobId()).orElseThrow(() -> e);
        }
    }

    public Optional<ComparisonResult> findByJobId(UUID jobId) {
        return jdbc.query("SELECT * FROM comparisons WHERE job_id = ?", ROW_MAPPER, id(jobId))
                .stream().findFirst();
    }

    public ComparisonSummary summarize(String projectCode, Instant since) {
        return jdbc.queryForObject("""
                SELECT COUNT(*) AS total,
                       COALESCE(SUM(CASE WHEN c.algorithms_agree THEN 1 ELSE 0 END), 0) AS agreeing,
                       COALESCE(AVG(c.agents_diff_pct), 0) AS avg_agents_pct,
                       COALESCE(AVG(c.service_level_diff), 0) AS avg_sl_diff
                FROM comparisons c JOIN jobs j ON j.id = c.job_id
                WHERE j.project_code = ? AND c.compared_at >= ?
                """,
                (rs, rowNum) -> {
                    long total = rs.getLong("total");
                    long agreeing = rs.getLong("agreeing");
                    return new ComparisonSummary(projectCode, total, agreeing,
                            total == 0 ? 0.0 : agreeing * 100.0 / total,
                            rs.getDouble("avg_agents_pct"),
                            rs.getDouble("avg_sl_diff"));
                },
                projectCode, ts(since));
    }
}
