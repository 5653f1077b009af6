package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.CalculationResult;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.ExecutionUsage;
import com.phillippitts.wfmparity.domain.InputParameters;
import com.phillippitts.wfmparity.domain.JobTarget;
import com.phillippitts.wfmparity.domain.StaffingMetrics;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

import static com.phillippitts.wfmparity.repository.JdbcSupport.date;
import static com.phillippitts.wfmparity.repository.JdbcSupport.id;
import static com.phillippitts.wfmparity.repository.JdbcSupport.instant;
import static com.phillippitts.wfmparity.repository.JdbcSupport.localDate;
import static com.phillippitts.wfmparity.repository.JdbcSupport.nullableDouble;
import static com.phillippitts.wfmparity.repository.JdbcSupport.ts;
import static com.phillippitts.wfmparity.repository.JdbcSupport.uuid;

/**
 * Write-once storage of engine results, unique per (job, variant).
 */
@Repository
public class CalculationResultRepository {

    private static final RowMapper<CalculationResult> ROW_MAPPER = (rs, rowNum) -> new CalculationResult(
            uuid(rs, "id"),
            uuid(rs, "job_id"),
            EngineVariant.valueOf(rs.getString("variant")),
            rs.getString("algorithm_version"),
            instant(rs, "calculated_at"),
            InputParameters.fromJson(rs.getString("input_parameters")),
            new StaffingMetrics(
                    rs.getDouble("offered_calls"),
                    rs.getDouble("handled_calls"),
                    rs.getDouble("abandoned_calls"),
                    rs.getDouble("service_level"),
                    rs.getDouble("average_wait_time"),
                    rs.getDouble("average_handle_time"),
                    rs.getInt("agents_required"),
                    rs.getDouble("occupancy"),
                    rs.getDouble("utilization")),
            JsonColumns.readDoubleMap(rs.getString("skill_coverage")),
            rs.getDouble("traffic_intensity"),
            rs.getDouble("erlang_b_blocking"),
            rs.getDouble("erlang_c_delay"),
            rs.getDouble("shrinkage_factor"),
            new ExecutionUsage(
                    rs.getLong("calculation_time_ms"),
                    rs.getLong("memory_used_bytes"),
                    rs.getInt("iterations"),
                    rs.getBoolean("converged")));

    private final JdbcTemplate jdbc;

    public CalculationResultRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Stores the result unless one already exists for its (job, variant); returns the stored row.
     */
    public CalculationResult insertIfAbsent(CalculationResult r) {
        try {
            StaffingMetrics m = r.metrics();
            jdbc.update("""
                    INSERT INTO calculation_results (id, job_id, variant, algorithm_version, calculated_at,
                        input_parameters, offered_calls, handled_calls, abandoned_calls, service_level,
                        average_wait_time, average_handle_time, agents_required, occupancy, utilization,
                        skill_coverage, traffic_intensity, erlang_b_blocking, erlang_c_delay, shrinkage_factor,
                        calculation_time_ms, memory_used_bytes, iterations, converged)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    id(r.id()), id(r.jobId()), r.variant().name(), r.algorithmVersion(), ts(r.calculatedAt()),
                    r.inputParameters().toJson(), m.offeredCalls(), m.handledCalls(), m.abandonedCalls(),
                    m.serviceLevel(), m.averageWaitTime(), m.averageHandleTime(), m.agentsRequired(),
                    m.occupancy(), m.utilization(), JsonColumns.writeMap(r.skillCoverage()),
                    r.trafficIntensity(), r.erlangBBlocking(), r.erlangCDelay(), r.shrinkageFactor(),
                    r.usage().calculationTimeMs(), r.usage().memoryUsedBytes(), r.usage().iterations(),
                    r.usage().converged());
            return r;
        } catch (DuplicateKeyException e) {
            return find(r.jobId(), r.variant()).orElseThrow(() -> e);
        }
    }

    public Optional<CalculationResult> find(UUID jobId, EngineVariant variant) {
        return jdbc.query("SELECT * FROM calculation_results WHERE job_id = ? AND variant = ?",
                ROW_MAPPER, id(jobId), variant.name()).stream().findFirst();
    }

    public Optional<CalculationResult> findById(UUID resultId) {
        return jdbc.query("SELECT * FROM calculation_results WHERE id = ?", ROW_MAPPER, id(resultId))
                .stream().findFirst();
    }

    /**
     * Average offered calls of earlier results for the same target and variant since {@code since}.
     */
    public OptionalDouble averageOfferedCalls(JobTarget target, EngineVariant variant, Instant since) {
        String queueClause = target.queueCode() == null ? "j.queue_code IS NULL" : "j.queue_code = ?";
        String sql = """
                SELECT AVG(r.offered_calls) AS avg_calls
                FROM calculation_results r JOIN jobs j ON j.id = r.job_id
                WHERE j.project_code = ? AND %s AND r.variant = ? AND r.calculated_at >= ?
                """.formatted(queueClause);
        Object[] args = target.queueCode() == null
                ? new Object[]{target.projectCode(), variant.name(), ts(since)}
                : new Object[]{target.projectCode(), target.queueCode(), variant.name(), ts(since)};
        Double avg = jdbc.query(sql, rs -> rs.next() ? nullableDouble(rs, "avg_calls") : null, args);
        return avg == null ? OptionalDouble.empty() : OptionalDouble.of(avg);
    }

    /**
     * Reference-side figures of a project between two calculation dates, oldest first.
     */
    public List<DatedFigures> findDatedFigures(String projectCode, EngineVariant variant, LocalDate from, LocalDate to) {
        return jdbc.query("""
                SELECT j.calculation_date, r.offered_calls, r.service_level, r.average_handle_time, r.agents_required
                FROM calculation_results r JOIN jobs j ON j.id = r.job_id
                WHERE j.project_code = ? AND r.variant = ? AND j.calculation_date BETWEEN ? AND ?
                ORDER BY j.calculation_date ASC
                """,
                (rs, rowNum) -> new DatedFigures(
                        localDate(rs, "calculation_date"),
                        rs.getDouble("offered_calls"),
                        rs.getDouble("service_level"),
                        rs.getDouble("average_handle_time"),
                        rs.getInt("agents_required")),
                projectCode, variant.name(), date(from), date(to));
    }

    /**
     * Per-result figures used for operational trend aggregation.
     */
    public record DatedFigures(LocalDate calculationDate, double offeredCalls, double serviceLevel,
                               double averageHandleTime, int agentsRequired) {
    }
}
