package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.PerformanceSample;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import static com.phillippitts.wfmparity.repository.JdbcSupport.id;
import static com.phillippitts.wfmparity.repository.JdbcSupport.instant;
import static com.phillippitts.wfmparity.repository.JdbcSupport.ts;
import static com.phillippitts.wfmparity.repository.JdbcSupport.uuid;

@Repository
public class PerformanceSampleRepository {

    private static final RowMapper<PerformanceSample> ROW_MAPPER = (rs, rowNum) -> new PerformanceSample(
            uuid(rs, "id"),
            uuid(rs, "job_id"),
            EngineVariant.valueOf(rs.getString("algorithm_type")),
            rs.getString("operation_type"),
            rs.getLong("initialization_ms"),
            rs.getLong("data_preparation_ms"),
            rs.getLong("calculation_ms"),
            rs.getLong("result_storage_ms"),
            rs.getLong("total_execution_ms"),
            rs.getLong("memory_used_bytes"),
            rs.getInt("iteration_count"),
            rs.getBoolean("convergence_achieved"),
            instant(rs, "recorded_at"));

    private final JdbcTemplate jdbc;

    public PerformanceSampleRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(PerformanceSample s) {
        jdbc.update("""
                INSERT INTO performance_samples (id, job_id, algorithm_type, operation_type, initialization_ms,
                    data_preparation_ms, calculation_ms, result_storage_ms, total_execution_ms, memory_used_bytes,
                    iteration_count, convergence_achieved, recorded_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                id(s.id()), id(s.jobId()), s.algorithm().name(), s.operationType(), s.initializationMs(),
                s.dataPreparationMs(), s.calculationMs(), s.resultStorageMs(), s.totalExecutionMs(),
                s.memoryUsedBytes(), s.iterationCount(), s.convergenceAchieved(), ts(s.recordedAt()));
    }

    public OptionalDouble averageTotalSince(String operationType, EngineVariant algorithm, Instant since) {
        Double avg = jdbc.queryForObject("""
                SELECT AVG(CAST(total_execution_ms AS DOUBLE PRECISION)) FROM performance_samples
                WHERE operation_type = ? AND algorithm_type = ? AND recorded_at >= ?
                """, Double.class, operationType, algorithm.name(), ts(since));
        return avg == null ? OptionalDouble.empty() : OptionalDouble.of(avg);
    }

    public Optional<PerformanceSample> findLatest(String operationType, EngineVariant algorithm) {
        return jdbc.query("""
                SELECT * FROM performance_samples
                WHERE operation_type = ? AND algorithm_type = ?
                ORDER BY recorded_at DESC
                LIMIT 1
                """, ROW_MAPPER, operationType, algorithm.name()).stream().findFirst();
    }

    public List<String> findOperationTypesSince(EngineVariant algorithm, Instant since) {
        return jdbc.queryForList("""
                SELECT DISTINCT operation_type FROM performance_samples
                WHERE algorithm_type = ? AND recorded_at >= ?
                ORDER BY operation_type
                """, String.class, algorithm.name(), ts(since));
    }

    public int deleteOlderThan(Instant cutoff) {
        return jdbc.update("DELETE FROM performance_samples WHERE recorded_at < ?", ts(cutoff));
    }
}
