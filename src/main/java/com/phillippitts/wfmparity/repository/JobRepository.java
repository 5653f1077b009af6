package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.domain.InputParameters;
import com.phillippitts.wfmparity.domain.IntervalType;
import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.domain.JobStatus;
import com.phillippitts.wfmparity.domain.JobTarget;
import com.phillippitts.wfmparity.domain.JobType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.phillippitts.wfmparity.repository.JdbcSupport.date;
import static com.phillippitts.wfmparity.repository.JdbcSupport.id;
import static com.phillippitts.wfmparity.repository.JdbcSupport.instant;
import static com.phillippitts.wfmparity.repository.JdbcSupport.localDate;
import static com.phillippitts.wfmparity.repository.JdbcSupport.ts;
import static com.phillippitts.wfmparity.repository.JdbcSupport.uuid;

/**
 * Persistence of jobs.
 *
 * <p>Every state change is a single conditional UPDATE. A claim succeeds only while the row is
 * still PENDING; completion, retry and failure succeed only while the row is RUNNING under the
 * caller's claim token. A {@code false} return means another worker or the lease reaper got there
 * first.
 */
@Repository
public class JobRepository {

    private static final RowMapper<Job> ROW_MAPPER = (rs, rowNum) -> new Job(
            uuid(rs, "id"),
            JobType.valueOf(rs.getString("job_type")),
            new JobTarget(rs.getString("project_code"), rs.getString("queue_code")),
            localDate(rs, "calculation_date"),
            IntervalType.fromCode(rs.getString("interval_type")),
            InputParameters.fromJson(rs.getString("input_parameters")),
            JobStatus.valueOf(rs.getString("status")),
            rs.getInt("priority"),
            rs.getInt("retry_count"),
            rs.getInt("max_retry_count"),
            instant(rs, "created_at"),
            instant(rs, "started_at"),
            instant(rs, "completed_at"),
            instant(rs, "next_attempt_at"),
            rs.getString("claimed_by"),
            uuid(rs, "claim_token"),
            instant(rs, "lease_expires_at"),
            uuid(rs, "reference_result_id"),
            uuid(rs, "candidate_result_id"),
            uuid(rs, "comparison_id"),
            rs.getString("error_message"),
            rs.getString("error_detail"));

    private final JdbcTemplate jdbc;

    public JobRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(Job job) {
        jdbc.update("""
                INSERT INTO jobs (id, job_type, project_code, queue_code, calculation_date, interval_type,
                                  input_parameters, status, priority, retry_count, max_retry_count, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                id(job.id()), job.type().name(), job.target().projectCode(), job.target().queueCode(),
                date(job.calculationDate()), job.intervalType().code(), job.inputParameters().toJson(),
                job.status().name(), job.priority(), job.retryCount(), job.maxRetryCount(), ts(job.createdAt()));
    }

    public Optional<Job> findById(UUID jobId) {
        return jdbc.query("SELECT * FROM jobs WHERE id = ?", ROW_MAPPER, id(jobId)).stream().findFirst();
    }

    /**
     * Ids of pending jobs due at {@code now}, highest priority first, oldest first within a priority.
     */
    public List<UUID> findClaimCandidates(Instant now, int limit) {
        return jdbc.query("""
                SELECT id FROM jobs
                WHERE status = 'PENDING' AND (next_attempt_at IS NULL OR next_attempt_at <= ?)
                ORDER BY priority DESC, created_at ASC
                LIMIT ?
                """,
                (rs, rowNum) -> uuid(rs, "id"), ts(now), limit);
    }

    public boolean tryClaim(UUID jobId, String owner, UUID claimToken, Instant now, Instant leaseExpiresAt) {
        return jdbc.update("""
                UPDATE jobs
                SET status = 'RUNNING', claimed_by = ?, claim_token = ?, started_at = ?, lease_expires_at = ?
                WHERE id = ? AND status = 'PENDING' AND (next_attempt_at IS NULL OR next_attempt_at <= ?)
                """,
                owner, id(claimToken), ts(now), ts(leaseExpiresAt), id(jobId), ts(now)) == 1;
    }

    public boolean attachResult(UUID jobId, UUID claimToken, EngineVariant variant, UUID resultId) {
        String column = variant == EngineVariant.REFERENCE ? "reference_result_id" : "candidate_result_id";
        return jdbc.update("UPDATE jobs SET " + column + " = ? WHERE id = ? AND status = 'RUNNING' AND claim_token = ?",
                id(resultId), id(jobId), id(claimToken)) == 1;
    }

    public boolean complete(UUID jobId, UUID claimToken, UUID referenceResultId, UUID candidateResultId,
                            UUID comparisonId, Instant now) {
        return jdbc.update("""
                UPDATE jobs
                SET status = 'COMPLETED', completed_at = ?, reference_result_id = ?, candidate_result_id = ?,
                    comparison_id = ?, lease_expires_at = NULL, error_message = NULL, error_detail = NULL
                WHERE id = ? AND status = 'RUNNING' AND claim_token = ?
                """,
                ts(now), id(referenceResultId), id(candidateResultId), id(comparisonId),
                id(jobId), id(claimToken)) == 1;
    }

    public boolean requeue(UUID jobId, UUID claimToken, int retryCount, Instant nextAttemptAt,
                           String errorMessage, String errorDetail) {
        return jdbc.update("""
                UPDATE jobs
                SET status = 'PENDING', retry_count = ?, next_attempt_at = ?, claimed_by = NULL,
                    claim_token = NULL, lease_expires_at = NULL, error_message = ?, error_detail = ?
                WHERE id = ? AND status = 'RUNNING' AND claim_token = ?
                """,
                retryCount, ts(nextAttemptAt), errorMessage, errorDetail, id(jobId), id(claimToken)) == 1;
    }

    public boolean fail(UUID jobId, UUID claimToken, int retryCount, Instant now,
                        String errorMessage, String errorDetail) {
        return jdbc.update("""
                UPDATE jobs
                SET status = 'FAILED', retry_count = ?, completed_at = ?, lease_expires_at = NULL,
                    error_message = ?, error_detail = ?
                WHERE id = ? AND status = 'RUNNING' AND claim_token = ?
                """,
                retryCount, ts(now), errorMessage, errorDetail, id(jobId), id(claimToken)) == 1;
    }

    public List<Job> findExpiredLeases(Instant now, int limit) {
        return jdbc.query("""
                SELECT * FROM jobs
                WHERE status = 'RUNNING' AND lease_expires_at < ?
                ORDER BY lease_expires_at ASC
                LIMIT ?
                """,
                ROW_MAPPER, ts(now), limit);
    }

    /**
     * Job counts per status, optionally restricted to one project. Every status is present.
     */
    public Map<JobStatus, Long> countByStatus(String projectCode) {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, 0L);
        }
        String sql = projectCode == null
                ? "SELECT status, COUNT(*) AS n FROM jobs GROUP BY status"
                : "SELECT status, COUNT(*) AS n FROM jobs WHERE project_code = ? GROUP BY status";
        Object[] args = projectCode == null ? new Object[0] : new Object[]{projectCode};
        jdbc.query(sql, (RowCallbackHandler) rs ->
                counts.put(JobStatus.valueOf(rs.getString("status")), rs.getLong("n")), args);
        return counts;
    }
}
