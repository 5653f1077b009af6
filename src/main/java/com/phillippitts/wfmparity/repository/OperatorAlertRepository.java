package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.OperatorAlert;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

import static com.phillippitts.wfmparity.repository.JdbcSupport.id;
import static com.phillippitts.wfmparity.repository.JdbcSupport.instant;
import static com.phillippitts.wfmparity.repository.JdbcSupport.ts;
import static com.phillippitts.wfmparity.repository.JdbcSupport.uuid;

@Repository
public class OperatorAlertRepository {

    private static final RowMapper<OperatorAlert> ROW_MAPPER = (rs, rowNum) -> new OperatorAlert(
            uuid(rs, "id"),
            uuid(rs, "job_id"),
            rs.getString("alert_type"),
            rs.getString("message"),
            instant(rs, "created_at"),
            rs.getBoolean("acknowledged"));

    private final JdbcTemplate jdbc;

    public OperatorAlertRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(OperatorAlert a) {
        jdbc.update("""
                INSERT INTO operator_alerts (id, job_id, alert_type, message, created_at, acknowledged)
                VALUES (?, ?, ?, ?, ?, ?)
                """, id(a.id()), id(a.jobId()), a.alertType(), a.message(), ts(a.createdAt()), a.acknowledged());
    }

    public List<OperatorAlert> findOpen(int limit) {
        return jdbc.query("""
                SELECT * FROM operator_alerts WHERE acknowledged = FALSE
                ORDER BY created_at DESC
                LIMIT ?
                """, ROW_MAPPER, limit);
    }

    public boolean acknowledge(UUID alertId) {
        return jdbc.update("UPDATE operator_alerts SET acknowledged = TRUE WHERE id = ? AND acknowledged = FALSE",
                id(alertId)) == 1;
    }
}
