package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.DataQualityIssue;
import com.phillippitts.wfmparity.domain.IssueSeverity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.phillippitts.wfmparity.repository.JdbcSupport.id;
import static com.phillippitts.wfmparity.repository.JdbcSupport.ts;

@Repository
public class DataQualityIssueRepository {

    private final JdbcTemplate jdbc;

    public DataQualityIssueRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(DataQualityIssue i) {
        jdbc.update("""
                INSERT INTO data_quality_issues (id, source_file, issue_type, column_name, row_count, severity,
                    impact_description, auto_corrected, correction_applied, detected_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                id(i.id()), i.sourceFile(), i.issueType(), i.columnName(), i.rowCount(), i.severity().name(),
                i.impactDescription(), i.autoCorrected(), i.correctionApplied(), ts(i.detectedAt()));
    }

    /**
     * Issue counts per (issue type, severity) since {@code since}.
     */
    public List<IssueCount> countByTypeAndSeverity(Instant since) {
        return jdbc.query("""
                SELECT issue_type, severity, COUNT(*) AS n FROM data_quality_issues
                WHERE detected_at >= ?
                GROUP BY issue_type, severity
                ORDER BY issue_type
                """,
                (rs, rowNum) -> new IssueCount(
                        rs.getString("issue_type"),
                        IssueSeverity.valueOf(rs.getString("severity")),
                        rs.getInt("n")),
                ts(since));
    }

    public record IssueCount(String issueType, IssueSeverity severity, int count) {
    }
}
