package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.ConfidenceBreakdown;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

import static com.phillippitts.wfmparity.repository.JdbcSupport.id;
import static com.phillippitts.wfmparity.repository.JdbcSupport.ts;

/**
 * History of confidence computations and their factors.
 */
@Repository
public class ConfidenceScoreRepository {

    private final JdbcTemplate jdbc;

    public ConfidenceScoreRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(String businessUnit, String metricType, ConfidenceBreakdown b, Instant calculatedAt) {
        jdbc.update("""
                INSERT INTO confidence_scores (id, business_unit, metric_type, base_confidence, historical_accuracy,
                    data_quality, volume_factor, final_confidence, sample_size, calculated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                id(UUID.randomUUID()), businessUnit, metricType, b.baseConfidence(), b.historicalAccuracy(),
                b.dataQuality(), b.volumeFactor(), b.finalScore(), b.sampleSize(), ts(calculatedAt));
    }

    public int deleteOlderThan(Instant cutoff) {
        return jdbc.update("DELETE FROM confidence_scores WHERE calculated_at < ?", ts(cutoff));
    }
}
