package com.phillippitts.wfmparity.service.maintenance;

import com.phillippitts.wfmparity.service.mining.FailurePatternMiner;
import com.phillippitts.wfmparity.service.trend.TrendEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Cron triggers for mining, trend generation and retention cleanup.
 *
 * <p>The services themselves propagate errors; a failed scheduled pass is logged here and
 * the next trigger runs as usual.
 */
@Component
@ConditionalOnProperty(prefix = "parity.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
class MaintenanceScheduler {
    private static final Logger LOG = LogManager.getLogger(MaintenanceScheduler.class);

    private final FailurePatternMiner miner;
    private final TrendEngine trends;
    private final RetentionCleanupService cleanup;
    private final Clock clock;

    MaintenanceScheduler(FailurePatternMiner miner, TrendEngine trends, RetentionCleanupService cleanup, Clock clock) {
        this.miner = miner;
        this.trends = trends;
        this.cleanup = cleanup;
        this.clock = clock;
    }

    @Scheduled(cron = "${parity.maintenance.mining-cron:0 5 * * * *}", zone = "UTC")
    void mine() {
        try {
            miner.mine();
        } catch (RuntimeException e) {
            LOG.error("Scheduled failure pattern mining failed", e);
        }
    }

    /** Aggregates the previous UTC day. */
    @Scheduled(cron = "${parity.maintenance.trend-cron:0 30 1 * * *}", zone = "UTC")
    void generateTrends() {
        LocalDate yesterday = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(1);
        try {
            trends.generateTrends(yesterday, yesterday);
        } catch (RuntimeException e) {
            LOG.error("Scheduled trend generation for {} failed", yesterday, e);
        }
    }

    @Scheduled(cron = "${parity.maintenance.cleanup-cron:0 0 3 * * *}", zone = "UTC")
    void cleanup() {
        try {
            cleanup.cleanup();
        } catch (RuntimeException e) {
            LOG.error("Scheduled retention cleanup failed", e);
        }
    }
}
