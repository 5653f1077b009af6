package com.phillippitts.wfmparity.service.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically returns jobs with expired claims to the queue.
 */
@Component
@ConditionalOnProperty(prefix = "parity.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
class LeaseReaper {
    private static final Logger LOG = LogManager.getLogger(LeaseReaper.class);

    private final JobQueueManager queue;

    LeaseReaper(JobQueueManager queue) {
        this.queue = queue;
    }

    @Scheduled(fixedDelayString = "${parity.worker.reaper-interval-ms:60000}")
    void reap() {
        try {
            int reaped = queue.reapExpiredLeases();
            if (reaped > 0) {
                LOG.info("Reaped {} job(s) with expired leases", reaped);
            }
        } catch (RuntimeException e) {
            LOG.error("Lease reaper pass failed", e);
        }
    }
}
