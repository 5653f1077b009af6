package com.phillippitts.wfmparity.service.execution;

import com.phillippitts.wfmparity.config.properties.QueueProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pull-based worker: polls the queue on a fixed delay so passes never overlap.
 */
@Component
@ConditionalOnProperty(prefix = "parity.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
class JobWorker {
    private static final Logger LOG = LogManager.getLogger(JobWorker.class);

    private final JobBatchProcessor processor;
    private final int batchSize;

    JobWorker(JobBatchProcessor processor, QueueProperties properties) {
        this.processor = processor;
        this.batchSize = properties.getBatchSize();
    }

    @Scheduled(fixedDelayString = "${parity.worker.poll-interval-ms:5000}",
            initialDelayString = "${parity.worker.poll-interval-ms:5000}")
    void poll() {
        try {
            BatchSummary summary = processor.processPendingJobs(batchSize);
            if (summary.processed() == 0) {
                LOG.trace("No due jobs");
            }
        } catch (RuntimeException e) {
            LOG.error("Worker pass failed", e);
        }
    }
}
