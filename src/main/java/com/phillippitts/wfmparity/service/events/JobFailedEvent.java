package com.phillippitts.wfmparity.service.events;

import com.phillippitts.wfmparity.domain.JobTarget;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when a job reaches FAILED.
 *
 * @param jobId    failed job
 * @param target   project/queue the job was calculating
 * @param attempts attempts made, including the last one
 * @param reason   last error message
 * @param timestamp when the job failed
 */
public record JobFailedEvent(
        UUID jobId,
        JobTarget target,
        int attempts,
        String reason,
        Instant timestamp
) {}
