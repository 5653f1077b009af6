package com.phillippitts.wfmparity.service.events;

import com.phillippitts.wfmparity.domain.EngineVariant;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when a job cannot be compared because one side has no result.
 *
 * @param jobId       affected job
 * @param survivor    the variant whose result exists, or null when neither does
 * @param reason      why the comparison was skipped
 * @param timestamp   when the skip was decided
 */
public record ComparisonSkippedEvent(
        UUID jobId,
        EngineVariant survivor,
        String reason,
        Instant timestamp
) {}
