package com.phillippitts.wfmparity.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit of comparison work: one input snapshot, computed by both engines and compared once.
 *
 * <p>Jobs are mutated only by the queue manager and are never deleted.
 */
public record Job(
        UUID id,
        JobType type,
        JobTarget target,
        LocalDate calculationDate,
        IntervalType intervalType,
        InputParameters inputParameters,
        JobStatus status,
        int priority,
        int retryCount,
        int maxRetryCount,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant nextAttemptAt,
        String claimedBy,
        UUID claimToken,
        Instant leaseExpiresAt,
        UUID referenceResultId,
        UUID candidateResultId,
        UUID comparisonId,
        String errorMessage,
        String errorDetail
) {

    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(calculationDate, "calculationDate must not be null");
        Objects.requireNonNull(intervalType, "intervalType must not be null");
        Objects.requireNonNull(inputParameters, "inputParameters must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public boolean retriesLeft() {
        return retryCount + 1 < maxRetryCount;
    }
}
