package com.phillippitts.wfmparity.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Entry in the operator queue: something a human has to look at.
 */
public record OperatorAlert(
        UUID id,
        UUID jobId,
        String alertType,
        String message,
        Instant createdAt,
        boolean acknowledged
) {
}
