package com.phillippitts.wfmparity.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a comparison job.
 *
 * <p>State transitions:
 * <pre>
 * PENDING → RUNNING              (claimed by a worker)
 * RUNNING → PENDING              (retry scheduled or lease expired with retries left)
 * RUNNING → COMPLETED            (both results compared)
 * RUNNING → FAILED               (retries exhausted or comparison impossible)
 * </pre>
 * COMPLETED and FAILED are terminal.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<JobStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(PENDING, COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
