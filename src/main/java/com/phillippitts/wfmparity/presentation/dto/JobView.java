package com.phillippitts.wfmparity.presentation.dto;

import com.phillippitts.wfmparity.domain.Job;
import com.phillippitts.wfmparity.domain.JobStatus;
import com.phillippitts.wfmparity.domain.JobType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * Job as returned by the API. Claim internals (token, owner) are not exposed.
 */
public record JobView(
        UUID jobId,
        JobType jobType,
        String projectCode,
        String queueCode,
        LocalDate calculationDate,
        String intervalType,
        Map<String, Object> inputParameters,
        JobStatus status,
        int priority,
        int retryCount,
        int maxRetryCount,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant nextAttemptAt,
        UUID referenceResultId,
        UUID candidateResultId,
        UUID comparisonId,
        String errorMessage
) {

    public static JobView of(Job job) {
        return new JobView(job.id(), job.type(), job.target().projectCode(), job.target().queueCode(),
                job.calculationDate(), job.intervalType().code(), job.inputParameters().asMap(), job.status(),
                job.priority(), job.retryCount(), job.maxRetryCount(), job.createdAt(), job.startedAt(),
                job.completedAt(), job.nextAttemptAt(), job.referenceResultId(), job.candidateResultId(),
                job.comparisonId(), job.errorMessage());
    }
}
