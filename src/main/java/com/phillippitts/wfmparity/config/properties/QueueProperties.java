package com.phillippitts.wfmparity.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.UUID;

/**
 * Job queue tuning: retry budget, claim lease and retry backoff.
 */
@Validated
@ConfigurationProperties(prefix = "parity.queue")
public class QueueProperties {

    /** Priority assigned when a submission names none (1 = lowest, 5 = highest). */
    private final int defaultPriority;

    /** Attempts allowed before a job fails permanently. */
    private final int maxRetryCount;

    /** How long a claim stays valid before the reaper may requeue the job. */
    private final Duration leaseDuration;

    /** First retry delay; doubles with each further retry. */
    private final Duration backoffBase;

    /** Upper bound on the retry delay. */
    private final Duration backoffMax;

    /** Jobs claimed per worker pass. */
    private final int batchSize;

    /** Candidates selected per claim pass, as a multiple of the batch size, to absorb lost races. */
    private final int claimOverfetchFactor;

    /** Identity written as the claim owner. */
    private final String workerId;

    @ConstructorBinding
    public QueueProperties(Integer defaultPriority, Integer maxRetryCount, Duration leaseDuration,
                           Duration backoffBase, Duration backoffMax, Integer batchSize,
                           Integer claimOverfetchFactor, String workerId) {
        this.defaultPriority = defaultPriority == null ? 3 : defaultPriority;
        if (this.defaultPriority < 1 || this.defaultPriority > 5) {
            throw new IllegalArgumentException("parity.queue.default-priority must be in [1,5]");
        }
        this.maxRetryCount = maxRetryCount == null ? 3 : maxRetryCount;
        if (this.maxRetryCount < 1) {
            throw new IllegalArgumentException("parity.queue.max-retry-count must be >= 1");
        }
        this.leaseDuration = positive(leaseDuration, Duration.ofMinutes(10), "lease-duration");
        this.backoffBase = positive(backoffBase, Duration.ofSeconds(30), "backoff-base");
        this.backoffMax = positive(backoffMax, Duration.ofMinutes(30), "backoff-max");
        if (this.backoffMax.compareTo(this.backoffBase) < 0) {
            throw new IllegalArgumentException("parity.queue.backoff-max must be >= backoff-base");
        }
        this.batchSize = batchSize == null || batchSize <= 0 ? 10 : batchSize;
        this.claimOverfetchFactor = claimOverfetchFactor == null || claimOverfetchFactor < 1 ? 2 : claimOverfetchFactor;
        this.workerId = workerId == null || workerId.isBlank()
                ? "worker-" + UUID.randomUUID().toString().substring(0, 8)
                : workerId;
    }

    public static QueueProperties defaults() {
        return new QueueProperties(null, null, null, null, null, null, null, null);
    }

    private static Duration positive(Duration value, Duration fallback, String name) {
        Duration d = value == null ? fallback : value;
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException("parity.queue." + name + " must be positive");
        }
        return d;
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }

    public int getMaxRetryCount() {
        return maxRetryCount;
    }

    public Duration getLeaseDuration() {
        return leaseDuration;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getClaimOverfetchFactor() {
        return claimOverfetchFactor;
    }

    public String getWorkerId() {
        return workerId;
    }
}
