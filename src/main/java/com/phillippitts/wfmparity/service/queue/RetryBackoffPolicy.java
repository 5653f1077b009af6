package com.phillippitts.wfmparity.service.queue;

import com.phillippitts.wfmparity.config.properties.QueueProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential retry delay: {@code base * 2^(retry - 1)}, capped at the configured maximum.
 */
@Component
public class RetryBackoffPolicy {

    private static final int MAX_SHIFT = 30;

    private final Duration base;
    private final Duration max;

    @Autowired
    public RetryBackoffPolicy(QueueProperties properties) {
        this(properties.getBackoffBase(), properties.getBackoffMax());
    }

    RetryBackoffPolicy(Duration base, Duration max) {
        this.base = base;
        this.max = max;
    }

    /**
     * @param retryCount retries made so far, including the one being scheduled (1-based)
     */
    public Duration delayFor(int retryCount) {
        int shift = Math.min(Math.max(retryCount - 1, 0), MAX_SHIFT);
        long millis = base.toMillis();
        if (millis > max.toMillis() >> shift) {
            return max;
        }
        Duration d = Duration.ofMillis(millis << shift);
        return d.compareTo(max) > 0 ? max : d;
    }
}
