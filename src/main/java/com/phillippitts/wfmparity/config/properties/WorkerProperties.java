package com.phillippitts.wfmparity.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Scheduled queue workers. The intervals are read by {@code @Scheduled} placeholders; they are
 * bound here so that invalid values fail at startup.
 */
@ConfigurationProperties(prefix = "parity.worker")
@Validated
public class WorkerProperties {

    /** When false no worker or lease reaper is scheduled; jobs run only through the REST trigger. */
    private boolean enabled = true;

    @Positive(message = "Worker poll interval must be positive")
    private long pollIntervalMs = 5000;

    @Positive(message = "Lease reaper interval must be positive")
    private long reaperIntervalMs = 60000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public long getReaperIntervalMs() {
        return reaperIntervalMs;
    }

    public void setReaperIntervalMs(long reaperIntervalMs) {
        this.reaperIntervalMs = reaperIntervalMs;
    }
}
