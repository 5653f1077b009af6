package com.phillippitts.wfmparity.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retention windows. Schedules ({@code parity.maintenance.*-cron}) are read directly by the scheduler.
 */
@ConfigurationProperties(prefix = "parity.maintenance")
@Validated
public class MaintenanceProperties {

    private boolean enabled = true;

    /** Accuracy samples, performance samples and confidence history older than this are purged. */
    @Positive(message = "Retention days must be positive")
    private int retentionDays = 90;

    /** Resolved failure patterns are purged this long after resolution. */
    @Positive(message = "Resolved pattern retention days must be positive")
    private int resolvedPatternRetentionDays = 30;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    public int getResolvedPatternRetentionDays() {
        return resolvedPatternRetentionDays;
    }

    public void setResolvedPatternRetentionDays(int resolvedPatternRetentionDays) {
        this.resolvedPatternRetentionDays = resolvedPatternRetentionDays;
    }
}
