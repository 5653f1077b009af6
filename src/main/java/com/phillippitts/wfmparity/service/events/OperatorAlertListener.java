package com.phillippitts.wfmparity.service.events;

import com.phillippitts.wfmparity.domain.OperatorAlert;
import com.phillippitts.wfmparity.repository.OperatorAlertRepository;
import com.phillippitts.wfmparity.util.ErrorDetails;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns failure and anomaly events into operator alerts.
 *
 * <p>Job failures and skipped comparisons always produce an alert. Anomalies are throttled
 * per key so a noisy metric raises at most one alert per minute.
 *
 * <p>Listeners run on {@code eventExecutor} so alert persistence never holds up a worker.
 */
@Component
class OperatorAlertListener {
    private static final Logger LOG = LogManager.getLogger(OperatorAlertListener.class);

    static final String JOB_FAILED = "job_failed";
    static final String COMPARISON_SKIPPED = "comparison_skipped";

    private static final Duration THROTTLE = Duration.ofMinutes(1);
    private static final int MAX_ALERT_MESSAGE = 2000;

    private final Map<String, Instant> lastAlert = new ConcurrentHashMap<>();
    private final OperatorAlertRepository alerts;
    private final Clock clock;

    OperatorAlertListener(OperatorAlertRepository alerts, Clock clock) {
        this.alerts = alerts;
        this.clock = clock;
    }

    @Async("eventExecutor")
    @EventListener
    void onJobFailed(JobFailedEvent e) {
        LOG.warn("Job {} for {} failed after {} attempt(s): {}", e.jobId(), e.target(), e.attempts(), e.reason());
        raise(e.jobId(), JOB_FAILED, "Job failed after " + e.attempts() + " attempt(s): " + e.reason());
    }

    @Async("eventExecutor")
    @EventListener
    void onComparisonSkipped(ComparisonSkippedEvent e) {
        String survivor = e.survivor() == null ? "none" : e.survivor().tag();
        LOG.warn("Comparison skipped for job {} (surviving result: {}): {}", e.jobId(), survivor, e.reason());
        raise(e.jobId(), COMPARISON_SKIPPED,
                "Comparison skipped, surviving result: " + survivor + ". " + e.reason());
    }

    @Async("eventExecutor")
    @EventListener
    void onAnomaly(AnomalyDetectedEvent e) {
        String key = e.kind().name() + '-' + e.key();
        if (shouldAlert(key)) {
            LOG.warn("Anomaly {} on {}: {}", e.kind(), e.key(), e.detail());
            raise(null, e.kind().name().toLowerCase(Locale.ROOT), e.key() + ": " + e.detail());
        }
    }

    private void raise(UUID jobId, String type, String message) {
        alerts.insert(new OperatorAlert(UUID.randomUUID(), jobId, type,
                ErrorDetails.truncate(message, MAX_ALERT_MESSAGE), clock.instant(), false));
    }

    // Package-private for tests
    boolean shouldAlert(String key) {
        Instant now = clock.instant();
        boolean[] fire = new boolean[1];
        // check and stamp under the map's per-key lock; listeners run concurrently
        lastAlert.compute(key, (k, prev) -> {
            fire[0] = prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0;
            return fire[0] ? now : prev;
        });
        return fire[0];
    }
}
