package com.phillippitts.wfmparity.service.health;

import com.phillippitts.wfmparity.domain.JobStatus;
import com.phillippitts.wfmparity.service.queue.JobQueueManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for the job queue.
 *
 * <p>Reports job counts per status. The queue is DOWN only when its table cannot be read;
 * a backlog or failed jobs are reported as details, not as ill health.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class JobQueueHealthIndicator implements HealthIndicator {

    private final JobQueueManager queue;

    public JobQueueHealthIndicator(JobQueueManager queue) {
        this.queue = queue;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        try {
            Map<JobStatus, Long> counts = queue.statusCounts(null);
            builder.up().withDetail("status", "Job queue readable");
            for (JobStatus status : JobStatus.values()) {
                builder.withDetail(status.name().toLowerCase(Locale.ROOT), counts.getOrDefault(status, 0L));
            }
        } catch (DataAccessException e) {
            builder.down()
                    .withDetail("status", "Job queue unreadable")
                    .withDetail("error", e.getMostSpecificCause().getMessage());
        }
        return builder.build();
    }
}
