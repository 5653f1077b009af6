package com.phillippitts.wfmparity.presentation.controller;

import com.phillippitts.wfmparity.config.properties.QueueProperties;
import com.phillippitts.wfmparity.domain.ComparisonResult;
import com.phillippitts.wfmparity.domain.JobStatus;
import com.phillippitts.wfmparity.domain.JobSubmission;
import com.phillippitts.wfmparity.domain.JobTarget;
import com.phillippitts.wfmparity.domain.JobType;
import com.phillippitts.wfmparity.exception.InvalidJobInputException;
import com.phillippitts.wfmparity.presentation.dto.JobView;
import com.phillippitts.wfmparity.presentation.dto.SubmitJobRequest;
import com.phillippitts.wfmparity.service.compare.ComparisonService;
import com.phillippitts.wfmparity.service.execution.BatchSummary;
import com.phillippitts.wfmparity.service.execution.JobBatchProcessor;
import com.phillippitts.wfmparity.service.queue.JobQueueManager;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * Job submission, lookup and the manual worker trigger.
 */
@RestController
@RequestMapping("/api/v1/jobs")
class JobController {

    private static final Logger LOG = LogManager.getLogger(JobController.class);

    private final JobQueueManager queue;
    private final ComparisonService comparisons;
    private final JobBatchProcessor processor;
    private final QueueProperties queueProperties;

    JobController(JobQueueManager queue, ComparisonService comparisons, JobBatchProcessor processor,
                  QueueProperties queueProperties) {
        this.queue = queue;
        this.comparisons = comparisons;
        this.processor = processor;
        this.queueProperties = queueProperties;
    }

    @PostMapping
    ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody SubmitJobRequest request) {
        JobSubmission submission = new JobSubmission(jobType(request.jobType()),
                new JobTarget(request.projectCode(), request.queueCode()), request.calculationDate(),
                request.intervalType(), request.inputParameters(), request.priority());
        UUID jobId = queue.submit(submission);
        LOG.info("Accepted job {} for {}", jobId, submission.target());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("job_id", jobId));
    }

    @GetMapping("/{id}")
    JobView get(@PathVariable("id") UUID id) {
        return JobView.of(queue.get(id));
    }

    /**
     * 404 when the job exists but has not been compared yet.
     */
    @GetMapping("/{id}/comparison")
    ResponseEntity<ComparisonResult> comparison(@PathVariable("id") UUID id) {
        queue.get(id);
        return ResponseEntity.of(comparisons.findByJob(id));
    }

    @GetMapping("/status-counts")
    Map<JobStatus, Long> statusCounts(@RequestParam(name = "project_code", required = false) String projectCode) {
        return queue.statusCounts(projectCode);
    }

    @PostMapping("/process")
    BatchSummary process(@RequestParam(name = "batch_size", required = false) Integer batchSize) {
        int size = batchSize == null ? queueProperties.getBatchSize() : batchSize;
        if (size <= 0) {
            throw new IllegalArgumentException("batch_size must be positive");
        }
        return processor.processPendingJobs(size);
    }

    private static JobType jobType(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return JobType.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new InvalidJobInputException(e.getMessage());
        }
    }
}
