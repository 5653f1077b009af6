package com.phillippitts.wfmparity.service.compare;

import com.phillippitts.wfmparity.domain.CalculationResult;
import com.phillippitts.wfmparity.domain.ComparisonResult;
import com.phillippitts.wfmparity.domain.ComparisonSummary;
import com.phillippitts.wfmparity.domain.EngineVariant;
import com.phillippitts.wfmparity.exception.ComparisonException;
import com.phillippitts.wfmparity.repository.CalculationResultRepository;
import com.phillippitts.wfmparity.repository.ComparisonRepository;
import com.phillippitts.wfmparity.service.metrics.ParityMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Compares the persisted results of a job and stores exactly one comparison per job.
 */
@Service
public class ComparisonService {
    private static final Logger LOG = LogManager.getLogger(ComparisonService.class);

    private final CalculationResultRepository results;
    private final ComparisonRepository comparisons;
    private final ResultComparator comparator;
    private final ParityMetrics metrics;

    public ComparisonService(CalculationResultRepository results, ComparisonRepository comparisons,
                             ResultComparator comparator, ParityMetrics metrics) {
        this.results = results;
        this.comparisons = comparisons;
        this.comparator = comparator;
        this.metrics = metrics;
    }

    /**
     * Loads both results of the job and compares them. A comparison stored earlier for the
     * job is returned unchanged.
     *
     * @throws ComparisonException if a side has no persisted result
     */
    public ComparisonResult compare(UUID jobId) {
        Optional<ComparisonResult> existing = comparisons.findByJobId(jobId);
        if (existing.isPresent()) {
            LOG.debug("Job {} already compared as {}", jobId, existing.get().id());
            return existing.get();
        }
        CalculationResult reference = results.find(jobId, EngineVariant.REFERENCE).orElse(null);
        CalculationResult candidate = results.find(jobId, EngineVariant.CANDIDATE).orElse(null);
        ComparisonResult comparison = comparisons.insertIfAbsent(comparator.compare(jobId, reference, candidate));
        metrics.recordComparison(comparison.recommendation());
        LOG.info("Job {} compared: agents {} vs {} ({}%), agree={}, recommendation={}",
                jobId, reference.metrics().agentsRequired(), candidate.metrics().agentsRequired(),
                String.format(Locale.ROOT, "%.1f", comparison.agentsDiffPct()), comparison.algorithmsAgree(),
                comparison.recommendation());
        return comparison;
    }

    public Optional<ComparisonResult> findByJob(UUID jobId) {
        return comparisons.findByJobId(jobId);
    }

    /**
     * Agreement statistics of comparisons made since {@code since}, optionally for one project.
     */
    public ComparisonSummary summarize(String projectCode, Instant since) {
        return comparisons.summarize(projectCode, since);
    }
}
