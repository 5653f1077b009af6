package com.phillippitts.wfmparity.service.execution;

/**
 * Outcome of one worker pass over the queue.
 *
 * @param processed            jobs claimed in this pass
 * @param succeeded            jobs completed with a comparison
 * @param failed               jobs requeued, failed or whose claim was lost
 * @param avgExecutionTimeMs   mean wall-clock time per claimed job, 0 when nothing was claimed
 */
public record BatchSummary(int processed, int succeeded, int failed, double avgExecutionTimeMs) {

    public static BatchSummary empty() {
        return new BatchSummary(0, 0, 0, 0.0);
    }
}
