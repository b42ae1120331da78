package com.txradar.job;

import com.txradar.domain.PipelineRun;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one run as reported to callers.
 */
public record PipelineRunSummary(
        String runId,
        PipelineRun.Status status,
        int rowCount,
        int categoryCount,
        Map<String, Long> counters,
        Instant startedAt,
        Instant completedAt
) {

    public static PipelineRunSummary of(PipelineRun run) {
        return new PipelineRunSummary(
                run.getId(),
                run.getStatus(),
                run.getRowCount(),
                run.getCategoryCount(),
                Map.copyOf(run.getCounters()),
                run.getStartedAt(),
                run.getCompletedAt());
    }
}
