package com.txradar.api.dto;

import com.txradar.job.PipelineRunSummary;

import java.time.Instant;
import java.util.Map;

public record PipelineRunResponse(
        String runId,
        String status,
        int rowCount,
        int categoryCount,
        Map<String, Long> counters,
        Instant startedAt,
        Instant completedAt
) {

    public static PipelineRunResponse from(PipelineRunSummary summary) {
        return new PipelineRunResponse(
                summary.runId(),
                summary.status().name(),
                summary.rowCount(),
                summary.categoryCount(),
                summary.counters(),
                summary.startedAt(),
                summary.completedAt());
    }
}
