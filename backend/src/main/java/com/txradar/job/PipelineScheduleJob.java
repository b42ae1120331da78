package com.txradar.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic pipeline run with default enrichment options. Enabled by txradar.pipeline.schedule-enabled=true.
 */
@Component
@ConditionalOnProperty(prefix = "txradar.pipeline", name = "schedule-enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class PipelineScheduleJob {

    private final PipelineRunService pipelineRunService;
    private final PipelineJobProperties properties;

    @Scheduled(fixedRateString = "${txradar.pipeline.schedule-interval-ms:86400000}",
            initialDelayString = "${txradar.pipeline.schedule-initial-delay-ms:60000}")
    public void runScheduled() {
        try {
            PipelineRunSummary summary = pipelineRunService.runWithDefaults();
            log.info("Scheduled pipeline run {} finished: {} rows; next run in {} ms",
                    summary.runId(), summary.rowCount(), properties.getScheduleIntervalMs());
        } catch (RuntimeException e) {
            // Run is already stored as FAILED.
            log.error("Scheduled pipeline run failed, retrying in {} ms: {}",
                    properties.getScheduleIntervalMs(), e.getMessage(), e);
        }
    }
}
