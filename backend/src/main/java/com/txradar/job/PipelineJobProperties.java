package com.txradar.job;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pipeline run scheduling. Documented in application.yml under txradar.pipeline.
 */
@ConfigurationProperties(prefix = "txradar.pipeline")
@Getter
@Setter
public class PipelineJobProperties {

    /** Run the pipeline periodically with the default enrichment options. */
    private boolean scheduleEnabled = false;

    /** Interval between scheduled runs (ms). */
    private long scheduleIntervalMs = 86_400_000L;

    /** Delay before the first scheduled run (ms). */
    private long scheduleInitialDelayMs = 60_000L;
}
