package com.txradar.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduling is switched on only together with the periodic pipeline run (txradar.pipeline.schedule-enabled).
 * A single thread: runs are serialized anyway, and a run still in progress delays the next tick.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "txradar.pipeline", name = "schedule-enabled", havingValue = "true")
@Slf4j
public class SchedulerConfig {

    public static final String PIPELINE_SCHEDULER = "pipeline-scheduler";

    @Bean(name = PIPELINE_SCHEDULER)
    public ThreadPoolTaskScheduler pipelineScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("pipeline-schedule-");
        scheduler.setErrorHandler(t -> log.error("Scheduled task failed", t));
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }
}
