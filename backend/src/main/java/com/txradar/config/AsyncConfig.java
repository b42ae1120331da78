package com.txradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Pool for the external lookup prefetch: one task per distinct holiday or FX key. Outbound request rate is
 * bounded separately by the per-API rate limiters, so the pool stays small.
 */
@Configuration
public class AsyncConfig {

    public static final String ENRICHMENT_EXECUTOR = "enrichment-executor";

    private static final int LOOKUP_THREADS = 4;
    private static final int PENDING_KEYS = 10_000;

    @Bean(name = ENRICHMENT_EXECUTOR)
    public Executor enrichmentExecutor() {
        ThreadPoolTaskExecutor lookups = new ThreadPoolTaskExecutor();
        lookups.setCorePoolSize(LOOKUP_THREADS);
        lookups.setMaxPoolSize(LOOKUP_THREADS);
        lookups.setQueueCapacity(PENDING_KEYS);
        lookups.setAllowCoreThreadTimeOut(true);
        // Overflow keys load on the pipeline thread instead of failing the prefetch.
        lookups.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        lookups.setThreadNamePrefix("enrich-lookup-");
        lookups.initialize();
        return lookups;
    }
}
