package com.txradar.pipeline.enrichment;

import com.txradar.config.AsyncConfig;
import com.txradar.pipeline.TransactionBatch;
import com.txradar.pipeline.config.EnrichmentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Stage 7: optional holiday and FX enrichment. Depends only on normalized date, amounts and currency.
 * Neither enrichment can fail the batch.
 */
@Component
@Slf4j
public class ExternalEnrichmentAdapter {

    private final HolidayEnricher holidayEnricher;
    private final FxEnricher fxEnricher;
    private final Executor enrichmentExecutor;
    private final Duration prefetchTimeout;

    public ExternalEnrichmentAdapter(HolidayEnricher holidayEnricher,
                                     FxEnricher fxEnricher,
                                     @Qualifier(AsyncConfig.ENRICHMENT_EXECUTOR) Executor enrichmentExecutor,
                                     EnrichmentProperties properties) {
        this.holidayEnricher = holidayEnricher;
        this.fxEnricher = fxEnricher;
        this.enrichmentExecutor = enrichmentExecutor;
        this.prefetchTimeout = Duration.ofSeconds(Math.max(1, properties.getPrefetchTimeoutSeconds()));
    }

    public void apply(TransactionBatch batch, EnrichmentOptions options) {
        if (options.holidaysEnabled()) {
            holidayEnricher.apply(batch, options, enrichmentExecutor, prefetchTimeout);
        }
        if (options.fxEnabled()) {
            fxEnricher.apply(batch, options, enrichmentExecutor, prefetchTimeout);
        }
        if (!options.holidaysEnabled() && !options.fxEnabled()) {
            log.debug("External enrichment disabled for this run");
        }
    }
}
