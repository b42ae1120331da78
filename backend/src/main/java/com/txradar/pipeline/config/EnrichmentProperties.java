package com.txradar.pipeline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Default toggles for external enrichment. A run may override them; see EnrichmentOptions.
 */
@ConfigurationProperties(prefix = "txradar.enrichment")
@Getter
@Setter
public class EnrichmentProperties {

    private boolean holidaysEnabled = true;
    private boolean fxEnabled = false;
    /** ISO 3166-1 alpha-2 country for the holiday calendar. */
    private String countryCode = "US";
    /** ISO 4217 code amounts are converted to. */
    private String targetCurrency = "USD";
    /** Prefetch distinct lookup keys on the enrichment executor instead of the calling thread. */
    private boolean parallelPrefetch = true;
    /** Max time to wait for the whole prefetch before falling back to on-demand lookups. */
    private long prefetchTimeoutSeconds = 120;
}
