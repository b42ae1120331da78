package com.txradar.external;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * HTTP settings for the holiday and FX services. Documented in application.yml under txradar.enrichment.http.
 */
@ConfigurationProperties(prefix = "txradar.enrichment.http")
@Getter
@Setter
public class ExternalApiProperties {

    /** Nager.Date base URL; path /api/v3/PublicHolidays/{year}/{country}. */
    private String nagerBaseUrl = "https://date.nager.at";

    /** Frankfurter base URL; path /{date}?from=S&to=T. */
    private String frankfurterBaseUrl = "https://api.frankfurter.app";

    /** Per-request timeout in seconds. */
    private int requestTimeoutSeconds = 20;

    /** Local limiter: requests per second, per service. */
    private int maxRequestsPerSecond = 5;

    /** Max wait for a limiter permit before the lookup fails. */
    private long limiterTimeoutMs = 5_000;

    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
        /** Total attempts including the first call. */
        private int maxAttempts = 3;
        private long baseDelayMs = 500;
        /** Backoff jitter in [0, 1]. */
        private double jitterFactor = 0.2;
    }
}
