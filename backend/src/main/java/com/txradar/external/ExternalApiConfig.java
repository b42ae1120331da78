package com.txradar.external;

import com.txradar.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Shared beans for the external lookup clients: one rate limiter per service and the retry policy.
 */
@Configuration
@EnableConfigurationProperties(ExternalApiProperties.class)
public class ExternalApiConfig {

    public static final String HOLIDAY_RATE_LIMITER = "holidayApiRateLimiter";
    public static final String FX_RATE_LIMITER = "fxApiRateLimiter";

    @Bean(name = HOLIDAY_RATE_LIMITER)
    public RateLimiter holidayApiRateLimiter(ExternalApiProperties properties) {
        return RateLimiter.of("nager-date", limiterConfig(properties));
    }

    @Bean(name = FX_RATE_LIMITER)
    public RateLimiter fxApiRateLimiter(ExternalApiProperties properties) {
        return RateLimiter.of("frankfurter", limiterConfig(properties));
    }

    @Bean
    public RetryPolicy externalRetryPolicy(ExternalApiProperties properties) {
        ExternalApiProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), Math.max(1, retry.getMaxAttempts()));
    }

    private static RateLimiterConfig limiterConfig(ExternalApiProperties properties) {
        return RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
    }
}
