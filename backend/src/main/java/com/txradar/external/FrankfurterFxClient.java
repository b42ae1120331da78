package com.txradar.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txradar.common.RetryPolicy;
import com.txradar.pipeline.enrichment.ExternalLookupException;
import com.txradar.pipeline.enrichment.FxRateLookup;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Daily reference rates from Frankfurter /{date}?from=S&to=T. On non-business days Frankfurter answers with
 * the closest earlier rate. 404/422 (unknown currency or date out of range) mean no rate.
 */
@Component
@Slf4j
public class FrankfurterFxClient implements FxRateLookup {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final WebClient webClient;
    private final ExternalApiProperties properties;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;

    public FrankfurterFxClient(WebClient.Builder webClientBuilder,
                               ExternalApiProperties properties,
                               @Qualifier(ExternalApiConfig.FX_RATE_LIMITER) RateLimiter rateLimiter,
                               RetryPolicy retryPolicy) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public Optional<BigDecimal> fetchRate(LocalDate date, String sourceCurrency, String targetCurrency) {
        String url = properties.getFrankfurterBaseUrl() + "/" + date.format(DATE_FORMAT)
                + "?from=" + sourceCurrency + "&to=" + targetCurrency;
        String body;
        try {
            body = retryPolicy.execute(() -> get(url), TransientHttpErrors::isTransient);
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 404 || status == 422) {
                log.warn("Frankfurter has no rate {}->{} on {} ({})", sourceCurrency, targetCurrency, date, status);
                return Optional.empty();
            }
            throw new ExternalLookupException("Frankfurter " + status + " for " + sourceCurrency + "->" + targetCurrency
                    + " on " + date, e);
        } catch (ExternalLookupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExternalLookupException("Frankfurter call failed for " + sourceCurrency + "->" + targetCurrency
                    + " on " + date, e);
        }
        return parseRate(body, targetCurrency);
    }

    private String get(String url) {
        if (!rateLimiter.acquirePermission()) {
            throw new ExternalLookupException("Local limiter timeout before " + url);
        }
        return webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .block();
    }

    /** rates.{target} of a Frankfurter payload; empty when the target is absent or not a positive number. */
    static Optional<BigDecimal> parseRate(String json, String targetCurrency) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExternalLookupException("Malformed Frankfurter payload", e);
        }
        JsonNode rate = root.path("rates").path(targetCurrency);
        if (!rate.isNumber() || rate.decimalValue().signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(rate.decimalValue());
    }
}
