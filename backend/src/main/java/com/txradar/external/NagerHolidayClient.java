package com.txradar.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txradar.common.RetryPolicy;
import com.txradar.pipeline.enrichment.ExternalLookupException;
import com.txradar.pipeline.enrichment.HolidayLookup;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Public holidays from Nager.Date /api/v3/PublicHolidays/{year}/{country}.
 * 204 and 404 mean the country has no calendar there: empty set, not a failure.
 */
@Component
@Slf4j
public class NagerHolidayClient implements HolidayLookup {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebClient webClient;
    private final ExternalApiProperties properties;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;

    public NagerHolidayClient(WebClient.Builder webClientBuilder,
                              ExternalApiProperties properties,
                              @Qualifier(ExternalApiConfig.HOLIDAY_RATE_LIMITER) RateLimiter rateLimiter,
                              RetryPolicy retryPolicy) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public Set<LocalDate> fetchHolidays(String countryCode, int year) {
        String url = properties.getNagerBaseUrl() + "/api/v3/PublicHolidays/" + year + "/" + countryCode;
        String body;
        try {
            body = retryPolicy.execute(() -> get(url), TransientHttpErrors::isTransient);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.warn("Nager.Date has no calendar for {} {}", countryCode, year);
                return Collections.emptySet();
            }
            throw new ExternalLookupException("Nager.Date " + e.getStatusCode().value() + " for " + countryCode + " " + year, e);
        } catch (ExternalLookupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExternalLookupException("Nager.Date call failed for " + countryCode + " " + year, e);
        }
        Set<LocalDate> holidays = parseHolidays(body);
        log.debug("Nager.Date {} {}: {} holidays", countryCode, year, holidays.size());
        return holidays;
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

    /** Dates of a Nager.Date PublicHolidays payload; blank body (204) is an empty calendar. */
    static Set<LocalDate> parseHolidays(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptySet();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExternalLookupException("Malformed Nager.Date payload", e);
        }
        if (!root.isArray()) {
            throw new ExternalLookupException("Nager.Date payload is not an array");
        }
        Set<LocalDate> dates = new HashSet<>();
        for (JsonNode holiday : root) {
            String date = holiday.path("date").asText("");
            try {
                dates.add(LocalDate.parse(date));
            } catch (DateTimeParseException e) {
                throw new ExternalLookupException("Bad holiday date '" + date + "'", e);
            }
        }
        return Collections.unmodifiableSet(dates);
    }
}
