package com.txradar.pipeline.enrichment;

import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.PipelineDiagnostics;
import com.txradar.pipeline.TransactionBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Sets is_public_holiday on every row from one calendar fetch per distinct (country, year). An unavailable
 * calendar or an unusable country code gives false, so the column is always present once the enrichment runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HolidayEnricher {

    private final HolidayLookup holidayLookup;

    public void apply(TransactionBatch batch, EnrichmentOptions options, Executor executor, Duration prefetchTimeout) {
        PipelineDiagnostics diagnostics = batch.getDiagnostics();
        if (!options.hasValidCountryCode()) {
            diagnostics.increment(PipelineDiagnostics.HOLIDAY_SKIPPED_INVALID_CONFIG);
            log.warn("Holiday calendar skipped: invalid country code '{}'; every row is marked non-holiday",
                    options.countryCode());
            batch.getRecords().forEach(r -> r.setIsPublicHoliday(false));
            return;
        }
        String country = options.countryCode();
        LookupCache<HolidayKey, Set<LocalDate>> calendars = new LookupCache<>(
                "Holiday",
                key -> holidayLookup.fetchHolidays(key.countryCode(), key.year()),
                diagnostics,
                PipelineDiagnostics.HOLIDAY_LOOKUPS,
                PipelineDiagnostics.HOLIDAY_LOOKUP_FAILURES);

        Set<HolidayKey> keys = new LinkedHashSet<>();
        for (TransactionRecord r : batch.getRecords()) {
            if (r.getDate() != null) {
                keys.add(new HolidayKey(country, r.getDate().getYear()));
            }
        }
        if (options.parallelPrefetch() && keys.size() > 1) {
            calendars.prefetch(keys, executor, prefetchTimeout);
        }

        int holidays = 0;
        for (TransactionRecord r : batch.getRecords()) {
            boolean holiday = false;
            if (r.getDate() != null) {
                LookupResult<Set<LocalDate>> calendar = calendars.get(new HolidayKey(country, r.getDate().getYear()));
                holiday = calendar.getValue().map(days -> days.contains(r.getDate())).orElse(false);
            }
            r.setIsPublicHoliday(holiday);
            if (holiday) {
                holidays++;
            }
        }
        log.info("Holiday enrichment ({}): {} calendars, {} rows on public holidays", country, keys.size(), holidays);
    }
}
