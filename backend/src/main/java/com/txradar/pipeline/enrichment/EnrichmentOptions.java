package com.txradar.pipeline.enrichment;

import com.txradar.pipeline.config.EnrichmentProperties;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Immutable per-run enrichment settings. Passed into the adapter for each run so concurrent or repeated runs
 * with different toggles do not interfere.
 */
public record EnrichmentOptions(
        boolean holidaysEnabled,
        boolean fxEnabled,
        String countryCode,
        String targetCurrency,
        boolean parallelPrefetch
) {

    private static final Pattern COUNTRY_CODE = Pattern.compile("[A-Z]{2}");
    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

    public EnrichmentOptions {
        countryCode = upper(countryCode);
        targetCurrency = upper(targetCurrency);
    }

    public static EnrichmentOptions from(EnrichmentProperties properties) {
        return new EnrichmentOptions(
                properties.isHolidaysEnabled(),
                properties.isFxEnabled(),
                properties.getCountryCode(),
                properties.getTargetCurrency(),
                properties.isParallelPrefetch());
    }

    public static EnrichmentOptions disabled() {
        return new EnrichmentOptions(false, false, null, null, false);
    }

    /** Non-null arguments replace the current values. */
    public EnrichmentOptions withOverrides(Boolean holidays, Boolean fx, String country, String target) {
        return new EnrichmentOptions(
                holidays != null ? holidays : holidaysEnabled,
                fx != null ? fx : fxEnabled,
                country != null ? country : countryCode,
                target != null ? target : targetCurrency,
                parallelPrefetch);
    }

    public boolean hasValidCountryCode() {
        return countryCode != null && COUNTRY_CODE.matcher(countryCode).matches();
    }

    public boolean hasValidTargetCurrency() {
        return targetCurrency != null && CURRENCY_CODE.matcher(targetCurrency).matches();
    }

    private static String upper(String code) {
        return code == null || code.isBlank() ? null : code.strip().toUpperCase(Locale.ROOT);
    }
}
