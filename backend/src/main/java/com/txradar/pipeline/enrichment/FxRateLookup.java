package com.txradar.pipeline.enrichment;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Point-in-time conversion rate source: amount_in_target = amount_in_source * rate.
 * Empty when the source has no rate for the pair; a failed call throws.
 */
public interface FxRateLookup {

    Optional<BigDecimal> fetchRate(LocalDate date, String sourceCurrency, String targetCurrency);
}
