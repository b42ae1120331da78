package com.txradar.pipeline.enrichment;

import java.time.LocalDate;

public record FxKey(LocalDate quoteDate, String sourceCurrency, String targetCurrency) {
}
