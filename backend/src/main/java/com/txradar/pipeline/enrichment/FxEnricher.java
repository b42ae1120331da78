package com.txradar.pipeline.enrichment;

import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.CanonicalColumns;
import com.txradar.pipeline.PipelineDiagnostics;
import com.txradar.pipeline.TransactionBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Adds {amount_field}_{TARGET} columns using one rate lookup per distinct (date, source, target).
 * Rows already in the target currency use rate 1, dated or not; rows without a resolvable rate get null values.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FxEnricher {

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private static final List<AmountField> AMOUNT_FIELDS = List.of(
            new AmountField(CanonicalColumns.CREDIT_AMOUNT, TransactionRecord::getCreditAmount),
            new AmountField(CanonicalColumns.DEBIT_AMOUNT, TransactionRecord::getDebitAmount),
            new AmountField(CanonicalColumns.NET_AMOUNT, TransactionRecord::getNetAmount),
            new AmountField(CanonicalColumns.ABS_AMOUNT, TransactionRecord::getAbsAmount)
    );

    private final FxRateLookup fxRateLookup;

    public void apply(TransactionBatch batch, EnrichmentOptions options, Executor executor, Duration prefetchTimeout) {
        PipelineDiagnostics diagnostics = batch.getDiagnostics();
        if (!batch.hasColumn(CanonicalColumns.CURRENCY)) {
            diagnostics.increment(PipelineDiagnostics.FX_SKIPPED_NO_CURRENCY_COLUMN);
            log.warn("FX enrichment skipped: batch has no currency column");
            return;
        }
        if (!options.hasValidTargetCurrency()) {
            diagnostics.increment(PipelineDiagnostics.FX_SKIPPED_INVALID_CONFIG);
            log.warn("FX enrichment skipped: invalid target currency '{}'", options.targetCurrency());
            return;
        }
        String target = options.targetCurrency();
        LookupCache<FxKey, BigDecimal> rates = new LookupCache<>(
                "FX",
                key -> fxRateLookup.fetchRate(key.quoteDate(), key.sourceCurrency(), key.targetCurrency()).orElse(null),
                diagnostics,
                PipelineDiagnostics.FX_LOOKUPS,
                PipelineDiagnostics.FX_LOOKUP_FAILURES);

        Set<FxKey> keys = new LinkedHashSet<>();
        for (TransactionRecord r : batch.getRecords()) {
            FxKey key = keyOf(r, target);
            if (key != null && !key.sourceCurrency().equals(target)) {
                keys.add(key);
            }
        }
        if (options.parallelPrefetch() && keys.size() > 1) {
            rates.prefetch(keys, executor, prefetchTimeout);
        }

        int unresolved = 0;
        for (TransactionRecord r : batch.getRecords()) {
            BigDecimal rate = rateFor(r, target, rates);
            if (rate == null) {
                unresolved++;
            }
            r.setFxTargetCurrency(target);
            r.setFxRate(rate);
            Map<String, BigDecimal> converted = new LinkedHashMap<>();
            for (AmountField field : AMOUNT_FIELDS) {
                BigDecimal amount = field.getter().apply(r);
                converted.put(field.name() + "_" + target,
                        amount == null || rate == null ? null : amount.multiply(rate).setScale(SCALE, ROUNDING));
            }
            r.setConvertedAmounts(converted);
        }
        diagnostics.add(PipelineDiagnostics.FX_UNRESOLVED_ROWS, unresolved);
        log.info("FX enrichment to {}: {} rate keys, {} rows without rate", target, keys.size(), unresolved);
    }

    private static BigDecimal rateFor(TransactionRecord r, String target, LookupCache<FxKey, BigDecimal> rates) {
        if (target.equals(r.getCurrency())) {
            return BigDecimal.ONE;
        }
        FxKey key = keyOf(r, target);
        if (key == null) {
            return null;
        }
        return rates.get(key).getValue().orElse(null);
    }

    private static FxKey keyOf(TransactionRecord r, String target) {
        if (r.getDate() == null || r.getCurrency() == null) {
            return null;
        }
        return new FxKey(r.getDate(), r.getCurrency(), target);
    }

    private record AmountField(String name, Function<TransactionRecord, BigDecimal> getter) {
    }
}
