package com.txradar.pipeline;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for non-fatal conditions seen during one run. Thread-safe: external lookups may increment
 * from the enrichment executor.
 */
public class PipelineDiagnostics {

    public static final String UNPARSEABLE_DATES = "unparseable_dates";
    public static final String MISSING_DATES = "missing_dates";
    public static final String UNPARSEABLE_AMOUNTS = "unparseable_amounts";
    public static final String MISSING_AMOUNTS = "missing_amounts";
    public static final String BOTH_SIDES_AMOUNT = "both_sides_amount";
    public static final String ZERO_NET_AMOUNT = "zero_net_amount";
    public static final String MISSING_CATEGORY = "missing_category";
    public static final String UNKNOWN_CATEGORY = "unknown_category";
    public static final String ANOMALIES = "anomalies";
    public static final String DUPLICATE_CANDIDATES = "duplicate_candidates";
    public static final String HOLIDAY_LOOKUPS = "holiday_lookups";
    public static final String HOLIDAY_LOOKUP_FAILURES = "holiday_lookup_failures";
    public static final String HOLIDAY_SKIPPED_INVALID_CONFIG = "holiday_skipped_invalid_config";
    public static final String FX_LOOKUPS = "fx_lookups";
    public static final String FX_LOOKUP_FAILURES = "fx_lookup_failures";
    public static final String FX_UNRESOLVED_ROWS = "fx_unresolved_rows";
    public static final String FX_SKIPPED_NO_CURRENCY_COLUMN = "fx_skipped_no_currency_column";
    public static final String FX_SKIPPED_INVALID_CONFIG = "fx_skipped_invalid_config";

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public void increment(String counter) {
        add(counter, 1);
    }

    public void add(String counter, long delta) {
        counters.computeIfAbsent(counter, k -> new AtomicLong()).addAndGet(delta);
    }

    public long get(String counter) {
        AtomicLong value = counters.get(counter);
        return value == null ? 0L : value.get();
    }

    /** Sorted copy of all non-zero counters. */
    public Map<String, Long> snapshot() {
        Map<String, Long> out = new TreeMap<>();
        counters.forEach((k, v) -> {
            if (v.get() != 0) {
                out.put(k, v.get());
            }
        });
        return out;
    }
}
