package com.txradar.pipeline.enrichment;

import java.util.Optional;

/**
 * Cached outcome of one external lookup. UNAVAILABLE is stored for failed or empty lookups so the key is not
 * fetched again in the same run.
 */
public final class LookupResult<V> {

    private static final LookupResult<?> UNAVAILABLE = new LookupResult<>(null);

    private final V value;

    private LookupResult(V value) {
        this.value = value;
    }

    public static <V> LookupResult<V> available(V value) {
        if (value == null) {
            return unavailable();
        }
        return new LookupResult<>(value);
    }

    @SuppressWarnings("unchecked")
    public static <V> LookupResult<V> unavailable() {
        return (LookupResult<V>) UNAVAILABLE;
    }

    public boolean isAvailable() {
        return value != null;
    }

    public Optional<V> getValue() {
        return Optional.ofNullable(value);
    }
}
