package com.txradar.pipeline.enrichment;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.txradar.pipeline.PipelineDiagnostics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Run-scoped key to lookup result cache. Caffeine's get(key, loader) is atomic per key, so a key is fetched at
 * most once however many rows or prefetch threads ask for it. Failures and empty results are cached as
 * {@link LookupResult#unavailable()}.
 */
@Slf4j
final class LookupCache<K, V> {

    private final String name;
    private final Function<K, V> fetcher;
    private final PipelineDiagnostics diagnostics;
    private final String lookupCounter;
    private final String failureCounter;
    private final Cache<K, LookupResult<V>> cache = Caffeine.newBuilder().build();

    LookupCache(String name, Function<K, V> fetcher, PipelineDiagnostics diagnostics,
                String lookupCounter, String failureCounter) {
        this.name = name;
        this.fetcher = fetcher;
        this.diagnostics = diagnostics;
        this.lookupCounter = lookupCounter;
        this.failureCounter = failureCounter;
    }

    LookupResult<V> get(K key) {
        return cache.get(key, this::load);
    }

    /**
     * Loads all keys on the executor and waits up to timeout. Keys still loading afterwards are picked up by
     * {@link #get} on demand.
     */
    void prefetch(Collection<K> keys, Executor executor, Duration timeout) {
        List<CompletableFuture<LookupResult<V>>> futures = keys.stream()
                .map(k -> CompletableFuture.supplyAsync(() -> get(k), executor))
                .toList();
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} prefetch did not finish within {}; remaining keys load on demand", name, timeout);
        } catch (ExecutionException e) {
            log.warn("{} prefetch failed; remaining keys load on demand", name, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} prefetch interrupted; remaining keys load on demand", name);
        }
    }

    private LookupResult<V> load(K key) {
        diagnostics.increment(lookupCounter);
        try {
            return LookupResult.available(fetcher.apply(key));
        } catch (ExternalLookupException e) {
            diagnostics.increment(failureCounter);
            log.warn("{} lookup failed for {}: {}", name, key, e.getMessage());
            return LookupResult.unavailable();
        } catch (RuntimeException e) {
            diagnostics.increment(failureCounter);
            log.warn("{} lookup error for {}", name, key, e);
            return LookupResult.unavailable();
        }
    }
}
