package com.example.clustermonitor.mcp;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Time-bounded memo for a single value, used in front of capability discovery.
 *
 * <p>The entry is replaced as a whole on refresh. Concurrent refreshes are
 * serialized by Caffeine, so the loader runs at most once per expiry.
 */
public class CapabilityCache<T> {

    private static final String KEY = "capabilities";

    private final Cache<String, Entry<T>> cache;
    private final Ticker ticker;

    public CapabilityCache(Duration ttl) {
        this(ttl, Ticker.systemTicker());
    }

    public CapabilityCache(Duration ttl, Ticker ticker) {
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * The cached value if it is younger than the TTL, otherwise a freshly loaded one.
     */
    public T getOrRefresh(Supplier<T> loader) {
        return cache.get(KEY, key -> new Entry<>(loader.get(), ticker.read())).value();
    }

    /**
     * Load a fresh value unconditionally and cache it.
     */
    public T refresh(Supplier<T> loader) {
        Entry<T> entry = new Entry<>(loader.get(), ticker.read());
        cache.put(KEY, entry);
        return entry.value();
    }

    public void invalidate() {
        cache.invalidate(KEY);
    }

    public boolean isPopulated() {
        return cache.getIfPresent(KEY) != null;
    }

    /**
     * Ticker reading at which the current value was captured, if any.
     */
    public Long capturedAtNanos() {
        Entry<T> entry = cache.getIfPresent(KEY);
        return entry != null ? entry.capturedAtNanos() : null;
    }

    private record Entry<T>(T value, long capturedAtNanos) {
    }
}
