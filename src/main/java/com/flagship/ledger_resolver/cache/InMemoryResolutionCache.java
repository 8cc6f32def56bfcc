package com.flagship.ledger_resolver.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed {@link ResolutionCache}. Each entry expires after the TTL it was
 * written with; a null or non-positive TTL keeps the entry until it is evicted.
 */
public class InMemoryResolutionCache implements ResolutionCache {

    private final Cache<String, TimedValue> entries;

    public InMemoryResolutionCache(long maxEntries) {
        this(maxEntries, Ticker.systemTicker());
    }

    InMemoryResolutionCache(long maxEntries, Ticker ticker) {
        this.entries = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxEntries))
                .expireAfter(new TtlExpiry())
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        TimedValue value = entries.getIfPresent(key);
        return value == null ? Optional.empty() : Optional.of(value.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new TimedValue(value, ttl));
    }

    @Override
    public void evict(String key) {
        entries.invalidate(key);
    }

    private record TimedValue(String value, Duration ttl) {

        long expiresAfterNanos() {
            return ResolutionCache.expires(ttl) ? ttl.toNanos() : Long.MAX_VALUE;
        }
    }

    private static final class TtlExpiry implements Expiry<String, TimedValue> {

        @Override
        public long expireAfterCreate(String key, TimedValue value, long currentTime) {
            return value.expiresAfterNanos();
        }

        @Override
        public long expireAfterUpdate(String key, TimedValue value, long currentTime, long currentDuration) {
            return value.expiresAfterNanos();
        }

        @Override
        public long expireAfterRead(String key, TimedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
