package com.flagship.ledger_resolver.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for ledger pools and DID resolution.
 *
 * Metrics exposed:
 * - ledger.lookup: Counter of lookups, tagged by outcome
 * - ledger.lookup.duration: Timer for complete fan-out lookups
 * - ledger.query: Counter of per-ledger queries, tagged by ledger and outcome
 * - ledger.resolution.cache: Counter of cache hits and misses
 * - ledger.pool.opened / ledger.pool.closed / ledger.pool.failures: pool lifecycle
 * - ledger.pool.open: Gauge of currently opened pools
 */
@Component
public class ResolutionMetrics {

    private final MeterRegistry registry;

    private final Timer lookupTimer;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final AtomicInteger openPools = new AtomicInteger();

    public ResolutionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.lookupTimer = Timer.builder("ledger.lookup.duration")
                .description("Time taken to resolve a DID across all configured ledgers")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.cacheHits = Counter.builder("ledger.resolution.cache")
                .tag("result", "hit")
                .description("Resolution cache lookups")
                .register(registry);

        this.cacheMisses = Counter.builder("ledger.resolution.cache")
                .tag("result", "miss")
                .description("Resolution cache lookups")
                .register(registry);

        Gauge.builder("ledger.pool.open", openPools, AtomicInteger::get)
                .description("Number of ledger pools with an open connection")
                .register(registry);
    }

    // ==================== Lookup Metrics ====================

    public void recordLookup(LookupOutcome outcome, Duration duration) {
        registry.counter("ledger.lookup", "outcome", outcome.tag()).increment();
        lookupTimer.record(duration);
    }

    public void recordLedgerQuery(String ledgerId, QueryOutcome outcome) {
        registry.counter("ledger.query",
                "ledger", sanitizeTag(ledgerId),
                "outcome", outcome.tag()
        ).increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    // ==================== Pool Metrics ====================

    public void recordPoolOpened(String poolName) {
        openPools.incrementAndGet();
        registry.counter("ledger.pool.opened", "pool", sanitizeTag(poolName)).increment();
    }

    public void recordPoolClosed(String poolName) {
        openPools.decrementAndGet();
        registry.counter("ledger.pool.closed", "pool", sanitizeTag(poolName)).increment();
    }

    public void recordPoolOpenFailure(String poolName) {
        registry.counter("ledger.pool.failures",
                "pool", sanitizeTag(poolName),
                "operation", "open"
        ).increment();
    }

    public void recordPoolCloseFailure(String poolName) {
        registry.counter("ledger.pool.failures",
                "pool", sanitizeTag(poolName),
                "operation", "close"
        ).increment();
    }

    public int getOpenPools() {
        return openPools.get();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_\\-]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }

    public enum LookupOutcome {
        CACHE_HIT, RESOLVED, NOT_FOUND, CANCELLED, FAILED;

        String tag() {
            return name().toLowerCase();
        }
    }

    public enum QueryOutcome {
        VERIFIED, NOT_FOUND, PROOF_FAILED, TIMEOUT, TRANSPORT_ERROR, POOL_ERROR, CONFIG_ERROR;

        String tag() {
            return name().toLowerCase();
        }
    }
}
