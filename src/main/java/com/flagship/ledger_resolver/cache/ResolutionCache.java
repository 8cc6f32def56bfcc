package com.flagship.ledger_resolver.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL key/value store holding the ledger a DID was last resolved on.
 * Implementations must be safe for concurrent use.
 */
public interface ResolutionCache {

    Optional<String> get(String key);

    /**
     * Stores a value; a null, zero or negative {@code ttl} stores it without expiry.
     */
    void set(String key, String value, Duration ttl);

    void evict(String key);

    static boolean expires(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }
}
