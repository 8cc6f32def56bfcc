package com.flagship.ledger_resolver.pool;

import lombok.Value;

/**
 * Point-in-time view of a pool's lifecycle state, for health and admin output.
 */
@Value
public class PoolStatus {
    String name;
    boolean opened;
    int refCount;
    boolean pendingClose;
    boolean degraded;
}
