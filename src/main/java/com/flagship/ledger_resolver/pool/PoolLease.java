package com.flagship.ledger_resolver.pool;

import com.flagship.ledger_resolver.connector.LedgerConnection;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A counted reference to an open pool.
 *
 * The holder must release the lease exactly once on every exit path; use it
 * in a try-with-resources block. The connection stays usable until then.
 */
@Slf4j
public final class PoolLease implements AutoCloseable {

    private final LedgerPool pool;
    private final LedgerConnection connection;
    private final AtomicBoolean released = new AtomicBoolean();

    PoolLease(LedgerPool pool, LedgerConnection connection) {
        this.pool = pool;
        this.connection = connection;
    }

    public LedgerConnection connection() {
        if (released.get()) {
            throw new IllegalStateException("Lease on pool " + pool.getName() + " already released");
        }
        return connection;
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            pool.release();
        } else {
            log.warn("Lease on pool {} released more than once", pool.getName());
        }
    }

    @Override
    public void close() {
        release();
    }
}
