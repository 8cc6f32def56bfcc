package com.flagship.ledger_resolver.pool;

import com.flagship.ledger_resolver.connector.LedgerConnection;
import com.flagship.ledger_resolver.connector.LedgerConnector;
import com.flagship.ledger_resolver.connector.LedgerTransportException;
import com.flagship.ledger_resolver.exception.PoolCloseException;
import com.flagship.ledger_resolver.exception.PoolConfigException;
import com.flagship.ledger_resolver.exception.PoolDegradedException;
import com.flagship.ledger_resolver.exception.PoolOpenException;
import com.flagship.ledger_resolver.observability.ResolutionMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lazily opened, reference-counted connection to a ledger network.
 *
 * Lifecycle:
 * - Unopened → Opened on the first {@link #acquire()} (or an explicit {@link #open()})
 * - Opened with leases outstanding while in use
 * - Opened with a pending close once the last lease is released and keepalive > 0
 * - back to Unopened when the keepalive timer fires with no new lease,
 *   or immediately on the last release when keepalive is 0
 *
 * A pending close is cancelled by the next acquire, which then reuses the
 * same connection. A close that fails on every attempt leaves the pool
 * degraded: it keeps its handle and refuses new leases until an explicit
 * close succeeds.
 *
 * All state is guarded by one lock per pool. Concurrent lookups share the
 * pool; they never get a private copy.
 */
@Slf4j
public class LedgerPool {

    private final LedgerPoolConfig config;
    private final LedgerConnector connector;
    private final GenesisStore genesisStore;
    private final ScheduledExecutorService closeScheduler;
    private final int closeAttempts;
    private final Duration closeBackoff;
    private final ResolutionMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock. handle != null iff the pool is opened.
    private LedgerConnection handle;
    private int refCount;
    private ScheduledFuture<?> pendingClose;
    private long closeGeneration;
    private boolean degraded;

    LedgerPool(LedgerPoolConfig config,
               LedgerConnector connector,
               GenesisStore genesisStore,
               ScheduledExecutorService closeScheduler,
               int closeAttempts,
               Duration closeBackoff,
               ResolutionMetrics metrics) {
        this.config = config;
        this.connector = connector;
        this.genesisStore = genesisStore;
        this.closeScheduler = closeScheduler;
        this.closeAttempts = closeAttempts;
        this.closeBackoff = closeBackoff;
        this.metrics = metrics;
    }

    public String getName() {
        return config.getName();
    }

    public LedgerPoolConfig getConfig() {
        return config;
    }

    /**
     * Opens the connection if it is not open yet.
     *
     * @throws PoolConfigException if no genesis transactions are available (no network call is made)
     * @throws PoolOpenException if the connector cannot open the network; not retried here
     */
    public void open() {
        lock.lock();
        try {
            if (handle == null) {
                doOpen();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes a lease on the pool, cancelling a pending close and opening the
     * connection when needed.
     *
     * @return a lease that must be released exactly once
     * @throws PoolDegradedException if an earlier close failed on every attempt
     */
    public PoolLease acquire() {
        lock.lock();
        try {
            if (degraded) {
                throw new PoolDegradedException(getName());
            }
            cancelPendingClose();
            if (handle == null) {
                log.debug("Opening the pool ledger {}", getName());
                doOpen();
            }
            refCount++;
            return new PoolLease(this, handle);
        } finally {
            lock.unlock();
        }
    }

    void release() {
        lock.lock();
        try {
            if (refCount == 0) {
                log.error("Release on pool {} without an outstanding lease", getName());
                return;
            }
            refCount--;
            if (refCount > 0 || handle == null) {
                return;
            }
            if (config.getKeepaliveSeconds() == 0) {
                closeAfterLastRelease();
            } else {
                long generation = ++closeGeneration;
                pendingClose = closeScheduler.schedule(
                        () -> closeAfterKeepalive(generation),
                        config.getKeepaliveSeconds(), TimeUnit.SECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the connection, retrying a failed close a fixed number of times.
     *
     * @throws PoolCloseException if every attempt failed; the pool is then degraded
     */
    public void close() {
        lock.lock();
        try {
            cancelPendingClose();
            if (handle == null) {
                return;
            }
            LedgerTransportException failure = null;
            for (int attempt = 1; attempt <= closeAttempts; attempt++) {
                try {
                    handle.close();
                    failure = null;
                    break;
                } catch (LedgerTransportException e) {
                    failure = e;
                    if (attempt < closeAttempts && !sleepBeforeRetry()) {
                        break;
                    }
                }
            }

            if (failure != null) {
                degraded = true;
                metrics.recordPoolCloseFailure(getName());
                log.error("Exception when closing pool ledger {}", getName(), failure);
                throw new PoolCloseException("Exception when closing pool ledger '" + getName() + "'", failure);
            }

            handle = null;
            degraded = false;
            metrics.recordPoolClosed(getName());
            log.debug("Closed pool ledger {}", getName());
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpened() {
        lock.lock();
        try {
            return handle != null;
        } finally {
            lock.unlock();
        }
    }

    public int getRefCount() {
        lock.lock();
        try {
            return refCount;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPendingClose() {
        lock.lock();
        try {
            return pendingClose != null;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDegraded() {
        lock.lock();
        try {
            return degraded;
        } finally {
            lock.unlock();
        }
    }

    public PoolStatus status() {
        lock.lock();
        try {
            return new PoolStatus(getName(), handle != null, refCount, pendingClose != null, degraded);
        } finally {
            lock.unlock();
        }
    }

    private void doOpen() {
        String genesis = genesisStore.resolveGenesis(config);
        String genesisHash = GenesisStore.hash(genesis);
        Optional<String> cached = genesisStore.readCachedTransactions(getName(), genesisHash);
        String transactions = cached.orElse(genesis);

        LedgerConnection connection;
        try {
            connection = connector.open(config, transactions);
        } catch (LedgerTransportException e) {
            metrics.recordPoolOpenFailure(getName());
            throw new PoolOpenException("Error opening pool ledger '" + getName() + "'", e);
        }
        handle = connection;
        metrics.recordPoolOpened(getName());
        log.debug("Opened pool ledger {}", getName());

        refreshCachedTransactions(connection, genesisHash, transactions, cached.isPresent());
    }

    private void refreshCachedTransactions(LedgerConnection connection, String genesisHash,
                                           String transactions, boolean wasCached) {
        try {
            String refreshed = GenesisStore.normalize(connection.getTransactions());
            if (!wasCached || !refreshed.equals(transactions)) {
                genesisStore.writeCachedTransactions(getName(), genesisHash, refreshed);
            }
        } catch (LedgerTransportException e) {
            log.warn("Could not refresh pool transactions for {}: {}", getName(), e.getMessage());
        }
    }

    private void closeAfterLastRelease() {
        try {
            close();
        } catch (PoolCloseException e) {
            // Already logged and counted by close(); the lease itself is released.
            log.warn("Pool {} left degraded after its last lease was released", getName());
        }
    }

    private void closeAfterKeepalive(long generation) {
        lock.lock();
        try {
            if (generation != closeGeneration || refCount > 0) {
                return;
            }
            pendingClose = null;
            log.debug("Closing pool ledger {} after keepalive timeout", getName());
            closeAfterLastRelease();
        } finally {
            lock.unlock();
        }
    }

    private void cancelPendingClose() {
        closeGeneration++;
        if (pendingClose != null) {
            pendingClose.cancel(false);
            pendingClose = null;
        }
    }

    private boolean sleepBeforeRetry() {
        try {
            Thread.sleep(closeBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
