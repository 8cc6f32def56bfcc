package com.flagship.ledger_resolver.pool;

import com.flagship.ledger_resolver.connector.LedgerConnector;
import com.flagship.ledger_resolver.observability.ResolutionMetrics;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builds {@link LedgerPool}s that share one connector, genesis store and
 * deferred-close scheduler.
 */
public class LedgerPoolFactory {

    private final LedgerConnector connector;
    private final GenesisStore genesisStore;
    private final ScheduledExecutorService closeScheduler;
    private final int closeAttempts;
    private final Duration closeBackoff;
    private final ResolutionMetrics metrics;

    public LedgerPoolFactory(LedgerConnector connector,
                             GenesisStore genesisStore,
                             ScheduledExecutorService closeScheduler,
                             int closeAttempts,
                             Duration closeBackoff,
                             ResolutionMetrics metrics) {
        if (closeAttempts < 1) {
            throw new IllegalArgumentException("Close attempts must be at least 1");
        }
        this.connector = connector;
        this.genesisStore = genesisStore;
        this.closeScheduler = closeScheduler;
        this.closeAttempts = closeAttempts;
        this.closeBackoff = closeBackoff;
        this.metrics = metrics;
    }

    public LedgerPool create(LedgerPoolConfig config) {
        if (config.getName() == null || config.getName().isBlank()) {
            throw new IllegalArgumentException("Pool name cannot be null or blank");
        }
        if (config.getKeepaliveSeconds() < 0) {
            throw new IllegalArgumentException("Keepalive cannot be negative for pool " + config.getName());
        }
        return new LedgerPool(config, connector, genesisStore, closeScheduler,
                closeAttempts, closeBackoff, metrics);
    }
}
