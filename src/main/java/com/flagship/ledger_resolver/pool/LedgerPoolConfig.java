package com.flagship.ledger_resolver.pool;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable configuration of one ledger pool.
 *
 * Two pools with equal configs are interchangeable, which is what lets a
 * reconfiguration keep an already opened pool.
 */
@Value
@Builder(toBuilder = true)
public class LedgerPoolConfig {

    String name;

    /**
     * Seconds to keep the connection open after the last lease is released.
     * 0 closes synchronously on the last release.
     */
    int keepaliveSeconds;

    boolean readOnly;

    /**
     * Inline genesis transactions. When null they are loaded from
     * {@code <genesis-dir>/<name>/genesis} on open.
     */
    String genesisTransactions;

    String socksProxy;

    String gatewayUrl;

    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(10);
}
