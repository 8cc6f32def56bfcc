package com.flagship.ledger_resolver.registry;

import com.flagship.ledger_resolver.pool.LedgerPoolConfig;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * One configured ledger, as handed to a registry rebuild.
 */
@Value
@Builder(toBuilder = true)
public class LedgerConfig {

    String id;

    String poolName;

    @Builder.Default
    boolean production = true;

    boolean write;

    String genesisTransactions;

    @Builder.Default
    int keepalive = 5;

    boolean readOnly;

    String socksProxy;

    String endorserDid;

    String endorserAlias;

    String gatewayUrl;

    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(10);

    /**
     * Pool name, defaulting to the ledger id.
     */
    public String effectivePoolName() {
        return poolName != null && !poolName.isBlank() ? poolName : id;
    }

    public LedgerPoolConfig toPoolConfig() {
        return LedgerPoolConfig.builder()
                .name(effectivePoolName())
                .keepaliveSeconds(keepalive)
                .readOnly(readOnly)
                .genesisTransactions(genesisTransactions)
                .socksProxy(socksProxy)
                .gatewayUrl(gatewayUrl)
                .requestTimeout(requestTimeout)
                .build();
    }
}
