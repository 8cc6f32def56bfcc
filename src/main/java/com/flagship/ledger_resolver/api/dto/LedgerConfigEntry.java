package com.flagship.ledger_resolver.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_resolver.registry.LedgerConfig;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ledger in a configuration update.
 */
@Data
@NoArgsConstructor
public class LedgerConfigEntry {

    @JsonProperty("id")
    private String id;

    @JsonProperty("pool_name")
    private String poolName;

    @JsonProperty("is_production")
    private boolean production = true;

    @JsonProperty("is_write")
    private boolean write;

    @JsonProperty("genesis_transactions")
    private String genesisTransactions;

    @Min(value = 0, message = "Keepalive cannot be negative")
    @JsonProperty("keepalive")
    private int keepalive = 5;

    @JsonProperty("read_only")
    private boolean readOnly;

    @JsonProperty("socks_proxy")
    private String socksProxy;

    @JsonProperty("endorser_did")
    private String endorserDid;

    @JsonProperty("endorser_alias")
    private String endorserAlias;

    @JsonProperty("gateway_url")
    private String gatewayUrl;

    public LedgerConfig toLedgerConfig() {
        return LedgerConfig.builder()
                .id(id)
                .poolName(poolName)
                .production(production)
                .write(write)
                .genesisTransactions(genesisTransactions)
                .keepalive(keepalive)
                .readOnly(readOnly)
                .socksProxy(socksProxy)
                .endorserDid(endorserDid)
                .endorserAlias(endorserAlias)
                .gatewayUrl(gatewayUrl)
                .build();
    }
}
