package com.flagship.ledger_resolver.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_resolver.pool.LedgerPoolConfig;
import com.flagship.ledger_resolver.registry.LedgerDescriptor;
import lombok.Builder;
import lombok.Value;

/**
 * A configured ledger as reported back; genesis transactions are never included.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerConfigView {

    @JsonProperty("id")
    String id;

    @JsonProperty("pool_name")
    String poolName;

    @JsonProperty("is_production")
    boolean production;

    @JsonProperty("is_write")
    boolean write;

    @JsonProperty("keepalive")
    int keepalive;

    @JsonProperty("read_only")
    boolean readOnly;

    @JsonProperty("socks_proxy")
    String socksProxy;

    @JsonProperty("endorser_did")
    String endorserDid;

    @JsonProperty("endorser_alias")
    String endorserAlias;

    @JsonProperty("gateway_url")
    String gatewayUrl;

    public static LedgerConfigView from(LedgerDescriptor descriptor) {
        LedgerPoolConfig pool = descriptor.getPool().getConfig();
        return LedgerConfigView.builder()
                .id(descriptor.getId())
                .poolName(pool.getName())
                .production(descriptor.isProduction())
                .write(descriptor.isWrite())
                .keepalive(pool.getKeepaliveSeconds())
                .readOnly(pool.isReadOnly())
                .socksProxy(pool.getSocksProxy())
                .endorserDid(descriptor.getEndorserDid())
                .endorserAlias(descriptor.getEndorserAlias())
                .gatewayUrl(pool.getGatewayUrl())
                .build();
    }
}
