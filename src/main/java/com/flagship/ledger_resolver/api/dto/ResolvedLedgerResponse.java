package com.flagship.ledger_resolver.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_resolver.resolution.ResolvedLedger;
import lombok.Builder;
import lombok.Value;

/**
 * Where a DID or identifier resolved to.
 */
@Value
@Builder
public class ResolvedLedgerResponse {

    @JsonProperty("ledger_id")
    String ledgerId;

    @JsonProperty("pool_name")
    String poolName;

    @JsonProperty("self_certified")
    boolean selfCertified;

    @JsonProperty("from_cache")
    boolean fromCache;

    public static ResolvedLedgerResponse from(ResolvedLedger resolved) {
        return ResolvedLedgerResponse.builder()
                .ledgerId(resolved.getLedgerId())
                .poolName(resolved.getPool().getName())
                .selfCertified(resolved.isSelfCertified())
                .fromCache(resolved.isFromCache())
                .build();
    }
}
