package com.flagship.ledger_resolver.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_resolver.registry.LedgerRegistry;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class LedgerConfigListResponse {

    @JsonProperty("production_ledgers")
    List<LedgerConfigView> productionLedgers;

    @JsonProperty("non_production_ledgers")
    List<LedgerConfigView> nonProductionLedgers;

    public static LedgerConfigListResponse from(LedgerRegistry registry) {
        return new LedgerConfigListResponse(
                registry.getProduction().values().stream().map(LedgerConfigView::from).collect(Collectors.toList()),
                registry.getNonProduction().values().stream().map(LedgerConfigView::from).collect(Collectors.toList()));
    }
}
