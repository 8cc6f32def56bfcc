package com.flagship.ledger_resolver.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Full replacement of the ledger configuration.
 */
@Data
@NoArgsConstructor
public class LedgerConfigUpdateRequest {

    @NotNull(message = "ledger_config_list is required")
    @Valid
    @JsonProperty("ledger_config_list")
    private List<LedgerConfigEntry> ledgerConfigList;
}
