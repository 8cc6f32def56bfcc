package com.flagship.ledger_resolver.exception;

import lombok.Getter;

/**
 * No configured ledger returned a verifiable record for the DID.
 * Carries how many ledgers of each class were searched so a misconfiguration
 * can be told apart from a DID that is genuinely absent.
 */
@Getter
public class DidNotFoundAnywhereException extends LedgerException {

    private final String did;
    private final int productionCount;
    private final int nonProductionCount;

    public DidNotFoundAnywhereException(String did, int productionCount, int nonProductionCount) {
        super(String.format("DID %s not found in any of the ledgers total: (production: %d, non_production: %d)",
                did, productionCount, nonProductionCount));
        this.did = did;
        this.productionCount = productionCount;
        this.nonProductionCount = nonProductionCount;
    }
}
