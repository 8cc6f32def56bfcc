package com.flagship.ledger_resolver.exception;

import lombok.Getter;

/**
 * The resolution cache points a DID at a ledger id the registry no longer has.
 */
@Getter
public class CacheInconsistencyException extends LedgerException {

    private final String did;
    private final String cachedLedgerId;

    public CacheInconsistencyException(String did, String cachedLedgerId) {
        super("Cached ledger_id " + cachedLedgerId + " for DID " + did
                + " not found in either production or non-production ledgers");
        this.did = did;
        this.cachedLedgerId = cachedLedgerId;
    }
}
