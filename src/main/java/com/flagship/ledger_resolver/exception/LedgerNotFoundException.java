package com.flagship.ledger_resolver.exception;

import lombok.Getter;

/**
 * A ledger id or pool name that is not part of the current registry.
 */
@Getter
public class LedgerNotFoundException extends LedgerException {

    private final String ledgerId;

    public LedgerNotFoundException(String ledgerId, String message) {
        super(message);
        this.ledgerId = ledgerId;
    }

    public static LedgerNotFoundException forLedgerId(String ledgerId) {
        return new LedgerNotFoundException(ledgerId,
                "Ledger " + ledgerId + " not found in either production or non-production ledgers");
    }
}
