package com.flagship.ledger_resolver.exception;

public class NoLedgerConfiguredException extends LedgerException {

    public NoLedgerConfiguredException() {
        super("No ledger configured");
    }
}
