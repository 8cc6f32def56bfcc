package com.flagship.ledger_resolver.exception;

public class LookupCancelledException extends LedgerException {

    public LookupCancelledException(String message) {
        super(message);
    }

    public LookupCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
