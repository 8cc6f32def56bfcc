package com.flagship.ledger_resolver.exception;

/**
 * Base type for every failure raised by the ledger pool and resolution layer.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
