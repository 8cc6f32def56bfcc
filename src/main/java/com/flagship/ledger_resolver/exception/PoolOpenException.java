package com.flagship.ledger_resolver.exception;

/**
 * The connector failed to open a connection to the ledger network.
 * Open does not retry; retrying is up to the caller.
 */
public class PoolOpenException extends LedgerException {

    public PoolOpenException(String message) {
        super(message);
    }

    public PoolOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
