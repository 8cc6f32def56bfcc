package com.flagship.ledger_resolver.exception;

/**
 * Closing the underlying connection failed on every attempt.
 */
public class PoolCloseException extends LedgerException {

    public PoolCloseException(String message, Throwable cause) {
        super(message, cause);
    }
}
