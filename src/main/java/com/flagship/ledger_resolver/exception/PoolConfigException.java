package com.flagship.ledger_resolver.exception;

/**
 * Missing, unreadable or conflicting genesis configuration for a pool.
 * Fatal to that pool's open; no network call is attempted.
 */
public class PoolConfigException extends LedgerException {

    public PoolConfigException(String message) {
        super(message);
    }

    public PoolConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
