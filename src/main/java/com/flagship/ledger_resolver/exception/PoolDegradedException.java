package com.flagship.ledger_resolver.exception;

/**
 * Raised by acquire on a pool whose last close exhausted its retries.
 * The pool stays unusable until an explicit close succeeds.
 */
public class PoolDegradedException extends PoolOpenException {

    public PoolDegradedException(String poolName) {
        super("Pool ledger '" + poolName + "' is degraded after a failed close");
    }
}
