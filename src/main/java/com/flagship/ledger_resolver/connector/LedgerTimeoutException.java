package com.flagship.ledger_resolver.connector;

public class LedgerTimeoutException extends LedgerTransportException {

    public LedgerTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
