package com.flagship.ledger_resolver.connector;

import java.io.IOException;

/**
 * I/O failure talking to a ledger network: connection refused, bad status,
 * closed handle, unreadable reply.
 */
public class LedgerTransportException extends IOException {

    public LedgerTransportException(String message) {
        super(message);
    }

    public LedgerTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
