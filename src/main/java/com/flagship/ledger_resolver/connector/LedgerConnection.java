package com.flagship.ledger_resolver.connector;

/**
 * An open connection to one ledger network.
 *
 * Instances are shared by every holder of a pool lease and must be safe for
 * concurrent {@link #submitRequest} calls.
 */
public interface LedgerConnection {

    /**
     * Submits a read request and returns the raw reply envelope.
     */
    String submitRequest(String requestJson) throws LedgerTransportException;

    /**
     * Returns the current pool transactions, as refreshed from the network.
     */
    String getTransactions() throws LedgerTransportException;

    void close() throws LedgerTransportException;
}
