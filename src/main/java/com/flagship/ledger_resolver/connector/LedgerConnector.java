package com.flagship.ledger_resolver.connector;

import com.flagship.ledger_resolver.pool.LedgerPoolConfig;

/**
 * Opens connections to a ledger network.
 *
 * Implementations own the wire protocol to the ledger nodes. The pool layer
 * only decides when to open and close.
 */
public interface LedgerConnector {

    /**
     * Opens a connection to the network described by the given pool transactions.
     *
     * @param config the pool configuration (name, proxy, gateway, timeouts)
     * @param transactions normalized pool transactions to bootstrap from
     * @return an open connection
     * @throws LedgerTransportException if the network cannot be reached
     */
    LedgerConnection open(LedgerPoolConfig config, String transactions) throws LedgerTransportException;
}
