package com.flagship.ledger_resolver.resolution;

/**
 * Read requests that can be routed to the ledger holding their subject.
 */
public enum LedgerRequestType {
    GET_SCHEMA(false),
    GET_CRED_DEF(false),
    GET_REVOC_REG_DEF(false),
    GET_REVOC_REG_ENTRY(false),
    GET_REVOC_REG_DELTA(false),
    GET_KEY_FOR_DID(true),
    GET_ALL_ENDPOINTS_FOR_DID(true),
    GET_ENDPOINT_FOR_DID(true),
    GET_NYM_ROLE(true);

    private final boolean didRequest;

    LedgerRequestType(boolean didRequest) {
        this.didRequest = didRequest;
    }

    /**
     * True when the identifier is itself a DID rather than an object id scoped to one.
     */
    public boolean isDidRequest() {
        return didRequest;
    }
}
