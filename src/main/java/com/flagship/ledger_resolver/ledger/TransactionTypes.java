package com.flagship.ledger_resolver.ledger;

/**
 * Ledger transaction type codes and state-path markers.
 */
public final class TransactionTypes {

    public static final String GET_NYM = "105";
    public static final String GET_SCHEMA = "107";
    public static final String GET_CLAIM_DEF = "108";
    public static final String GET_REVOC_REG_DEF = "115";

    public static final String MARKER_SCHEMA = "2";
    public static final String MARKER_CLAIM_DEF = "3";

    private TransactionTypes() {
    }
}
