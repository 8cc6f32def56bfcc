package com.flagship.ledger_resolver.resolution;

/**
 * Arbitration classes for verified answers, strongest first.
 */
public enum LedgerPriority {
    PRODUCTION_SELF_CERTIFIED,
    NON_PRODUCTION_SELF_CERTIFIED,
    PRODUCTION,
    NON_PRODUCTION;

    public static LedgerPriority of(boolean production, boolean selfCertified) {
        if (selfCertified) {
            return production ? PRODUCTION_SELF_CERTIFIED : NON_PRODUCTION_SELF_CERTIFIED;
        }
        return production ? PRODUCTION : NON_PRODUCTION;
    }
}
