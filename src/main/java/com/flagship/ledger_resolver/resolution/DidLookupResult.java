package com.flagship.ledger_resolver.resolution;

import com.flagship.ledger_resolver.pool.LedgerPool;
import lombok.Value;

import java.util.Comparator;

/**
 * One ledger's verified answer for a DID, kept only until arbitration.
 */
@Value
public class DidLookupResult {

    public static final Comparator<DidLookupResult> BY_PRIORITY =
            Comparator.comparing(DidLookupResult::priority).thenComparingInt(DidLookupResult::getIndex);

    String ledgerId;
    LedgerPool pool;
    boolean selfCertified;
    boolean production;

    /** Position in configured order: production ledgers first, then non-production. */
    int index;

    public LedgerPriority priority() {
        return LedgerPriority.of(production, selfCertified);
    }
}
