package com.flagship.ledger_resolver.resolution;

import com.flagship.ledger_resolver.pool.LedgerPool;
import lombok.Value;

/**
 * The ledger a DID or identifier resolved to.
 *
 * {@code selfCertified} is only known for fresh resolutions; cache hits and
 * write-ledger fallbacks report false.
 */
@Value
public class ResolvedLedger {
    String ledgerId;
    LedgerPool pool;
    boolean selfCertified;
    boolean fromCache;
}
