package com.flagship.ledger_resolver.resolution;

import com.flagship.ledger_resolver.exception.CacheInconsistencyException;
import com.flagship.ledger_resolver.exception.DidNotFoundAnywhereException;
import com.flagship.ledger_resolver.registry.LedgerDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes ledger read requests to the ledger that holds their subject.
 *
 * Object ids (schemas, credential definitions, revocation registries) are
 * routed by the DID that prefixes them; DID requests by the DID itself.
 * When no ledger has the DID the request goes to the write ledger.
 */
@Slf4j
@RequiredArgsConstructor
public class LedgerRequestsExecutor {

    private static final String DID_SOV_PREFIX = "did:sov:";

    private final MultiLedgerManager manager;

    public ResolvedLedger getLedgerForIdentifier(String identifier, LedgerRequestType requestType) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier cannot be null or blank");
        }
        String did = requestType.isDidRequest()
                ? stripDidSovPrefix(identifier)
                : MultiLedgerManager.extractDidFromIdentifier(identifier);

        try {
            return resolve(did);
        } catch (DidNotFoundAnywhereException e) {
            LedgerDescriptor writeLedger = manager.getWriteLedger();
            log.warn("{}; routing {} for {} to write ledger {}",
                    e.getMessage(), requestType, identifier, writeLedger.getId());
            return new ResolvedLedger(writeLedger.getId(), writeLedger.getPool(), false, false);
        }
    }

    private ResolvedLedger resolve(String did) {
        try {
            return manager.lookupDid(did, true);
        } catch (CacheInconsistencyException e) {
            log.warn("Evicting stale cache entry: {}", e.getMessage());
            manager.evictCachedLedger(did);
            return manager.lookupDid(did, true);
        }
    }

    private static String stripDidSovPrefix(String identifier) {
        return identifier.startsWith(DID_SOV_PREFIX) ? identifier.substring(DID_SOV_PREFIX.length()) : identifier;
    }
}
