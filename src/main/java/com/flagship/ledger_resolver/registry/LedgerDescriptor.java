package com.flagship.ledger_resolver.registry;

import com.flagship.ledger_resolver.pool.LedgerPool;
import lombok.Value;

import java.util.Optional;

/**
 * Identity of a configured ledger bound to its pool.
 * Superseded on reconfiguration, never mutated.
 */
@Value
public class LedgerDescriptor {
    String id;
    LedgerPool pool;
    boolean production;
    boolean write;
    String endorserDid;
    String endorserAlias;

    /**
     * Endorser (alias, did), when both are configured for this ledger.
     */
    public Optional<EndorserInfo> endorserInfo() {
        if (endorserDid == null || endorserAlias == null) {
            return Optional.empty();
        }
        return Optional.of(new EndorserInfo(endorserAlias, endorserDid));
    }

    public record EndorserInfo(String alias, String did) {
    }
}
