package com.flagship.ledger_resolver.registry;

import com.flagship.ledger_resolver.exception.LedgerNotFoundException;
import com.flagship.ledger_resolver.exception.PoolConfigException;
import com.flagship.ledger_resolver.pool.GenesisStore;
import com.flagship.ledger_resolver.pool.LedgerPool;
import com.flagship.ledger_resolver.pool.LedgerPoolConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Immutable snapshot of the configured ledgers.
 *
 * Production and non-production ledgers are kept in configured order; that
 * order is the tie-break between ledgers of the same priority class.
 * Reconfiguration swaps in a whole new snapshot. Lookups keep using the
 * snapshot (and pools) they started with.
 */
public final class LedgerRegistry {

    private static final LedgerRegistry EMPTY =
            new LedgerRegistry(Collections.emptyMap(), Collections.emptyMap(), null);

    private final Map<String, LedgerDescriptor> production;
    private final Map<String, LedgerDescriptor> nonProduction;
    private final String writeLedgerId;

    private LedgerRegistry(Map<String, LedgerDescriptor> production,
                           Map<String, LedgerDescriptor> nonProduction,
                           String writeLedgerId) {
        this.production = production;
        this.nonProduction = nonProduction;
        this.writeLedgerId = writeLedgerId;
    }

    public static LedgerRegistry empty() {
        return EMPTY;
    }

    /**
     * Builds a registry from scratch.
     *
     * @param configs ledger configurations in priority order
     * @param poolProvider returns the pool to bind to each configuration
     * @throws IllegalArgumentException on duplicate ledger ids
     * @throws PoolConfigException if ledgers sharing a pool name disagree on its genesis transactions
     *                             or connection settings
     */
    public static LedgerRegistry build(List<LedgerConfig> configs, Function<LedgerConfig, LedgerPool> poolProvider) {
        Map<String, LedgerDescriptor> production = new LinkedHashMap<>();
        Map<String, LedgerDescriptor> nonProduction = new LinkedHashMap<>();
        Map<String, LedgerPoolConfig> poolConfigs = new HashMap<>();
        String writeLedgerId = null;

        for (LedgerConfig config : configs) {
            String id = config.getId() != null && !config.getId().isBlank()
                    ? config.getId()
                    : UUID.randomUUID().toString();
            LedgerConfig normalized = config.toBuilder().id(id).build();

            if (production.containsKey(id) || nonProduction.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate ledger id: " + id);
            }

            String genesis = normalized.getGenesisTransactions() == null
                    ? null
                    : GenesisStore.normalize(normalized.getGenesisTransactions());
            String poolName = normalized.effectivePoolName();
            LedgerPoolConfig poolConfig = normalized.toPoolConfig().toBuilder().genesisTransactions(genesis).build();
            LedgerPoolConfig shared = poolConfigs.putIfAbsent(poolName, poolConfig);
            if (shared != null && !Objects.equals(shared.getGenesisTransactions(), genesis)) {
                throw new PoolConfigException("Duplicate genesis configuration for pool '" + poolName + "'");
            }
            if (shared != null && !shared.equals(poolConfig)) {
                throw new PoolConfigException("Ledger '" + id + "' shares pool '" + poolName
                        + "' but configures it differently");
            }

            LedgerDescriptor descriptor = new LedgerDescriptor(
                    id,
                    poolProvider.apply(normalized),
                    normalized.isProduction(),
                    normalized.isWrite(),
                    normalized.getEndorserDid(),
                    normalized.getEndorserAlias());

            if (descriptor.isProduction()) {
                production.put(id, descriptor);
            } else {
                nonProduction.put(id, descriptor);
            }
            if (descriptor.isWrite() && writeLedgerId == null) {
                writeLedgerId = id;
            }
        }

        return new LedgerRegistry(
                Collections.unmodifiableMap(production),
                Collections.unmodifiableMap(nonProduction),
                writeLedgerId);
    }

    /**
     * Returns a copy with the given write ledger.
     *
     * @throws LedgerNotFoundException if the id is in neither partition
     */
    public LedgerRegistry withWriteLedger(String ledgerId) {
        if (!contains(ledgerId)) {
            throw LedgerNotFoundException.forLedgerId(ledgerId);
        }
        return new LedgerRegistry(production, nonProduction, ledgerId);
    }

    public Map<String, LedgerDescriptor> getProduction() {
        return production;
    }

    public Map<String, LedgerDescriptor> getNonProduction() {
        return nonProduction;
    }

    public Optional<String> getWriteLedgerId() {
        return Optional.ofNullable(writeLedgerId);
    }

    public boolean contains(String ledgerId) {
        return ledgerId != null && (production.containsKey(ledgerId) || nonProduction.containsKey(ledgerId));
    }

    public Optional<LedgerDescriptor> find(String ledgerId) {
        if (ledgerId == null) {
            return Optional.empty();
        }
        LedgerDescriptor descriptor = production.get(ledgerId);
        return Optional.ofNullable(descriptor != null ? descriptor : nonProduction.get(ledgerId));
    }

    public Optional<LedgerDescriptor> findByPoolName(String poolName) {
        return allInOrder().stream()
                .filter(descriptor -> descriptor.getPool().getName().equals(poolName))
                .findFirst();
    }

    /**
     * All ledgers: production first, then non-production, each in configured order.
     */
    public List<LedgerDescriptor> allInOrder() {
        List<LedgerDescriptor> all = new ArrayList<>(production.size() + nonProduction.size());
        all.addAll(production.values());
        all.addAll(nonProduction.values());
        return all;
    }

    public boolean isEmpty() {
        return production.isEmpty() && nonProduction.isEmpty();
    }

    public int size() {
        return production.size() + nonProduction.size();
    }
}
