package com.flagship.ledger_resolver.resolution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.ledger_resolver.cache.ResolutionCache;
import com.flagship.ledger_resolver.connector.LedgerTimeoutException;
import com.flagship.ledger_resolver.connector.LedgerTransportException;
import com.flagship.ledger_resolver.exception.CacheInconsistencyException;
import com.flagship.ledger_resolver.exception.DidNotFoundAnywhereException;
import com.flagship.ledger_resolver.exception.LedgerNotFoundException;
import com.flagship.ledger_resolver.exception.LookupCancelledException;
import com.flagship.ledger_resolver.exception.NoLedgerConfiguredException;
import com.flagship.ledger_resolver.exception.PoolConfigException;
import com.flagship.ledger_resolver.exception.PoolOpenException;
import com.flagship.ledger_resolver.ledger.LedgerReply;
import com.flagship.ledger_resolver.ledger.LedgerRequestBuilder;
import com.flagship.ledger_resolver.observability.CorrelationContext;
import com.flagship.ledger_resolver.observability.ResolutionMetrics;
import com.flagship.ledger_resolver.observability.ResolutionMetrics.LookupOutcome;
import com.flagship.ledger_resolver.observability.ResolutionMetrics.QueryOutcome;
import com.flagship.ledger_resolver.pool.LedgerPool;
import com.flagship.ledger_resolver.pool.LedgerPoolConfig;
import com.flagship.ledger_resolver.pool.LedgerPoolFactory;
import com.flagship.ledger_resolver.pool.PoolLease;
import com.flagship.ledger_resolver.proof.StateProofVerifier;
import com.flagship.ledger_resolver.registry.LedgerConfig;
import com.flagship.ledger_resolver.registry.LedgerDescriptor;
import com.flagship.ledger_resolver.registry.LedgerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Resolves a DID to the one configured ledger on which it is verifiably registered.
 *
 * A lookup on a cache miss queries every configured ledger concurrently, waits
 * for all of them, and picks the best verified answer:
 * production and self-certified first, then non-production and self-certified,
 * then production, then non-production; configured order breaks ties.
 *
 * Per-ledger failures (timeout, transport error, missing record, failed proof)
 * only mean that ledger had no answer. Only "nothing verified anywhere" fails
 * the lookup.
 *
 * The registry is an immutable snapshot swapped under a writer lock, so
 * lookups never wait on reconfiguration and keep the pools they started with.
 * Pools dropped by a reconfiguration are not closed here; their own reference
 * counts and keepalive govern when they close.
 */
@Slf4j
public class MultiLedgerManager {

    static final String CACHE_KEY_PREFIX = "did_ledger_id_resolver::";

    private static final String DID_MDC_KEY = "did";
    private static final String LEDGER_ID_MDC_KEY = "ledgerId";

    private final LedgerPoolFactory poolFactory;
    private final LedgerRequestBuilder requestBuilder;
    private final StateProofVerifier stateProofVerifier;
    private final ObjectMapper objectMapper;
    private final ResolutionMetrics metrics;
    private final Optional<ResolutionCache> cache;
    private final Duration cacheTtl;
    private final ExecutorService lookupExecutor;
    private final Duration taskTimeout;

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile LedgerRegistry registry = LedgerRegistry.empty();

    public MultiLedgerManager(LedgerPoolFactory poolFactory,
                              LedgerRequestBuilder requestBuilder,
                              StateProofVerifier stateProofVerifier,
                              ObjectMapper objectMapper,
                              ResolutionMetrics metrics,
                              Optional<ResolutionCache> cache,
                              Duration cacheTtl,
                              ExecutorService lookupExecutor,
                              Duration taskTimeout) {
        this.poolFactory = poolFactory;
        this.requestBuilder = requestBuilder;
        this.stateProofVerifier = stateProofVerifier;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.cache = cache;
        this.cacheTtl = cacheTtl;
        this.lookupExecutor = lookupExecutor;
        this.taskTimeout = taskTimeout;
    }

    // ==================== Configuration ====================

    /**
     * Replaces the whole ledger configuration.
     *
     * A pool is carried over when the new configuration names the same pool
     * with an identical pool configuration and the pool is not degraded.
     *
     * @throws IllegalArgumentException on duplicate ledger ids
     * @throws PoolConfigException if one pool name is configured with different genesis transactions
     */
    public void updateLedgerConfig(List<LedgerConfig> configs) {
        writeLock.lock();
        try {
            Map<String, LedgerPool> reusable = new HashMap<>();
            for (LedgerDescriptor descriptor : registry.allInOrder()) {
                reusable.putIfAbsent(descriptor.getPool().getName(), descriptor.getPool());
            }
            Map<String, LedgerPool> bound = new HashMap<>();

            LedgerRegistry updated = LedgerRegistry.build(configs, config -> bound.computeIfAbsent(
                    config.effectivePoolName(), name -> reuseOrCreate(reusable.get(name), config.toPoolConfig())));

            registry = updated;
            log.info("Ledger configuration updated: production={}, non_production={}, write={}",
                    updated.getProduction().keySet(), updated.getNonProduction().keySet(),
                    updated.getWriteLedgerId().orElse(null));
        } finally {
            writeLock.unlock();
        }
    }

    private LedgerPool reuseOrCreate(LedgerPool existing, LedgerPoolConfig config) {
        if (existing != null && existing.getConfig().equals(config) && !existing.isDegraded()) {
            log.debug("Reusing pool {}", config.getName());
            return existing;
        }
        return poolFactory.create(config);
    }

    /**
     * Designates the write ledger.
     *
     * @throws LedgerNotFoundException if the id is not configured
     */
    public void setWriteLedger(String ledgerId) {
        writeLock.lock();
        try {
            registry = registry.withWriteLedger(ledgerId);
            log.info("Write ledger set to {}", ledgerId);
        } finally {
            writeLock.unlock();
        }
    }

    // ==================== Queries ====================

    public LedgerRegistry getRegistry() {
        return registry;
    }

    /**
     * The designated write ledger; else the first production ledger; else the first non-production one.
     *
     * @throws NoLedgerConfiguredException if no ledger is configured
     */
    public LedgerDescriptor getWriteLedger() {
        LedgerRegistry snapshot = registry;
        Optional<LedgerDescriptor> designated = snapshot.getWriteLedgerId().flatMap(snapshot::find);
        if (designated.isPresent()) {
            return designated.get();
        }
        return snapshot.allInOrder().stream()
                .findFirst()
                .orElseThrow(NoLedgerConfiguredException::new);
    }

    /**
     * Ids of every ledger configured as a write ledger, in configured order.
     */
    public List<String> getWriteLedgers() {
        return registry.allInOrder().stream()
                .filter(LedgerDescriptor::isWrite)
                .map(LedgerDescriptor::getId)
                .collect(Collectors.toList());
    }

    public Map<String, LedgerDescriptor> getProductionLedgers() {
        return registry.getProduction();
    }

    public Map<String, LedgerDescriptor> getNonProductionLedgers() {
        return registry.getNonProduction();
    }

    /**
     * @throws LedgerNotFoundException if the id is not configured
     */
    public LedgerPool getLedgerById(String ledgerId) {
        return registry.find(ledgerId)
                .map(LedgerDescriptor::getPool)
                .orElseThrow(() -> LedgerNotFoundException.forLedgerId(ledgerId));
    }

    /**
     * @throws LedgerNotFoundException if no configured ledger uses the pool
     */
    public String getLedgerIdByPoolName(String poolName) {
        return registry.findByPoolName(poolName)
                .map(LedgerDescriptor::getId)
                .orElseThrow(() -> new LedgerNotFoundException(null,
                        "Ledger not found for pool name " + poolName));
    }

    public Optional<LedgerDescriptor.EndorserInfo> getEndorserInfoForLedger(String ledgerId) {
        return registry.find(ledgerId).flatMap(LedgerDescriptor::endorserInfo);
    }

    // ==================== Resolution ====================

    /**
     * Resolves the ledger holding {@code did}, waiting as long as the per-ledger tasks take.
     *
     * @see #lookupDid(String, boolean, Duration)
     */
    public ResolvedLedger lookupDid(String did, boolean useCache) {
        return lookupDid(did, useCache, null);
    }

    /**
     * Resolves the ledger holding {@code did}.
     *
     * @param did bare DID, without a {@code did:} prefix
     * @param useCache read the cache first and write the winner back to it
     * @param deadline overall limit for the fan-out, or null for none
     * @throws CacheInconsistencyException if the cached ledger id is no longer configured
     * @throws DidNotFoundAnywhereException if no ledger verifiably answered
     * @throws LookupCancelledException if the deadline passed or the caller was interrupted
     * @throws PoolConfigException if no ledger answered and every configured pool lacks usable genesis transactions
     */
    public ResolvedLedger lookupDid(String did, boolean useCache, Duration deadline) {
        if (did == null || did.isBlank()) {
            throw new IllegalArgumentException("DID cannot be null or blank");
        }
        long startNanos = System.nanoTime();
        LedgerRegistry snapshot = registry;
        MDC.put(DID_MDC_KEY, did);
        try {
            if (useCache && cache.isPresent()) {
                Optional<String> cachedLedgerId = cache.get().get(cacheKey(did));
                if (cachedLedgerId.isPresent()) {
                    metrics.recordCacheHit();
                    LedgerDescriptor descriptor = snapshot.find(cachedLedgerId.get())
                            .orElseThrow(() -> {
                                metrics.recordLookup(LookupOutcome.FAILED, elapsedSince(startNanos));
                                return new CacheInconsistencyException(did, cachedLedgerId.get());
                            });
                    metrics.recordLookup(LookupOutcome.CACHE_HIT, elapsedSince(startNanos));
                    log.debug("DID {} resolved to ledger {} from cache", did, descriptor.getId());
                    return new ResolvedLedger(descriptor.getId(), descriptor.getPool(), false, true);
                }
                metrics.recordCacheMiss();
            }

            List<DidLookupResult> results = fanOut(snapshot, did, deadline, startNanos);

            Optional<DidLookupResult> winner = results.stream().min(DidLookupResult.BY_PRIORITY);
            if (winner.isEmpty()) {
                metrics.recordLookup(LookupOutcome.NOT_FOUND, elapsedSince(startNanos));
                throw new DidNotFoundAnywhereException(did,
                        snapshot.getProduction().size(), snapshot.getNonProduction().size());
            }

            DidLookupResult selected = winner.get();
            if (useCache && cache.isPresent()) {
                cache.get().set(cacheKey(did), selected.getLedgerId(), cacheTtl);
            }
            metrics.recordLookup(LookupOutcome.RESOLVED, elapsedSince(startNanos));
            log.info("DID {} resolved to ledger {} ({}) among {} verified answers",
                    did, selected.getLedgerId(), selected.priority(), results.size());
            return new ResolvedLedger(selected.getLedgerId(), selected.getPool(), selected.isSelfCertified(), false);
        } finally {
            MDC.remove(DID_MDC_KEY);
        }
    }

    /**
     * Drops the cached ledger for a DID, if any.
     */
    public void evictCachedLedger(String did) {
        cache.ifPresent(c -> c.evict(cacheKey(did)));
    }

    /**
     * Normalizes an object identifier to its leading DID:
     * {@code did:<method>:<id>...} yields {@code <id>} and
     * {@code <id>:<marker>:...} yields {@code <id>}.
     */
    public static String extractDidFromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier cannot be null or blank");
        }
        String[] parts = identifier.split(":");
        if (identifier.startsWith("did:")) {
            if (parts.length < 3) {
                throw new IllegalArgumentException("Malformed DID identifier: " + identifier);
            }
            return parts[2];
        }
        return parts[0];
    }

    static String cacheKey(String did) {
        return CACHE_KEY_PREFIX + did;
    }

    // ==================== Fan-out ====================

    private List<DidLookupResult> fanOut(LedgerRegistry snapshot, String did, Duration deadline, long startNanos) {
        List<LedgerDescriptor> descriptors = snapshot.allInOrder();
        List<LedgerTask> tasks = new ArrayList<>(descriptors.size());
        List<PoolConfigException> configErrors = new CopyOnWriteArrayList<>();
        Map<String, String> callerContext = MDC.getCopyOfContextMap();

        for (int index = 0; index < descriptors.size(); index++) {
            tasks.add(submit(descriptors.get(index), index, did, callerContext, configErrors));
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(
                tasks.stream().map(LedgerTask::settled).toArray(CompletableFuture[]::new));
        try {
            if (deadline == null) {
                all.get();
            } else {
                all.get(deadline.toNanos(), TimeUnit.NANOSECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(tasks);
            metrics.recordLookup(LookupOutcome.CANCELLED, elapsedSince(startNanos));
            throw new LookupCancelledException("Lookup of DID " + did + " was interrupted", e);
        } catch (TimeoutException e) {
            cancelAll(tasks);
            metrics.recordLookup(LookupOutcome.CANCELLED, elapsedSince(startNanos));
            throw new LookupCancelledException("Lookup of DID " + did + " exceeded its deadline of " + deadline, e);
        } catch (ExecutionException e) {
            cancelAll(tasks);
            metrics.recordLookup(LookupOutcome.FAILED, elapsedSince(startNanos));
            throw new IllegalStateException("Lookup of DID " + did + " failed", e.getCause());
        }

        List<DidLookupResult> results = new ArrayList<>();
        for (LedgerTask task : tasks) {
            task.settled().join().ifPresent(results::add);
        }
        // A configuration that cannot open any ledger is not a "not found".
        if (results.isEmpty() && !descriptors.isEmpty() && configErrors.size() == descriptors.size()) {
            metrics.recordLookup(LookupOutcome.FAILED, elapsedSince(startNanos));
            throw configErrors.get(0);
        }
        return results;
    }

    private LedgerTask submit(LedgerDescriptor descriptor, int index, String did,
                              Map<String, String> callerContext, List<PoolConfigException> configErrors) {
        CompletableFuture<Optional<DidLookupResult>> result = new CompletableFuture<>();
        FutureTask<Void> worker = new FutureTask<>(() -> {
            // The per-ledger timeout starts when the task starts, not when it is queued.
            result.orTimeout(taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
            withContext(callerContext, descriptor.getId(), () -> {
                try {
                    result.complete(queryLedger(descriptor, index, did));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        }, null);

        CompletableFuture<Optional<DidLookupResult>> settled = result.handle((answer, error) -> {
            if (error == null) {
                return answer;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof TimeoutException) {
                worker.cancel(true);
                metrics.recordLedgerQuery(descriptor.getId(), QueryOutcome.TIMEOUT);
                log.warn("get-nym request timed out for DID {} and ledger {}, reply not received within {}",
                        did, descriptor.getId(), taskTimeout);
                return Optional.empty();
            }
            if (cause instanceof PoolConfigException) {
                configErrors.add((PoolConfigException) cause);
                metrics.recordLedgerQuery(descriptor.getId(), QueryOutcome.CONFIG_ERROR);
                log.error("Pool for ledger {} is misconfigured while looking up DID {}: {}",
                        descriptor.getId(), did, cause.getMessage());
                return Optional.empty();
            }
            if (cause instanceof CancellationException) {
                return Optional.empty();
            }
            metrics.recordLedgerQuery(descriptor.getId(), QueryOutcome.POOL_ERROR);
            log.error("Unexpected failure looking up DID {} on ledger {}", did, descriptor.getId(), cause);
            return Optional.empty();
        });

        lookupExecutor.execute(worker);
        return new LedgerTask(result, settled, worker);
    }

    /**
     * Queries one ledger. Returns empty when the ledger has no verifiable answer.
     */
    private Optional<DidLookupResult> queryLedger(LedgerDescriptor descriptor, int index, String did) {
        String ledgerId = descriptor.getId();
        try (PoolLease lease = descriptor.getPool().acquire()) {
            String request = requestBuilder.buildGetNymRequest(null, did);
            String raw = lease.connection().submitRequest(request);
            LedgerReply reply = LedgerReply.parse(raw, objectMapper);

            Optional<JsonNode> data = reply.data();
            if (data.isEmpty()) {
                metrics.recordLedgerQuery(ledgerId, QueryOutcome.NOT_FOUND);
                log.warn("Did {} not posted to ledger {}", did, ledgerId);
                return Optional.empty();
            }
            if (!stateProofVerifier.verifyReply(reply)) {
                metrics.recordLedgerQuery(ledgerId, QueryOutcome.PROOF_FAILED);
                log.warn("State Proof validation failed for Did {} and ledger {}", did, ledgerId);
                return Optional.empty();
            }

            String verkey = data.get().path("verkey").asText(null);
            boolean selfCertified = SelfCertification.isSelfCertified(did, verkey);
            metrics.recordLedgerQuery(ledgerId, QueryOutcome.VERIFIED);
            log.debug("Did {} verified on ledger {} (self-certified: {})", did, ledgerId, selfCertified);
            return Optional.of(new DidLookupResult(ledgerId, descriptor.getPool(),
                    selfCertified, descriptor.isProduction(), index));

        } catch (LedgerTimeoutException e) {
            metrics.recordLedgerQuery(ledgerId, QueryOutcome.TIMEOUT);
            log.warn("get-nym request timed out for Did {} and ledger {}: {}", did, ledgerId, e.getMessage());
            return Optional.empty();
        } catch (LedgerTransportException e) {
            metrics.recordLedgerQuery(ledgerId, QueryOutcome.TRANSPORT_ERROR);
            log.error("Exception when submitting get-nym request for Did {} and ledger {}: {}",
                    did, ledgerId, e.getMessage());
            return Optional.empty();
        } catch (PoolOpenException e) {
            metrics.recordLedgerQuery(ledgerId, QueryOutcome.POOL_ERROR);
            log.error("Pool for ledger {} unavailable while looking up Did {}: {}", ledgerId, did, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            metrics.recordLedgerQuery(ledgerId, QueryOutcome.TRANSPORT_ERROR);
            log.error("Malformed get-nym reply for Did {} from ledger {}: {}", did, ledgerId, e.getMessage());
            return Optional.empty();
        }
    }

    private static void withContext(Map<String, String> callerContext, String ledgerId, Runnable body) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (callerContext != null) {
            MDC.setContextMap(callerContext);
        } else {
            MDC.clear();
        }
        MDC.put(LEDGER_ID_MDC_KEY, ledgerId);
        if (callerContext != null && callerContext.containsKey(CorrelationContext.CORRELATION_ID_MDC_KEY)) {
            CorrelationContext.setCorrelationId(callerContext.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        }
        try {
            body.run();
        } finally {
            CorrelationContext.clear();
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    private static void cancelAll(List<LedgerTask> tasks) {
        for (LedgerTask task : tasks) {
            task.worker().cancel(true);
            task.result().cancel(true);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private record LedgerTask(CompletableFuture<Optional<DidLookupResult>> result,
                              CompletableFuture<Optional<DidLookupResult>> settled,
                              FutureTask<Void> worker) {
    }
}
