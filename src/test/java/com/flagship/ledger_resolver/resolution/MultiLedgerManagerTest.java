package com.flagship.ledger_resolver.resolution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.ledger_resolver.cache.InMemoryResolutionCache;
import com.flagship.ledger_resolver.cache.ResolutionCache;
import com.flagship.ledger_resolver.connector.LedgerConnection;
import com.flagship.ledger_resolver.connector.LedgerConnector;
import com.flagship.ledger_resolver.connector.LedgerTransportException;
import com.flagship.ledger_resolver.exception.CacheInconsistencyException;
import com.flagship.ledger_resolver.exception.DidNotFoundAnywhereException;
import com.flagship.ledger_resolver.exception.LedgerNotFoundException;
import com.flagship.ledger_resolver.exception.LookupCancelledException;
import com.flagship.ledger_resolver.exception.NoLedgerConfiguredException;
import com.flagship.ledger_resolver.exception.PoolConfigException;
import com.flagship.ledger_resolver.ledger.LedgerRequestBuilder;
import com.flagship.ledger_resolver.observability.ResolutionMetrics;
import com.flagship.ledger_resolver.pool.GenesisStore;
import com.flagship.ledger_resolver.pool.LedgerPool;
import com.flagship.ledger_resolver.pool.LedgerPoolConfig;
import com.flagship.ledger_resolver.pool.LedgerPoolFactory;
import com.flagship.ledger_resolver.proof.PatriciaTrieProofValidator;
import com.flagship.ledger_resolver.proof.StateProofVerifier;
import com.flagship.ledger_resolver.proof.TrieFixtures;
import com.flagship.ledger_resolver.registry.LedgerConfig;
import com.flagship.ledger_resolver.registry.LedgerDescriptor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Fan-out resolution across configured ledgers, with real pools over mocked connections.
 */
class MultiLedgerManagerTest {

    private static final String DID = "Th7MpTaRZVRYnPiabds81Y";
    private static final String SELF_CERTIFIED_VERKEY = "~7TYfekw4GUagBnBVCqPjiC";
    private static final String FOREIGN_VERKEY = "GJ1SzoWzavQYfNL9XkaJdrQejfztN4XqdsiV4ct3LXKL";
    private static final String GENESIS = "{\"reqSignature\":{},\"txn\":{\"type\":\"0\"}}\n";

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, LedgerConnection> connections = new HashMap<>();

    private LedgerConnector connector;
    private ScheduledExecutorService scheduler;
    private ExecutorService lookupExecutor;
    private SimpleMeterRegistry meterRegistry;
    private ResolutionMetrics metrics;

    @BeforeEach
    void setUp() throws Exception {
        connector = mock(LedgerConnector.class);
        when(connector.open(any(), anyString())).thenAnswer(invocation -> {
            LedgerPoolConfig config = invocation.getArgument(0);
            LedgerConnection connection = connections.get(config.getName());
            if (connection == null) {
                throw new LedgerTransportException("No route to " + config.getName());
            }
            return connection;
        });
        scheduler = Executors.newSingleThreadScheduledExecutor();
        lookupExecutor = Executors.newFixedThreadPool(4);
        meterRegistry = new SimpleMeterRegistry();
        metrics = new ResolutionMetrics(meterRegistry);
    }

    @AfterEach
    void tearDown() {
        lookupExecutor.shutdownNow();
        scheduler.shutdownNow();
    }

    private MultiLedgerManager manager(Optional<ResolutionCache> cache, Duration taskTimeout) {
        LedgerPoolFactory poolFactory = new LedgerPoolFactory(connector, new GenesisStore(null), scheduler,
                3, Duration.ofMillis(1), metrics);
        return new MultiLedgerManager(poolFactory, new LedgerRequestBuilder(mapper),
                new StateProofVerifier(new PatriciaTrieProofValidator(), mapper), mapper, metrics,
                cache, Duration.ofMinutes(10), lookupExecutor, taskTimeout);
    }

    private MultiLedgerManager manager() {
        return manager(Optional.empty(), Duration.ofSeconds(5));
    }

    private static LedgerConfig ledger(String id, boolean production) {
        return LedgerConfig.builder()
                .id(id)
                .production(production)
                .genesisTransactions(GENESIS)
                .build();
    }

    private LedgerConnection answering(String poolName, ObjectNode reply) throws Exception {
        LedgerConnection connection = mock(LedgerConnection.class);
        when(connection.submitRequest(anyString())).thenReturn(mapper.writeValueAsString(reply));
        when(connection.getTransactions()).thenReturn(GENESIS);
        connections.put(poolName, connection);
        return connection;
    }

    private LedgerConnection delayed(String poolName, ObjectNode reply, long millis) throws Exception {
        String raw = mapper.writeValueAsString(reply);
        LedgerConnection connection = mock(LedgerConnection.class);
        when(connection.submitRequest(anyString())).thenAnswer(invocation -> {
            Thread.sleep(millis);
            return raw;
        });
        when(connection.getTransactions()).thenReturn(GENESIS);
        connections.put(poolName, connection);
        return connection;
    }

    private LedgerConnection hanging(String poolName) throws Exception {
        LedgerConnection connection = mock(LedgerConnection.class);
        when(connection.submitRequest(anyString())).thenAnswer(invocation -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                throw new LedgerTransportException("Interrupted while waiting for reply", e);
            }
            return "{}";
        });
        when(connection.getTransactions()).thenReturn(GENESIS);
        connections.put(poolName, connection);
        return connection;
    }

    private double queryCount(String ledgerId, String outcome) {
        return meterRegistry.find("ledger.query").tag("ledger", ledgerId).tag("outcome", outcome)
                .counters().stream().mapToDouble(c -> c.count()).sum();
    }

    @Nested
    @DisplayName("Winner selection")
    class WinnerSelection {

        @Test
        @DisplayName("Production self-certified beats earlier production and any non-production")
        void productionSelfCertifiedWins() throws Exception {
            answering("prodB", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            answering("prodA", TrieFixtures.nymReply(mapper, DID, SELF_CERTIFIED_VERKEY));
            answering("nonprodC", TrieFixtures.nymReply(mapper, DID, SELF_CERTIFIED_VERKEY));
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(
                    ledger("prodB", true), ledger("prodA", true), ledger("nonprodC", false)));

            ResolvedLedger resolved = manager.lookupDid(DID, false);

            assertEquals("prodA", resolved.getLedgerId());
            assertTrue(resolved.isSelfCertified());
            assertFalse(resolved.isFromCache());
            assertSame(manager.getLedgerById("prodA"), resolved.getPool());
        }

        @Test
        @DisplayName("Non-production self-certified beats production without self-certification")
        void nonProductionSelfCertifiedBeatsProduction() throws Exception {
            answering("prodB", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            answering("nonprodC", TrieFixtures.nymReply(mapper, DID, SELF_CERTIFIED_VERKEY));
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(ledger("prodB", true), ledger("nonprodC", false)));

            assertEquals("nonprodC", manager.lookupDid(DID, false).getLedgerId());
        }

        @Test
        @DisplayName("Configured order breaks ties within a priority class")
        void configuredOrderBreaksTies() throws Exception {
            answering("prodA", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            answering("prodD", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(ledger("prodD", true), ledger("prodA", true)));

            ResolvedLedger resolved = manager.lookupDid(DID, false);

            assertEquals("prodD", resolved.getLedgerId());
            assertFalse(resolved.isSelfCertified());
        }

        @Test
        @DisplayName("Production without self-certification beats non-production without it")
        void productionBeatsNonProduction() throws Exception {
            answering("nonprodC", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            answering("prodB", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(ledger("nonprodC", false), ledger("prodB", true)));

            assertEquals("prodB", manager.lookupDid(DID, false).getLedgerId());
        }

        @Test
        @DisplayName("A slow production answer still beats a fast non-production one")
        void priorityIgnoresResponseTiming() throws Exception {
            delayed("prodA", TrieFixtures.nymReply(mapper, DID, SELF_CERTIFIED_VERKEY), 300);
            answering("nonprodC", TrieFixtures.nymReply(mapper, DID, SELF_CERTIFIED_VERKEY));
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(ledger("nonprodC", false), ledger("prodA", true)));

            ResolvedLedger resolved = manager.lookupDid(DID, false);

            assertEquals("prodA", resolved.getLedgerId());
            assertTrue(resolved.isSelfCertified());
            assertEquals(1.0, queryCount("nonprodC", "verified"));
        }
    }

    @Nested
    @DisplayName("Per-ledger failures")
    class PerLedgerFailures {

        @Test
        @DisplayName("A DID absent everywhere fails with the searched ledger counts")
        void notFoundAnywhere() throws Exception {
            answering("prodA", TrieFixtures.emptyNymReply(mapper, DID));
            answering("prodB", TrieFixtures.emptyNymReply(mapper, DID));
            answering("nonprodC", TrieFixtures.emptyNymReply(mapper, DID));
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(
                    ledger("prodA", true), ledger("prodB", true), ledger("nonprodC", false)));

            DidNotFoundAnywhereException e = assertThrows(DidNotFoundAnywhereException.class,
                    () -> manager.lookupDid(DID, false));

            assertEquals(2, e.getProductionCount());
            assertEquals(1, e.getNonProductionCount());
            assertEquals(1.0, queryCount("prodA", "not_found"));
            assertEquals(1.0, meterRegistry.get("ledger.lookup").tag("outcome", "not_found").counter().count());
        }

        @Test
        @DisplayName("A reply whose proof does not match its data is not an answer")
        void failedProofIsIgnored() throws Exception {
            ObjectNode tampered = TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY);
            ObjectNode result = (ObjectNode) tampered.get("result");
            ObjectNode data = (ObjectNode) mapper.readTree(result.get("data").asText());
            data.put("verkey", SELF_CERTIFIED_VERKEY);
            result.put("data", mapper.writeValueAsString(data));

            answering("prodA", tampered);
            answering("nonprodC", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(ledger("prodA", true), ledger("nonprodC", false)));

            assertEquals("nonprodC", manager.lookupDid(DID, false).getLedgerId());
            assertEquals(1.0, queryCount("prodA", "proof_failed"));
        }

        @Test
        @DisplayName("Transport errors and unreachable pools only drop that ledger")
        void transportErrorsAreIgnored() throws Exception {
            LedgerConnection broken = mock(LedgerConnection.class);
            when(broken.submitRequest(anyString())).thenThrow(new LedgerTransportException("connection reset"));
            when(broken.getTransactions()).thenReturn(GENESIS);
            connections.put("prodA", broken);
            answering("nonprodC", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(
                    ledger("prodA", true), ledger("unreachable", true), ledger("nonprodC", false)));

            assertEquals("nonprodC", manager.lookupDid(DID, false).getLedgerId());
            assertEquals(1.0, queryCount("prodA", "transport_error"));
            assertEquals(1.0, queryCount("unreachable", "pool_error"));
        }

        @Test
        @DisplayName("A slow ledger is dropped after the per-ledger timeout and its worker interrupted")
        void slowLedgerTimesOut() throws Exception {
            LedgerConnection slow = hanging("prodA");
            answering("nonprodC", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            MultiLedgerManager manager = manager(Optional.empty(), Duration.ofMillis(300));
            manager.updateLedgerConfig(List.of(ledger("prodA", true), ledger("nonprodC", false)));

            long start = System.nanoTime();
            ResolvedLedger resolved = manager.lookupDid(DID, false);

            assertEquals("nonprodC", resolved.getLedgerId());
            assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(10)) < 0);
            assertEquals(1.0, queryCount("prodA", "timeout"));
            verify(slow, times(1)).submitRequest(anyString());
        }

        @Test
        @DisplayName("A ledger without genesis is skipped while another ledger answers")
        void missingGenesisSkipsLedger() throws Exception {
            answering("nonprodC", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(
                    LedgerConfig.builder().id("prodA").production(true).build(), ledger("nonprodC", false)));

            ResolvedLedger resolved = manager.lookupDid(DID, false);

            assertEquals("nonprodC", resolved.getLedgerId());
            assertEquals(1.0, queryCount("prodA", "config_error"));
            verify(connector, never()).open(argThat(
                    config -> config != null && "prodA".equals(config.getName())), anyString());
        }

        @Test
        @DisplayName("Missing genesis on every ledger surfaces as a configuration error")
        void missingGenesisEverywhereSurfaces() {
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(
                    LedgerConfig.builder().id("prodA").production(true).build(),
                    LedgerConfig.builder().id("nonprodC").production(false).build()));

            assertThrows(PoolConfigException.class, () -> manager.lookupDid(DID, false));
            assertEquals(1.0, meterRegistry.get("ledger.lookup").tag("outcome", "failed").counter().count());
        }
    }

    @Nested
    @DisplayName("Deadlines")
    class Deadlines {

        @Test
        @DisplayName("An overall deadline cancels the outstanding ledger tasks")
        void deadlineCancelsLookup() throws Exception {
            hanging("prodA");
            hanging("nonprodC");
            MultiLedgerManager manager = manager(Optional.empty(), Duration.ofSeconds(20));
            manager.updateLedgerConfig(List.of(ledger("prodA", true), ledger("nonprodC", false)));

            assertThrows(LookupCancelledException.class,
                    () -> manager.lookupDid(DID, false, Duration.ofMillis(200)));
            assertEquals(1.0, meterRegistry.get("ledger.lookup").tag("outcome", "cancelled").counter().count());
            assertNull(MDC.get("did"));
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("A cached winner is returned without querying any ledger")
        void cachedWinnerSkipsLedgers() throws Exception {
            LedgerConnection prodA = answering("prodA", TrieFixtures.nymReply(mapper, DID, SELF_CERTIFIED_VERKEY));
            LedgerConnection nonprodC = answering("nonprodC", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            MultiLedgerManager manager = manager(Optional.of(new InMemoryResolutionCache(100)), Duration.ofSeconds(5));
            manager.updateLedgerConfig(List.of(ledger("prodA", true), ledger("nonprodC", false)));

            ResolvedLedger first = manager.lookupDid(DID, true);
            ResolvedLedger second = manager.lookupDid(DID, true);

            assertEquals("prodA", first.getLedgerId());
            assertFalse(first.isFromCache());
            assertEquals("prodA", second.getLedgerId());
            assertTrue(second.isFromCache());
            verify(prodA, times(1)).submitRequest(anyString());
            verify(nonprodC, times(1)).submitRequest(anyString());
        }

        @Test
        @DisplayName("Lookups without the cache always query the ledgers")
        void bypassingCacheQueriesLedgers() throws Exception {
            LedgerConnection prodA = answering("prodA", TrieFixtures.nymReply(mapper, DID, SELF_CERTIFIED_VERKEY));
            MultiLedgerManager manager = manager(Optional.of(new InMemoryResolutionCache(100)), Duration.ofSeconds(5));
            manager.updateLedgerConfig(List.of(ledger("prodA", true)));

            manager.lookupDid(DID, false);
            manager.lookupDid(DID, false);

            verify(prodA, times(2)).submitRequest(anyString());
        }

        @Test
        @DisplayName("A cached ledger that is no longer configured is reported, and recovers after eviction")
        void staleCacheEntry() throws Exception {
            answering("prodA", TrieFixtures.nymReply(mapper, DID, SELF_CERTIFIED_VERKEY));
            answering("nonprodC", TrieFixtures.nymReply(mapper, DID, FOREIGN_VERKEY));
            MultiLedgerManager manager = manager(Optional.of(new InMemoryResolutionCache(100)), Duration.ofSeconds(5));
            manager.updateLedgerConfig(List.of(ledger("prodA", true), ledger("nonprodC", false)));
            manager.lookupDid(DID, true);

            manager.updateLedgerConfig(List.of(ledger("nonprodC", false)));

            CacheInconsistencyException e = assertThrows(CacheInconsistencyException.class,
                    () -> manager.lookupDid(DID, true));
            assertTrue(e.getMessage().contains("prodA"));

            manager.evictCachedLedger(DID);
            assertEquals("nonprodC", manager.lookupDid(DID, true).getLedgerId());
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Unchanged pools are carried over a reconfiguration and stay open")
        void poolsAreReused() throws Exception {
            answering("prodA", TrieFixtures.nymReply(mapper, DID, SELF_CERTIFIED_VERKEY));
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(ledger("prodA", true)));
            LedgerPool before = manager.getLedgerById("prodA");
            manager.lookupDid(DID, false);

            manager.updateLedgerConfig(List.of(ledger("prodA", true), ledger("nonprodC", false)));
            manager.lookupDid(DID, false);

            assertSame(before, manager.getLedgerById("prodA"));
            verify(connector, times(1)).open(argThat(
                    config -> config != null && "prodA".equals(config.getName())), anyString());
        }

        @Test
        @DisplayName("A changed pool configuration gets a new pool")
        void changedPoolIsReplaced() {
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(ledger("prodA", true)));
            LedgerPool before = manager.getLedgerById("prodA");

            manager.updateLedgerConfig(List.of(ledger("prodA", true).toBuilder().keepalive(30).build()));

            assertNotSame(before, manager.getLedgerById("prodA"));
        }

        @Test
        @DisplayName("The write ledger falls back to the first production, then the first non-production ledger")
        void writeLedgerFallback() {
            MultiLedgerManager manager = manager();
            assertThrows(NoLedgerConfiguredException.class, manager::getWriteLedger);

            manager.updateLedgerConfig(List.of(ledger("nonprodC", false)));
            assertEquals("nonprodC", manager.getWriteLedger().getId());

            manager.updateLedgerConfig(List.of(ledger("nonprodC", false), ledger("prodA", true), ledger("prodB", true)));
            assertEquals("prodA", manager.getWriteLedger().getId());

            manager.setWriteLedger("prodB");
            assertEquals("prodB", manager.getWriteLedger().getId());
            assertThrows(LedgerNotFoundException.class, () -> manager.setWriteLedger("missing"));
            assertEquals("prodB", manager.getWriteLedger().getId());
        }

        @Test
        @DisplayName("Write flags, pool names and endorser info are queryable")
        void ledgerQueries() {
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(
                    ledger("prodA", true).toBuilder().write(true).poolName("sovrin-main")
                            .endorserDid("V4SGRU86Z58d6TV7PBUe6f").endorserAlias("endorser").build(),
                    ledger("nonprodC", false).toBuilder().write(true).build(),
                    ledger("prodB", true)));

            assertEquals(List.of("prodA", "nonprodC"), manager.getWriteLedgers());
            assertEquals("prodA", manager.getWriteLedger().getId());
            assertEquals("prodA", manager.getLedgerIdByPoolName("sovrin-main"));
            assertThrows(LedgerNotFoundException.class, () -> manager.getLedgerIdByPoolName("unknown"));
            assertThrows(LedgerNotFoundException.class, () -> manager.getLedgerById("unknown"));

            LedgerDescriptor.EndorserInfo endorser = manager.getEndorserInfoForLedger("prodA").orElseThrow();
            assertEquals("endorser", endorser.alias());
            assertEquals("V4SGRU86Z58d6TV7PBUe6f", endorser.did());
            assertTrue(manager.getEndorserInfoForLedger("prodB").isEmpty());
            assertEquals(List.of("prodA", "prodB"), List.copyOf(manager.getProductionLedgers().keySet()));
            assertEquals(List.of("nonprodC"), List.copyOf(manager.getNonProductionLedgers().keySet()));
        }

        @Test
        @DisplayName("Duplicate ledger ids are rejected and the previous configuration kept")
        void duplicateIdsRejected() {
            MultiLedgerManager manager = manager();
            manager.updateLedgerConfig(List.of(ledger("prodA", true)));

            assertThrows(IllegalArgumentException.class, () -> manager.updateLedgerConfig(
                    List.of(ledger("prodB", true), ledger("prodB", false))));
            assertTrue(manager.getRegistry().contains("prodA"));
            assertFalse(manager.getRegistry().contains("prodB"));
        }
    }

    @Test
    @DisplayName("Identifiers are reduced to their leading DID")
    void extractDidFromIdentifier() {
        assertEquals(DID, MultiLedgerManager.extractDidFromIdentifier("did:sov:" + DID));
        assertEquals(DID, MultiLedgerManager.extractDidFromIdentifier(DID + ":2:degree:1.0"));
        assertEquals(DID, MultiLedgerManager.extractDidFromIdentifier(DID + ":3:CL:18:tag"));
        assertEquals(DID, MultiLedgerManager.extractDidFromIdentifier(DID));
        assertThrows(IllegalArgumentException.class, () -> MultiLedgerManager.extractDidFromIdentifier("did:sov"));
        assertThrows(IllegalArgumentException.class, () -> MultiLedgerManager.extractDidFromIdentifier(" "));
        assertEquals("did_ledger_id_resolver::" + DID, MultiLedgerManager.cacheKey(DID));
    }
}
