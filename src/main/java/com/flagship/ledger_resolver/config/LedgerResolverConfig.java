package com.flagship.ledger_resolver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.ledger_resolver.cache.InMemoryResolutionCache;
import com.flagship.ledger_resolver.cache.RedisResolutionCache;
import com.flagship.ledger_resolver.cache.ResolutionCache;
import com.flagship.ledger_resolver.connector.HttpLedgerConnector;
import com.flagship.ledger_resolver.connector.LedgerConnector;
import com.flagship.ledger_resolver.ledger.LedgerRequestBuilder;
import com.flagship.ledger_resolver.observability.ResolutionMetrics;
import com.flagship.ledger_resolver.pool.GenesisStore;
import com.flagship.ledger_resolver.pool.LedgerPoolFactory;
import com.flagship.ledger_resolver.proof.PatriciaTrieProofValidator;
import com.flagship.ledger_resolver.proof.StateProofVerifier;
import com.flagship.ledger_resolver.proof.TrieProofValidator;
import com.flagship.ledger_resolver.registry.LedgerConfig;
import com.flagship.ledger_resolver.resolution.LedgerRequestsExecutor;
import com.flagship.ledger_resolver.resolution.MultiLedgerManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Wires pools, proof checking, caching and the resolution manager from {@link LedgerProperties}.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
@Slf4j
public class LedgerResolverConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService ledgerLookupExecutor(LedgerProperties properties) {
        return Executors.newFixedThreadPool(properties.getLookup().getMaxWorkers(), namedThreads("ledger-lookup-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService poolCloseScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("ledger-pool-close-"));
    }

    @Bean
    @ConditionalOnMissingBean(LedgerConnector.class)
    public LedgerConnector ledgerConnector(LedgerProperties properties) {
        return new HttpLedgerConnector(properties.getConnectTimeout());
    }

    @Bean
    public GenesisStore genesisStore(LedgerProperties properties) {
        String dir = properties.getGenesisDir();
        return new GenesisStore(dir == null || dir.isBlank() ? null : Path.of(dir));
    }

    @Bean
    public LedgerPoolFactory ledgerPoolFactory(LedgerConnector connector,
                                               GenesisStore genesisStore,
                                               ScheduledExecutorService poolCloseScheduler,
                                               LedgerProperties properties,
                                               ResolutionMetrics metrics) {
        return new LedgerPoolFactory(connector, genesisStore, poolCloseScheduler,
                properties.getClose().getAttempts(), properties.getClose().getBackoff(), metrics);
    }

    @Bean
    public TrieProofValidator trieProofValidator() {
        return new PatriciaTrieProofValidator();
    }

    @Bean
    public StateProofVerifier stateProofVerifier(TrieProofValidator trieProofValidator, ObjectMapper objectMapper) {
        return new StateProofVerifier(trieProofValidator, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "ledger.cache", name = "type", havingValue = "memory", matchIfMissing = true)
    public ResolutionCache inMemoryResolutionCache(LedgerProperties properties) {
        return new InMemoryResolutionCache(properties.getCache().getMaxEntries());
    }

    @Bean
    @ConditionalOnProperty(prefix = "ledger.cache", name = "type", havingValue = "redis")
    public ResolutionCache redisResolutionCache(StringRedisTemplate redisTemplate) {
        return new RedisResolutionCache(redisTemplate);
    }

    @Bean
    public MultiLedgerManager multiLedgerManager(LedgerPoolFactory poolFactory,
                                                 LedgerRequestBuilder requestBuilder,
                                                 StateProofVerifier stateProofVerifier,
                                                 ObjectMapper objectMapper,
                                                 ResolutionMetrics metrics,
                                                 Optional<ResolutionCache> resolutionCache,
                                                 ExecutorService ledgerLookupExecutor,
                                                 LedgerProperties properties) {
        MultiLedgerManager manager = new MultiLedgerManager(poolFactory, requestBuilder, stateProofVerifier,
                objectMapper, metrics, resolutionCache, properties.getCache().getTtl(),
                ledgerLookupExecutor, properties.getLookup().getTaskTimeout());

        List<LedgerConfig> configs = properties.getLedgers().stream()
                .map(LedgerProperties.Ledger::toLedgerConfig)
                .collect(Collectors.toList());
        if (configs.isEmpty()) {
            log.warn("No ledgers configured; lookups fail until a configuration is supplied");
        } else {
            manager.updateLedgerConfig(configs);
        }
        return manager;
    }

    @Bean
    public LedgerRequestsExecutor ledgerRequestsExecutor(MultiLedgerManager manager) {
        return new LedgerRequestsExecutor(manager);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
