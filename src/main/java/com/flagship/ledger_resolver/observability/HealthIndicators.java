package com.flagship.ledger_resolver.observability;

import com.flagship.ledger_resolver.pool.PoolStatus;
import com.flagship.ledger_resolver.registry.LedgerDescriptor;
import com.flagship.ledger_resolver.registry.LedgerRegistry;
import com.flagship.ledger_resolver.resolution.MultiLedgerManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicators for the ledger resolver.
 */
public class HealthIndicators {

    /**
     * DOWN with no ledger configured, DEGRADED when a pool failed to close.
     */
    @Component("ledgerPoolsHealth")
    public static class LedgerPoolsHealthIndicator implements HealthIndicator {

        private final MultiLedgerManager manager;

        public LedgerPoolsHealthIndicator(MultiLedgerManager manager) {
            this.manager = manager;
        }

        @Override
        public Health health() {
            LedgerRegistry registry = manager.getRegistry();
            if (registry.isEmpty()) {
                return Health.down()
                        .withDetail("error", "No ledger configured")
                        .build();
            }

            Map<String, Object> pools = new LinkedHashMap<>();
            boolean degraded = false;
            for (LedgerDescriptor descriptor : registry.allInOrder()) {
                PoolStatus status = descriptor.getPool().status();
                degraded |= status.isDegraded();
                pools.put(descriptor.getId(), status);
            }

            Health.Builder builder = degraded ? Health.status("DEGRADED") : Health.up();
            return builder
                    .withDetail("production", registry.getProduction().size())
                    .withDetail("nonProduction", registry.getNonProduction().size())
                    .withDetail("writeLedger", registry.getWriteLedgerId().orElse("none"))
                    .withDetail("pools", pools)
                    .build();
        }
    }

    /**
     * Redis connectivity, when Redis backs the resolution cache.
     */
    @Component("redisHealth")
    @ConditionalOnProperty(prefix = "ledger.cache", name = "type", havingValue = "redis")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", "Lookups still resolve without the cache")
                            .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return Health.down()
                            .withDetail("response", result != null ? result : "null")
                            .build();
                }
            } catch (Exception e) {
                // A lost cache only costs extra fan-outs
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Lookups still resolve without the cache")
                        .build();
            }
        }
    }
}
