package com.flagship.ledger_resolver.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed {@link ResolutionCache}.
 *
 * Redis is a fast path only: a failed read counts as a miss and a failed
 * write is logged, so resolution keeps working while Redis is down.
 */
@Slf4j
public class RedisResolutionCache implements ResolutionCache {

    private static final String REDIS_KEY_PREFIX = "ledger-resolver:";

    private final StringRedisTemplate redisTemplate;

    public RedisResolutionCache(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(REDIS_KEY_PREFIX + key));
        } catch (Exception e) {
            log.warn("Redis lookup failed for key {}, treating as a miss. Error: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            if (ResolutionCache.expires(ttl)) {
                redisTemplate.opsForValue().set(REDIS_KEY_PREFIX + key, value, ttl);
            } else {
                redisTemplate.opsForValue().set(REDIS_KEY_PREFIX + key, value);
            }
            log.debug("Stored {} -> {} in Redis", key, value);
        } catch (Exception e) {
            log.warn("Failed to store key {} in Redis. Error: {}", key, e.getMessage());
        }
    }

    @Override
    public void evict(String key) {
        try {
            redisTemplate.delete(REDIS_KEY_PREFIX + key);
        } catch (Exception e) {
            log.warn("Failed to evict key {} from Redis. Error: {}", key, e.getMessage());
        }
    }
}
