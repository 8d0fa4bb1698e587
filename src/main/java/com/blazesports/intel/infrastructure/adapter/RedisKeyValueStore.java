package com.blazesports.intel.infrastructure.adapter;

import com.blazesports.intel.domain.port.out.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis binding of the backing store. Connection failures propagate to the cache, which counts them.
 */
@Repository
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private final RedisTemplate<String, String> redisTemplate;

    public RedisKeyValueStore(RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
        logger.trace("SET {} (TTL: {}s)", key, ttl.toSeconds());
    }

    @Override
    public void delete(String key) {
        Boolean deleted = redisTemplate.delete(key);
        logger.trace("DEL {} -> {}", key, deleted);
    }
}
