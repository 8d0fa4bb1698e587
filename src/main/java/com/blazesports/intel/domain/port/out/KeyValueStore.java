package com.blazesports.intel.domain.port.out;

import java.time.Duration;
import java.util.Optional;

/**
 * Backing store port: a flat key-value store with per-entry expiration.
 * No listing or query capability is assumed; implementations may throw on connectivity problems.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * Write a value that the store expires on its own after {@code ttl}.
     */
    void put(String key, String value, Duration ttl);

    void delete(String key);
}
