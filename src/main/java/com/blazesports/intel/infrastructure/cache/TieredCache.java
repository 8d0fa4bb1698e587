package com.blazesports.intel.infrastructure.cache;

import com.blazesports.intel.domain.model.CacheCategory;
import com.blazesports.intel.domain.port.out.OriginFetcher;
import com.blazesports.intel.infrastructure.cache.key.CacheTags;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Optional;
import java.util.Set;

/**
 * Cache with per-category freshness windows, stale-while-revalidate reads and tag invalidation.
 * Caching failures never reach callers; only origin failures on a real miss do.
 */
public interface TieredCache {

    /**
     * Read an entry without touching the origin.
     * @return the cached value while fresh or stale-but-usable, empty otherwise
     */
    <T> Optional<T> get(String key, CacheCategory category, Class<T> type);

    <T> Optional<T> get(String key, CacheCategory category, TypeReference<T> type);

    /**
     * Whether a fresh or stale-but-usable entry is stored under the key. Hit and miss counters are left untouched.
     */
    boolean contains(String key);

    /**
     * Store a value under the category's TTL profile and register it under each tag
     */
    <T> void set(String key, T data, CacheCategory category, Set<String> tags, String provenance);

    default <T> void set(String key, T data, CacheCategory category) {
        set(key, data, category, Set.of(), null);
    }

    void delete(String key);

    /**
     * Read-through with stale-while-revalidate. Stale entries are returned immediately and refreshed
     * in the background; the fetcher only blocks the caller on a miss or a forced refresh.
     */
    <T> T getWithSWR(String key, CacheOptions options, OriginFetcher<T> fetcher, Class<T> type);

    <T> T getWithSWR(String key, CacheOptions options, OriginFetcher<T> fetcher, TypeReference<T> type);

    /**
     * @return number of keys that were listed under the tag
     */
    int invalidateByTag(String tag);

    default int invalidateSport(String sport) {
        return invalidateByTag(CacheTags.sport(sport));
    }

    default int invalidateTeam(String teamId) {
        return invalidateByTag(CacheTags.team(teamId));
    }

    CacheStats getStats();

    CacheStats resetStats();
}
