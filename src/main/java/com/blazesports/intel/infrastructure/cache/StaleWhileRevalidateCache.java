package com.blazesports.intel.infrastructure.cache;

import com.blazesports.intel.domain.model.CacheCategory;
import com.blazesports.intel.domain.model.TtlProfile;
import com.blazesports.intel.domain.port.out.DeferredTaskRunner;
import com.blazesports.intel.domain.port.out.KeyValueStore;
import com.blazesports.intel.domain.port.out.OriginFetcher;
import com.blazesports.intel.infrastructure.cache.entry.CacheEntry;
import com.blazesports.intel.infrastructure.cache.entry.CacheEntryCodec;
import com.blazesports.intel.infrastructure.cache.entry.Freshness;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed implementation of {@link TieredCache}.
 *
 * <p>Entries carry their own freshness and stale deadlines; the store TTL only garbage-collects
 * what can no longer be served. Background work (revalidation, hit counters) goes through the
 * {@link DeferredTaskRunner} and is skipped when the runner cannot take it.
 *
 * <p>Concurrent stale reads of one key may each schedule a revalidation. Both write an entry
 * computed from the same profile, so the last write wins.
 */
@Component
public class StaleWhileRevalidateCache implements TieredCache {

    private static final Logger logger = LoggerFactory.getLogger(StaleWhileRevalidateCache.class);

    private final KeyValueStore store;
    private final CacheEntryCodec codec;
    private final TtlProfileTable ttlProfiles;
    private final TagIndex tagIndex;
    private final DeferredTaskRunner deferredTasks;
    private final TieredCacheConfig config;
    private final Clock clock;

    private final CacheStatsRecorder stats = new CacheStatsRecorder();
    private final JavaType anyPayload;

    public StaleWhileRevalidateCache(KeyValueStore store,
                                     CacheEntryCodec codec,
                                     TtlProfileTable ttlProfiles,
                                     TagIndex tagIndex,
                                     DeferredTaskRunner deferredTasks,
                                     TieredCacheConfig config,
                                     Clock clock) {
        this.store = store;
        this.codec = codec;
        this.ttlProfiles = ttlProfiles;
        this.tagIndex = tagIndex;
        this.deferredTasks = deferredTasks;
        this.config = config;
        this.clock = clock;
        this.anyPayload = codec.typeOf(JsonNode.class);
    }

    // ===== Core store operations =====

    @Override
    public <T> Optional<T> get(String key, CacheCategory category, Class<T> type) {
        return get(key, category, codec.typeOf(type));
    }

    @Override
    public <T> Optional<T> get(String key, CacheCategory category, TypeReference<T> type) {
        return get(key, category, codec.typeOf(type));
    }

    private <T> Optional<T> get(String key, CacheCategory category, JavaType type) {
        long startedAt = System.nanoTime();
        try {
            Optional<CacheEntry<T>> cached = readEntry(key, type);
            long now = clock.millis();

            if (cached.isEmpty() || cached.get().freshnessAt(now) == Freshness.EXPIRED) {
                stats.recordMiss(category);
                logger.debug("Cache miss for {} ({})", key, category.wireName());
                return Optional.empty();
            }

            CacheEntry<T> entry = cached.get();
            if (entry.category() != category) {
                logger.debug("Entry {} was cached as {}, read as {}", key, entry.category().wireName(), category.wireName());
            }

            if (entry.freshnessAt(now) == Freshness.FRESH) {
                stats.recordHit(category);
                recordHitAsync(key, entry, type);
                logger.debug("Fresh hit for {}", key);
            } else {
                stats.recordStaleHit(category);
                logger.debug("Stale hit for {}, {}ms left", key, entry.remainingMillis(now));
            }
            return Optional.ofNullable(entry.data());

        } catch (Exception e) {
            stats.recordError();
            stats.recordMiss(category);
            logger.warn("Cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        } finally {
            stats.recordLatency(startedAt);
        }
    }

    @Override
    public boolean contains(String key) {
        try {
            return readEntry(key, anyPayload)
                    .map(entry -> entry.freshnessAt(clock.millis()) != Freshness.EXPIRED)
                    .orElse(false);
        } catch (Exception e) {
            stats.recordError();
            logger.warn("Cache lookup failed for {}: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public <T> void set(String key, T data, CacheCategory category, Set<String> tags, String provenance) {
        Set<String> entryTags = tags != null ? tags : Set.of();

        try {
            TtlProfile profile = ttlProfiles.profileFor(category);
            CacheEntry<T> entry = CacheEntry.create(data, category, profile, entryTags, provenance, clock.millis());

            store.put(entryKey(key), codec.encode(entry), profile.storeTtl());
            logger.debug("Cached {} as {} (fresh {}s, stale {}s)",
                    key, category.wireName(), profile.freshSeconds(), profile.staleSeconds());

        } catch (Exception e) {
            stats.recordError();
            logger.warn("Failed to cache {}: {}", key, e.getMessage());
            return;
        }

        for (String tag : entryTags) {
            try {
                tagIndex.register(key, tag);
            } catch (Exception e) {
                stats.recordError();
                logger.warn("Failed to register {} under tag {}: {}", key, tag, e.getMessage());
            }
        }
    }

    @Override
    public void delete(String key) {
        try {
            store.delete(entryKey(key));
            logger.debug("Deleted {}", key);
        } catch (Exception e) {
            stats.recordError();
            logger.warn("Failed to delete {}: {}", key, e.getMessage());
        }
    }

    // ===== Stale-while-revalidate =====

    @Override
    public <T> T getWithSWR(String key, CacheOptions options, OriginFetcher<T> fetcher, Class<T> type) {
        return getWithSWR(key, options, fetcher, codec.typeOf(type));
    }

    @Override
    public <T> T getWithSWR(String key, CacheOptions options, OriginFetcher<T> fetcher, TypeReference<T> type) {
        return getWithSWR(key, options, fetcher, codec.typeOf(type));
    }

    private <T> T getWithSWR(String key, CacheOptions options, OriginFetcher<T> fetcher, JavaType type) {
        long startedAt = System.nanoTime();
        try {
            if (options.forceRefresh()) {
                logger.debug("Forced refresh of {}", key);
                return fetchAndStore(key, options, fetcher);
            }

            Optional<CacheEntry<T>> cached;
            try {
                cached = readEntry(key, type);
            } catch (Exception e) {
                stats.recordError();
                logger.warn("Cache read failed for {}, fetching from origin: {}", key, e.getMessage());
                cached = Optional.empty();
            }

            Freshness freshness = cached
                    .map(entry -> entry.freshnessAt(clock.millis()))
                    .orElse(Freshness.EXPIRED);

            switch (freshness) {
                case FRESH -> {
                    stats.recordHit(options.category());
                    logger.debug("Fresh hit for {}", key);
                    return cached.get().data();
                }
                case STALE -> {
                    stats.recordStaleHit(options.category());
                    scheduleRevalidation(key, options, fetcher);
                    return cached.get().data();
                }
                default -> {
                    stats.recordMiss(options.category());
                    logger.debug("Cache miss for {}, fetching from origin", key);
                    return fetchAndStore(key, options, fetcher);
                }
            }
        } finally {
            stats.recordLatency(startedAt);
        }
    }

    private <T> T fetchAndStore(String key, CacheOptions options, OriginFetcher<T> fetcher) {
        stats.recordOriginFetch();
        T fresh = fetcher.fetch();
        set(key, fresh, options.category(), options.tags(), options.provenance());
        return fresh;
    }

    private <T> void scheduleRevalidation(String key, CacheOptions options, OriginFetcher<T> fetcher) {
        boolean scheduled = deferredTasks.defer("revalidate " + key, () -> revalidate(key, options, fetcher));

        if (scheduled) {
            logger.debug("Stale hit for {}, revalidating in background", key);
        } else {
            logger.debug("Stale hit for {}, background revalidation unavailable", key);
        }
    }

    private <T> void revalidate(String key, CacheOptions options, OriginFetcher<T> fetcher) {
        stats.recordRevalidation();
        try {
            fetchAndStore(key, options, fetcher);
            logger.debug("Revalidated {}", key);
        } catch (Exception e) {
            stats.recordError();
            logger.warn("Background revalidation of {} failed, keeping stale entry: {}", key, e.getMessage());
        }
    }

    // ===== Tag invalidation =====

    @Override
    public int invalidateByTag(String tag) {
        List<String> keys;
        try {
            keys = tagIndex.members(tag);
        } catch (Exception e) {
            stats.recordError();
            logger.warn("Failed to read index for tag {}: {}", tag, e.getMessage());
            return 0;
        }

        keys.forEach(this::delete);

        try {
            tagIndex.drop(tag);
        } catch (Exception e) {
            stats.recordError();
            logger.warn("Failed to drop index for tag {}: {}", tag, e.getMessage());
        }

        logger.info("Invalidated {} entries tagged {}", keys.size(), tag);
        return keys.size();
    }

    // ===== Stats =====

    @Override
    public CacheStats getStats() {
        return stats.snapshot();
    }

    @Override
    public CacheStats resetStats() {
        stats.reset();
        return stats.snapshot();
    }

    // ===== Private Helper Methods =====

    private <T> Optional<CacheEntry<T>> readEntry(String key, JavaType type) {
        return store.get(entryKey(key)).flatMap(text -> codec.decode(text, type));
    }

    // Bumps the entry that is stored when the task runs, and only if it is still the one that was read.
    private <T> void recordHitAsync(String key, CacheEntry<T> served, JavaType type) {
        if (!config.isTrackHits()) {
            return;
        }

        deferredTasks.defer("hit counter " + key, () -> {
            try {
                Optional<CacheEntry<T>> current = readEntry(key, type);
                if (current.isEmpty() || current.get().cachedAt() != served.cachedAt()) {
                    logger.debug("Hit counter update for {} skipped, entry replaced or removed", key);
                    return;
                }

                long remaining = current.get().remainingMillis(clock.millis());
                if (remaining > 0) {
                    store.put(entryKey(key), codec.encode(current.get().withHit()), Duration.ofMillis(remaining));
                }
            } catch (Exception e) {
                logger.debug("Hit counter update for {} skipped: {}", key, e.getMessage());
            }
        });
    }

    private String entryKey(String key) {
        return config.getKeyPrefix() + key;
    }
}
