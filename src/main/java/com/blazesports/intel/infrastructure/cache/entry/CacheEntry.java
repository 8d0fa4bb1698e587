package com.blazesports.intel.infrastructure.cache.entry;

import com.blazesports.intel.domain.model.CacheCategory;
import com.blazesports.intel.domain.model.TtlProfile;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Set;

/**
 * A cached value with its timing metadata. Timestamps are epoch milliseconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheEntry<T>(
        T data,
        long cachedAt,
        long expiresAt,
        long staleAt,
        CacheCategory category,
        Set<String> tags,
        long hits,
        String provenance
) {

    public CacheEntry {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static <T> CacheEntry<T> create(T data, CacheCategory category, TtlProfile profile,
                                           Set<String> tags, String provenance, long now) {
        long expiresAt = now + profile.freshSeconds() * 1000;
        long staleAt = expiresAt + profile.staleSeconds() * 1000;
        return new CacheEntry<>(data, now, expiresAt, staleAt, category, tags, 0, provenance);
    }

    public Freshness freshnessAt(long now) {
        if (now < expiresAt) {
            return Freshness.FRESH;
        }
        if (now < staleAt) {
            return Freshness.STALE;
        }
        return Freshness.EXPIRED;
    }

    public CacheEntry<T> withHit() {
        return new CacheEntry<>(data, cachedAt, expiresAt, staleAt, category, tags, hits + 1, provenance);
    }

    /**
     * Milliseconds the entry can still be served for, zero once expired.
     */
    public long remainingMillis(long now) {
        return Math.max(0, staleAt - now);
    }

    @JsonIgnore
    public boolean isWellFormed() {
        return category != null && cachedAt <= expiresAt && expiresAt <= staleAt;
    }
}
