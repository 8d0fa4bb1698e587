package com.blazesports.intel.infrastructure.cache;

import com.blazesports.intel.domain.model.CacheCategory;

import java.util.Objects;
import java.util.Set;

/**
 * Per-call options for {@link TieredCache#getWithSWR}.
 *
 * @param category TTL profile of the entry
 * @param tags group labels registered when the value is stored
 * @param provenance free-form origin label kept with the entry
 * @param forceRefresh fetch from origin even if a fresh entry exists
 */
public record CacheOptions(
        CacheCategory category,
        Set<String> tags,
        String provenance,
        boolean forceRefresh
) {

    public CacheOptions {
        Objects.requireNonNull(category, "category");
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static CacheOptions of(CacheCategory category) {
        return new CacheOptions(category, Set.of(), null, false);
    }

    public CacheOptions withTags(String... tags) {
        return new CacheOptions(category, Set.of(tags), provenance, forceRefresh);
    }

    public CacheOptions withProvenance(String provenance) {
        return new CacheOptions(category, tags, provenance, forceRefresh);
    }

    public CacheOptions forcingRefresh() {
        return new CacheOptions(category, tags, provenance, true);
    }
}
