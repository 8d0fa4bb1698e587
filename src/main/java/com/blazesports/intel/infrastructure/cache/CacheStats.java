package com.blazesports.intel.infrastructure.cache;

import com.blazesports.intel.domain.model.CacheCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Cache performance metrics, local to this process
 *
 * @param categoryHits   reads served from cache per category, stale answers included
 * @param categoryMisses reads that missed per category
 */
public record CacheStats(
        long hits,
        long misses,
        long staleHits,
        long revalidations,
        long errors,
        long originFetches,
        double averageLatencyMs,
        Map<CacheCategory, Long> categoryHits,
        Map<CacheCategory, Long> categoryMisses
) {
    public CacheStats {
        categoryHits = categoryHits != null ? Map.copyOf(categoryHits) : Map.of();
        categoryMisses = categoryMisses != null ? Map.copyOf(categoryMisses) : Map.of();
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0, 0, 0.0, Map.of(), Map.of());
    }

    /**
     * Share of reads answered from cache, stale answers included.
     */
    public double hitRatio() {
        long served = hits + staleHits;
        long total = served + misses;
        return total > 0 ? (double) served / total : 0.0;
    }

    /**
     * Hit ratio of every category that saw at least one read.
     */
    public Map<CacheCategory, Double> hitRateByCategory() {
        Map<CacheCategory, Double> rates = new EnumMap<>(CacheCategory.class);
        for (CacheCategory category : CacheCategory.values()) {
            long served = categoryHits.getOrDefault(category, 0L);
            long total = served + categoryMisses.getOrDefault(category, 0L);
            if (total > 0) {
                rates.put(category, (double) served / total);
            }
        }
        return Collections.unmodifiableMap(rates);
    }

    public boolean isHealthy() {
        long reads = hits + staleHits + misses;
        return reads == 0 || (hitRatio() > 0.75 && errors < reads * 0.05);
    }

    public String summary() {
        return String.format("Hit ratio: %.1f%%, Stale hits: %d, Revalidations: %d, Origin fetches: %d, Errors: %d, Avg latency: %.2fms",
                hitRatio() * 100, staleHits, revalidations, originFetches, errors, averageLatencyMs);
    }
}
