package com.blazesports.intel.infrastructure.web.dto;

import com.blazesports.intel.infrastructure.cache.CacheStats;

import java.util.LinkedHashMap;
import java.util.Map;

public record CacheStatsResponse(
        long hits,
        long misses,
        long stale_hits,
        long revalidations,
        long errors,
        long origin_fetches,
        double avg_latency_ms,
        double hit_ratio,
        Map<String, Double> hit_rate_by_category,
        boolean healthy,
        String summary
) {
    public static CacheStatsResponse fromStats(CacheStats stats) {
        Map<String, Double> byCategory = new LinkedHashMap<>();
        stats.hitRateByCategory().forEach((category, rate) -> byCategory.put(category.wireName(), rate));

        return new CacheStatsResponse(
                stats.hits(),
                stats.misses(),
                stats.staleHits(),
                stats.revalidations(),
                stats.errors(),
                stats.originFetches(),
                stats.averageLatencyMs(),
                stats.hitRatio(),
                byCategory,
                stats.isHealthy(),
                stats.summary()
        );
    }
}
