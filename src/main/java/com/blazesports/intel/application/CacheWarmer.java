package com.blazesports.intel.application;

import com.blazesports.intel.domain.model.CacheCategory;
import com.blazesports.intel.domain.port.out.SportsDataProvider;
import com.blazesports.intel.infrastructure.cache.TieredCache;
import com.blazesports.intel.infrastructure.cache.key.CacheKeys;
import com.blazesports.intel.infrastructure.cache.key.CacheTags;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Preloads the cache from the upstream provider so first requests are served warm.
 * Keys that already hold a usable entry are skipped; failures are counted, never thrown.
 */
@Service
public class CacheWarmer {

    private static final Logger logger = LoggerFactory.getLogger(CacheWarmer.class);

    static final int DEFAULT_CONCURRENCY = 5;
    static final int LIVE_CONCURRENCY = 10;
    private static final String PROVENANCE = "warmer";

    private final TieredCache cache;
    private final SportsDataProvider sportsDataProvider;
    private final Clock clock;

    public CacheWarmer(TieredCache cache, SportsDataProvider sportsDataProvider, Clock clock) {
        this.cache = cache;
        this.sportsDataProvider = sportsDataProvider;
        this.clock = clock;
    }

    public WarmingResult warmKeys(List<String> keys, CacheCategory category, int concurrency) {
        List<WarmingTarget> targets = keys.stream()
                .map(key -> new WarmingTarget(key, category, Set.of()))
                .toList();
        return warm(targets, concurrency);
    }

    /**
     * Warms targets in batches of {@code concurrency}; each batch completes before the next starts.
     */
    public WarmingResult warm(List<WarmingTarget> targets, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
        }

        AtomicInteger warmed = new AtomicInteger();
        AtomicInteger skipped = new AtomicInteger();
        AtomicInteger errors = new AtomicInteger();

        for (int i = 0; i < targets.size(); i += concurrency) {
            List<WarmingTarget> batch = targets.subList(i, Math.min(i + concurrency, targets.size()));
            List<CompletableFuture<Void>> inFlight = new ArrayList<>();

            for (WarmingTarget target : batch) {
                if (cache.contains(target.key())) {
                    skipped.incrementAndGet();
                    continue;
                }
                inFlight.add(fetchAndStore(target, warmed, errors));
            }

            CompletableFuture.allOf(inFlight.toArray(CompletableFuture[]::new)).join();
        }

        WarmingResult result = new WarmingResult(targets.size(), warmed.get(), skipped.get(), errors.get());
        logger.info("Cache warming finished: {} total, {} warmed, {} skipped, {} errors",
                result.total(), result.warmed(), result.skipped(), result.errors());
        return result;
    }

    public WarmingResult warmSportData(String sport, boolean standings, boolean rankings, boolean schedule) {
        Set<String> tags = Set.of(CacheTags.sport(sport));
        List<WarmingTarget> targets = new ArrayList<>();

        if (standings) {
            targets.add(new WarmingTarget(CacheKeys.standings(sport), CacheCategory.STANDINGS, tags));
        }
        if (rankings) {
            targets.add(new WarmingTarget(CacheKeys.rankings(sport), CacheCategory.RANKINGS, tags));
        }
        if (schedule) {
            targets.add(new WarmingTarget(CacheKeys.schedule(sport, LocalDate.now(clock)), CacheCategory.SCHEDULE, tags));
        }

        return warm(targets, DEFAULT_CONCURRENCY);
    }

    /**
     * Live scores have the shortest freshness window, so they are warmed with higher concurrency.
     */
    public WarmingResult warmLiveGames(List<String> sports) {
        List<WarmingTarget> targets = sports.stream()
                .map(sport -> new WarmingTarget(CacheKeys.liveScores(sport), CacheCategory.LIVE_SCORES,
                        Set.of(CacheTags.sport(sport))))
                .toList();
        return warm(targets, LIVE_CONCURRENCY);
    }

    private CompletableFuture<Void> fetchAndStore(WarmingTarget target, AtomicInteger warmed, AtomicInteger errors) {
        CompletableFuture<JsonNode> fetch;
        try {
            fetch = sportsDataProvider.fetch(target.key());
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }

        return fetch
                .thenAccept(data -> {
                    cache.set(target.key(), data, target.category(), target.tags(), PROVENANCE);
                    warmed.incrementAndGet();
                })
                .exceptionally(ex -> {
                    errors.incrementAndGet();
                    logger.warn("Failed to warm {}: {}", target.key(), ex.getMessage());
                    return null;
                });
    }
}
