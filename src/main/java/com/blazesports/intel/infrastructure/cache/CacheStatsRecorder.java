package com.blazesports.intel.infrastructure.cache;

import com.blazesports.intel.domain.model.CacheCategory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free counters behind {@link CacheStats}. Advisory only; concurrent resets may drop increments.
 */
public class CacheStatsRecorder {

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong staleHits = new AtomicLong();
    private final AtomicLong revalidations = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong originFetches = new AtomicLong();
    private final AtomicLong timedReads = new AtomicLong();
    private final AtomicLong totalLatencyNanos = new AtomicLong();

    private final Map<CacheCategory, AtomicLong> categoryHits = counterPerCategory();
    private final Map<CacheCategory, AtomicLong> categoryMisses = counterPerCategory();

    public void recordHit(CacheCategory category) {
        hits.incrementAndGet();
        categoryHits.get(category).incrementAndGet();
    }

    public void recordMiss(CacheCategory category) {
        misses.incrementAndGet();
        categoryMisses.get(category).incrementAndGet();
    }

    public void recordStaleHit(CacheCategory category) {
        staleHits.incrementAndGet();
        categoryHits.get(category).incrementAndGet();
    }

    public void recordRevalidation() {
        revalidations.incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public void recordOriginFetch() {
        originFetches.incrementAndGet();
    }

    public void recordLatency(long startedAtNanos) {
        totalLatencyNanos.addAndGet(System.nanoTime() - startedAtNanos);
        timedReads.incrementAndGet();
    }

    public CacheStats snapshot() {
        long reads = timedReads.get();
        double averageLatencyMs = reads > 0
                ? (double) totalLatencyNanos.get() / reads / TimeUnit.MILLISECONDS.toNanos(1)
                : 0.0;

        return new CacheStats(
                hits.get(),
                misses.get(),
                staleHits.get(),
                revalidations.get(),
                errors.get(),
                originFetches.get(),
                averageLatencyMs,
                nonZero(categoryHits),
                nonZero(categoryMisses)
        );
    }

    public void reset() {
        hits.set(0);
        misses.set(0);
        staleHits.set(0);
        revalidations.set(0);
        errors.set(0);
        originFetches.set(0);
        timedReads.set(0);
        totalLatencyNanos.set(0);
        categoryHits.values().forEach(counter -> counter.set(0));
        categoryMisses.values().forEach(counter -> counter.set(0));
    }

    private static Map<CacheCategory, AtomicLong> counterPerCategory() {
        Map<CacheCategory, AtomicLong> counters = new EnumMap<>(CacheCategory.class);
        for (CacheCategory category : CacheCategory.values()) {
            counters.put(category, new AtomicLong());
        }
        return counters;
    }

    private static Map<CacheCategory, Long> nonZero(Map<CacheCategory, AtomicLong> counters) {
        Map<CacheCategory, Long> values = new EnumMap<>(CacheCategory.class);
        counters.forEach((category, counter) -> {
            long value = counter.get();
            if (value > 0) {
                values.put(category, value);
            }
        });
        return values;
    }
}
