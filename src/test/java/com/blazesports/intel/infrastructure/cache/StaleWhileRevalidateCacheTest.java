package com.blazesports.intel.infrastructure.cache;

import com.blazesports.intel.domain.model.CacheCategory;
import com.blazesports.intel.domain.port.out.DeferredTaskRunner;
import com.blazesports.intel.domain.port.out.OriginFetcher;
import com.blazesports.intel.infrastructure.cache.entry.CacheEntry;
import com.blazesports.intel.infrastructure.cache.entry.CacheEntryCodec;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.blazesports.intel.domain.model.CacheCategory.HISTORICAL;
import static com.blazesports.intel.domain.model.CacheCategory.LIVE_SCORES;
import static com.blazesports.intel.domain.model.CacheCategory.STANDINGS;
import static org.assertj.core.api.Assertions.*;

class StaleWhileRevalidateCacheTest {

    private static final Instant T0 = Instant.parse("2025-04-05T18:00:00Z");

    record Score(int home, int away) {
    }

    record Standings(List<String> teams, int version) {
    }

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private QueuedDeferredTaskRunner deferredTasks;
    private TieredCacheConfig config;
    private CacheEntryCodec codec;
    private ObjectMapper objectMapper;
    private StaleWhileRevalidateCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryKeyValueStore(clock);
        deferredTasks = new QueuedDeferredTaskRunner();
        config = new TieredCacheConfig();
        objectMapper = new ObjectMapper();
        codec = new CacheEntryCodec(objectMapper);
        cache = newCache(deferredTasks);
    }

    private StaleWhileRevalidateCache newCache(DeferredTaskRunner runner) {
        TtlProfileTable ttlProfiles = new TtlProfileTable(config);
        return new StaleWhileRevalidateCache(
                store,
                codec,
                ttlProfiles,
                new TagIndex(store, objectMapper, config, ttlProfiles),
                runner,
                config,
                clock);
    }

    // ===== get / set classification =====

    @Test
    void shouldServeLiveScoresFreshThenStaleThenAbsent() {
        // Given
        cache.set("g1", new Score(1, 0), LIVE_SCORES);

        // When - t=10: inside the 15s freshness window
        clock.advanceSeconds(10);

        // Then
        assertThat(cache.get("g1", LIVE_SCORES, Score.class)).contains(new Score(1, 0));
        assertThat(cache.getStats().hits()).isEqualTo(1);

        // When - t=40: inside the 60s stale window
        clock.advanceSeconds(30);

        // Then
        assertThat(cache.get("g1", LIVE_SCORES, Score.class)).contains(new Score(1, 0));
        assertThat(cache.getStats().staleHits()).isEqualTo(1);

        // When - t=90: past the stale deadline
        clock.advanceSeconds(50);

        // Then
        assertThat(cache.get("g1", LIVE_SCORES, Score.class)).isEmpty();
        assertThat(cache.getStats().misses()).isEqualTo(1);
    }

    @Test
    void shouldTreatFreshnessDeadlineAsStale() {
        // Given
        cache.set("g1", new Score(3, 2), LIVE_SCORES);

        // When
        clock.advanceSeconds(15);

        // Then
        assertThat(cache.get("g1", LIVE_SCORES, Score.class)).contains(new Score(3, 2));
        assertThat(cache.getStats().hits()).isZero();
        assertThat(cache.getStats().staleHits()).isEqualTo(1);
    }

    @Test
    void shouldWriteStoreTtlCoveringFreshAndStaleWindows() {
        // When
        cache.set("g1", new Score(1, 0), LIVE_SCORES);

        // Then
        assertThat(store.ttlOf("bsi:cache:g1")).isEqualTo(Duration.ofSeconds(75));
    }

    @Test
    void shouldTreatExpiredEntryAsAbsentEvenWhenStoreStillHoldsIt() throws Exception {
        // Given - entry cached two minutes ago, stored with a generous TTL
        CacheEntry<Score> old = CacheEntry.create(new Score(2, 2), LIVE_SCORES, LIVE_SCORES.defaultProfile(),
                Set.of(), null, clock.millis() - 120_000);
        store.put("bsi:cache:g2", codec.encode(old), Duration.ofHours(1));

        // When
        var result = cache.get("g2", LIVE_SCORES, Score.class);

        // Then
        assertThat(result).isEmpty();
        assertThat(cache.getStats().misses()).isEqualTo(1);
    }

    @Test
    void shouldPersistHitCounterInBackground() {
        // Given
        cache.set("g1", new Score(1, 0), LIVE_SCORES);
        clock.advanceSeconds(5);

        // When
        cache.get("g1", LIVE_SCORES, Score.class);
        deferredTasks.runAll();

        // Then
        CacheEntry<Score> stored = codec.<Score>decode(store.raw("bsi:cache:g1"), codec.typeOf(Score.class)).orElseThrow();
        assertThat(stored.hits()).isEqualTo(1);
        assertThat(stored.data()).isEqualTo(new Score(1, 0));
        assertThat(store.ttlOf("bsi:cache:g1")).isEqualTo(Duration.ofSeconds(70));
    }

    @Test
    void shouldNotResurrectInvalidatedEntryFromPendingHitCounter() {
        // Given
        cache.set("k1", new Score(1, 0), LIVE_SCORES, Set.of("sport:mlb"), null);
        cache.get("k1", LIVE_SCORES, Score.class);

        // When
        assertThat(cache.invalidateSport("mlb")).isEqualTo(1);
        deferredTasks.runAll();

        // Then
        assertThat(store.contains("bsi:cache:k1")).isFalse();
        assertThat(cache.get("k1", LIVE_SCORES, Score.class)).isEmpty();
    }

    @Test
    void shouldNotResurrectDeletedEntryFromPendingHitCounter() {
        // Given
        cache.set("k1", new Score(1, 0), LIVE_SCORES);
        cache.get("k1", LIVE_SCORES, Score.class);

        // When
        cache.delete("k1");
        deferredTasks.runAll();

        // Then
        assertThat(store.contains("bsi:cache:k1")).isFalse();
    }

    @Test
    void shouldKeepNewerValueWrittenAfterFreshHit() {
        // Given
        cache.set("k1", new Score(1, 0), LIVE_SCORES);
        cache.get("k1", LIVE_SCORES, Score.class);

        // When - same millisecond and a later one
        cache.set("k1", new Score(9, 9), LIVE_SCORES);
        deferredTasks.runAll();

        // Then
        assertThat(cache.get("k1", LIVE_SCORES, Score.class)).contains(new Score(9, 9));
    }

    @Test
    void shouldSkipHitCounterWhenEntryWasReplacedLater() {
        // Given
        cache.set("k1", new Score(1, 0), LIVE_SCORES);
        cache.get("k1", LIVE_SCORES, Score.class);
        clock.advanceSeconds(2);
        cache.set("k1", new Score(9, 9), LIVE_SCORES);

        // When
        deferredTasks.runAll();

        // Then
        CacheEntry<Score> stored = codec.<Score>decode(store.raw("bsi:cache:k1"), codec.typeOf(Score.class)).orElseThrow();
        assertThat(stored.data()).isEqualTo(new Score(9, 9));
        assertThat(stored.hits()).isZero();
        assertThat(store.ttlOf("bsi:cache:k1")).isEqualTo(Duration.ofSeconds(75));
    }

    @Test
    void shouldNotScheduleHitCounterWhenTrackingDisabled() {
        // Given
        config.setTrackHits(false);
        cache.set("g1", new Score(1, 0), LIVE_SCORES);

        // When
        cache.get("g1", LIVE_SCORES, Score.class);

        // Then
        assertThat(deferredTasks.pending(description -> true)).isZero();
    }

    @Test
    void shouldReportMissWhenStoreReadFails() {
        // Given
        cache.set("g1", new Score(1, 0), LIVE_SCORES);
        store.failReads(true);

        // When
        var result = cache.get("g1", LIVE_SCORES, Score.class);

        // Then
        assertThat(result).isEmpty();
        assertThat(cache.getStats().errors()).isEqualTo(1);
        assertThat(cache.getStats().misses()).isEqualTo(1);
    }

    @Test
    void shouldReportMissForCorruptEntry() {
        // Given
        store.put("bsi:cache:bad", "{\"data\": {\"home\": 1,", Duration.ofMinutes(5));

        // When
        var result = cache.get("bad", LIVE_SCORES, Score.class);

        // Then
        assertThat(result).isEmpty();
        assertThat(cache.getStats().misses()).isEqualTo(1);
    }

    @Test
    void shouldSwallowWriteFailures() {
        // Given
        store.failWrites(true);

        // When & Then
        assertThatCode(() -> cache.set("g1", new Score(1, 0), LIVE_SCORES, Set.of("sport:mlb"), null))
                .doesNotThrowAnyException();
        assertThat(cache.getStats().errors()).isEqualTo(1);
    }

    @Test
    void shouldSwallowDeleteFailures() {
        // Given
        store.failWrites(true);

        // When & Then
        assertThatCode(() -> cache.delete("g1")).doesNotThrowAnyException();
        assertThat(cache.getStats().errors()).isEqualTo(1);
    }

    @Test
    void shouldDecodeGenericPayloads() {
        // Given
        cache.set("scores:live:mlb", List.of(new Score(1, 0), new Score(4, 4)), LIVE_SCORES);

        // When
        var result = cache.get("scores:live:mlb", LIVE_SCORES, new TypeReference<List<Score>>() {});

        // Then
        assertThat(result).hasValueSatisfying(scores ->
                assertThat(scores).containsExactly(new Score(1, 0), new Score(4, 4)));
    }

    // ===== getWithSWR =====

    @Test
    void shouldFetchOnMissAndServeFromCacheWithinFreshWindow() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        OriginFetcher<Standings> fetcher = () -> new Standings(List.of("TEX", "LSU"), calls.incrementAndGet());

        // When
        Standings first = cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS), fetcher, Standings.class);
        clock.advanceSeconds(100);
        Standings second = cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS), fetcher, Standings.class);

        // Then
        assertThat(calls).hasValue(1);
        assertThat(second).isEqualTo(first);
        assertThat(store.ttlOf("bsi:cache:standings:sec")).isEqualTo(Duration.ofSeconds(300 + 1800));
        assertThat(cache.getStats().misses()).isEqualTo(1);
        assertThat(cache.getStats().hits()).isEqualTo(1);
    }

    @Test
    void shouldReturnStaleValueWithoutWaitingForOrigin() {
        // Given
        Standings old = new Standings(List.of("TEX"), 1);
        cache.set("standings:sec", old, STANDINGS);
        clock.advanceSeconds(400);

        AtomicInteger calls = new AtomicInteger();
        OriginFetcher<Standings> fetcher = () -> new Standings(List.of("TEX", "LSU"), 1 + calls.incrementAndGet());

        // When
        Standings result = cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS), fetcher, Standings.class);

        // Then - served before any fetch happened
        assertThat(result).isEqualTo(old);
        assertThat(calls).hasValue(0);
        assertThat(deferredTasks.pendingRevalidations()).isEqualTo(1);
        assertThat(cache.getStats().staleHits()).isEqualTo(1);

        // When - background work runs after the response
        deferredTasks.runAll();

        // Then
        assertThat(calls).hasValue(1);
        assertThat(cache.getStats().revalidations()).isEqualTo(1);
        assertThat(cache.get("standings:sec", STANDINGS, Standings.class))
                .contains(new Standings(List.of("TEX", "LSU"), 2));
        assertThat(cache.getStats().hits()).isEqualTo(1);
    }

    @Test
    void shouldConvergeWhenConcurrentStaleReadsBothRevalidate() {
        // Given
        cache.set("standings:sec", new Standings(List.of("TEX"), 0), STANDINGS);
        clock.advanceSeconds(400);

        AtomicInteger calls = new AtomicInteger();
        OriginFetcher<Standings> fetcher = () -> new Standings(List.of("TEX", "LSU"), calls.incrementAndGet());

        // When
        cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS), fetcher, Standings.class);
        cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS), fetcher, Standings.class);
        deferredTasks.runAll();

        // Then - one fetch per stale read, last write wins
        assertThat(calls).hasValue(2);
        assertThat(cache.getStats().revalidations()).isEqualTo(2);
        assertThat(cache.get("standings:sec", STANDINGS, Standings.class))
                .hasValueSatisfying(standings -> {
                    assertThat(standings.teams()).containsExactly("TEX", "LSU");
                    assertThat(standings.version()).isEqualTo(2);
                });
    }

    @Test
    void shouldKeepStaleEntryWhenBackgroundRevalidationFails() {
        // Given
        Standings old = new Standings(List.of("TEX"), 1);
        cache.set("standings:sec", old, STANDINGS);
        clock.advanceSeconds(400);
        OriginFetcher<Standings> failing = () -> {
            throw new IllegalStateException("upstream down");
        };

        // When
        Standings result = cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS), failing, Standings.class);

        // Then
        assertThat(result).isEqualTo(old);
        assertThatCode(() -> deferredTasks.runAll()).doesNotThrowAnyException();
        assertThat(cache.getStats().errors()).isEqualTo(1);
        assertThat(cache.getStats().revalidations()).isEqualTo(1);
        assertThat(cache.get("standings:sec", STANDINGS, Standings.class)).contains(old);
    }

    @Test
    void shouldServeStaleValueWhenDeferredTasksUnavailable() {
        // Given
        StaleWhileRevalidateCache withoutBackground = newCache(DeferredTaskRunner.unavailable());
        Standings old = new Standings(List.of("TEX"), 1);
        withoutBackground.set("standings:sec", old, STANDINGS);
        clock.advanceSeconds(400);
        AtomicInteger calls = new AtomicInteger();

        // When
        Standings result = withoutBackground.getWithSWR("standings:sec", CacheOptions.of(STANDINGS),
                () -> new Standings(List.of(), calls.incrementAndGet()), Standings.class);

        // Then
        assertThat(result).isEqualTo(old);
        assertThat(calls).hasValue(0);
        assertThat(withoutBackground.getStats().revalidations()).isZero();
    }

    @Test
    void shouldRevalidateWithOriginalTagsAndProvenance() throws Exception {
        // Given
        CacheOptions options = CacheOptions.of(STANDINGS).withTags("sport:ncaa-baseball").withProvenance("d1baseball");
        cache.set("standings:sec", new Standings(List.of("TEX"), 1), STANDINGS, options.tags(), options.provenance());
        clock.advanceSeconds(400);

        // When
        cache.getWithSWR("standings:sec", options, () -> new Standings(List.of("LSU"), 2), Standings.class);
        deferredTasks.runAll();

        // Then
        CacheEntry<Standings> stored = codec.<Standings>decode(store.raw("bsi:cache:standings:sec"),
                codec.typeOf(Standings.class)).orElseThrow();
        assertThat(stored.data().version()).isEqualTo(2);
        assertThat(stored.tags()).containsExactly("sport:ncaa-baseball");
        assertThat(stored.provenance()).isEqualTo("d1baseball");
        assertThat(stored.cachedAt()).isEqualTo(clock.millis());
    }

    @Test
    void shouldPropagateOriginFailureOnTrueMiss() {
        // Given
        IllegalStateException failure = new IllegalStateException("upstream down");

        // When & Then
        assertThatThrownBy(() -> cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS),
                () -> {
                    throw failure;
                }, Standings.class))
                .isSameAs(failure);
        assertThat(store.contains("bsi:cache:standings:sec")).isFalse();
        assertThat(cache.getStats().misses()).isEqualTo(1);
    }

    @Test
    void shouldFetchSynchronouslyOnceEntryIsFullyExpired() {
        // Given
        cache.set("g1", new Score(0, 0), LIVE_SCORES);
        clock.advanceSeconds(80);
        AtomicInteger calls = new AtomicInteger();

        // When
        Score result = cache.getWithSWR("g1", CacheOptions.of(LIVE_SCORES), () -> {
            calls.incrementAndGet();
            return new Score(5, 3);
        }, Score.class);

        // Then
        assertThat(result).isEqualTo(new Score(5, 3));
        assertThat(calls).hasValue(1);
        assertThat(deferredTasks.pendingRevalidations()).isZero();
    }

    @Test
    void shouldBypassFreshEntryOnForcedRefresh() {
        // Given
        cache.set("standings:sec", new Standings(List.of("TEX"), 1), STANDINGS);
        AtomicInteger calls = new AtomicInteger();

        // When
        Standings result = cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS).forcingRefresh(),
                () -> new Standings(List.of("LSU"), 1 + calls.incrementAndGet()), Standings.class);

        // Then
        assertThat(calls).hasValue(1);
        assertThat(result.version()).isEqualTo(2);
        assertThat(cache.get("standings:sec", STANDINGS, Standings.class)).contains(result);
    }

    @Test
    void shouldFetchFromOriginWhenStoreReadFails() {
        // Given
        store.failReads(true);

        // When
        Score result = cache.getWithSWR("g1", CacheOptions.of(LIVE_SCORES), () -> new Score(7, 6), Score.class);

        // Then
        assertThat(result).isEqualTo(new Score(7, 6));
        assertThat(cache.getStats().errors()).isEqualTo(1);
        assertThat(cache.getStats().misses()).isEqualTo(1);
    }

    // ===== tag invalidation =====

    @Test
    void shouldInvalidateEveryKeyTaggedWithSport() {
        // Given
        cache.set("k1", new Score(1, 0), LIVE_SCORES, Set.of("sport:mlb"), null);
        cache.set("k2", new Score(2, 0), LIVE_SCORES, Set.of("sport:mlb"), null);
        cache.set("k3", new Score(3, 0), LIVE_SCORES, Set.of("sport:nfl"), null);

        // When
        int removed = cache.invalidateSport("mlb");

        // Then
        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("k1", LIVE_SCORES, Score.class)).isEmpty();
        assertThat(cache.get("k2", LIVE_SCORES, Score.class)).isEmpty();
        assertThat(cache.get("k3", LIVE_SCORES, Score.class)).isPresent();
        assertThat(store.contains("bsi:tag:sport:mlb")).isFalse();
    }

    @Test
    void shouldInvalidateTeamTag() {
        // Given
        cache.set("team:251", new Score(0, 0), CacheCategory.TEAM_INFO, Set.of("team:251", "sport:ncaaf"), null);

        // When
        int removed = cache.invalidateTeam("251");

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(cache.get("team:251", CacheCategory.TEAM_INFO, Score.class)).isEmpty();
    }

    @Test
    void shouldTolerateIndexedKeysThatNoLongerExist() {
        // Given
        cache.set("k1", new Score(1, 0), HISTORICAL, Set.of("season:2024"), null);
        cache.delete("k1");

        // When & Then
        assertThat(cache.invalidateByTag("season:2024")).isEqualTo(1);
        assertThat(cache.getStats().errors()).isZero();
    }

    @Test
    void shouldInvalidateLongLivedEntryAfterShortLivedKeyJoinedTag() {
        // Given
        cache.set("hist", new Score(1, 0), HISTORICAL, Set.of("sport:mlb"), null);
        cache.set("live", new Score(2, 0), LIVE_SCORES, Set.of("sport:mlb"), null);

        // When
        clock.advanceSeconds(2 * 86400);
        int removed = cache.invalidateSport("mlb");

        // Then
        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("hist", HISTORICAL, Score.class)).isEmpty();
    }

    @Test
    void shouldKeepRepeatedlyWrittenKeyIndexedPastIndexLifetime() {
        // Given
        config.setTagIndexTtlSeconds(60);
        cache = newCache(deferredTasks);
        cache.set("scores:live:mlb", new Score(0, 0), LIVE_SCORES, Set.of("sport:mlb"), null);
        clock.advanceSeconds(30);
        cache.set("scores:live:mlb", new Score(1, 0), LIVE_SCORES, Set.of("sport:mlb"), null);
        clock.advanceSeconds(30);
        cache.set("scores:live:mlb", new Score(2, 0), LIVE_SCORES, Set.of("sport:mlb"), null);

        // When
        clock.advanceSeconds(20);
        int removed = cache.invalidateSport("mlb");

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(cache.get("scores:live:mlb", LIVE_SCORES, Score.class)).isEmpty();
    }

    @Test
    void shouldReturnZeroForUnknownTag() {
        assertThat(cache.invalidateByTag("sport:cricket")).isZero();
    }

    @Test
    void shouldReturnZeroWhenIndexCannotBeRead() {
        // Given
        cache.set("k1", new Score(1, 0), LIVE_SCORES, Set.of("sport:mlb"), null);
        store.failReads(true);

        // When
        int removed = cache.invalidateSport("mlb");

        // Then
        assertThat(removed).isZero();
        assertThat(cache.getStats().errors()).isEqualTo(1);
    }

    // ===== stats =====

    @Test
    void shouldResetStatistics() {
        // Given
        cache.set("g1", new Score(1, 0), LIVE_SCORES);
        cache.get("g1", LIVE_SCORES, Score.class);
        cache.get("missing", LIVE_SCORES, Score.class);

        // When
        CacheStats stats = cache.resetStats();

        // Then
        assertThat(stats).isEqualTo(CacheStats.empty());
        assertThat(cache.getStats().hits()).isZero();
    }

    @Test
    void shouldTrackHitRatePerCategoryAndOriginFetches() {
        // Given
        cache.set("g1", new Score(1, 0), LIVE_SCORES);

        // When
        cache.get("g1", LIVE_SCORES, Score.class);
        cache.get("missing", LIVE_SCORES, Score.class);
        cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS), () -> new Standings(List.of("TEX"), 1), Standings.class);
        cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS), () -> new Standings(List.of("TEX"), 2), Standings.class);
        cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS).forcingRefresh(),
                () -> new Standings(List.of("TEX"), 3), Standings.class);

        // Then
        CacheStats stats = cache.getStats();
        assertThat(stats.originFetches()).isEqualTo(2);
        assertThat(stats.categoryHits()).containsEntry(LIVE_SCORES, 1L).containsEntry(STANDINGS, 1L);
        assertThat(stats.categoryMisses()).containsEntry(LIVE_SCORES, 1L).containsEntry(STANDINGS, 1L);
        assertThat(stats.hitRateByCategory())
                .containsEntry(LIVE_SCORES, 0.5)
                .containsEntry(STANDINGS, 0.5)
                .doesNotContainKey(HISTORICAL);
    }

    @Test
    void shouldCountBackgroundRevalidationAsOriginFetch() {
        // Given
        cache.set("standings:sec", new Standings(List.of("TEX"), 1), STANDINGS);
        clock.advanceSeconds(400);

        // When
        cache.getWithSWR("standings:sec", CacheOptions.of(STANDINGS), () -> new Standings(List.of("LSU"), 2), Standings.class);
        deferredTasks.runAll();

        // Then
        assertThat(cache.getStats().originFetches()).isEqualTo(1);
        assertThat(cache.getStats().categoryHits()).containsEntry(STANDINGS, 1L);
    }

    @Test
    void shouldLookUpEntriesWithoutTouchingHitCounters() {
        // Given
        cache.set("g1", new Score(1, 0), LIVE_SCORES);
        cache.set("old", new Score(0, 0), LIVE_SCORES);
        clock.advanceSeconds(40);
        cache.set("g1", new Score(2, 0), LIVE_SCORES);

        // When & Then
        assertThat(cache.contains("g1")).isTrue();
        clock.advanceSeconds(40);
        assertThat(cache.contains("old")).isFalse();
        assertThat(cache.contains("missing")).isFalse();
        assertThat(cache.getStats()).isEqualTo(CacheStats.empty());
        assertThat(deferredTasks.pending(description -> true)).isZero();
    }

    @Test
    void shouldTrackHitRatioAndLatency() {
        // Given
        cache.set("g1", new Score(1, 0), LIVE_SCORES);

        // When
        cache.get("g1", LIVE_SCORES, Score.class);
        cache.get("g1", LIVE_SCORES, Score.class);
        cache.get("g1", LIVE_SCORES, Score.class);
        cache.get("missing", LIVE_SCORES, Score.class);

        // Then
        CacheStats stats = cache.getStats();
        assertThat(stats.hitRatio()).isEqualTo(0.75);
        assertThat(stats.averageLatencyMs()).isGreaterThanOrEqualTo(0.0);
        assertThat(stats.summary()).startsWith("Hit ratio:");
    }
}
