package com.blazesports.intel.infrastructure.web;

import com.blazesports.intel.application.CacheWarmer;
import com.blazesports.intel.application.WarmingResult;
import com.blazesports.intel.infrastructure.cache.TieredCache;
import com.blazesports.intel.infrastructure.cache.key.CacheTags;
import com.blazesports.intel.infrastructure.web.dto.CacheStatsResponse;
import com.blazesports.intel.infrastructure.web.dto.InvalidationResponse;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Operational endpoints for the cache: statistics, invalidation and warming.
 * Blank path variables fail method validation and are answered with 400.
 */
@RestController
@RequestMapping("/cache")
public class CacheAdminController {

    private static final Logger logger = LoggerFactory.getLogger(CacheAdminController.class);

    private final TieredCache cache;
    private final CacheWarmer cacheWarmer;

    public CacheAdminController(TieredCache cache, CacheWarmer cacheWarmer) {
        this.cache = cache;
        this.cacheWarmer = cacheWarmer;
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStatsResponse> stats() {
        return ResponseEntity.ok(CacheStatsResponse.fromStats(cache.getStats()));
    }

    @DeleteMapping("/stats")
    public ResponseEntity<CacheStatsResponse> resetStats() {
        logger.info("Resetting cache statistics");
        return ResponseEntity.ok(CacheStatsResponse.fromStats(cache.resetStats()));
    }

    @DeleteMapping("/entries/{key}")
    public ResponseEntity<Void> deleteEntry(@PathVariable("key") @NotBlank String key) {
        cache.delete(key);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/tags/{tag}")
    public ResponseEntity<InvalidationResponse> invalidateTag(@PathVariable("tag") @NotBlank String tag) {
        int removed = cache.invalidateByTag(tag);
        return ResponseEntity.ok(new InvalidationResponse(tag, removed));
    }

    @DeleteMapping("/sports/{sport}")
    public ResponseEntity<InvalidationResponse> invalidateSport(@PathVariable("sport") @NotBlank String sport) {
        int removed = cache.invalidateSport(sport);
        return ResponseEntity.ok(new InvalidationResponse(CacheTags.sport(sport), removed));
    }

    @DeleteMapping("/teams/{teamId}")
    public ResponseEntity<InvalidationResponse> invalidateTeam(@PathVariable("teamId") @NotBlank String teamId) {
        int removed = cache.invalidateTeam(teamId);
        return ResponseEntity.ok(new InvalidationResponse(CacheTags.team(teamId), removed));
    }

    @PostMapping("/warm/{sport}")
    public ResponseEntity<WarmingResult> warmSport(
            @PathVariable("sport") @NotBlank String sport,
            @RequestParam(name = "standings", defaultValue = "true") boolean standings,
            @RequestParam(name = "rankings", defaultValue = "true") boolean rankings,
            @RequestParam(name = "schedule", defaultValue = "true") boolean schedule
    ) {
        logger.info("Warming cache for {} (standings={}, rankings={}, schedule={})", sport, standings, rankings, schedule);
        return ResponseEntity.ok(cacheWarmer.warmSportData(sport, standings, rankings, schedule));
    }
}
