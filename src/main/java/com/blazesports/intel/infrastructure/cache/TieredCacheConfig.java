package com.blazesports.intel.infrastructure.cache;

import com.blazesports.intel.domain.model.CacheCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for the tiered cache: key layout, tag index lifetime and per-category TTL overrides
 */
@Component
@ConfigurationProperties(prefix = "blaze.cache")
public class TieredCacheConfig {

    private String keyPrefix = "bsi:cache:";
    private String tagPrefix = "bsi:tag:";
    private long tagIndexTtlSeconds = 86400;
    private boolean trackHits = true;
    private Map<CacheCategory, ProfileOverride> profiles = new HashMap<>();

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String getTagPrefix() {
        return tagPrefix;
    }

    public void setTagPrefix(String tagPrefix) {
        this.tagPrefix = tagPrefix;
    }

    public long getTagIndexTtlSeconds() {
        return tagIndexTtlSeconds;
    }

    public void setTagIndexTtlSeconds(long tagIndexTtlSeconds) {
        this.tagIndexTtlSeconds = tagIndexTtlSeconds;
    }

    public boolean isTrackHits() {
        return trackHits;
    }

    public void setTrackHits(boolean trackHits) {
        this.trackHits = trackHits;
    }

    public Map<CacheCategory, ProfileOverride> getProfiles() {
        return profiles;
    }

    public void setProfiles(Map<CacheCategory, ProfileOverride> profiles) {
        this.profiles = profiles;
    }

    /**
     * Partial override of a category's TTL profile; unset fields keep the default.
     */
    public static class ProfileOverride {

        private Long freshSeconds;
        private Long staleSeconds;

        public Long getFreshSeconds() {
            return freshSeconds;
        }

        public void setFreshSeconds(Long freshSeconds) {
            this.freshSeconds = freshSeconds;
        }

        public Long getStaleSeconds() {
            return staleSeconds;
        }

        public void setStaleSeconds(Long staleSeconds) {
            this.staleSeconds = staleSeconds;
        }
    }
}
