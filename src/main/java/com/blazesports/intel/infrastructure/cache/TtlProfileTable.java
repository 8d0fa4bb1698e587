package com.blazesports.intel.infrastructure.cache;

import com.blazesports.intel.domain.model.CacheCategory;
import com.blazesports.intel.domain.model.TtlProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves the TTL profile of every category.
 * Built once at startup; an incomplete table fails the application context.
 */
@Component
public class TtlProfileTable {

    private static final Logger logger = LoggerFactory.getLogger(TtlProfileTable.class);

    private final Map<CacheCategory, TtlProfile> profiles;

    public TtlProfileTable(TieredCacheConfig config) {
        Map<CacheCategory, TtlProfile> resolved = new EnumMap<>(CacheCategory.class);

        for (CacheCategory category : CacheCategory.values()) {
            TtlProfile profile = category.defaultProfile();
            TieredCacheConfig.ProfileOverride override = config.getProfiles().get(category);

            if (override != null) {
                profile = new TtlProfile(
                        override.getFreshSeconds() != null ? override.getFreshSeconds() : profile.freshSeconds(),
                        override.getStaleSeconds() != null ? override.getStaleSeconds() : profile.staleSeconds());
                logger.info("TTL profile for {} overridden: fresh {}s, stale {}s",
                        category.wireName(), profile.freshSeconds(), profile.staleSeconds());
            }

            resolved.put(category, profile);
        }

        if (resolved.size() != CacheCategory.values().length) {
            throw new IllegalStateException("TTL profile table does not cover every cache category");
        }

        this.profiles = Collections.unmodifiableMap(resolved);
    }

    public TtlProfile profileFor(CacheCategory category) {
        TtlProfile profile = profiles.get(category);
        if (profile == null) {
            throw new IllegalStateException("No TTL profile for category " + category);
        }
        return profile;
    }

    public Map<CacheCategory, TtlProfile> asMap() {
        return profiles;
    }
}
