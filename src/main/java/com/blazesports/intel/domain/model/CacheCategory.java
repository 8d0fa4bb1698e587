package com.blazesports.intel.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Data categories with their default TTL profiles.
 * Live data refreshes in seconds, reference data in days.
 */
public enum CacheCategory {

    LIVE_SCORES("live_scores", TtlProfile.of(15, 60)),
    BOX_SCORE("box_score", TtlProfile.of(30, 300)),
    SCHEDULE("schedule", TtlProfile.of(300, 900)),
    STANDINGS("standings", TtlProfile.of(300, 1800)),
    RANKINGS("rankings", TtlProfile.of(3600, 7200)),
    PLAYER_STATS("player_stats", TtlProfile.of(1800, 3600)),
    TEAM_INFO("team_info", TtlProfile.of(86400, 172800)),
    HISTORICAL("historical", TtlProfile.of(604800, 2592000));

    private final String wireName;
    private final TtlProfile defaultProfile;

    CacheCategory(String wireName, TtlProfile defaultProfile) {
        this.wireName = wireName;
        this.defaultProfile = defaultProfile;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public TtlProfile defaultProfile() {
        return defaultProfile;
    }

    @JsonCreator
    public static CacheCategory fromWireName(String value) {
        return Arrays.stream(values())
                .filter(category -> category.wireName.equals(value) || category.name().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cache category: " + value));
    }
}
