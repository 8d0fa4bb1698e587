package com.blazesports.intel.infrastructure.cache.key;

/**
 * Conventional tag names used for grouped invalidation.
 */
public final class CacheTags {

    private CacheTags() {
    }

    public static String sport(String sport) {
        return "sport:" + sport;
    }

    public static String team(String teamId) {
        return "team:" + teamId;
    }
}
