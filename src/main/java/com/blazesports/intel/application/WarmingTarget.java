package com.blazesports.intel.application;

import com.blazesports.intel.domain.model.CacheCategory;

import java.util.Set;

public record WarmingTarget(String key, CacheCategory category, Set<String> tags) {

    public WarmingTarget {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }
}
