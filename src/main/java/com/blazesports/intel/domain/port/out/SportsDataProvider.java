package com.blazesports.intel.domain.port.out;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Upstream source of sports data, addressed by cache key.
 */
public interface SportsDataProvider {

    /**
     * Fetches the document behind a cache key such as {@code standings:mlb:all}.
     * The future completes exceptionally when the upstream cannot produce it.
     */
    CompletableFuture<JsonNode> fetch(String cacheKey);
}
