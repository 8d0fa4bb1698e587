package com.blazesports.intel.infrastructure.adapter.provider;

import com.blazesports.intel.domain.port.out.SportsDataProvider;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches sports documents from the upstream API. A cache key maps to a path by turning
 * separators into slashes ({@code standings:mlb:all} -> {@code standings/mlb/all}).
 * There is no fallback: failures must reach the cache so it can keep or drop its entry.
 */
@Component
public class SportsDataClient implements SportsDataProvider {

    private static final Logger logger = LoggerFactory.getLogger(SportsDataClient.class);

    private final SportsDataApi sportsDataApi;

    public SportsDataClient(SportsDataApi sportsDataApi) {
        this.sportsDataApi = sportsDataApi;
    }

    @Override
    @CircuitBreaker(name = "sports-origin")
    @Retry(name = "sports-origin")
    @TimeLimiter(name = "sports-origin")
    public CompletableFuture<JsonNode> fetch(String cacheKey) {
        return CompletableFuture.supplyAsync(() -> {
            String path = toPath(cacheKey);
            try {
                logger.debug("Fetching {} from upstream", path);
                var response = sportsDataApi.fetch(path).execute();
                if (response.isSuccessful() && response.body() != null) {
                    return response.body();
                }
                throw new OriginFetchException("Upstream returned " + response.code() + " for " + path);
            } catch (IOException e) {
                logger.warn("I/O failure fetching {}: {}", path, e.getMessage());
                throw new OriginFetchException("Failed to fetch " + path, e);
            }
        });
    }

    static String toPath(String cacheKey) {
        return cacheKey.replace(':', '/');
    }
}
