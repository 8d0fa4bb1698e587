package com.blazesports.intel.domain.model;

import java.time.Duration;

/**
 * Freshness and staleness windows for one data category.
 * An entry is served fresh for {@code freshSeconds}, then served stale (with a background
 * refresh) for another {@code staleSeconds}, and is gone after that.
 * The fresh window must be positive; with zero every entry would be stale as soon as it is written.
 * The stale window may be empty.
 */
public record TtlProfile(long freshSeconds, long staleSeconds) {

    public TtlProfile {
        if (freshSeconds <= 0) {
            throw new IllegalArgumentException("freshSeconds must be positive, was " + freshSeconds);
        }
        if (staleSeconds < 0) {
            throw new IllegalArgumentException("staleSeconds must not be negative, was " + staleSeconds);
        }
    }

    public static TtlProfile of(long freshSeconds, long staleSeconds) {
        return new TtlProfile(freshSeconds, staleSeconds);
    }

    public long totalSeconds() {
        return freshSeconds + staleSeconds;
    }

    /**
     * Expiration handed to the backing store; the store drops the entry once it can no longer be served.
     */
    public Duration storeTtl() {
        return Duration.ofSeconds(totalSeconds());
    }
}
