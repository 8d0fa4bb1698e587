package com.blazesports.intel.infrastructure.cache.entry;

/**
 * Classification of a cache entry at a point in time.
 */
public enum Freshness {
    /** Served as is. */
    FRESH,
    /** Still served, but due for a refresh. */
    STALE,
    /** Past its stale deadline; equivalent to absent. */
    EXPIRED
}
