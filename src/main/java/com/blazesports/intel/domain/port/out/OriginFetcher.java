package com.blazesports.intel.domain.port.out;

/**
 * Produces a fresh value for a cached key. Any exception is a failed fetch.
 */
@FunctionalInterface
public interface OriginFetcher<T> {

    T fetch();
}
