package com.blazesports.intel.infrastructure.adapter.provider;

/**
 * The upstream sports data API could not produce a document.
 */
public class OriginFetchException extends RuntimeException {

    public OriginFetchException(String message) {
        super(message);
    }

    public OriginFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
