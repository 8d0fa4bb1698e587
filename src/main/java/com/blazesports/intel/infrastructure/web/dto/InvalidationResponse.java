package com.blazesports.intel.infrastructure.web.dto;

public record InvalidationResponse(String tag, int removed) {
}
