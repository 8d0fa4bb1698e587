package com.blazesports.intel.infrastructure.cache.key;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional view of a colon-separated key: {@code prefix:sport:type:id:timestamp}.
 * Missing trailing parts are null.
 */
public record CacheKeyPattern(String prefix, String sport, String type, String id, Long timestamp) {

    private static final String SEPARATOR = ":";

    public static CacheKeyPattern of(String prefix, String sport) {
        return new CacheKeyPattern(prefix, sport, null, null, null);
    }

    public String build() {
        List<String> parts = new ArrayList<>();
        parts.add(prefix);
        addIfPresent(parts, sport);
        addIfPresent(parts, type);
        addIfPresent(parts, id);
        if (timestamp != null) {
            parts.add(String.valueOf(timestamp));
        }
        return String.join(SEPARATOR, parts);
    }

    public static CacheKeyPattern parse(String key) {
        String[] parts = key.split(SEPARATOR, -1);
        return new CacheKeyPattern(
                part(parts, 0) != null ? part(parts, 0) : "",
                part(parts, 1),
                part(parts, 2),
                part(parts, 3),
                parseTimestamp(part(parts, 4))
        );
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isEmpty()) {
            parts.add(value);
        }
    }

    private static String part(String[] parts, int index) {
        return index < parts.length && !parts[index].isEmpty() ? parts[index] : null;
    }

    private static Long parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
