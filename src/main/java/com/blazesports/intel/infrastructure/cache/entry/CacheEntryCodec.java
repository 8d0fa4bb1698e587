package com.blazesports.intel.infrastructure.cache.entry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * JSON representation of cache entries in the backing store.
 * Undecodable text is reported as absent, never as an exception.
 */
@Component
public class CacheEntryCodec {

    private static final Logger logger = LoggerFactory.getLogger(CacheEntryCodec.class);

    private final ObjectMapper objectMapper;

    public CacheEntryCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(CacheEntry<?> entry) throws JsonProcessingException {
        return objectMapper.writeValueAsString(entry);
    }

    public <T> Optional<CacheEntry<T>> decode(String text, JavaType valueType) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        try {
            JavaType entryType = objectMapper.getTypeFactory()
                    .constructParametricType(CacheEntry.class, valueType);
            CacheEntry<T> entry = objectMapper.readValue(text, entryType);

            if (entry == null || !entry.isWellFormed()) {
                logger.warn("Discarding malformed cache entry (timestamps or category invalid)");
                return Optional.empty();
            }
            return Optional.of(entry);

        } catch (JsonProcessingException e) {
            logger.warn("Failed to decode cache entry: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public JavaType typeOf(Class<?> type) {
        return objectMapper.getTypeFactory().constructType(type);
    }

    public JavaType typeOf(TypeReference<?> type) {
        return objectMapper.getTypeFactory().constructType(type);
    }
}
