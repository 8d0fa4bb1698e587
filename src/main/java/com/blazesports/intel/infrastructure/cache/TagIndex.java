package com.blazesports.intel.infrastructure.cache;

import com.blazesports.intel.domain.model.TtlProfile;
import com.blazesports.intel.domain.port.out.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tag to member-key index kept as plain records in the backing store.
 * Members may outlive their entries; readers must tolerate keys that no longer exist.
 */
@Component
public class TagIndex {

    private static final Logger logger = LoggerFactory.getLogger(TagIndex.class);

    private static final TypeReference<List<String>> MEMBER_LIST = new TypeReference<>() {};

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final TieredCacheConfig config;
    private final Duration indexTtl;

    public TagIndex(KeyValueStore store, ObjectMapper objectMapper, TieredCacheConfig config, TtlProfileTable ttlProfiles) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.config = config;
        this.indexTtl = indexTtl(config, ttlProfiles);
    }

    /**
     * Add a key to a tag. Read-modify-write; concurrent registrations on the same tag may lose a member.
     * The index is rewritten on every registration so it always outlives its newest member.
     */
    public void register(String key, String tag) throws JsonProcessingException {
        Set<String> members = new LinkedHashSet<>(members(tag));
        boolean added = members.add(key);

        store.put(indexKey(tag), objectMapper.writeValueAsString(members), indexTtl);
        if (added) {
            logger.debug("Registered {} under tag {} ({} members)", key, tag, members.size());
        }
    }

    /**
     * Keys currently listed under a tag. A corrupt index reads as empty; store failures propagate.
     */
    public List<String> members(String tag) {
        Optional<String> raw = store.get(indexKey(tag));
        if (raw.isEmpty() || raw.get().isBlank()) {
            return List.of();
        }

        try {
            List<String> members = objectMapper.readValue(raw.get(), MEMBER_LIST);
            return members != null ? members : List.of();
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring corrupt index for tag {}: {}", tag, e.getOriginalMessage());
            return List.of();
        }
    }

    public void drop(String tag) {
        store.delete(indexKey(tag));
    }

    String indexKey(String tag) {
        return config.getTagPrefix() + tag;
    }

    Duration indexTtl() {
        return indexTtl;
    }

    // Fixed for the process lifetime: never shorter than the longest-lived entry of any category.
    private static Duration indexTtl(TieredCacheConfig config, TtlProfileTable ttlProfiles) {
        Duration ttl = Duration.ofSeconds(config.getTagIndexTtlSeconds());
        for (TtlProfile profile : ttlProfiles.asMap().values()) {
            if (profile.storeTtl().compareTo(ttl) > 0) {
                ttl = profile.storeTtl();
            }
        }
        return ttl;
    }
}
