package io.contextrunr.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.contextrunr.config.MemoryProperties;
import io.contextrunr.store.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Profile tier: one long-term profile per user, cached in process and written
 * through to the {@link ChatStore}.
 *
 * <p>A user without a stored profile gets the default profile, which is
 * persisted on first access. {@link #update} is a read-merge-write without
 * isolation; of two concurrent updates for the same user the later one wins.</p>
 */
@Component
public class ProfileStore {

    private static final Logger log = LoggerFactory.getLogger(ProfileStore.class);

    private final ChatStore store;
    private final Cache<String, UserProfile> cache;
    private final Clock clock;

    public ProfileStore(ChatStore store, MemoryProperties properties) {
        this(store, properties, Clock.systemUTC());
    }

    ProfileStore(ChatStore store, MemoryProperties properties, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.maxCachedProfiles())
                .build();
    }

    /**
     * Returns the user's profile, creating and persisting the default profile if none exists.
     */
    public UserProfile get(String userId) {
        UserProfile cached = cache.getIfPresent(userId);
        if (cached != null) {
            return cached;
        }
        UserProfile profile = store.findProfile(userId).orElseGet(() -> {
            UserProfile created = UserProfile.defaults(Instant.now(clock));
            store.upsertProfile(userId, created);
            log.info("Created default profile for user: {}", userId);
            return created;
        });
        cache.put(userId, profile);
        return profile;
    }

    /**
     * Replaces the user's profile in the store, then in the cache.
     */
    public void put(String userId, UserProfile profile) {
        store.upsertProfile(userId, profile);
        cache.put(userId, profile);
    }

    /**
     * Deep-merges a partial profile into the current one and stores the result.
     *
     * @param userId  the user
     * @param partial nested attributes to merge; maps merge key by key, other values replace
     * @return the merged profile
     */
    public UserProfile update(String userId, Map<String, Object> partial) {
        UserProfile current = get(userId);
        Map<String, Object> merged = deepMerge(current.attributes(), partial);
        UserProfile updated = new UserProfile(merged).withLastUpdated(Instant.now(clock));
        put(userId, updated);
        log.debug("Updated profile for user: {}", userId);
        return updated;
    }

    /** Drops the cached copy of a user's profile. */
    public void evict(String userId) {
        cache.invalidate(userId);
    }

    static Map<String, Object> deepMerge(Map<?, ?> base, Map<?, ?> overlay) {
        Map<String, Object> result = new LinkedHashMap<>();
        base.forEach((key, value) -> result.put(String.valueOf(key), value));
        if (overlay == null) {
            return result;
        }
        overlay.forEach((rawKey, value) -> {
            String key = String.valueOf(rawKey);
            Object existing = result.get(key);
            if (existing instanceof Map<?, ?> existingMap && value instanceof Map<?, ?> valueMap) {
                result.put(key, deepMerge(existingMap, valueMap));
            } else {
                result.put(key, value);
            }
        });
        return result;
    }
}
