package io.contextrunr.memory;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-term profile of a user, held as an ordered attribute map so that
 * arbitrary nested keys survive a deep merge.
 *
 * <p>Well-known sections: {@code preferences}, {@code behavior_patterns},
 * {@code context} and the {@code last_updated} timestamp.</p>
 *
 * <p>The attribute tree is deep-copied and unmodifiable; a cached profile is a
 * value snapshot, never a live view of a store.</p>
 */
public record UserProfile(Map<String, Object> attributes) {

    public static final String PREFERENCES = "preferences";
    public static final String BEHAVIOR_PATTERNS = "behavior_patterns";
    public static final String CONTEXT = "context";
    public static final String LAST_UPDATED = "last_updated";

    public UserProfile {
        attributes = attributes == null ? Map.of() : copyMap(attributes);
    }

    /** The fixed shape every new user starts with. */
    public static UserProfile defaults(Instant now) {
        Map<String, Object> preferences = new LinkedHashMap<>();
        preferences.put("communication_style", "balanced");
        preferences.put("expertise_level", "intermediate");
        preferences.put("topics_of_interest", List.of());

        Map<String, Object> behavior = new LinkedHashMap<>();
        behavior.put("typical_session_length", 0);
        behavior.put("preferred_response_length", "medium");
        behavior.put("frequently_asked_topics", List.of());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("occupation", null);
        context.put("timezone", "UTC");
        context.put("language", "en");

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(PREFERENCES, preferences);
        attributes.put(BEHAVIOR_PATTERNS, behavior);
        attributes.put(CONTEXT, context);
        attributes.put(LAST_UPDATED, now.toString());
        return new UserProfile(attributes);
    }

    @JsonValue
    @Override
    public Map<String, Object> attributes() {
        return attributes;
    }

    public Map<String, Object> preferences() {
        return section(PREFERENCES);
    }

    public Map<String, Object> context() {
        return section(CONTEXT);
    }

    public String lastUpdated() {
        Object value = attributes.get(LAST_UPDATED);
        return value != null ? value.toString() : null;
    }

    public UserProfile withLastUpdated(Instant instant) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(LAST_UPDATED, instant.toString());
        return new UserProfile(copy);
    }

    private Map<String, Object> section(String name) {
        Object value = attributes.get(name);
        return value instanceof Map<?, ?> map ? copyMap(map) : Map.of();
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object item : collection) {
                list.add(copyValue(item));
            }
            return Collections.unmodifiableList(list);
        }
        return value;
    }
}
