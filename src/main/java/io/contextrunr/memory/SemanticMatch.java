package io.contextrunr.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A nearest-neighbour hit from the semantic tier.
 *
 * @param id       record id
 * @param content  stored text
 * @param metadata metadata stored with the record
 * @param score    similarity (1 - cosine distance), rounded to 3 decimals
 */
public record SemanticMatch(String id, String content, Map<String, Object> metadata, double score) {

    public SemanticMatch {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
