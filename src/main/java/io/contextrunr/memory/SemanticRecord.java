package io.contextrunr.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An embedded message written to the semantic tier.
 *
 * @param id        record id; writing an existing id overwrites it
 * @param userId    owner, used to scope queries
 * @param content   text that was embedded
 * @param embedding embedding vector
 * @param metadata  free-form metadata (e.g. {@code conversation_title}, {@code role})
 */
public record SemanticRecord(String id, String userId, String content, float[] embedding, Map<String, Object> metadata) {

    public SemanticRecord {
        embedding = embedding == null ? new float[0] : embedding.clone();
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
