package io.contextrunr.memory;

import io.contextrunr.store.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Writes turns into the durable store, the recency window and the semantic index,
 * and removes everything a user owns across all of them.
 */
@Component
public class MemoryWriter {

    private static final Logger log = LoggerFactory.getLogger(MemoryWriter.class);

    private final ChatStore store;
    private final RecencyCache recency;
    private final ProfileStore profiles;
    private final SemanticIndex semanticIndex;

    public MemoryWriter(ChatStore store, RecencyCache recency, ProfileStore profiles, SemanticIndex semanticIndex) {
        this.store = store;
        this.recency = recency;
        this.profiles = profiles;
        this.semanticIndex = semanticIndex;
    }

    /**
     * Persists a turn, then appends it to the conversation's recency window.
     * A store failure propagates and leaves the window untouched.
     */
    public void saveTurn(Turn turn) {
        store.saveTurn(turn);
        recency.put(turn.conversationId(), turn);
    }

    /**
     * Adds a turn's embedding to the semantic index. Failures are logged and ignored.
     */
    public void index(String userId, Turn turn, float[] embedding, Map<String, Object> metadata) {
        if (embedding == null || embedding.length == 0) {
            return;
        }
        try {
            semanticIndex.add(new SemanticRecord(turn.id(), userId, turn.content(), embedding, metadata));
        } catch (RuntimeException e) {
            log.warn("Failed to index turn {}: {}", turn.id(), e.getMessage());
        }
    }

    /**
     * Deletes a user's conversations, turns, summaries, profile, corrections and traces,
     * their semantic records and every cached copy.
     */
    public void clearUser(String userId) {
        for (String conversationId : store.conversationIds(userId)) {
            recency.evict(conversationId);
        }
        store.deleteUser(userId);
        semanticIndex.clear(userId);
        profiles.evict(userId);
        log.info("Cleared all memory for user: {}", userId);
    }
}
