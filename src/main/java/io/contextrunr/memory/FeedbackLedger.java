package io.contextrunr.memory;

import io.contextrunr.store.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Feedback tier: corrections a user has made, surfaced into later prompts.
 */
@Component
public class FeedbackLedger {

    private static final Logger log = LoggerFactory.getLogger(FeedbackLedger.class);

    /** Relevance assigned to every retrieved correction until a re-ranker exists. */
    static final double DEFAULT_RELEVANCE = 1.0;

    private final ChatStore store;

    public FeedbackLedger(ChatStore store) {
        this.store = store;
    }

    /**
     * Returns the user's most recent corrections, newest first.
     */
    public List<Correction> retrieve(String userId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return store.recentCorrections(userId, limit).stream()
                .map(c -> c.withRelevanceScore(DEFAULT_RELEVANCE))
                .toList();
    }

    /**
     * Persists a new correction with a zero applied count. Store failures propagate.
     */
    public Correction store(Correction correction) {
        Correction fresh = correction.withAppliedCount(0);
        store.saveCorrection(fresh);
        log.info("Stored {} correction {} for user {}", fresh.correctionType(), fresh.id(), fresh.userId());
        return fresh;
    }

    /**
     * Bumps the applied counter of a correction. Failures are logged and ignored.
     */
    public void incrementApplied(String correctionId) {
        try {
            if (!store.incrementApplied(correctionId)) {
                log.debug("Correction {} no longer exists, applied count not bumped", correctionId);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to bump applied count of correction {}: {}", correctionId, e.getMessage());
        }
    }

    /**
     * Deletes every correction of a user.
     *
     * @return number of corrections removed
     */
    public int clear(String userId) {
        int deleted = store.deleteCorrections(userId);
        log.info("Cleared {} corrections for user: {}", deleted, userId);
        return deleted;
    }
}
