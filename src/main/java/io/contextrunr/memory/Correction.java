package io.contextrunr.memory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A correction the user made to an earlier answer.
 *
 * @param id              unique identifier
 * @param userId          owner
 * @param conversationId  conversation the correction was made in
 * @param messageId       message (or request) that was corrected
 * @param correctionType  e.g. {@code manual_user_correction}, {@code factual_error}
 * @param userText        what the user said was wrong
 * @param correctedText   what should have been said, if known
 * @param contextSnapshot digest of the memory state when the correction was made
 * @param appliedCount    times this correction was surfaced into a prompt; never decreases
 * @param relevanceScore  relevance to the current request, set on retrieval
 * @param createdAt       creation time
 */
public record Correction(
        String id,
        String userId,
        String conversationId,
        String messageId,
        String correctionType,
        String userText,
        String correctedText,
        Map<String, Object> contextSnapshot,
        int appliedCount,
        double relevanceScore,
        Instant createdAt
) {

    public static final String MANUAL_USER_CORRECTION = "manual_user_correction";

    public Correction {
        contextSnapshot = contextSnapshot == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(contextSnapshot));
    }

    /** A new correction with a fresh id, zero applications and the current time. */
    public static Correction create(String userId, String conversationId, String messageId, String correctionType,
                                    String userText, String correctedText, Map<String, Object> contextSnapshot) {
        return new Correction(UUID.randomUUID().toString(), userId, conversationId, messageId, correctionType,
                userText, correctedText, contextSnapshot, 0, 0.0, Instant.now());
    }

    public Correction withRelevanceScore(double score) {
        return new Correction(id, userId, conversationId, messageId, correctionType, userText, correctedText,
                contextSnapshot, appliedCount, score, createdAt);
    }

    public Correction withAppliedCount(int count) {
        return new Correction(id, userId, conversationId, messageId, correctionType, userText, correctedText,
                contextSnapshot, count, relevanceScore, createdAt);
    }
}
