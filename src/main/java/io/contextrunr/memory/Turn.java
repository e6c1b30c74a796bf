package io.contextrunr.memory;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * A single persisted message of a conversation.
 *
 * @param id             unique identifier
 * @param conversationId owning conversation
 * @param role           who produced the message
 * @param content        message text
 * @param tokenCount     token cost, computed once at creation
 * @param createdAt      creation time
 */
public record Turn(
        String id,
        String conversationId,
        Role role,
        String content,
        int tokenCount,
        Instant createdAt
) {

    public enum Role {
        USER, ASSISTANT;

        /** Lower-case name used in storage and in rendered prompts. */
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Role fromString(String s) {
            if (s == null) return USER;
            return switch (s.toLowerCase(Locale.ROOT)) {
                case "assistant" -> ASSISTANT;
                default -> USER;
            };
        }
    }

    /** Creates a new turn with a fresh id and the current time. */
    public static Turn create(String conversationId, Role role, String content, int tokenCount) {
        return new Turn(UUID.randomUUID().toString(), conversationId, role, content, tokenCount, Instant.now());
    }
}
