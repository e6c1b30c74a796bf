package io.contextrunr.store;

import java.time.Instant;

/**
 * A conversation owning an ordered series of turns.
 *
 * @param id        unique identifier
 * @param userId    owner
 * @param title     display title, taken from the first message
 * @param createdAt creation time
 */
public record Conversation(String id, String userId, String title, Instant createdAt) {

    static final int MAX_TITLE_LENGTH = 100;

    /** Creates a conversation titled after the first message. */
    public static Conversation start(String id, String userId, String firstMessage) {
        return new Conversation(id, userId, titleFrom(firstMessage), Instant.now());
    }

    public static String titleFrom(String message) {
        if (message == null) return "";
        return message.length() > MAX_TITLE_LENGTH ? message.substring(0, MAX_TITLE_LENGTH) : message;
    }
}
