package io.contextrunr.memory;

import java.time.Instant;

/**
 * Condensed text standing in for an earlier range of a conversation.
 *
 * @param id                unique identifier
 * @param conversationId    owning conversation
 * @param text              summary text
 * @param messageRangeStart index of the first summarized message
 * @param messageRangeEnd   index of the last summarized message
 * @param tokensSaved       tokens no longer sent because of this summary
 * @param createdAt         creation time
 */
public record ConversationSummary(
        String id,
        String conversationId,
        String text,
        int messageRangeStart,
        int messageRangeEnd,
        int tokensSaved,
        Instant createdAt
) {}
