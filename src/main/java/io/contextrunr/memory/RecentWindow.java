package io.contextrunr.memory;

import java.util.List;

/**
 * What the recency tier yields: the most recent turns in chronological order
 * plus the latest summary of the conversation, if one was ever stored.
 */
public record RecentWindow(List<Turn> turns, ConversationSummary summary) {

    public RecentWindow {
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public static RecentWindow empty() {
        return new RecentWindow(List.of(), null);
    }
}
