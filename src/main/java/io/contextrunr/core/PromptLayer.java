package io.contextrunr.core;

/**
 * Sections of an assembled prompt, in the order they appear, with their
 * default token allocations.
 */
public enum PromptLayer {
    SYSTEM_INSTRUCTIONS("system_instructions", 300),
    USER_PROFILE("user_profile", 200),
    FEEDBACK_CORRECTIONS("feedback_corrections", 150),
    CONVERSATION_SUMMARY("conversation_summary", 250),
    SEMANTIC_CONTEXT("semantic_context", 400),
    RECENT_MESSAGES("recent_messages", 800),
    CURRENT_MESSAGE("current_message", 200);

    private final String key;
    private final int defaultAllocation;

    PromptLayer(String key, int defaultAllocation) {
        this.key = key;
        this.defaultAllocation = defaultAllocation;
    }

    /** Name used in token breakdowns and allocation overrides. */
    public String key() {
        return key;
    }

    public int defaultAllocation() {
        return defaultAllocation;
    }
}
