package io.contextrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Token budget and layer settings for prompt assembly.
 *
 * @param maxContextWindow   model context window in tokens
 * @param responseReserve    tokens kept free for the response
 * @param systemInstructions text of the system_instructions layer
 * @param allocations        per-layer token allocation overrides, keyed by layer name (e.g. {@code semantic_context})
 */
@ConfigurationProperties(prefix = "prompt")
public record PromptProperties(
        int maxContextWindow,
        int responseReserve,
        String systemInstructions,
        Map<String, Integer> allocations
) {

    public static final String DEFAULT_SYSTEM_INSTRUCTIONS = """
            You are a helpful AI assistant with persistent memory.

            Key capabilities:
            - You remember user preferences and past conversations
            - You learn from corrections and feedback
            - You provide context-aware responses

            Important guidelines:
            - If you're unsure, say so
            - Reference past conversations when relevant
            - Acknowledge when you've been corrected before""";

    public PromptProperties {
        if (maxContextWindow <= 0) maxContextWindow = 4096;
        if (responseReserve <= 0) responseReserve = 1000;
        if (systemInstructions == null || systemInstructions.isBlank()) systemInstructions = DEFAULT_SYSTEM_INSTRUCTIONS;
        allocations = allocations == null ? Map.of() : Map.copyOf(allocations);
    }

    public static PromptProperties defaults() {
        return new PromptProperties(0, 0, null, null);
    }

    /** Token ceiling the assembler targets. */
    public int budget() {
        return maxContextWindow - responseReserve;
    }
}
