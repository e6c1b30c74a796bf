package io.contextrunr.store;

import java.time.Instant;

/**
 * Durable record of one full request: inputs, outputs, usage and the memory
 * snapshot the prompt was built from (serialized as JSON).
 */
public record RequestTrace(
        String requestId,
        String userId,
        String conversationId,
        String userMessage,
        String assistantResponse,
        int promptTokens,
        int completionTokens,
        int totalTokens,
        double latencyMs,
        String provider,
        String model,
        String memorySnapshot,
        Instant createdAt
) {}
