package io.contextrunr.core;

import io.contextrunr.memory.MemorySnapshot;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * What a processed request returns to its caller.
 *
 * @param responseText   generated answer
 * @param conversationId conversation the turns were stored in
 * @param messageId      id of the stored assistant turn
 * @param requestId      id of the request and of its trace
 * @param observability  what went into the answer and what it cost
 */
public record ChatResult(
        String responseText,
        String conversationId,
        String messageId,
        String requestId,
        Observability observability
) {

    /**
     * @param snapshot         memory state after the request's writes
     * @param tokenBreakdown   prompt tokens per layer
     * @param promptTokens     prompt tokens reported by the backend
     * @param completionTokens completion tokens reported by the backend
     * @param totalTokens      total tokens reported by the backend
     * @param estimatedCost    USD cost estimate
     * @param provider         generation provider
     * @param model            generation model
     * @param latency          time spent per stage
     * @param warnings         non-fatal problems, e.g. a failed trace write
     */
    public record Observability(
            MemorySnapshot snapshot,
            Map<String, Integer> tokenBreakdown,
            int promptTokens,
            int completionTokens,
            int totalTokens,
            BigDecimal estimatedCost,
            String provider,
            String model,
            Latency latency,
            List<String> warnings
    ) {
        public Observability {
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }

    /**
     * Stage timings in milliseconds.
     */
    public record Latency(long retrievalMs, long assemblyMs, long generationMs, long persistenceMs, long totalMs) {}
}
