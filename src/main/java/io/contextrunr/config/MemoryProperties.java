package io.contextrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for the four memory tiers and their storage.
 *
 * <p>Binds to {@code memory} in application.yml:</p>
 * <pre>
 * memory:
 *   path: ${MEMORY_PATH:./data}
 *   recency-capacity: 20
 *   recency-limit: 10
 *   summarization-threshold-tokens: 2000
 *   max-feedback-corrections: 3
 *   correction-marker: "incorrect:"
 *   tier-timeout: 2s
 *   semantic:
 *     enabled: true
 *     k: 5
 *     similarity-threshold: 0.7
 * </pre>
 *
 * @param path                         directory holding the SQLite databases
 * @param recencyCapacity              max turns cached per conversation (FIFO)
 * @param recencyLimit                 turns requested from the recency tier per request
 * @param maxCachedConversations       bound on the number of conversation windows kept in process
 * @param maxCachedProfiles            bound on the number of profiles kept in process
 * @param summarizationThresholdTokens cached-token total above which a conversation should be summarized
 * @param maxFeedbackCorrections       corrections retrieved per request
 * @param correctionMarker             prefix that tags a message as a correction
 * @param tierTimeout                  per-tier retrieval timeout
 * @param tierThreads                  size of the tier retrieval pool
 * @param semantic                     semantic tier settings
 */
@ConfigurationProperties(prefix = "memory")
public record MemoryProperties(
        String path,
        int recencyCapacity,
        int recencyLimit,
        int maxCachedConversations,
        int maxCachedProfiles,
        int summarizationThresholdTokens,
        int maxFeedbackCorrections,
        String correctionMarker,
        Duration tierTimeout,
        int tierThreads,
        Semantic semantic
) {

    public MemoryProperties {
        if (path == null || path.isBlank()) path = "./data";
        if (recencyCapacity <= 0) recencyCapacity = 20;
        if (recencyLimit <= 0) recencyLimit = 10;
        if (maxCachedConversations <= 0) maxCachedConversations = 10_000;
        if (maxCachedProfiles <= 0) maxCachedProfiles = 10_000;
        if (summarizationThresholdTokens <= 0) summarizationThresholdTokens = 2000;
        if (maxFeedbackCorrections <= 0) maxFeedbackCorrections = 3;
        if (correctionMarker == null || correctionMarker.isBlank()) correctionMarker = "incorrect:";
        if (tierTimeout == null || tierTimeout.isZero() || tierTimeout.isNegative()) tierTimeout = Duration.ofSeconds(2);
        if (tierThreads <= 0) tierThreads = 8;
        if (semantic == null) semantic = new Semantic(null, 0, 0);
    }

    /** All defaults. */
    public static MemoryProperties defaults() {
        return new MemoryProperties(null, 0, 0, 0, 0, 0, 0, null, null, 0, null);
    }

    /**
     * Semantic recall settings.
     *
     * @param enabled             whether the vector backend is used at all
     * @param k                   nearest neighbours requested per query
     * @param similarityThreshold minimum similarity for a match to be returned
     */
    public record Semantic(Boolean enabled, int k, double similarityThreshold) {
        public Semantic {
            if (enabled == null) enabled = true;
            if (k <= 0) k = 5;
            if (similarityThreshold <= 0) similarityThreshold = 0.7;
        }
    }
}
