package io.contextrunr.memory;

import io.contextrunr.config.MemoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Reads the four memory tiers in parallel and combines them into a {@link MemorySnapshot}.
 *
 * <p>Each tier runs on the tier executor under {@code memory.tier-timeout}. A tier
 * that throws, times out or has no backend is reported as degraded and carries
 * its empty value (empty window, default profile, no matches, no corrections),
 * so a snapshot is always complete.</p>
 *
 * <p>A message starting with the correction marker is also stored as a
 * correction before the snapshot is returned; that is the only write made here.</p>
 */
@Component
public class MemoryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MemoryCoordinator.class);

    private final RecencyCache recency;
    private final ProfileStore profiles;
    private final SemanticIndex semanticIndex;
    private final FeedbackLedger feedback;
    private final MemoryProperties properties;
    private final ExecutorService executor;

    public MemoryCoordinator(RecencyCache recency, ProfileStore profiles, SemanticIndex semanticIndex,
                             FeedbackLedger feedback, MemoryProperties properties,
                             @Qualifier("tierExecutor") ExecutorService executor) {
        this.recency = recency;
        this.profiles = profiles;
        this.semanticIndex = semanticIndex;
        this.feedback = feedback;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Retrieves all tiers and captures a correction if the message is tagged as one.
     *
     * @param userId         the user
     * @param conversationId the conversation
     * @param queryText      the user's message
     * @param queryEmbedding embedding of the message
     * @param requestId      id recorded as the corrected message of a captured correction
     * @return a complete snapshot
     */
    public MemorySnapshot aggregate(String userId, String conversationId, String queryText,
                                    float[] queryEmbedding, String requestId) {
        MemorySnapshot snapshot = retrieve(userId, conversationId, queryEmbedding);
        if (!isCorrection(queryText)) {
            return snapshot;
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("short_term", snapshot.recentTurns().size());
        context.put("has_long_term", !snapshot.profile().isDegraded());
        try {
            feedback.store(Correction.create(userId, conversationId, requestId,
                    Correction.MANUAL_USER_CORRECTION, queryText, null, context));
        } catch (RuntimeException e) {
            log.error("Failed to capture correction for user {}: {}", userId, e.getMessage());
            return snapshot;
        }

        TierResult<List<Correction>> refreshed = await(submit(TierResult.Tier.FEEDBACK,
                () -> feedback.retrieve(userId, properties.maxFeedbackCorrections()), List.of()));
        if (refreshed.isDegraded()) {
            log.warn("Feedback refresh failed after capture, keeping earlier corrections: {}", refreshed.error());
            return snapshot.withFeedback(snapshot.feedback(), true);
        }
        return snapshot.withFeedback(refreshed, true);
    }

    /**
     * Retrieves all tiers without any side effect.
     */
    public MemorySnapshot retrieve(String userId, String conversationId, float[] queryEmbedding) {
        log.debug("Retrieving memory tiers for user: {}, conversation: {}", userId, conversationId);
        MemoryProperties.Semantic semantic = properties.semantic();

        var recencyFuture = submit(TierResult.Tier.RECENCY,
                () -> recency.get(conversationId, properties.recencyLimit()), RecentWindow.empty());
        var profileFuture = submit(TierResult.Tier.PROFILE,
                () -> profiles.get(userId), UserProfile.defaults(Instant.now()));
        var semanticFuture = submit(TierResult.Tier.SEMANTIC, () -> {
            if (!semanticIndex.isAvailable()) {
                throw new IllegalStateException("semantic backend unavailable");
            }
            return semanticIndex.query(userId, queryEmbedding, semantic.k(), semantic.similarityThreshold());
        }, List.<SemanticMatch>of());
        var feedbackFuture = submit(TierResult.Tier.FEEDBACK,
                () -> feedback.retrieve(userId, properties.maxFeedbackCorrections()), List.<Correction>of());

        return new MemorySnapshot(
                await(recencyFuture),
                await(profileFuture),
                await(semanticFuture),
                await(feedbackFuture),
                false);
    }

    /**
     * Whether the cached turns of a conversation have grown past the summarization threshold.
     */
    public boolean summarizationDue(String conversationId) {
        return recency.shouldSummarize(conversationId, properties.summarizationThresholdTokens());
    }

    boolean isCorrection(String queryText) {
        if (queryText == null) {
            return false;
        }
        String marker = properties.correctionMarker().toLowerCase(Locale.ROOT);
        return queryText.strip().toLowerCase(Locale.ROOT).startsWith(marker);
    }

    private <T> CompletableFuture<TierResult<T>> submit(TierResult.Tier tier, Supplier<T> call, T fallback) {
        Duration timeout = properties.tierTimeout();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        long start = System.nanoTime();
        return CompletableFuture.supplyAsync(() -> withMdc(mdc, call), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((value, error) -> {
                    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    if (error == null) {
                        return TierResult.success(tier, value, elapsedMs);
                    }
                    Throwable cause = unwrap(error);
                    String reason = cause instanceof TimeoutException
                            ? "timed out after " + timeout.toMillis() + "ms"
                            : cause.getClass().getSimpleName() + ": " + cause.getMessage();
                    log.warn("{} tier degraded: {}", tier, reason);
                    return TierResult.degraded(tier, fallback, reason, elapsedMs);
                });
    }

    private static <T> T withMdc(Map<String, String> mdc, Supplier<T> call) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            return call.get();
        } finally {
            MDC.clear();
        }
    }

    private static <T> TierResult<T> await(CompletableFuture<TierResult<T>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrieving memory tiers", e);
        } catch (ExecutionException e) {
            // handle() never completes exceptionally
            throw new IllegalStateException("Tier retrieval failed", e.getCause());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
