package io.contextrunr.memory;

import java.util.List;

/**
 * Per-request read of all four tiers. Built fresh for every request and never
 * persisted as a unit; every field is always present.
 *
 * @param recency          recent turns and summary
 * @param profile          long-term profile
 * @param semantic         similarity matches for the query
 * @param feedback         prior corrections, most recent first
 * @param feedbackCaptured whether this request stored a new correction
 */
public record MemorySnapshot(
        TierResult<RecentWindow> recency,
        TierResult<UserProfile> profile,
        TierResult<List<SemanticMatch>> semantic,
        TierResult<List<Correction>> feedback,
        boolean feedbackCaptured
) {

    public List<Turn> recentTurns() {
        return recency.value().turns();
    }

    public List<SemanticMatch> semanticMatches() {
        return semantic.value();
    }

    public List<Correction> corrections() {
        return feedback.value();
    }

    public MemorySnapshot withFeedback(TierResult<List<Correction>> refreshed, boolean captured) {
        return new MemorySnapshot(recency, profile, semantic, refreshed, captured);
    }
}
