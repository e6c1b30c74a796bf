package io.contextrunr.memory;

/**
 * Outcome of one tier retrieval. A degraded result still carries the tier's
 * empty or default value, so consumers never branch on absence; the status
 * only tells "returned nothing" apart from "failed".
 *
 * @param tier      which tier produced the result
 * @param status    success or degraded
 * @param value     retrieved value, or the tier's fallback when degraded
 * @param error     failure description when degraded, otherwise null
 * @param elapsedMs time spent on the retrieval
 */
public record TierResult<T>(Tier tier, Status status, T value, String error, long elapsedMs) {

    public enum Tier { RECENCY, PROFILE, SEMANTIC, FEEDBACK }

    public enum Status { SUCCESS, DEGRADED }

    public static <T> TierResult<T> success(Tier tier, T value, long elapsedMs) {
        return new TierResult<>(tier, Status.SUCCESS, value, null, elapsedMs);
    }

    public static <T> TierResult<T> degraded(Tier tier, T fallback, String error, long elapsedMs) {
        return new TierResult<>(tier, Status.DEGRADED, fallback, error, elapsedMs);
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
