package io.contextrunr.memory;

import java.util.List;

/**
 * Vector backend of the semantic tier.
 *
 * <p>Implementations never throw from {@link #query} or {@link #add}: a backend
 * failure yields an empty result or a dropped write. Only the user's own
 * records are ever matched.</p>
 */
public interface SemanticIndex extends AutoCloseable {

    /**
     * Finds the records of a user most similar to an embedding.
     *
     * @param userId              owner filter
     * @param embedding           query vector
     * @param k                   max number of matches
     * @param similarityThreshold minimum similarity of a returned match
     * @return matches in descending score order
     */
    List<SemanticMatch> query(String userId, float[] embedding, int k, double similarityThreshold);

    /**
     * Writes a record; an existing record with the same id is overwritten.
     */
    void add(SemanticRecord record);

    /**
     * Removes every record of a user.
     */
    void clear(String userId);

    /**
     * Whether the backend can currently serve queries.
     */
    boolean isAvailable();

    /**
     * Releases the backend's resources.
     */
    @Override
    default void close() {
    }
}
