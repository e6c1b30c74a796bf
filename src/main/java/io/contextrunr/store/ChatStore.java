package io.contextrunr.store;

import io.contextrunr.memory.ConversationSummary;
import io.contextrunr.memory.Correction;
import io.contextrunr.memory.Turn;
import io.contextrunr.memory.UserProfile;

import java.util.List;
import java.util.Optional;

/**
 * Durable relational store for conversations, turns, profiles, corrections,
 * summaries and request traces.
 *
 * <p>Every write is committed on its own; there is no cross-call transaction.
 * Failures surface as {@link StoreException}.</p>
 */
public interface ChatStore {

    void createConversation(Conversation conversation);

    Optional<Conversation> findConversation(String conversationId);

    /**
     * Lists the ids of a user's conversations, newest first.
     */
    List<String> conversationIds(String userId);

    void saveTurn(Turn turn);

    /**
     * Loads the most recent turns of a conversation.
     *
     * @param conversationId the conversation
     * @param limit          max number of turns
     * @return turns in descending time order (newest first)
     */
    List<Turn> recentTurns(String conversationId, int limit);

    void saveSummary(ConversationSummary summary);

    Optional<ConversationSummary> latestSummary(String conversationId);

    Optional<UserProfile> findProfile(String userId);

    /**
     * Inserts or replaces the profile of a user.
     */
    void upsertProfile(String userId, UserProfile profile);

    void saveCorrection(Correction correction);

    /**
     * Loads a user's corrections, most recent first.
     */
    List<Correction> recentCorrections(String userId, int limit);

    /**
     * Adds one to a correction's applied count.
     *
     * @return true if the correction exists
     */
    boolean incrementApplied(String correctionId);

    int deleteCorrections(String userId);

    void saveTrace(RequestTrace trace);

    Optional<RequestTrace> findTrace(String requestId);

    /**
     * Deletes everything owned by a user: conversations with their turns and
     * summaries, the profile, corrections and traces.
     */
    void deleteUser(String userId);

    boolean healthCheck();
}
