package io.contextrunr.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.contextrunr.config.MemoryProperties;
import io.contextrunr.store.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Recency tier: a bounded window of the most recent turns per conversation,
 * loaded from the {@link ChatStore} on a cache miss.
 *
 * <p>Key behaviors:</p>
 * <ul>
 *   <li>Each window holds at most {@code recencyCapacity} turns, oldest evicted first</li>
 *   <li>Turns are returned oldest to newest</li>
 *   <li>The number of windows kept in process is bounded; an evicted window is reloaded from the store</li>
 * </ul>
 *
 * <p>Windows are per process. Two requests missing the same conversation at the
 * same time may both load it; the later load wins.</p>
 */
@Component
public class RecencyCache {

    private static final Logger log = LoggerFactory.getLogger(RecencyCache.class);

    private final ChatStore store;
    private final int capacity;
    private final Cache<String, Deque<Turn>> windows;

    public RecencyCache(ChatStore store, MemoryProperties properties) {
        this.store = store;
        this.capacity = properties.recencyCapacity();
        this.windows = Caffeine.newBuilder()
                .maximumSize(properties.maxCachedConversations())
                .build();
    }

    /**
     * Returns the most recent turns of a conversation plus its latest summary.
     *
     * @param conversationId the conversation
     * @param limit          max number of turns
     * @return window with turns in chronological order
     */
    public RecentWindow get(String conversationId, int limit) {
        Deque<Turn> window = windows.getIfPresent(conversationId);
        if (window == null) {
            window = load(conversationId, limit);
            windows.put(conversationId, window);
        }
        List<Turn> turns;
        synchronized (window) {
            List<Turn> all = new ArrayList<>(window);
            turns = all.size() > limit ? all.subList(all.size() - limit, all.size()) : all;
        }
        ConversationSummary summary = store.latestSummary(conversationId).orElse(null);
        return new RecentWindow(turns, summary);
    }

    /**
     * Appends a stored turn to the conversation's window, evicting the oldest beyond capacity.
     * A conversation without a cached window is left alone; its next read loads the turn from the store.
     */
    public void put(String conversationId, Turn turn) {
        Deque<Turn> window = windows.getIfPresent(conversationId);
        if (window == null) {
            log.debug("Conversation {} not cached, turn {} left to the next load", conversationId, turn.id());
            return;
        }
        synchronized (window) {
            if (window.stream().anyMatch(t -> t.id().equals(turn.id()))) {
                return;
            }
            window.addLast(turn);
            while (window.size() > capacity) {
                window.removeFirst();
            }
        }
    }

    /**
     * Whether the cached turns of a conversation exceed a token threshold.
     * A conversation that is not cached never does.
     */
    public boolean shouldSummarize(String conversationId, int tokenThreshold) {
        Deque<Turn> window = windows.getIfPresent(conversationId);
        if (window == null) {
            return false;
        }
        int total;
        synchronized (window) {
            total = window.stream().mapToInt(Turn::tokenCount).sum();
        }
        return total > tokenThreshold;
    }

    /** Drops a conversation's window. */
    public void evict(String conversationId) {
        windows.invalidate(conversationId);
    }

    private Deque<Turn> load(String conversationId, int limit) {
        List<Turn> newestFirst = new ArrayList<>(store.recentTurns(conversationId, Math.min(limit, capacity)));
        Collections.reverse(newestFirst);
        log.debug("Loaded {} turns for conversation {} from store", newestFirst.size(), conversationId);
        return new ArrayDeque<>(newestFirst);
    }
}
