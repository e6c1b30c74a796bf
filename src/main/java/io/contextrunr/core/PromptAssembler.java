package io.contextrunr.core;

import io.contextrunr.config.PromptProperties;
import io.contextrunr.memory.ConversationSummary;
import io.contextrunr.memory.Correction;
import io.contextrunr.memory.MemorySnapshot;
import io.contextrunr.memory.SemanticMatch;
import io.contextrunr.memory.Turn;
import io.contextrunr.memory.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Renders a {@link MemorySnapshot} and the current message into ordered prompt
 * layers and fits them into the token budget.
 *
 * <p>Budget is {@code maxContextWindow - responseReserve}. When the layers fit,
 * the prompt is their plain concatenation. Otherwise:</p>
 * <ol>
 *   <li>{@code semantic_context} is cut to its allocation if it exceeds it</li>
 *   <li>if still over budget, {@code recent_messages} is cut to its allocation</li>
 * </ol>
 * <p>No other layer is ever cut, so a prompt can still end over budget; that is logged.</p>
 */
@Component
public class PromptAssembler {

    private static final Logger log = LoggerFactory.getLogger(PromptAssembler.class);

    static final int MAX_RENDERED_CORRECTIONS = 3;
    static final int MAX_RENDERED_MATCHES = 3;
    static final int MAX_RENDERED_TURNS = 10;
    static final int MATCH_EXCERPT_CHARS = 200;

    private final TokenCounter tokenCounter;
    private final PromptProperties properties;

    public PromptAssembler(TokenCounter tokenCounter, PromptProperties properties) {
        this.tokenCounter = tokenCounter;
        this.properties = properties;
    }

    /**
     * Builds the prompt for one request.
     *
     * @param snapshot  memory read for the request
     * @param queryText the user's message
     * @return the prompt with its token breakdown
     */
    public AssembledPrompt assemble(MemorySnapshot snapshot, String queryText) {
        List<Correction> corrections = firstN(snapshot.corrections(), MAX_RENDERED_CORRECTIONS);

        Map<PromptLayer, String> layers = new EnumMap<>(PromptLayer.class);
        layers.put(PromptLayer.SYSTEM_INSTRUCTIONS, properties.systemInstructions());
        layers.put(PromptLayer.USER_PROFILE,
                snapshot.profile().isDegraded() ? "" : renderProfile(snapshot.profile().value()));
        layers.put(PromptLayer.FEEDBACK_CORRECTIONS, renderCorrections(corrections));
        layers.put(PromptLayer.CONVERSATION_SUMMARY,
                renderSummary(snapshot.recency().value().summary()));
        layers.put(PromptLayer.SEMANTIC_CONTEXT, renderSemantic(snapshot.semanticMatches()));
        layers.put(PromptLayer.RECENT_MESSAGES, renderRecent(snapshot.recentTurns()));
        layers.put(PromptLayer.CURRENT_MESSAGE, "\n\nUser: " + queryText + "\n\nAssistant:");

        int budget = properties.budget();
        Map<PromptLayer, Integer> tokens = countLayers(layers);
        int total = sum(tokens);
        boolean trimmed = false;

        if (total > budget) {
            log.warn("Prompt exceeds budget: {} > {}. Trimming layers...", total, budget);
            trimmed = true;

            int semanticAllocation = allocation(PromptLayer.SEMANTIC_CONTEXT);
            if (tokens.get(PromptLayer.SEMANTIC_CONTEXT) > semanticAllocation) {
                layers.put(PromptLayer.SEMANTIC_CONTEXT,
                        tokenCounter.truncate(layers.get(PromptLayer.SEMANTIC_CONTEXT), semanticAllocation));
            }
            if (sum(countLayers(layers)) > budget) {
                layers.put(PromptLayer.RECENT_MESSAGES, tokenCounter.truncate(
                        layers.get(PromptLayer.RECENT_MESSAGES), allocation(PromptLayer.RECENT_MESSAGES)));
            }

            tokens = countLayers(layers);
            total = sum(tokens);
            if (total > budget) {
                log.warn("Prompt still over budget after trimming: {} > {}", total, budget);
            }
        }

        Map<String, Integer> breakdown = new LinkedHashMap<>();
        for (PromptLayer layer : PromptLayer.values()) {
            breakdown.put(layer.key(), tokens.get(layer));
        }

        log.info("Built prompt with {} tokens", total);
        return new AssembledPrompt(join(layers), breakdown, total, trimmed,
                corrections.stream().map(Correction::id).toList());
    }

    int allocation(PromptLayer layer) {
        Integer override = properties.allocations().get(layer.key());
        return override != null && override > 0 ? override : layer.defaultAllocation();
    }

    private String renderProfile(UserProfile profile) {
        Map<String, Object> preferences = profile.preferences();
        Map<String, Object> context = profile.context();
        Object occupation = context.get("occupation");
        return "\n\n## User Profile"
                + "\n- Communication style: " + valueOr(preferences.get("communication_style"), "balanced")
                + "\n- Expertise level: " + valueOr(preferences.get("expertise_level"), "intermediate")
                + "\n- Interests: " + joinList(preferences.get("topics_of_interest"))
                + "\n- Context: " + valueOr(occupation, "Not specified");
    }

    private String renderCorrections(List<Correction> corrections) {
        if (corrections.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n\n## Past Corrections (Learn from these)");
        for (Correction correction : corrections) {
            sb.append("\n- Previous mistake: ").append(valueOr(correction.userText(), ""));
            sb.append("\n- Correct approach: ").append(valueOr(correction.correctedText(), "N/A"));
        }
        return sb.toString();
    }

    private String renderSummary(ConversationSummary summary) {
        if (summary == null) {
            return "";
        }
        return "\n\n## Conversation Summary\n" + valueOr(summary.text(), "")
                + "\n(Covers messages " + summary.messageRangeStart() + " to " + summary.messageRangeEnd() + ")";
    }

    private String renderSemantic(List<SemanticMatch> matches) {
        if (matches.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n\n## Relevant Past Conversations");
        for (SemanticMatch match : firstN(matches, MAX_RENDERED_MATCHES)) {
            String content = valueOr(match.content(), "");
            String excerpt = content.length() > MATCH_EXCERPT_CHARS ? content.substring(0, MATCH_EXCERPT_CHARS) : content;
            sb.append("\n- [").append(valueOr(match.metadata().get("conversation_title"), "Untitled")).append("]")
                    .append(String.format(Locale.ROOT, " (Similarity: %.2f)", match.score()))
                    .append("\n  ").append(excerpt).append("...");
        }
        return sb.toString();
    }

    private String renderRecent(List<Turn> turns) {
        if (turns.isEmpty()) {
            return "";
        }
        List<Turn> last = turns.size() > MAX_RENDERED_TURNS
                ? turns.subList(turns.size() - MAX_RENDERED_TURNS, turns.size())
                : turns;
        StringBuilder sb = new StringBuilder("\n\n## Recent Conversation");
        for (Turn turn : last) {
            String role = turn.role() == Turn.Role.USER ? "User" : "Assistant";
            sb.append('\n').append(role).append(": ").append(turn.content()).append('\n');
        }
        return sb.toString();
    }

    private Map<PromptLayer, Integer> countLayers(Map<PromptLayer, String> layers) {
        Map<PromptLayer, Integer> counts = new EnumMap<>(PromptLayer.class);
        for (PromptLayer layer : PromptLayer.values()) {
            counts.put(layer, tokenCounter.count(layers.get(layer)));
        }
        return counts;
    }

    private static int sum(Map<PromptLayer, Integer> counts) {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    private static String join(Map<PromptLayer, String> layers) {
        StringJoiner joiner = new StringJoiner("\n");
        for (PromptLayer layer : PromptLayer.values()) {
            String content = layers.get(layer);
            if (content != null && !content.isEmpty()) {
                joiner.add(content);
            }
        }
        return joiner.toString();
    }

    private static String valueOr(Object value, String fallback) {
        return value == null ? fallback : value.toString();
    }

    private static String joinList(Object value) {
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        return value == null ? "" : value.toString();
    }

    private static <T> List<T> firstN(List<T> items, int n) {
        return items.size() > n ? new ArrayList<>(items.subList(0, n)) : items;
    }
}
