package io.contextrunr.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final prompt text with its per-layer token accounting.
 *
 * @param text                  the prompt sent to the generation backend
 * @param tokenBreakdown        tokens per layer key, in layer order, zero for empty layers
 * @param totalTokens           sum of the breakdown
 * @param trimmed               whether any layer was truncated to meet the budget
 * @param appliedCorrectionIds  ids of the corrections rendered into the prompt
 */
public record AssembledPrompt(
        String text,
        Map<String, Integer> tokenBreakdown,
        int totalTokens,
        boolean trimmed,
        List<String> appliedCorrectionIds
) {

    public AssembledPrompt {
        tokenBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(tokenBreakdown));
        appliedCorrectionIds = appliedCorrectionIds == null ? List.of() : List.copyOf(appliedCorrectionIds);
    }
}
