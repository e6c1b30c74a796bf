package io.contextrunr.llm;

/**
 * Text produced by a generation backend with its token usage.
 *
 * @param text             generated text
 * @param promptTokens     tokens consumed by the prompt
 * @param completionTokens tokens in the generated text
 * @param totalTokens      prompt plus completion tokens
 * @param model            model that produced the text
 * @param provider         provider tag, e.g. {@code openai}
 */
public record Generation(
        String text,
        int promptTokens,
        int completionTokens,
        int totalTokens,
        String model,
        String provider
) {}
