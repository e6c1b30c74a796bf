package io.contextrunr.llm;

/**
 * Text generation and embedding capability of a model provider.
 *
 * <p>The request pipeline only depends on this interface, so providers can be
 * swapped without touching it. Failures are thrown as runtime exceptions.</p>
 */
public interface GenerationBackend {

    /**
     * Generates a completion for a single-message prompt.
     *
     * @param prompt      full prompt text
     * @param maxTokens   max completion tokens
     * @param temperature sampling temperature
     * @return generated text with usage
     */
    Generation generate(String prompt, int maxTokens, double temperature);

    /**
     * Embeds text into a vector.
     */
    float[] embed(String text);

    /** Provider tag, e.g. {@code openai}. */
    String provider();

    /** Model used for generation. */
    String model();
}
