package io.contextrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generation backend selection and pricing.
 *
 * <p>Binds to {@code generation} in application.yml:</p>
 * <pre>
 * generation:
 *   provider: ${GENERATION_PROVIDER:openai}   # openai | anthropic | groq | ollama
 *   model: ${GENERATION_MODEL:}
 *   max-tokens: 1000
 *   temperature: 0.7
 *   pricing:
 *     gpt-4: { input: 0.03, output: 0.06 }
 *   default-rate: { input: 0.03, output: 0.06 }
 * </pre>
 *
 * @param provider    provider tag
 * @param model       model name; blank selects the provider's default
 * @param maxTokens   max completion tokens per request
 * @param temperature sampling temperature
 * @param pricing     per-model rates in USD per 1K tokens
 * @param defaultRate rate used for models missing from {@code pricing}
 */
@ConfigurationProperties(prefix = "generation")
public record GenerationProperties(
        String provider,
        String model,
        int maxTokens,
        Double temperature,
        Map<String, Rate> pricing,
        Rate defaultRate
) {

    public static final Map<String, Rate> DEFAULT_PRICING;

    static {
        Map<String, Rate> rates = new LinkedHashMap<>();
        rates.put("gpt-4", new Rate(0.03, 0.06));
        rates.put("gpt-3.5-turbo", new Rate(0.0015, 0.002));
        rates.put("claude-3-opus-20240229", new Rate(0.015, 0.075));
        DEFAULT_PRICING = Map.copyOf(rates);
    }

    public GenerationProperties {
        if (provider == null || provider.isBlank()) provider = "openai";
        if (maxTokens <= 0) maxTokens = 1000;
        if (temperature == null) temperature = 0.7;
        pricing = (pricing == null || pricing.isEmpty()) ? DEFAULT_PRICING : Map.copyOf(pricing);
        if (defaultRate == null) defaultRate = DEFAULT_PRICING.get("gpt-4");
    }

    public static GenerationProperties defaults() {
        return new GenerationProperties(null, null, 0, null, null, null);
    }

    /**
     * Price per 1K tokens.
     *
     * @param input  prompt token rate
     * @param output completion token rate
     */
    public record Rate(double input, double output) {}
}
