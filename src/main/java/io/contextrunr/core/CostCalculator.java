package io.contextrunr.core;

import io.contextrunr.config.GenerationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Estimates the USD cost of a generation from its token usage.
 *
 * <p>{@code cost = prompt / 1000 * input + completion / 1000 * output}, rounded
 * half-up to 6 decimals. Models without a configured rate use the default rate.</p>
 */
@Component
public class CostCalculator {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final GenerationProperties properties;

    public CostCalculator(GenerationProperties properties) {
        this.properties = properties;
    }

    public BigDecimal estimate(String model, int promptTokens, int completionTokens) {
        GenerationProperties.Rate rate = model == null
                ? properties.defaultRate()
                : properties.pricing().getOrDefault(model, properties.defaultRate());
        BigDecimal input = BigDecimal.valueOf(Math.max(0, promptTokens))
                .divide(THOUSAND)
                .multiply(BigDecimal.valueOf(rate.input()));
        BigDecimal output = BigDecimal.valueOf(Math.max(0, completionTokens))
                .divide(THOUSAND)
                .multiply(BigDecimal.valueOf(rate.output()));
        return input.add(output).setScale(6, RoundingMode.HALF_UP);
    }
}
