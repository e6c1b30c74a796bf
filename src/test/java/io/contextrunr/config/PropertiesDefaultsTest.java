package io.contextrunr.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PropertiesDefaultsTest {

    @Test
    void shouldDefaultMemorySettings() {
        var props = MemoryProperties.defaults();
        assertEquals("./data", props.path());
        assertEquals(20, props.recencyCapacity());
        assertEquals(10, props.recencyLimit());
        assertEquals(2000, props.summarizationThresholdTokens());
        assertEquals(3, props.maxFeedbackCorrections());
        assertEquals("incorrect:", props.correctionMarker());
        assertEquals(Duration.ofSeconds(2), props.tierTimeout());
        assertTrue(props.semantic().enabled());
        assertEquals(5, props.semantic().k());
        assertEquals(0.7, props.semantic().similarityThreshold());
    }

    @Test
    void shouldKeepExplicitSemanticSettings() {
        var semantic = new MemoryProperties.Semantic(false, 3, 0.5);
        assertFalse(semantic.enabled());
        assertEquals(3, semantic.k());
        assertEquals(0.5, semantic.similarityThreshold());
    }

    @Test
    void shouldComputePromptBudget() {
        var props = PromptProperties.defaults();
        assertEquals(4096, props.maxContextWindow());
        assertEquals(1000, props.responseReserve());
        assertEquals(3096, props.budget());
        assertEquals(PromptProperties.DEFAULT_SYSTEM_INSTRUCTIONS, props.systemInstructions());
        assertTrue(props.allocations().isEmpty());
    }

    @Test
    void shouldDefaultGenerationSettings() {
        var props = GenerationProperties.defaults();
        assertEquals("openai", props.provider());
        assertEquals(1000, props.maxTokens());
        assertEquals(0.7, props.temperature());
        assertEquals(new GenerationProperties.Rate(0.03, 0.06), props.pricing().get("gpt-4"));
        assertEquals(props.pricing().get("gpt-4"), props.defaultRate());
    }

    @Test
    void shouldReplacePricingWhenConfigured() {
        var props = new GenerationProperties("ollama", "llama3", 500, 0.1,
                Map.of("llama3", new GenerationProperties.Rate(0, 0)), null);
        assertEquals(1, props.pricing().size());
        assertEquals(500, props.maxTokens());
        assertEquals(0.1, props.temperature());
    }

    @Test
    void shouldDefaultPipelineSettings() {
        var props = PipelineProperties.defaults();
        assertEquals(Duration.ofSeconds(60), props.requestTimeout());
        assertEquals(16, props.workerThreads());
        assertEquals(Duration.ofSeconds(10), props.embeddingTimeout());
    }
}
