package io.contextrunr.llm;

import io.contextrunr.core.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.embedding.EmbeddingModel;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Random;

/**
 * {@link GenerationBackend} over a Spring AI {@link ChatModel} and, optionally,
 * an {@link EmbeddingModel}.
 *
 * <p>Without an embedding model, text is embedded into a deterministic
 * {@value #HASH_DIMENSIONS}-dimension vector seeded from its SHA-256 digest, so
 * identical texts still match each other. Usage missing from a response is
 * counted locally.</p>
 */
public class SpringAiGenerationBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(SpringAiGenerationBackend.class);
    static final int HASH_DIMENSIONS = 384;

    private final Provider provider;
    private final String model;
    private final ChatModel chatModel;
    private final EmbeddingModel embeddingModel;
    private final TokenCounter tokenCounter;

    public SpringAiGenerationBackend(Provider provider, String model, ChatModel chatModel,
                                     EmbeddingModel embeddingModel, TokenCounter tokenCounter) {
        this.provider = provider;
        this.model = model;
        this.chatModel = chatModel;
        this.embeddingModel = embeddingModel;
        this.tokenCounter = tokenCounter;
    }

    @Override
    public Generation generate(String prompt, int maxTokens, double temperature) {
        log.info("Generating response with {} {}", provider.tag(), model);
        ChatOptions options = ChatOptions.builder()
                .model(model)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();
        ChatResponse response = chatModel.call(new Prompt(List.of(new UserMessage(prompt)), options));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new IllegalStateException("Empty response from " + provider.tag());
        }
        String text = response.getResult().getOutput().getText();
        if (text == null) {
            text = "";
        }

        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        int promptTokens = positive(usage != null ? usage.getPromptTokens() : null);
        int completionTokens = positive(usage != null ? usage.getCompletionTokens() : null);
        if (promptTokens == 0 && completionTokens == 0) {
            promptTokens = tokenCounter.count(prompt);
            completionTokens = tokenCounter.count(text);
        }
        int totalTokens = positive(usage != null ? usage.getTotalTokens() : null);
        if (totalTokens < promptTokens + completionTokens) {
            totalTokens = promptTokens + completionTokens;
        }

        String responseModel = response.getMetadata() != null ? response.getMetadata().getModel() : null;
        String resolvedModel = responseModel == null || responseModel.isBlank() ? model : responseModel;
        log.info("Generated response: {} tokens", totalTokens);
        return new Generation(text, promptTokens, completionTokens, totalTokens, resolvedModel, provider.tag());
    }

    @Override
    public float[] embed(String text) {
        if (embeddingModel == null) {
            return hashEmbedding(text);
        }
        float[] embedding = embeddingModel.embed(text);
        log.debug("Generated embedding: {} dimensions", embedding.length);
        return embedding;
    }

    @Override
    public String provider() {
        return provider.tag();
    }

    @Override
    public String model() {
        return model;
    }

    static float[] hashEmbedding(String text) {
        byte[] digest;
        try {
            digest = MessageDigest.getInstance("SHA-256")
                    .digest((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        long seed = 0;
        for (int i = 0; i < Long.BYTES; i++) {
            seed = (seed << 8) | (digest[i] & 0xFF);
        }
        Random random = new Random(seed);
        float[] vector = new float[HASH_DIMENSIONS];
        double norm = 0;
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) random.nextGaussian();
            norm += vector[i] * vector[i];
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
        return vector;
    }

    private static int positive(Integer value) {
        return value == null || value < 0 ? 0 : value;
    }
}
