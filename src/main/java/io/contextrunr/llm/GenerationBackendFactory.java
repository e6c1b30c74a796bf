package io.contextrunr.llm;

import io.contextrunr.config.GenerationProperties;
import io.contextrunr.core.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.Map;

/**
 * Builds the {@link GenerationBackend} for the configured provider from the
 * Spring AI models present in the context.
 *
 * <p>The provider is fixed at construction time:</p>
 * <ul>
 *   <li>{@code openai}: OpenAI chat and embedding models</li>
 *   <li>{@code anthropic}: Anthropic chat, OpenAI embeddings when available</li>
 *   <li>{@code groq}: OpenAI-compatible chat, hash embeddings</li>
 *   <li>{@code ollama}: local Ollama chat and embedding models</li>
 * </ul>
 */
public class GenerationBackendFactory {

    private static final Logger log = LoggerFactory.getLogger(GenerationBackendFactory.class);

    private final Map<String, ChatModel> chatModels;
    private final Map<String, EmbeddingModel> embeddingModels;
    private final TokenCounter tokenCounter;

    public GenerationBackendFactory(Map<String, ChatModel> chatModels, Map<String, EmbeddingModel> embeddingModels,
                                    TokenCounter tokenCounter) {
        this.chatModels = Map.copyOf(chatModels);
        this.embeddingModels = Map.copyOf(embeddingModels);
        this.tokenCounter = tokenCounter;
    }

    /**
     * Creates the backend for the configured provider.
     *
     * @throws IllegalStateException if the provider's chat model is not configured
     */
    public GenerationBackend create(GenerationProperties properties) {
        Provider provider = Provider.fromTag(properties.provider());
        ChatModel chatModel = chatModels.get(provider.chatBean());
        if (chatModel == null) {
            throw new IllegalStateException("No chat model '%s' configured for provider '%s' (available: %s)"
                    .formatted(provider.chatBean(), provider.tag(), chatModels.keySet()));
        }

        EmbeddingModel embeddingModel = provider.embeddingBean() != null
                ? embeddingModels.get(provider.embeddingBean())
                : null;
        if (embeddingModel == null) {
            log.warn("No embedding model for provider '{}', using hash embeddings", provider.tag());
        }

        String model = properties.model() == null || properties.model().isBlank()
                ? provider.defaultModel()
                : properties.model();
        log.info("Generation backend initialized: provider={}, model={}, embeddings={}",
                provider.tag(), model, embeddingModel != null ? provider.embeddingBean() : "hash");
        return new SpringAiGenerationBackend(provider, model, chatModel, embeddingModel, tokenCounter);
    }
}
