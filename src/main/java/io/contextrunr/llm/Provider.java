package io.contextrunr.llm;

import java.util.Locale;

/**
 * Supported generation providers with the Spring AI beans that serve them.
 *
 * <p>Groq exposes an OpenAI-compatible API, so it runs on the OpenAI chat model
 * pointed at Groq's base URL; it has no embedding endpoint.</p>
 */
public enum Provider {
    OPENAI("openai", "openAiChatModel", "openAiEmbeddingModel", "gpt-4"),
    ANTHROPIC("anthropic", "anthropicChatModel", "openAiEmbeddingModel", "claude-3-opus-20240229"),
    GROQ("groq", "openAiChatModel", null, "llama-3.3-70b-versatile"),
    OLLAMA("ollama", "ollamaChatModel", "ollamaEmbeddingModel", "llama3");

    private final String tag;
    private final String chatBean;
    private final String embeddingBean;
    private final String defaultModel;

    Provider(String tag, String chatBean, String embeddingBean, String defaultModel) {
        this.tag = tag;
        this.chatBean = chatBean;
        this.embeddingBean = embeddingBean;
        this.defaultModel = defaultModel;
    }

    public String tag() {
        return tag;
    }

    public String chatBean() {
        return chatBean;
    }

    /** Embedding model bean name, or null when the provider has none. */
    public String embeddingBean() {
        return embeddingBean;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public static Provider fromTag(String tag) {
        if (tag != null) {
            for (Provider provider : values()) {
                if (provider.tag.equals(tag.toLowerCase(Locale.ROOT))) {
                    return provider;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported generation provider: " + tag);
    }
}
