package io.contextrunr.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.contextrunr.core.TokenCounter;
import io.contextrunr.llm.GenerationBackend;
import io.contextrunr.llm.GenerationBackendFactory;
import io.contextrunr.memory.NoOpSemanticIndex;
import io.contextrunr.memory.SQLiteSemanticIndex;
import io.contextrunr.memory.SemanticIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the pieces that depend on configuration: the semantic backend, the
 * generation backend and the two worker pools.
 */
@Configuration
@EnableConfigurationProperties({
        MemoryProperties.class,
        PromptProperties.class,
        GenerationProperties.class,
        PipelineProperties.class
})
public class ContextRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(ContextRunrConfig.class);

    /**
     * Pool running the four tier retrievals of each request.
     */
    @Bean(name = "tierExecutor", destroyMethod = "shutdown")
    public ExecutorService tierExecutor(MemoryProperties properties) {
        return Executors.newFixedThreadPool(properties.tierThreads(), namedThreads("memory-tier-"));
    }

    /**
     * Pool running generation, response embedding and post-generation persistence.
     */
    @Bean(name = "pipelineExecutor", destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor(PipelineProperties properties) {
        return Executors.newFixedThreadPool(properties.workerThreads(), namedThreads("pipeline-"));
    }

    @Bean
    public SemanticIndex semanticIndex(MemoryProperties properties, ObjectMapper objectMapper) {
        if (!properties.semantic().enabled()) {
            log.info("Semantic recall disabled");
            return new NoOpSemanticIndex();
        }
        Path dir = Path.of(properties.path());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Failed to create data directory: {}", dir, e);
        }
        return new SQLiteSemanticIndex(dir.resolve("semantic.db"), objectMapper);
    }

    @Bean
    public GenerationBackend generationBackend(ListableBeanFactory beanFactory, TokenCounter tokenCounter,
                                               GenerationProperties properties) {
        GenerationBackendFactory factory = new GenerationBackendFactory(
                beanFactory.getBeansOfType(ChatModel.class),
                beanFactory.getBeansOfType(EmbeddingModel.class),
                tokenCounter);
        return factory.create(properties);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
