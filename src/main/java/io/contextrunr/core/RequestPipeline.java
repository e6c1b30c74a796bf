package io.contextrunr.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.contextrunr.config.GenerationProperties;
import io.contextrunr.config.PipelineProperties;
import io.contextrunr.llm.Generation;
import io.contextrunr.llm.GenerationBackend;
import io.contextrunr.memory.FeedbackLedger;
import io.contextrunr.memory.MemoryCoordinator;
import io.contextrunr.memory.MemorySnapshot;
import io.contextrunr.memory.MemoryWriter;
import io.contextrunr.memory.Turn;
import io.contextrunr.store.ChatStore;
import io.contextrunr.store.Conversation;
import io.contextrunr.store.RequestTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one chat request end to end: embed the message, read memory, assemble
 * the prompt, generate, persist both turns and record a trace.
 *
 * <p>The request deadline is checked before generation and bounds the
 * generation call; if it expires there, nothing is persisted. Once generation
 * has returned, persistence runs on the pipeline executor and is awaited
 * without interruption, so it completes even if the caller gives up.</p>
 *
 * <p>Failure handling:</p>
 * <ul>
 *   <li>embedding or generation failure: {@link GenerationException}, nothing persisted</li>
 *   <li>turn write failure: {@link PersistenceException}, earlier writes stay</li>
 *   <li>trace write failure: logged and reported as a warning, the answer is still returned</li>
 *   <li>semantic indexing and applied-count bumps: best effort</li>
 * </ul>
 */
@Component
public class RequestPipeline {

    private static final Logger log = LoggerFactory.getLogger(RequestPipeline.class);
    static final String MDC_REQUEST_ID = "requestId";

    private final MemoryCoordinator coordinator;
    private final MemoryWriter writer;
    private final FeedbackLedger feedback;
    private final PromptAssembler assembler;
    private final GenerationBackend backend;
    private final TokenCounter tokenCounter;
    private final CostCalculator costCalculator;
    private final ChatStore store;
    private final GenerationProperties generationProperties;
    private final PipelineProperties pipelineProperties;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public RequestPipeline(MemoryCoordinator coordinator, MemoryWriter writer, FeedbackLedger feedback,
                           PromptAssembler assembler, GenerationBackend backend, TokenCounter tokenCounter,
                           CostCalculator costCalculator, ChatStore store,
                           GenerationProperties generationProperties, PipelineProperties pipelineProperties,
                           ObjectMapper objectMapper, @Qualifier("pipelineExecutor") ExecutorService executor) {
        this.coordinator = coordinator;
        this.writer = writer;
        this.feedback = feedback;
        this.assembler = assembler;
        this.backend = backend;
        this.tokenCounter = tokenCounter;
        this.costCalculator = costCalculator;
        this.store = store;
        this.generationProperties = generationProperties;
        this.pipelineProperties = pipelineProperties;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    /**
     * Processes a message under the default request timeout.
     */
    public ChatResult process(String userId, String messageText, String conversationId) {
        return process(userId, messageText, conversationId, null);
    }

    /**
     * Processes a message.
     *
     * @param userId         the user
     * @param messageText    the user's message
     * @param conversationId existing or new conversation id; null or blank starts a new conversation
     * @param deadline       request deadline; null applies {@code pipeline.request-timeout}
     * @return the answer with its observability payload
     * @throws PipelineTimeoutException if the deadline expires before generation returns
     * @throws GenerationException      if embedding or generation fails
     * @throws PersistenceException     if a turn cannot be stored
     */
    public ChatResult process(String userId, String messageText, String conversationId, Instant deadline) {
        String requestId = UUID.randomUUID().toString();
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            return run(requestId, userId, messageText, conversationId, deadline);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    /**
     * Deletes everything stored for a user across the store, the semantic index and the caches.
     */
    public void clearUserMemory(String userId) {
        writer.clearUser(userId);
    }

    private ChatResult run(String requestId, String userId, String messageText, String conversationId,
                           Instant deadline) {
        long start = System.nanoTime();
        Instant effectiveDeadline = deadline != null
                ? deadline
                : Instant.now().plus(pipelineProperties.requestTimeout());
        String convId = conversationId == null || conversationId.isBlank()
                ? UUID.randomUUID().toString()
                : conversationId;
        log.info("Processing message for user: {}, conversation: {}", userId, convId);

        float[] queryEmbedding = embedQuery(messageText);

        MemorySnapshot snapshot = coordinator.aggregate(userId, convId, messageText, queryEmbedding, requestId);
        long retrievalMs = elapsedMs(start);

        long assemblyStart = System.nanoTime();
        AssembledPrompt prompt = assembler.assemble(snapshot, messageText);
        long assemblyMs = elapsedMs(assemblyStart);

        checkDeadline(effectiveDeadline);
        long generationStart = System.nanoTime();
        Generation generation = generate(prompt.text(), effectiveDeadline);
        long generationMs = elapsedMs(generationStart);

        long persistenceStart = System.nanoTime();
        CompletableFuture<float[]> responseEmbedding = CompletableFuture.supplyAsync(
                () -> backend.embed(generation.text()), executor);
        Persisted persisted = awaitUninterruptibly(executor.submit(withMdc(() -> persist(
                requestId, userId, convId, messageText, queryEmbedding, responseEmbedding,
                snapshot, prompt, generation, start))));
        long persistenceMs = elapsedMs(persistenceStart);

        MemorySnapshot refreshed = coordinator.retrieve(userId, convId, queryEmbedding);
        refreshed = refreshed.withFeedback(refreshed.feedback(), snapshot.feedbackCaptured());

        ChatResult.Latency latency = new ChatResult.Latency(
                retrievalMs, assemblyMs, generationMs, persistenceMs, elapsedMs(start));
        ChatResult.Observability observability = new ChatResult.Observability(
                refreshed,
                prompt.tokenBreakdown(),
                generation.promptTokens(),
                generation.completionTokens(),
                generation.totalTokens(),
                persisted.cost(),
                generation.provider(),
                generation.model(),
                latency,
                persisted.warnings());

        log.info("Request completed in {}ms ({} tokens, cost ${})", latency.totalMs(),
                generation.totalTokens(), persisted.cost());
        return new ChatResult(generation.text(), convId, persisted.assistantTurnId(), requestId, observability);
    }

    private float[] embedQuery(String messageText) {
        try {
            return backend.embed(messageText);
        } catch (RuntimeException e) {
            log.error("Failed to embed message: {}", e.getMessage());
            throw new GenerationException("Failed to embed message", e);
        }
    }

    private Generation generate(String promptText, Instant deadline) {
        Future<Generation> future = executor.submit(withMdc(() -> backend.generate(
                promptText, generationProperties.maxTokens(), generationProperties.temperature())));
        long remainingMs = Duration.between(Instant.now(), deadline).toMillis();
        try {
            return future.get(Math.max(0, remainingMs), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Generation did not return before the request deadline");
            throw new PipelineTimeoutException("Request deadline expired during generation");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PipelineTimeoutException("Request interrupted during generation");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Generation failed: {}", cause.getMessage());
            throw new GenerationException("Generation failed: " + cause.getMessage(), cause);
        }
    }

    private Persisted persist(String requestId, String userId, String convId, String messageText,
                              float[] queryEmbedding, CompletableFuture<float[]> responseEmbedding,
                              MemorySnapshot snapshot, AssembledPrompt prompt, Generation generation, long start) {
        List<String> warnings = new ArrayList<>();
        String responseText = generation.text();

        String title;
        try {
            Conversation conversation = store.findConversation(convId).orElseGet(() -> {
                Conversation created = Conversation.start(convId, userId, messageText);
                store.createConversation(created);
                return created;
            });
            title = conversation.title();
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to create conversation " + convId, e);
        }

        Turn userTurn = Turn.create(convId, Turn.Role.USER, messageText, tokenCounter.count(messageText));
        saveTurn(userTurn);
        writer.index(userId, userTurn, queryEmbedding, metadata(title, userTurn));

        int assistantTokens = generation.completionTokens() > 0
                ? generation.completionTokens()
                : tokenCounter.count(responseText);
        Turn assistantTurn = Turn.create(convId, Turn.Role.ASSISTANT, responseText, assistantTokens);
        saveTurn(assistantTurn);

        for (String correctionId : prompt.appliedCorrectionIds()) {
            feedback.incrementApplied(correctionId);
        }

        BigDecimal cost = costCalculator.estimate(
                generation.model(), generation.promptTokens(), generation.completionTokens());

        try {
            store.saveTrace(new RequestTrace(
                    requestId, userId, convId, messageText, responseText,
                    generation.promptTokens(), generation.completionTokens(), generation.totalTokens(),
                    TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start) / 1000.0,
                    generation.provider(), generation.model(),
                    serialize(snapshot), Instant.now()));
        } catch (RuntimeException e) {
            log.error("Failed to store trace for request {}: {}", requestId, e.getMessage());
            warnings.add("Trace not recorded: " + e.getMessage());
        }

        long embeddingTimeoutMs = pipelineProperties.embeddingTimeout().toMillis();
        try {
            float[] embedding = responseEmbedding.get(embeddingTimeoutMs, TimeUnit.MILLISECONDS);
            writer.index(userId, assistantTurn, embedding, metadata(title, assistantTurn));
        } catch (TimeoutException e) {
            responseEmbedding.cancel(true);
            log.warn("Response embedding of request {} not ready after {}ms, not indexed", requestId, embeddingTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted before indexing response of request {}", requestId);
        } catch (ExecutionException e) {
            log.warn("Failed to embed response of request {}: {}", requestId, e.getCause().getMessage());
        }

        if (coordinator.summarizationDue(convId)) {
            log.info("Conversation {} exceeds the summarization threshold", convId);
        }
        return new Persisted(assistantTurn.id(), cost, warnings);
    }

    private void saveTurn(Turn turn) {
        try {
            writer.saveTurn(turn);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to store " + turn.role().wireName() + " turn", e);
        }
    }

    private static Map<String, Object> metadata(String title, Turn turn) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("conversation_id", turn.conversationId());
        metadata.put("conversation_title", title);
        metadata.put("role", turn.role().wireName());
        metadata.put("tokens", turn.tokenCount());
        return metadata;
    }

    private String serialize(MemorySnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize memory snapshot: {}", e.getMessage());
            return "{}";
        }
    }

    private static void checkDeadline(Instant deadline) {
        if (!Instant.now().isBefore(deadline)) {
            log.warn("Request deadline expired before generation");
            throw new PipelineTimeoutException("Request deadline expired before generation");
        }
    }

    private static <T> T awaitUninterruptibly(Future<T> future) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof PipelineException pipelineException) {
                        throw pipelineException;
                    }
                    throw new PersistenceException("Persistence failed", cause);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static <T> Callable<T> withMdc(Callable<T> task) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        return () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record Persisted(String assistantTurnId, BigDecimal cost, List<String> warnings) {}
}
