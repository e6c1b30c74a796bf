package io.contextrunr.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.contextrunr.config.GenerationProperties;
import io.contextrunr.config.MemoryProperties;
import io.contextrunr.config.PipelineProperties;
import io.contextrunr.config.PromptProperties;
import io.contextrunr.llm.Generation;
import io.contextrunr.llm.GenerationBackend;
import io.contextrunr.memory.Correction;
import io.contextrunr.memory.FeedbackLedger;
import io.contextrunr.memory.MemoryCoordinator;
import io.contextrunr.memory.MemoryWriter;
import io.contextrunr.memory.ProfileStore;
import io.contextrunr.memory.RecencyCache;
import io.contextrunr.memory.SQLiteSemanticIndex;
import io.contextrunr.memory.SemanticIndex;
import io.contextrunr.memory.Turn;
import io.contextrunr.store.RequestTrace;
import io.contextrunr.store.SQLiteChatStore;
import io.contextrunr.store.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RequestPipelineTest {

    private static final float[] EMBEDDING = {1, 0, 0};

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final TokenCounter tokenCounter = new TokenCounter();

    private ExecutorService tierExecutor;
    private ExecutorService pipelineExecutor;
    private SQLiteChatStore store;
    private SQLiteSemanticIndex semanticIndex;
    private GenerationBackend backend;

    @BeforeEach
    void setUp() {
        tierExecutor = Executors.newFixedThreadPool(8);
        pipelineExecutor = Executors.newFixedThreadPool(4);
        store = new SQLiteChatStore(tempDir.resolve("chat.db"), objectMapper);
        store.init();
        semanticIndex = new SQLiteSemanticIndex(tempDir.resolve("semantic.db"), objectMapper);
        semanticIndex.init();

        backend = mock(GenerationBackend.class);
        when(backend.embed(anyString())).thenReturn(EMBEDDING);
        when(backend.generate(anyString(), anyInt(), anyDouble()))
                .thenReturn(new Generation("Hi there!", 10, 5, 15, "gpt-4", "openai"));
        when(backend.provider()).thenReturn("openai");
        when(backend.model()).thenReturn("gpt-4");
    }

    @AfterEach
    void tearDown() {
        tierExecutor.shutdownNow();
        pipelineExecutor.shutdownNow();
        semanticIndex.close();
        store.close();
    }

    @Test
    void shouldAnswerAndPersistFirstMessage() {
        RequestPipeline pipeline = pipeline(store, semanticIndex);

        ChatResult result = pipeline.process("alice", "Hello", null);

        assertEquals("Hi there!", result.responseText());
        assertNotNull(result.conversationId());
        assertFalse(result.conversationId().isBlank());
        assertEquals(2, store.recentTurns(result.conversationId(), 100).size());
        assertEquals("Hello", store.findConversation(result.conversationId()).orElseThrow().title());
        assertTrue(store.findProfile("alice").isPresent());

        ChatResult.Observability observability = result.observability();
        assertEquals(10, observability.promptTokens());
        assertEquals(5, observability.completionTokens());
        assertEquals(15, observability.totalTokens());
        assertEquals(new BigDecimal("0.000600"), observability.estimatedCost());
        assertEquals("openai", observability.provider());
        assertEquals("gpt-4", observability.model());
        assertTrue(observability.warnings().isEmpty());
        assertEquals(List.of("system_instructions", "user_profile", "feedback_corrections", "conversation_summary",
                "semantic_context", "recent_messages", "current_message"),
                List.copyOf(observability.tokenBreakdown().keySet()));
        assertEquals(2, observability.snapshot().recentTurns().size());
        assertFalse(observability.snapshot().feedbackCaptured());

        RequestTrace trace = store.findTrace(result.requestId()).orElseThrow();
        assertEquals("alice", trace.userId());
        assertEquals("Hello", trace.userMessage());
        assertEquals("Hi there!", trace.assistantResponse());
        assertEquals(15, trace.totalTokens());
        assertTrue(trace.memorySnapshot().startsWith("{"));

        List<Turn> turns = store.recentTurns(result.conversationId(), 10);
        assertEquals(result.messageId(), turns.get(0).id());
        assertEquals(Turn.Role.ASSISTANT, turns.get(0).role());
        assertEquals(5, turns.get(0).tokenCount());
    }

    @Test
    void shouldIncludeHistoryOnSecondMessage() {
        RequestPipeline pipeline = pipeline(store, semanticIndex);
        ChatResult first = pipeline.process("alice", "My name is Alice", null);

        pipeline.process("alice", "What is my name?", first.conversationId());

        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(backend, times(2)).generate(prompts.capture(), eq(1000), eq(0.7));
        String prompt = prompts.getAllValues().get(1);
        assertTrue(prompt.contains("## Recent Conversation\nUser: My name is Alice\n\nAssistant: Hi there!\n"));
        assertTrue(prompt.contains("## Relevant Past Conversations"));
        assertTrue(prompt.endsWith("User: What is my name?\n\nAssistant:"));
        assertEquals(4, store.recentTurns(first.conversationId(), 100).size());
    }

    @Test
    void shouldCaptureCorrectionAndApplyIt() {
        RequestPipeline pipeline = pipeline(store, semanticIndex);
        ChatResult first = pipeline.process("alice", "Capital of Australia?", null);

        ChatResult second = pipeline.process("alice", "incorrect: it is Canberra, not Sydney", first.conversationId());

        assertTrue(second.observability().snapshot().feedbackCaptured());
        List<Correction> corrections = store.recentCorrections("alice", 3);
        assertEquals(1, corrections.size());
        Correction correction = corrections.get(0);
        assertEquals(second.requestId(), correction.messageId());
        assertEquals(Correction.MANUAL_USER_CORRECTION, correction.correctionType());
        assertEquals(1, correction.appliedCount());
        assertTrue(second.observability().tokenBreakdown().get("feedback_corrections") > 0);

        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(backend, times(2)).generate(prompts.capture(), anyInt(), anyDouble());
        assertTrue(prompts.getAllValues().get(1)
                .contains("- Previous mistake: incorrect: it is Canberra, not Sydney\n- Correct approach: N/A"));
    }

    @Test
    void shouldAnswerWhenSemanticTierFails() {
        SemanticIndex failing = mock(SemanticIndex.class);
        when(failing.isAvailable()).thenReturn(true);
        when(failing.query(anyString(), any(), anyInt(), anyDouble())).thenThrow(new IllegalStateException("down"));
        RequestPipeline pipeline = pipeline(store, failing);

        ChatResult result = pipeline.process("alice", "Hello", null);

        assertEquals("Hi there!", result.responseText());
        assertTrue(result.observability().snapshot().semantic().isDegraded());
        assertFalse(result.observability().snapshot().recency().isDegraded());
        assertEquals(0, result.observability().tokenBreakdown().get("semantic_context"));
    }

    @Test
    void shouldReturnAnswerWithWarningWhenTraceFails() {
        SQLiteChatStore traceless = new SQLiteChatStore(tempDir.resolve("traceless.db"), objectMapper) {
            @Override
            public synchronized void saveTrace(RequestTrace trace) {
                throw new StoreException("trace table locked", null);
            }
        };
        traceless.init();
        try {
            ChatResult result = pipeline(traceless, semanticIndex).process("alice", "Hello", null);

            assertEquals("Hi there!", result.responseText());
            assertEquals(List.of("Trace not recorded: trace table locked"), result.observability().warnings());
            assertEquals(2, traceless.recentTurns(result.conversationId(), 100).size());
            assertEquals(Optional.empty(), traceless.findTrace(result.requestId()));
        } finally {
            traceless.close();
        }
    }

    @Test
    void shouldFailWithPersistenceErrorWhenTurnCannotBeStored() {
        SQLiteChatStore readOnlyTurns = new SQLiteChatStore(tempDir.resolve("noturns.db"), objectMapper) {
            @Override
            public synchronized void saveTurn(Turn turn) {
                throw new StoreException("disk full", null);
            }
        };
        readOnlyTurns.init();
        try {
            RequestPipeline pipeline = pipeline(readOnlyTurns, semanticIndex);

            PersistenceException e = assertThrows(PersistenceException.class,
                    () -> pipeline.process("alice", "Hello", "conv-1"));
            assertTrue(e.getMessage().contains("user turn"));
            assertTrue(readOnlyTurns.findConversation("conv-1").isPresent());
            assertTrue(readOnlyTurns.recentTurns("conv-1", 10).isEmpty());
        } finally {
            readOnlyTurns.close();
        }
    }

    @Test
    void shouldPersistNothingWhenDeadlineAlreadyExpired() {
        RequestPipeline pipeline = pipeline(store, semanticIndex);

        assertThrows(PipelineTimeoutException.class,
                () -> pipeline.process("alice", "Hello", "conv-1", Instant.now().minusSeconds(1)));

        verify(backend, never()).generate(anyString(), anyInt(), anyDouble());
        assertTrue(store.findConversation("conv-1").isEmpty());
        assertEquals(0, store.recentTurns("conv-1", 100).size());
    }

    @Test
    void shouldTimeOutSlowGenerationWithoutPersisting() {
        when(backend.generate(anyString(), anyInt(), anyDouble())).thenAnswer(invocation -> {
            Thread.sleep(5000);
            return new Generation("too late", 1, 1, 2, "gpt-4", "openai");
        });
        RequestPipeline pipeline = pipeline(store, semanticIndex);

        assertThrows(PipelineTimeoutException.class,
                () -> pipeline.process("alice", "Hello", "conv-1", Instant.now().plusMillis(500)));

        assertTrue(store.findConversation("conv-1").isEmpty());
        assertEquals(0, store.recentTurns("conv-1", 100).size());
    }

    @Test
    void shouldFailWithGenerationErrorWhenBackendFails() {
        when(backend.generate(anyString(), anyInt(), anyDouble())).thenThrow(new RuntimeException("rate limited"));
        RequestPipeline pipeline = pipeline(store, semanticIndex);

        GenerationException e = assertThrows(GenerationException.class,
                () -> pipeline.process("alice", "Hello", "conv-1"));

        assertTrue(e.getMessage().contains("rate limited"));
        assertTrue(store.findConversation("conv-1").isEmpty());
    }

    @Test
    void shouldFailWithGenerationErrorWhenEmbeddingFails() {
        when(backend.embed(anyString())).thenThrow(new RuntimeException("embedding service down"));
        RequestPipeline pipeline = pipeline(store, semanticIndex);

        assertThrows(GenerationException.class, () -> pipeline.process("alice", "Hello", "conv-1"));
        verify(backend, never()).generate(anyString(), anyInt(), anyDouble());
    }

    @Test
    void shouldNotWaitForHungResponseEmbedding() {
        when(backend.embed("Hi there!")).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return EMBEDDING;
        });
        RequestPipeline pipeline = pipeline(store, semanticIndex,
                new PipelineProperties(null, 0, Duration.ofMillis(200)));

        long start = System.nanoTime();
        ChatResult result = pipeline.process("alice", "Hello", null);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertEquals("Hi there!", result.responseText());
        assertTrue(elapsedMs < 5000);
        assertTrue(store.findTrace(result.requestId()).isPresent());
        List<String> indexed = semanticIndex.query("alice", EMBEDDING, 5, 0.1).stream()
                .map(match -> match.content()).toList();
        assertEquals(List.of("Hello"), indexed);
    }

    @Test
    void shouldClearEverythingOwnedByUser() {
        RequestPipeline pipeline = pipeline(store, semanticIndex);
        ChatResult result = pipeline.process("alice", "Hello", null);
        pipeline.process("bob", "Hello", null);

        pipeline.clearUserMemory("alice");

        assertTrue(store.conversationIds("alice").isEmpty());
        assertEquals(0, store.recentTurns(result.conversationId(), 100).size());
        assertTrue(store.findProfile("alice").isEmpty());
        assertTrue(store.findTrace(result.requestId()).isEmpty());
        assertTrue(semanticIndex.query("alice", EMBEDDING, 5, 0.1).isEmpty());
        assertFalse(semanticIndex.query("bob", EMBEDDING, 5, 0.1).isEmpty());
        assertEquals(1, store.conversationIds("bob").size());
    }

    private RequestPipeline pipeline(SQLiteChatStore chatStore, SemanticIndex index) {
        return pipeline(chatStore, index, PipelineProperties.defaults());
    }

    private RequestPipeline pipeline(SQLiteChatStore chatStore, SemanticIndex index,
                                     PipelineProperties pipelineProperties) {
        MemoryProperties memoryProperties = MemoryProperties.defaults();
        RecencyCache recency = new RecencyCache(chatStore, memoryProperties);
        ProfileStore profiles = new ProfileStore(chatStore, memoryProperties);
        FeedbackLedger feedback = new FeedbackLedger(chatStore);
        MemoryCoordinator coordinator = new MemoryCoordinator(
                recency, profiles, index, feedback, memoryProperties, tierExecutor);
        MemoryWriter writer = new MemoryWriter(chatStore, recency, profiles, index);
        GenerationProperties generationProperties = GenerationProperties.defaults();
        return new RequestPipeline(coordinator, writer, feedback,
                new PromptAssembler(tokenCounter, PromptProperties.defaults()), backend, tokenCounter,
                new CostCalculator(generationProperties), chatStore, generationProperties,
                pipelineProperties, objectMapper, pipelineExecutor);
    }
}
