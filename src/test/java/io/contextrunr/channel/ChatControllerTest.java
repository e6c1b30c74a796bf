package io.contextrunr.channel;

import io.contextrunr.core.ChatResult;
import io.contextrunr.core.GenerationException;
import io.contextrunr.core.PersistenceException;
import io.contextrunr.core.PipelineTimeoutException;
import io.contextrunr.core.RequestPipeline;
import io.contextrunr.llm.GenerationBackend;
import io.contextrunr.memory.MemorySnapshot;
import io.contextrunr.memory.RecentWindow;
import io.contextrunr.memory.SemanticIndex;
import io.contextrunr.memory.TierResult;
import io.contextrunr.memory.UserProfile;
import io.contextrunr.store.ChatStore;
import io.contextrunr.store.RequestTrace;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ChatController.class)
class ChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RequestPipeline pipeline;

    @MockBean
    private ChatStore store;

    @MockBean
    private SemanticIndex semanticIndex;

    @MockBean
    private GenerationBackend backend;

    @Test
    void shouldReturnHealthStatus() throws Exception {
        when(store.healthCheck()).thenReturn(true);
        when(semanticIndex.isAvailable()).thenReturn(true);
        when(backend.provider()).thenReturn("openai");
        when(backend.model()).thenReturn("gpt-4");

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("contextrunr"))
                .andExpect(jsonPath("$.store").value("up"))
                .andExpect(jsonPath("$.semantic").value("available"))
                .andExpect(jsonPath("$.provider").value("openai"))
                .andExpect(jsonPath("$.model").value("gpt-4"));
    }

    @Test
    void shouldReportDegradedWhenStoreDown() throws Exception {
        when(store.healthCheck()).thenReturn(false);
        when(semanticIndex.isAvailable()).thenReturn(false);

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.store").value("down"))
                .andExpect(jsonPath("$.semantic").value("unavailable"));
    }

    @Test
    void shouldHandleChatRequest() throws Exception {
        when(pipeline.process("alice", "Hello", null)).thenReturn(result());

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"alice\", \"message\": \"Hello\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.responseText").value("Hi there!"))
                .andExpect(jsonPath("$.conversationId").value("conv-1"))
                .andExpect(jsonPath("$.requestId").value("req-1"))
                .andExpect(jsonPath("$.observability.totalTokens").value(15))
                .andExpect(jsonPath("$.observability.tokenBreakdown.current_message").value(8))
                .andExpect(jsonPath("$.observability.snapshot.profile.status").value("SUCCESS"));
    }

    @Test
    void shouldMapTimeoutTo504() throws Exception {
        when(pipeline.process(anyString(), anyString(), any()))
                .thenThrow(new PipelineTimeoutException("Request deadline expired during generation"));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"alice\", \"message\": \"Hello\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error").value("Request deadline expired during generation"));
    }

    @Test
    void shouldMapGenerationFailureTo502() throws Exception {
        when(pipeline.process(anyString(), anyString(), any()))
                .thenThrow(new GenerationException("Generation failed: rate limited", null));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"alice\", \"message\": \"Hello\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Generation failed: rate limited"))
                .andExpect(jsonPath("$.observability").doesNotExist());
    }

    @Test
    void shouldMapPersistenceFailureTo500() throws Exception {
        when(pipeline.process(anyString(), anyString(), any()))
                .thenThrow(new PersistenceException("Failed to store user turn", null));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"alice\", \"message\": \"Hello\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Failed to store user turn"));
    }

    @Test
    void shouldReturnTrace() throws Exception {
        when(store.findTrace("req-1")).thenReturn(Optional.of(new RequestTrace("req-1", "alice", "conv-1",
                "Hello", "Hi there!", 10, 5, 15, 42.0, "openai", "gpt-4", "{}", Instant.now())));

        mockMvc.perform(get("/api/traces/req-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userMessage").value("Hello"))
                .andExpect(jsonPath("$.totalTokens").value(15));
    }

    @Test
    void shouldReturn404ForUnknownTrace() throws Exception {
        when(store.findTrace("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/traces/missing"))
                .andExpect(status().isNotFound());
    }

    private static ChatResult result() {
        MemorySnapshot snapshot = new MemorySnapshot(
                TierResult.success(TierResult.Tier.RECENCY, RecentWindow.empty(), 1),
                TierResult.success(TierResult.Tier.PROFILE, UserProfile.defaults(Instant.now()), 1),
                TierResult.success(TierResult.Tier.SEMANTIC, List.of(), 1),
                TierResult.success(TierResult.Tier.FEEDBACK, List.of(), 1),
                false);
        ChatResult.Observability observability = new ChatResult.Observability(snapshot,
                Map.of("current_message", 8), 10, 5, 15, new BigDecimal("0.000600"), "openai", "gpt-4",
                new ChatResult.Latency(1, 1, 10, 2, 14), List.of());
        return new ChatResult("Hi there!", "conv-1", "msg-1", "req-1", observability);
    }
}
