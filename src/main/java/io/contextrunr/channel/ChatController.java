package io.contextrunr.channel;

import io.contextrunr.core.ChatResult;
import io.contextrunr.core.RequestPipeline;
import io.contextrunr.llm.GenerationBackend;
import io.contextrunr.memory.SemanticIndex;
import io.contextrunr.store.ChatStore;
import io.contextrunr.store.RequestTrace;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API channel for the chat pipeline.
 * Accepts a message and returns the answer with its observability payload.
 */
@RestController
@RequestMapping("/api")
public class ChatController {

    private final RequestPipeline pipeline;
    private final ChatStore store;
    private final SemanticIndex semanticIndex;
    private final GenerationBackend backend;

    public ChatController(RequestPipeline pipeline, ChatStore store, SemanticIndex semanticIndex,
                          GenerationBackend backend) {
        this.pipeline = pipeline;
        this.store = store;
        this.semanticIndex = semanticIndex;
        this.backend = backend;
    }

    /**
     * Chat endpoint. Runs one message through the pipeline.
     */
    @PostMapping("/chat")
    public ResponseEntity<ChatResult> chat(@RequestBody ChatRequestDto request) {
        ChatResult result = pipeline.process(request.userId(), request.message(), request.conversationId());
        return ResponseEntity.ok(result);
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean storeUp = store.healthCheck();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", storeUp ? "ok" : "degraded");
        body.put("service", "contextrunr");
        body.put("store", storeUp ? "up" : "down");
        body.put("semantic", semanticIndex.isAvailable() ? "available" : "unavailable");
        body.put("provider", backend.provider());
        body.put("model", backend.model());
        return ResponseEntity.ok(body);
    }

    /**
     * Returns the trace recorded for a request.
     */
    @GetMapping("/traces/{requestId}")
    public ResponseEntity<RequestTrace> trace(@PathVariable String requestId) {
        return store.findTrace(requestId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // --- DTOs ---

    public record ChatRequestDto(String userId, String message, String conversationId) {}
}
