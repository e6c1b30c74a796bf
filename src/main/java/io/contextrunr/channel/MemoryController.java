package io.contextrunr.channel;

import io.contextrunr.core.RequestPipeline;
import io.contextrunr.memory.Correction;
import io.contextrunr.memory.FeedbackLedger;
import io.contextrunr.memory.ProfileStore;
import io.contextrunr.memory.UserProfile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Memory API endpoints: profile, corrections and per-user data removal.
 */
@RestController
@RequestMapping("/api/memory/{userId}")
public class MemoryController {

    private final ProfileStore profiles;
    private final FeedbackLedger feedback;
    private final RequestPipeline pipeline;

    public MemoryController(ProfileStore profiles, FeedbackLedger feedback, RequestPipeline pipeline) {
        this.profiles = profiles;
        this.feedback = feedback;
        this.pipeline = pipeline;
    }

    @GetMapping("/profile")
    public ResponseEntity<UserProfile> profile(@PathVariable String userId) {
        return ResponseEntity.ok(profiles.get(userId));
    }

    /**
     * Deep-merges the body into the user's profile.
     */
    @PutMapping("/profile")
    public ResponseEntity<UserProfile> updateProfile(@PathVariable String userId,
                                                     @RequestBody Map<String, Object> partial) {
        return ResponseEntity.ok(profiles.update(userId, partial));
    }

    @GetMapping("/feedback")
    public ResponseEntity<List<Correction>> corrections(@PathVariable String userId,
                                                        @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(feedback.retrieve(userId, limit));
    }

    /**
     * Records an explicit correction of an earlier answer.
     */
    @PostMapping("/feedback")
    public ResponseEntity<Correction> submitCorrection(@PathVariable String userId,
                                                       @RequestBody CorrectionDto request) {
        String type = request.correctionType() == null || request.correctionType().isBlank()
                ? Correction.MANUAL_USER_CORRECTION
                : request.correctionType();
        Correction stored = feedback.store(Correction.create(userId, request.conversationId(), request.messageId(),
                type, request.userCorrection(), request.correctedResponse(), Map.of()));
        return ResponseEntity.status(HttpStatus.CREATED).body(stored);
    }

    @DeleteMapping
    public ResponseEntity<Map<String, String>> clear(@PathVariable String userId) {
        pipeline.clearUserMemory(userId);
        return ResponseEntity.ok(Map.of("status", "cleared"));
    }

    // --- DTOs ---

    public record CorrectionDto(
            String conversationId,
            String messageId,
            String correctionType,
            String userCorrection,
            String correctedResponse
    ) {}
}
