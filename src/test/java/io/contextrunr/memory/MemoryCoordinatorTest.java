package io.contextrunr.memory;

import io.contextrunr.config.MemoryProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MemoryCoordinatorTest {

    private static final float[] EMBEDDING = {1, 0, 0};

    private RecencyCache recency;
    private ProfileStore profiles;
    private SemanticIndex semanticIndex;
    private FeedbackLedger feedback;
    private ExecutorService executor;
    private MemoryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        recency = mock(RecencyCache.class);
        profiles = mock(ProfileStore.class);
        semanticIndex = mock(SemanticIndex.class);
        feedback = mock(FeedbackLedger.class);
        executor = Executors.newFixedThreadPool(8);

        when(recency.get(anyString(), anyInt())).thenReturn(RecentWindow.empty());
        when(profiles.get(anyString())).thenReturn(UserProfile.defaults(Instant.now()));
        when(semanticIndex.isAvailable()).thenReturn(true);
        when(semanticIndex.query(anyString(), any(), anyInt(), anyDouble())).thenReturn(List.of());
        when(feedback.retrieve(anyString(), anyInt())).thenReturn(List.of());

        MemoryProperties properties = new MemoryProperties(null, 0, 0, 0, 0, 0, 0, null,
                Duration.ofMillis(200), 0, null);
        coordinator = new MemoryCoordinator(recency, profiles, semanticIndex, feedback, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReturnAllTiersSuccessfully() {
        Turn turn = Turn.create("c1", Turn.Role.USER, "hi", 1);
        SemanticMatch match = new SemanticMatch("m", "past", Map.of(), 0.9);
        when(recency.get("c1", 10)).thenReturn(new RecentWindow(List.of(turn), null));
        when(semanticIndex.query("u", EMBEDDING, 5, 0.7)).thenReturn(List.of(match));

        MemorySnapshot snapshot = coordinator.retrieve("u", "c1", EMBEDDING);

        assertFalse(snapshot.recency().isDegraded());
        assertFalse(snapshot.profile().isDegraded());
        assertFalse(snapshot.semantic().isDegraded());
        assertFalse(snapshot.feedback().isDegraded());
        assertEquals(List.of(turn), snapshot.recentTurns());
        assertEquals(List.of(match), snapshot.semanticMatches());
        assertFalse(snapshot.feedbackCaptured());
        verify(feedback).retrieve("u", 3);
    }

    @Test
    void shouldDegradeFailingTierWithoutAffectingOthers() {
        when(semanticIndex.query(anyString(), any(), anyInt(), anyDouble()))
                .thenThrow(new IllegalStateException("index corrupt"));

        MemorySnapshot snapshot = coordinator.retrieve("u", "c1", EMBEDDING);

        assertTrue(snapshot.semantic().isDegraded());
        assertEquals("IllegalStateException: index corrupt", snapshot.semantic().error());
        assertTrue(snapshot.semanticMatches().isEmpty());
        assertFalse(snapshot.recency().isDegraded());
        assertFalse(snapshot.profile().isDegraded());
        assertFalse(snapshot.feedback().isDegraded());
    }

    @Test
    void shouldDegradeSemanticTierWhenBackendUnavailable() {
        when(semanticIndex.isAvailable()).thenReturn(false);

        MemorySnapshot snapshot = coordinator.retrieve("u", "c1", EMBEDDING);

        assertTrue(snapshot.semantic().isDegraded());
        assertTrue(snapshot.semantic().error().contains("semantic backend unavailable"));
        verify(semanticIndex, never()).query(anyString(), any(), anyInt(), anyDouble());
    }

    @Test
    void shouldDegradeSlowTierToDefaultProfile() {
        when(profiles.get("u")).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return new UserProfile(Map.of("preferences", Map.of("communication_style", "slow")));
        });

        long start = System.nanoTime();
        MemorySnapshot snapshot = coordinator.retrieve("u", "c1", EMBEDDING);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(snapshot.profile().isDegraded());
        assertEquals("timed out after 200ms", snapshot.profile().error());
        assertEquals("balanced", snapshot.profile().value().preferences().get("communication_style"));
        assertTrue(elapsedMs < 1500);
    }

    @Test
    void shouldCaptureCorrectionAndRefreshFeedback() {
        Turn turn = Turn.create("c1", Turn.Role.ASSISTANT, "Paris is in Italy", 5);
        when(recency.get("c1", 10)).thenReturn(new RecentWindow(List.of(turn), null));
        Correction refreshed = Correction.create("u", "c1", "req-1", Correction.MANUAL_USER_CORRECTION,
                "incorrect: Paris is in France", null, Map.of());
        when(feedback.retrieve("u", 3)).thenReturn(List.of(), List.of(refreshed));

        MemorySnapshot snapshot = coordinator.aggregate("u", "c1", "incorrect: Paris is in France", EMBEDDING, "req-1");

        ArgumentCaptor<Correction> captor = ArgumentCaptor.forClass(Correction.class);
        verify(feedback).store(captor.capture());
        Correction stored = captor.getValue();
        assertEquals("req-1", stored.messageId());
        assertEquals(Correction.MANUAL_USER_CORRECTION, stored.correctionType());
        assertEquals("incorrect: Paris is in France", stored.userText());
        assertNull(stored.correctedText());
        assertEquals(Map.of("short_term", 1, "has_long_term", true), stored.contextSnapshot());
        assertTrue(snapshot.feedbackCaptured());
        assertEquals(List.of(refreshed), snapshot.corrections());
    }

    @Test
    void shouldKeepEarlierCorrectionsWhenRefreshFails() {
        Correction earlier = Correction.create("u", "c0", "req-0", "factual_error", "wrong date", "1969", Map.of());
        when(feedback.retrieve("u", 3))
                .thenReturn(List.of(earlier))
                .thenThrow(new IllegalStateException("database is locked"));

        MemorySnapshot snapshot = coordinator.aggregate("u", "c1", "incorrect: still wrong", EMBEDDING, "req-1");

        verify(feedback).store(any());
        assertTrue(snapshot.feedbackCaptured());
        assertFalse(snapshot.feedback().isDegraded());
        assertEquals(List.of(earlier), snapshot.corrections());
    }

    @Test
    void shouldNotCaptureOrdinaryMessages() {
        MemorySnapshot snapshot = coordinator.aggregate("u", "c1", "What is the incorrect: answer?", EMBEDDING, "req-1");

        verify(feedback, never()).store(any());
        assertFalse(snapshot.feedbackCaptured());
    }

    @Test
    void shouldReturnSnapshotWhenCorrectionCannotBeStored() {
        when(feedback.store(any())).thenThrow(new IllegalStateException("locked"));

        MemorySnapshot snapshot = coordinator.aggregate("u", "c1", "incorrect: nope", EMBEDDING, "req-1");

        assertFalse(snapshot.feedbackCaptured());
        assertFalse(snapshot.feedback().isDegraded());
    }

    @Test
    void shouldDetectMarkerIgnoringCaseAndLeadingWhitespace() {
        assertTrue(coordinator.isCorrection("  INCORRECT: that was wrong"));
        assertTrue(coordinator.isCorrection("incorrect:"));
        assertFalse(coordinator.isCorrection("incorrect that was wrong"));
        assertFalse(coordinator.isCorrection(null));
    }

    @Test
    void shouldDelegateSummarizationCheck() {
        when(recency.shouldSummarize("c1", 2000)).thenReturn(true);

        assertTrue(coordinator.summarizationDue("c1"));
    }
}
