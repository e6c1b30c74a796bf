package io.contextrunr.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.contextrunr.config.MemoryProperties;
import io.contextrunr.memory.ConversationSummary;
import io.contextrunr.memory.Correction;
import io.contextrunr.memory.Turn;
import io.contextrunr.memory.UserProfile;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite-backed {@link ChatStore}.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code conversations}: one row per conversation, owned by a user</li>
 *   <li>{@code turns}: persisted messages, cascade-deleted with their conversation</li>
 *   <li>{@code conversation_summaries}: condensed earlier ranges, cascade-deleted with their conversation</li>
 *   <li>{@code user_profiles}: one JSON profile per user</li>
 *   <li>{@code feedback_corrections}: corrections with their applied counter</li>
 *   <li>{@code request_traces}: one row per completed request</li>
 * </ul>
 *
 * <p>Rows carry an autoincrement {@code seq} so "most recent" is insertion order
 * even when timestamps collide. Access to the single connection is serialized.</p>
 */
@Component
public class SQLiteChatStore implements ChatStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteChatStore.class);
    private static final TypeReference<LinkedHashMap<String, Object>> JSON_MAP = new TypeReference<>() {};

    private final String dbPath;
    private final ObjectMapper objectMapper;
    private Connection connection;

    @Autowired
    public SQLiteChatStore(MemoryProperties properties, ObjectMapper objectMapper) {
        Path dir = Path.of(properties.path());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Failed to create data directory: {}", dir, e);
        }
        this.dbPath = dir.resolve("chat.db").toString();
        this.objectMapper = objectMapper;
    }

    /** Constructor for tests with an explicit database file. */
    public SQLiteChatStore(Path dbFile, ObjectMapper objectMapper) {
        this.dbPath = dbFile.toString();
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
                stmt.execute("PRAGMA foreign_keys=ON");
            }
            createSchema();
            log.info("SQLiteChatStore initialized at: {}", dbPath);
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite chat store at {}", dbPath, e);
            throw new RuntimeException("Chat store initialization failed", e);
        }
    }

    private void createSchema() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS conversations (
                    id TEXT PRIMARY KEY,
                    user_id TEXT NOT NULL,
                    title TEXT,
                    created_at TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_conversations_user ON conversations(user_id)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS turns (
                    seq INTEGER PRIMARY KEY AUTOINCREMENT,
                    id TEXT NOT NULL UNIQUE,
                    conversation_id TEXT NOT NULL REFERENCES conversations(id) ON DELETE CASCADE,
                    role TEXT NOT NULL,
                    content TEXT NOT NULL,
                    token_count INTEGER NOT NULL DEFAULT 0,
                    created_at TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_turns_conversation ON turns(conversation_id, seq)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS conversation_summaries (
                    seq INTEGER PRIMARY KEY AUTOINCREMENT,
                    id TEXT NOT NULL UNIQUE,
                    conversation_id TEXT NOT NULL REFERENCES conversations(id) ON DELETE CASCADE,
                    summary_text TEXT NOT NULL,
                    message_range_start INTEGER NOT NULL,
                    message_range_end INTEGER NOT NULL,
                    tokens_saved INTEGER NOT NULL DEFAULT 0,
                    created_at TEXT NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS user_profiles (
                    user_id TEXT PRIMARY KEY,
                    profile_data TEXT NOT NULL,
                    created_at TEXT NOT NULL,
                    updated_at TEXT NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS feedback_corrections (
                    seq INTEGER PRIMARY KEY AUTOINCREMENT,
                    id TEXT NOT NULL UNIQUE,
                    user_id TEXT NOT NULL,
                    conversation_id TEXT,
                    message_id TEXT,
                    correction_type TEXT NOT NULL,
                    user_correction TEXT,
                    corrected_response TEXT,
                    context_snapshot TEXT,
                    applied_count INTEGER NOT NULL DEFAULT 0,
                    created_at TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_corrections_user ON feedback_corrections(user_id, seq)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS request_traces (
                    request_id TEXT PRIMARY KEY,
                    user_id TEXT NOT NULL,
                    conversation_id TEXT NOT NULL,
                    user_message TEXT NOT NULL,
                    assistant_response TEXT NOT NULL,
                    prompt_tokens INTEGER NOT NULL DEFAULT 0,
                    completion_tokens INTEGER NOT NULL DEFAULT 0,
                    total_tokens INTEGER NOT NULL DEFAULT 0,
                    latency_ms REAL,
                    llm_provider TEXT,
                    model_name TEXT,
                    memory_snapshot TEXT,
                    created_at TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_traces_user ON request_traces(user_id)");
        }
    }

    // --- Conversations ---

    @Override
    public synchronized void createConversation(Conversation conversation) {
        String sql = "INSERT OR IGNORE INTO conversations (id, user_id, title, created_at) VALUES (?, ?, ?, ?)";
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, conversation.id());
            stmt.setString(2, conversation.userId());
            stmt.setString(3, conversation.title());
            stmt.setString(4, conversation.createdAt().toString());
            stmt.executeUpdate();
            log.debug("Created conversation: id='{}', user='{}'", conversation.id(), conversation.userId());
        } catch (SQLException e) {
            throw failure("create conversation " + conversation.id(), e);
        }
    }

    @Override
    public synchronized Optional<Conversation> findConversation(String conversationId) {
        String sql = "SELECT id, user_id, title, created_at FROM conversations WHERE id = ?";
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, conversationId);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Conversation(
                            rs.getString("id"),
                            rs.getString("user_id"),
                            rs.getString("title"),
                            Instant.parse(rs.getString("created_at"))));
                }
            }
        } catch (SQLException e) {
            throw failure("find conversation " + conversationId, e);
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<String> conversationIds(String userId) {
        List<String> ids = new ArrayList<>();
        String sql = "SELECT id FROM conversations WHERE user_id = ? ORDER BY created_at DESC";
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, userId);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            throw failure("list conversations of " + userId, e);
        }
        return ids;
    }

    // --- Turns ---

    @Override
    public synchronized void saveTurn(Turn turn) {
        String sql = """
            INSERT INTO turns (id, conversation_id, role, content, token_count, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, turn.id());
            stmt.setString(2, turn.conversationId());
            stmt.setString(3, turn.role().wireName());
            stmt.setString(4, turn.content());
            stmt.setInt(5, turn.tokenCount());
            stmt.setString(6, turn.createdAt().toString());
            stmt.executeUpdate();
            log.debug("Stored {} turn {} in conversation {}", turn.role().wireName(), turn.id(), turn.conversationId());
        } catch (SQLException e) {
            throw failure("save turn " + turn.id(), e);
        }
    }

    @Override
    public synchronized List<Turn> recentTurns(String conversationId, int limit) {
        List<Turn> turns = new ArrayList<>();
        String sql = """
            SELECT id, conversation_id, role, content, token_count, created_at
            FROM turns
            WHERE conversation_id = ?
            ORDER BY seq DESC
            LIMIT ?
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, conversationId);
            stmt.setInt(2, limit);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    turns.add(new Turn(
                            rs.getString("id"),
                            rs.getString("conversation_id"),
                            Turn.Role.fromString(rs.getString("role")),
                            rs.getString("content"),
                            rs.getInt("token_count"),
                            Instant.parse(rs.getString("created_at"))));
                }
            }
        } catch (SQLException e) {
            throw failure("load turns of " + conversationId, e);
        }
        return turns;
    }

    // --- Summaries ---

    @Override
    public synchronized void saveSummary(ConversationSummary summary) {
        String sql = """
            INSERT INTO conversation_summaries
                (id, conversation_id, summary_text, message_range_start, message_range_end, tokens_saved, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, summary.id());
            stmt.setString(2, summary.conversationId());
            stmt.setString(3, summary.text());
            stmt.setInt(4, summary.messageRangeStart());
            stmt.setInt(5, summary.messageRangeEnd());
            stmt.setInt(6, summary.tokensSaved());
            stmt.setString(7, summary.createdAt().toString());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure("save summary " + summary.id(), e);
        }
    }

    @Override
    public synchronized Optional<ConversationSummary> latestSummary(String conversationId) {
        String sql = """
            SELECT id, conversation_id, summary_text, message_range_start, message_range_end, tokens_saved, created_at
            FROM conversation_summaries
            WHERE conversation_id = ?
            ORDER BY seq DESC
            LIMIT 1
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, conversationId);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new ConversationSummary(
                            rs.getString("id"),
                            rs.getString("conversation_id"),
                            rs.getString("summary_text"),
                            rs.getInt("message_range_start"),
                            rs.getInt("message_range_end"),
                            rs.getInt("tokens_saved"),
                            Instant.parse(rs.getString("created_at"))));
                }
            }
        } catch (SQLException e) {
            throw failure("load summary of " + conversationId, e);
        }
        return Optional.empty();
    }

    // --- Profiles ---

    @Override
    public synchronized Optional<UserProfile> findProfile(String userId) {
        try (var stmt = connection.prepareStatement("SELECT profile_data FROM user_profiles WHERE user_id = ?")) {
            stmt.setString(1, userId);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new UserProfile(readJson(rs.getString(1))));
                }
            }
        } catch (SQLException e) {
            throw failure("load profile of " + userId, e);
        }
        return Optional.empty();
    }

    @Override
    public synchronized void upsertProfile(String userId, UserProfile profile) {
        String now = Instant.now().toString();
        String sql = """
            INSERT INTO user_profiles (user_id, profile_data, created_at, updated_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(user_id) DO UPDATE SET profile_data = excluded.profile_data, updated_at = excluded.updated_at
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, userId);
            stmt.setString(2, writeJson(profile.attributes()));
            stmt.setString(3, now);
            stmt.setString(4, now);
            stmt.executeUpdate();
            log.debug("Stored profile for user: {}", userId);
        } catch (SQLException e) {
            throw failure("store profile of " + userId, e);
        }
    }

    // --- Corrections ---

    @Override
    public synchronized void saveCorrection(Correction correction) {
        String sql = """
            INSERT INTO feedback_corrections
                (id, user_id, conversation_id, message_id, correction_type, user_correction,
                 corrected_response, context_snapshot, applied_count, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, correction.id());
            stmt.setString(2, correction.userId());
            stmt.setString(3, correction.conversationId());
            stmt.setString(4, correction.messageId());
            stmt.setString(5, correction.correctionType());
            stmt.setString(6, correction.userText());
            setNullableString(stmt, 7, correction.correctedText());
            stmt.setString(8, writeJson(correction.contextSnapshot()));
            stmt.setInt(9, correction.appliedCount());
            stmt.setString(10, correction.createdAt().toString());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure("save correction " + correction.id(), e);
        }
    }

    @Override
    public synchronized List<Correction> recentCorrections(String userId, int limit) {
        List<Correction> results = new ArrayList<>();
        String sql = """
            SELECT id, user_id, conversation_id, message_id, correction_type, user_correction,
                   corrected_response, context_snapshot, applied_count, created_at
            FROM feedback_corrections
            WHERE user_id = ?
            ORDER BY seq DESC
            LIMIT ?
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, userId);
            stmt.setInt(2, limit);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(new Correction(
                            rs.getString("id"),
                            rs.getString("user_id"),
                            rs.getString("conversation_id"),
                            rs.getString("message_id"),
                            rs.getString("correction_type"),
                            rs.getString("user_correction"),
                            rs.getString("corrected_response"),
                            readJson(rs.getString("context_snapshot")),
                            rs.getInt("applied_count"),
                            0.0,
                            Instant.parse(rs.getString("created_at"))));
                }
            }
        } catch (SQLException e) {
            throw failure("load corrections of " + userId, e);
        }
        return results;
    }

    @Override
    public synchronized boolean incrementApplied(String correctionId) {
        String sql = "UPDATE feedback_corrections SET applied_count = applied_count + 1 WHERE id = ?";
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, correctionId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("increment applied count of " + correctionId, e);
        }
    }

    @Override
    public synchronized int deleteCorrections(String userId) {
        try (var stmt = connection.prepareStatement("DELETE FROM feedback_corrections WHERE user_id = ?")) {
            stmt.setString(1, userId);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure("delete corrections of " + userId, e);
        }
    }

    // --- Traces ---

    @Override
    public synchronized void saveTrace(RequestTrace trace) {
        String sql = """
            INSERT INTO request_traces
                (request_id, user_id, conversation_id, user_message, assistant_response, prompt_tokens,
                 completion_tokens, total_tokens, latency_ms, llm_provider, model_name, memory_snapshot, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, trace.requestId());
            stmt.setString(2, trace.userId());
            stmt.setString(3, trace.conversationId());
            stmt.setString(4, trace.userMessage());
            stmt.setString(5, trace.assistantResponse());
            stmt.setInt(6, trace.promptTokens());
            stmt.setInt(7, trace.completionTokens());
            stmt.setInt(8, trace.totalTokens());
            stmt.setDouble(9, trace.latencyMs());
            stmt.setString(10, trace.provider());
            stmt.setString(11, trace.model());
            stmt.setString(12, trace.memorySnapshot());
            stmt.setString(13, trace.createdAt().toString());
            stmt.executeUpdate();
            log.debug("Stored trace for request: {}", trace.requestId());
        } catch (SQLException e) {
            throw failure("save trace " + trace.requestId(), e);
        }
    }

    @Override
    public synchronized Optional<RequestTrace> findTrace(String requestId) {
        String sql = """
            SELECT request_id, user_id, conversation_id, user_message, assistant_response, prompt_tokens,
                   completion_tokens, total_tokens, latency_ms, llm_provider, model_name, memory_snapshot, created_at
            FROM request_traces
            WHERE request_id = ?
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, requestId);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new RequestTrace(
                            rs.getString("request_id"),
                            rs.getString("user_id"),
                            rs.getString("conversation_id"),
                            rs.getString("user_message"),
                            rs.getString("assistant_response"),
                            rs.getInt("prompt_tokens"),
                            rs.getInt("completion_tokens"),
                            rs.getInt("total_tokens"),
                            rs.getDouble("latency_ms"),
                            rs.getString("llm_provider"),
                            rs.getString("model_name"),
                            rs.getString("memory_snapshot"),
                            Instant.parse(rs.getString("created_at"))));
                }
            }
        } catch (SQLException e) {
            throw failure("load trace " + requestId, e);
        }
        return Optional.empty();
    }

    // --- Users ---

    @Override
    public synchronized void deleteUser(String userId) {
        String[] statements = {
                "DELETE FROM conversations WHERE user_id = ?",
                "DELETE FROM user_profiles WHERE user_id = ?",
                "DELETE FROM feedback_corrections WHERE user_id = ?",
                "DELETE FROM request_traces WHERE user_id = ?"
        };
        try {
            connection.setAutoCommit(false);
            for (String sql : statements) {
                try (var stmt = connection.prepareStatement(sql)) {
                    stmt.setString(1, userId);
                    stmt.executeUpdate();
                }
            }
            connection.commit();
            log.info("Deleted all stored data for user: {}", userId);
        } catch (SQLException e) {
            rollbackQuietly();
            throw failure("delete user " + userId, e);
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                log.error("Failed to restore auto-commit", e);
            }
        }
    }

    @Override
    public synchronized boolean healthCheck() {
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            return false;
        }
    }

    @PreDestroy
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
                log.info("SQLiteChatStore closed");
            } catch (SQLException e) {
                log.error("Failed to close SQLite connection", e);
            }
        }
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed", e);
        }
    }

    private static void setNullableString(PreparedStatement stmt, int index, String value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value);
        }
    }

    private String writeJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize JSON column", e);
        }
    }

    private Map<String, Object> readJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, JSON_MAP);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to parse JSON column", e);
        }
    }

    private static StoreException failure(String action, SQLException e) {
        log.error("Failed to {}", action, e);
        return new StoreException("Failed to " + action, e);
    }
}
