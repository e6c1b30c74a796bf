package io.contextrunr.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Semantic index kept in its own SQLite file.
 *
 * <p>Embeddings are stored as little-endian float32 blobs and metadata as JSON.
 * A query scans the user's rows and ranks them by cosine similarity, so results
 * are exact rather than approximate.</p>
 *
 * <p>Failures never reach the caller: a failed query returns no matches and a
 * failed write is dropped, both logged.</p>
 */
public class SQLiteSemanticIndex implements SemanticIndex {

    private static final Logger log = LoggerFactory.getLogger(SQLiteSemanticIndex.class);
    private static final TypeReference<LinkedHashMap<String, Object>> JSON_MAP = new TypeReference<>() {};

    private final String dbPath;
    private final ObjectMapper objectMapper;
    private Connection connection;

    public SQLiteSemanticIndex(Path dbFile, ObjectMapper objectMapper) {
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
                stmt.execute("""
                    CREATE TABLE IF NOT EXISTS semantic_records (
                        id TEXT PRIMARY KEY,
                        user_id TEXT NOT NULL,
                        content TEXT NOT NULL,
                        embedding BLOB NOT NULL,
                        metadata TEXT
                    )
                    """);
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_semantic_user ON semantic_records(user_id)");
            }
            log.info("SQLiteSemanticIndex initialized at: {}", dbPath);
        } catch (SQLException e) {
            log.error("Failed to initialize semantic index at {}, semantic recall unavailable", dbPath, e);
            connection = null;
        }
    }

    @Override
    public synchronized List<SemanticMatch> query(String userId, float[] embedding, int k, double similarityThreshold) {
        if (connection == null || embedding == null || embedding.length == 0 || k <= 0) {
            return List.of();
        }
        List<SemanticMatch> candidates = new ArrayList<>();
        String sql = "SELECT id, content, embedding, metadata FROM semantic_records WHERE user_id = ?";
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, userId);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    float[] stored = fromBlob(rs.getBytes("embedding"));
                    double score = round3(cosineSimilarity(embedding, stored));
                    if (score >= similarityThreshold) {
                        candidates.add(new SemanticMatch(
                                rs.getString("id"),
                                rs.getString("content"),
                                readMetadata(rs.getString("metadata")),
                                score));
                    }
                }
            }
        } catch (Exception e) {
            log.error("Semantic query failed for user {}", userId, e);
            return List.of();
        }
        candidates.sort(Comparator.comparingDouble(SemanticMatch::score).reversed());
        List<SemanticMatch> top = candidates.size() > k ? candidates.subList(0, k) : candidates;
        log.debug("Semantic query for user {} returned {} matches (threshold: {})", userId, top.size(), similarityThreshold);
        return List.copyOf(top);
    }

    @Override
    public synchronized void add(SemanticRecord record) {
        if (connection == null) {
            log.warn("Semantic index unavailable, dropping record {}", record.id());
            return;
        }
        String sql = """
            INSERT INTO semantic_records (id, user_id, content, embedding, metadata)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                user_id = excluded.user_id,
                content = excluded.content,
                embedding = excluded.embedding,
                metadata = excluded.metadata
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, record.id());
            stmt.setString(2, record.userId());
            stmt.setString(3, record.content());
            stmt.setBytes(4, toBlob(record.embedding()));
            stmt.setString(5, objectMapper.writeValueAsString(record.metadata()));
            stmt.executeUpdate();
            log.debug("Stored embedding for record: {}", record.id());
        } catch (Exception e) {
            log.error("Failed to store embedding for record {}", record.id(), e);
        }
    }

    @Override
    public synchronized void clear(String userId) {
        if (connection == null) {
            return;
        }
        try (var stmt = connection.prepareStatement("DELETE FROM semantic_records WHERE user_id = ?")) {
            stmt.setString(1, userId);
            int deleted = stmt.executeUpdate();
            log.info("Cleared {} semantic records for user: {}", deleted, userId);
        } catch (SQLException e) {
            log.error("Failed to clear semantic records for user {}", userId, e);
        }
    }

    @Override
    public boolean isAvailable() {
        return connection != null;
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                log.error("Failed to close semantic index", e);
            }
        }
    }

    static double cosineSimilarity(float[] a, float[] b) {
        int n = Math.min(a.length, b.length);
        if (n == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < n; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    static byte[] toBlob(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : vector) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    static float[] fromBlob(byte[] blob) {
        if (blob == null) {
            return new float[0];
        }
        ByteBuffer buffer = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[blob.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    private Map<String, Object> readMetadata(String json) throws IOException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return objectMapper.readValue(json, JSON_MAP);
    }
}
