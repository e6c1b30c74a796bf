package io.contextrunr.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Semantic index used when semantic recall is disabled. Queries are always
 * empty and writes are dropped.
 */
public class NoOpSemanticIndex implements SemanticIndex {

    private static final Logger log = LoggerFactory.getLogger(NoOpSemanticIndex.class);

    @Override
    public List<SemanticMatch> query(String userId, float[] embedding, int k, double similarityThreshold) {
        return List.of();
    }

    @Override
    public void add(SemanticRecord record) {
        log.debug("Semantic recall disabled, dropping record {}", record.id());
    }

    @Override
    public void clear(String userId) {
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
