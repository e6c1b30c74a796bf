package io.contextrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Request pipeline settings.
 *
 * @param requestTimeout   default deadline applied when the caller supplies none
 * @param workerThreads    size of the pool running generation, response embedding and persistence
 * @param embeddingTimeout how long persistence waits for the response embedding before skipping its indexing
 */
@ConfigurationProperties(prefix = "pipeline")
public record PipelineProperties(Duration requestTimeout, int workerThreads, Duration embeddingTimeout) {

    public PipelineProperties {
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            requestTimeout = Duration.ofSeconds(60);
        }
        if (workerThreads <= 0) workerThreads = 16;
        if (embeddingTimeout == null || embeddingTimeout.isZero() || embeddingTimeout.isNegative()) {
            embeddingTimeout = Duration.ofSeconds(10);
        }
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(null, 0, null);
    }
}
