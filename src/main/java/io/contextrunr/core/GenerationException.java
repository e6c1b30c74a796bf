package io.contextrunr.core;

/**
 * Embedding or text generation failed; nothing was persisted.
 */
public class GenerationException extends PipelineException {

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
