package io.contextrunr.core;

/**
 * The request deadline expired before generation returned; nothing was persisted.
 */
public class PipelineTimeoutException extends PipelineException {

    public PipelineTimeoutException(String message) {
        super(message);
    }
}
