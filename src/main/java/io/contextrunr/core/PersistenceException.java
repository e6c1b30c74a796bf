package io.contextrunr.core;

/**
 * A turn could not be persisted after generation. Writes made before the
 * failure are not rolled back.
 */
public class PersistenceException extends PipelineException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
