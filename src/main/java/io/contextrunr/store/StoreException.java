package io.contextrunr.store;

/**
 * Raised when the durable store cannot complete an operation.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
