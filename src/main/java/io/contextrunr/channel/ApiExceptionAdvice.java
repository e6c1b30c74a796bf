package io.contextrunr.channel;

import io.contextrunr.core.GenerationException;
import io.contextrunr.core.PersistenceException;
import io.contextrunr.core.PipelineTimeoutException;
import io.contextrunr.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps pipeline failures to a status code and a single {@code {"error": ...}} body.
 * No partial memory or trace data is ever returned on failure.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionAdvice.class);

    @ExceptionHandler(PipelineTimeoutException.class)
    public ResponseEntity<Map<String, String>> handleTimeout(PipelineTimeoutException ex) {
        return error(HttpStatus.GATEWAY_TIMEOUT, ex);
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<Map<String, String>> handleGeneration(GenerationException ex) {
        return error(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler({PersistenceException.class, StoreException.class})
    public ResponseEntity<Map<String, String>> handlePersistence(RuntimeException ex) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException ex) {
        log.warn("Request failed with {}: {}", status.value(), ex.getMessage());
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(ex.getMessage())));
    }
}
