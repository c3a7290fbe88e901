package io.memoryrunr.api;

import io.memoryrunr.embedding.EmbeddingUnavailableException;
import io.memoryrunr.memory.AmbiguousMemoryIdException;
import io.memoryrunr.memory.MemoryException;
import io.memoryrunr.memory.MemoryNotFoundException;
import io.memoryrunr.memory.MemoryStorageException;
import io.memoryrunr.memory.MemoryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps memory engine errors to JSON responses of the form {@code {"error": ..., "message": ...}}.
 */
@RestControllerAdvice(assignableTypes = MemoryController.class)
public class MemoryExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(MemoryExceptionHandler.class);

    @ExceptionHandler(MemoryNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(MemoryNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e);
    }

    @ExceptionHandler(AmbiguousMemoryIdException.class)
    public ResponseEntity<Map<String, String>> ambiguous(AmbiguousMemoryIdException e) {
        return error(HttpStatus.CONFLICT, "ambiguous_id", e);
    }

    @ExceptionHandler(EmbeddingUnavailableException.class)
    public ResponseEntity<Map<String, String>> providerUnavailable(EmbeddingUnavailableException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "provider_unavailable", e);
    }

    @ExceptionHandler(MemoryValidationException.class)
    public ResponseEntity<Map<String, String>> invalid(MemoryValidationException e) {
        return error(HttpStatus.BAD_REQUEST, "validation", e);
    }

    @ExceptionHandler(MemoryStorageException.class)
    public ResponseEntity<Map<String, String>> storage(MemoryStorageException e) {
        log.error("Memory storage failure", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "storage", e);
    }

    @ExceptionHandler(MemoryException.class)
    public ResponseEntity<Map<String, String>> other(MemoryException e) {
        log.error("Memory operation failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "memory", e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : code;
        return ResponseEntity.status(status).body(Map.of("error", code, "message", message));
    }
}
