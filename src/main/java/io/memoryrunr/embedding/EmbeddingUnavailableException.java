package io.memoryrunr.embedding;

import io.memoryrunr.memory.MemoryException;

/**
 * Raised when no embedding provider is configured, or the configured one failed to produce a vector.
 */
public class EmbeddingUnavailableException extends MemoryException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public static EmbeddingUnavailableException notConfigured() {
        return new EmbeddingUnavailableException(
                "No embedding provider configured (set memory.embedding.provider)");
    }
}
