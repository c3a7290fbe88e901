package io.memoryrunr.memory;

/**
 * Wraps I/O and transaction failures of the backing store.
 */
public class MemoryStorageException extends MemoryException {

    public MemoryStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
