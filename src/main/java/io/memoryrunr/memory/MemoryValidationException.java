package io.memoryrunr.memory;

public class MemoryValidationException extends MemoryException {

    public MemoryValidationException(String message) {
        super(message);
    }
}
