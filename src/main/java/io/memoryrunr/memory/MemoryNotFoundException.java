package io.memoryrunr.memory;

public class MemoryNotFoundException extends MemoryException {

    public MemoryNotFoundException(String id) {
        super("Memory not found: " + id);
    }
}
