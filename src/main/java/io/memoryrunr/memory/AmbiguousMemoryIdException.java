package io.memoryrunr.memory;

/**
 * Thrown when an id prefix matches more than one memory.
 */
public class AmbiguousMemoryIdException extends MemoryException {

    private final int matches;

    public AmbiguousMemoryIdException(String prefix, int matches) {
        super("Ambiguous memory id '%s': %d memories match".formatted(prefix, matches));
        this.matches = matches;
    }

    public int getMatches() {
        return matches;
    }
}
