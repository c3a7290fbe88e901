package io.memoryrunr.memory;

/**
 * Lifecycle state of a memory. Only {@code ACTIVE} memories are listed, counted and searched.
 */
public enum MemoryStatus {
    ACTIVE,
    /** Replaced by a newer memory; see {@link Memory#supersededById()}. */
    SUPERSEDED,
    /** Terminal. Reachable only through {@link MemoryStore#archive(String)}. */
    ARCHIVED,
    /** Soft-deleted. The row is kept. */
    FORGOTTEN;

    public static MemoryStatus fromString(String s) {
        if (s == null || s.isBlank()) return ACTIVE;
        return valueOf(s.trim().toUpperCase());
    }

    public String value() {
        return name().toLowerCase();
    }
}
