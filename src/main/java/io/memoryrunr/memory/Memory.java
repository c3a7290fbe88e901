package io.memoryrunr.memory;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A stored memory: a natural-language fact, preference, correction or pattern.
 *
 * <p>The embedding array is shared, not copied; treat it as read-only. Equality compares its
 * contents and {@link #toString()} shows only its dimension.</p>
 *
 * @param id                 unique identifier (UUID); prefixes resolve through {@link MemoryStore#getByPrefix(String)}
 * @param agentHandle        agent scope, null for global memories
 * @param pathScope          project path scope, null when unscoped
 * @param content            the memory itself
 * @param category           memory category
 * @param embedding          vector representation of {@code content}, null if none was computed
 * @param confidence         how certain the memory is accurate (0.0-1.0)
 * @param accessCount        number of times returned by search or get
 * @param lastAccessedAt     last time returned by search or get, null if never
 * @param supersedesId       memory this one replaced
 * @param supersededById     memory that replaced this one
 * @param supersessionReason why this memory was replaced
 * @param status             lifecycle status
 * @param sourceSessionId    session that produced the memory
 * @param sourceMessageId    message that produced the memory
 * @param createdAt          creation time
 * @param updatedAt          last modification time
 */
public record Memory(
        String id,
        String agentHandle,
        String pathScope,
        String content,
        MemoryCategory category,
        float[] embedding,
        double confidence,
        long accessCount,
        Instant lastAccessedAt,
        String supersedesId,
        String supersededById,
        String supersessionReason,
        MemoryStatus status,
        String sourceSessionId,
        String sourceMessageId,
        Instant createdAt,
        Instant updatedAt
) {

    public boolean isActive() {
        return status == MemoryStatus.ACTIVE;
    }

    public boolean isGlobal() {
        return agentHandle == null;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    /** Returns a copy reflecting one more access at the given time. */
    public Memory withAccess(Instant accessedAt) {
        return new Memory(id, agentHandle, pathScope, content, category, embedding, confidence,
                accessCount + 1, accessedAt, supersedesId, supersededById, supersessionReason,
                status, sourceSessionId, sourceMessageId, createdAt, updatedAt);
    }

    /** First eight characters of the id, as shown in listings. */
    public String shortId() {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Memory other)) return false;
        return Double.compare(confidence, other.confidence) == 0
                && accessCount == other.accessCount
                && Objects.equals(id, other.id)
                && Objects.equals(agentHandle, other.agentHandle)
                && Objects.equals(pathScope, other.pathScope)
                && Objects.equals(content, other.content)
                && category == other.category
                && Arrays.equals(embedding, other.embedding)
                && Objects.equals(lastAccessedAt, other.lastAccessedAt)
                && Objects.equals(supersedesId, other.supersedesId)
                && Objects.equals(supersededById, other.supersededById)
                && Objects.equals(supersessionReason, other.supersessionReason)
                && status == other.status
                && Objects.equals(sourceSessionId, other.sourceSessionId)
                && Objects.equals(sourceMessageId, other.sourceMessageId)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(updatedAt, other.updatedAt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, agentHandle, pathScope, content, category, confidence, accessCount,
                lastAccessedAt, supersedesId, supersededById, supersessionReason, status,
                sourceSessionId, sourceMessageId, createdAt, updatedAt);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "Memory[id=" + id + ", agentHandle=" + agentHandle + ", pathScope=" + pathScope
                + ", content=" + content + ", category=" + category
                + ", embedding=" + (embedding == null ? "none" : embedding.length + "d")
                + ", confidence=" + confidence + ", accessCount=" + accessCount
                + ", lastAccessedAt=" + lastAccessedAt + ", supersedesId=" + supersedesId
                + ", supersededById=" + supersededById + ", supersessionReason=" + supersessionReason
                + ", status=" + status + ", sourceSessionId=" + sourceSessionId
                + ", sourceMessageId=" + sourceMessageId + ", createdAt=" + createdAt
                + ", updatedAt=" + updatedAt + "]";
    }
}
