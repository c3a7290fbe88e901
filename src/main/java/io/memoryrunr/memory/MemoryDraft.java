package io.memoryrunr.memory;

/**
 * The caller-supplied part of a new memory. Everything else is assigned by {@link MemoryStore#create(MemoryDraft)}.
 *
 * @param content         the memory text, required
 * @param category        category, null defaults to {@link MemoryCategory#FACT}
 * @param agentHandle     agent scope, null for global
 * @param pathScope       path scope, null for unscoped
 * @param confidence      confidence, null defaults to 1.0
 * @param embedding       precomputed vector for {@code content}; when null the store embeds it
 * @param sourceSessionId provenance session id
 * @param sourceMessageId provenance message id
 */
public record MemoryDraft(
        String content,
        MemoryCategory category,
        String agentHandle,
        String pathScope,
        Double confidence,
        float[] embedding,
        String sourceSessionId,
        String sourceMessageId
) {

    public MemoryDraft {
        agentHandle = blankToNull(agentHandle);
        pathScope = blankToNull(pathScope);
        sourceSessionId = blankToNull(sourceSessionId);
        sourceMessageId = blankToNull(sourceMessageId);
    }

    public static MemoryDraft of(String content, MemoryCategory category) {
        return new MemoryDraft(content, category, null, null, null, null, null, null);
    }

    public MemoryDraft withScope(String agentHandle, String pathScope) {
        return new MemoryDraft(content, category, agentHandle, pathScope, confidence, embedding,
                sourceSessionId, sourceMessageId);
    }

    public MemoryDraft withSource(String sessionId, String messageId) {
        return new MemoryDraft(content, category, agentHandle, pathScope, confidence, embedding,
                sessionId, messageId);
    }

    public MemoryDraft withConfidence(double confidence) {
        return new MemoryDraft(content, category, agentHandle, pathScope, confidence, embedding,
                sourceSessionId, sourceMessageId);
    }

    public MemoryDraft withEmbedding(float[] embedding) {
        return new MemoryDraft(content, category, agentHandle, pathScope, confidence, embedding,
                sourceSessionId, sourceMessageId);
    }

    static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
