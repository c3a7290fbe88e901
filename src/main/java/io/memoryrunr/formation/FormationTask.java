package io.memoryrunr.formation;

import io.memoryrunr.memory.MemoryCategory;

/**
 * A request to turn a piece of conversation into a memory.
 *
 * @param id              task id, assigned by the queue (null for synchronous formation)
 * @param content         candidate memory text
 * @param category        category hint, null to auto-detect
 * @param agentHandle     agent scope, null for global
 * @param pathScope       path scope, null for unscoped
 * @param sourceSessionId provenance session id
 * @param sourceMessageId provenance message id
 */
public record FormationTask(
        String id,
        String content,
        MemoryCategory category,
        String agentHandle,
        String pathScope,
        String sourceSessionId,
        String sourceMessageId
) {

    public static FormationTask of(String content, MemoryCategory category, String agentHandle, String pathScope) {
        return new FormationTask(null, content, category, agentHandle, pathScope, null, null);
    }

    public FormationTask withId(String id) {
        return new FormationTask(id, content, category, agentHandle, pathScope, sourceSessionId, sourceMessageId);
    }

    public FormationTask withSource(String sessionId, String messageId) {
        return new FormationTask(id, content, category, agentHandle, pathScope, sessionId, messageId);
    }
}
