package io.memoryrunr.memory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage and lifecycle transitions for memories. The single source of truth.
 *
 * <p>Explicit operations surface failures as {@link MemoryException} subclasses:
 * {@link MemoryNotFoundException}, {@link AmbiguousMemoryIdException},
 * {@link MemoryValidationException} and {@link MemoryStorageException}.</p>
 */
public interface MemoryStore {

    /**
     * Stores a new active memory. When an embedding provider is configured and the draft carries no
     * vector, the content is embedded first; an embedding failure leaves the vector empty instead of
     * failing the call.
     *
     * @param draft the memory to create
     * @return the materialized memory with id, timestamps and defaults assigned
     * @throws MemoryValidationException if the content is empty or the confidence is outside [0, 1]
     */
    Memory create(MemoryDraft draft);

    /**
     * Gets a memory by exact id, in any status, and records the access.
     *
     * @throws MemoryNotFoundException if no memory has this id
     */
    Memory get(String id);

    /**
     * Resolves an exact id, or else a unique id prefix, in any status, and records the access.
     *
     * @throws MemoryNotFoundException    if nothing matches
     * @throws AmbiguousMemoryIdException if the prefix matches several memories
     */
    Memory getByPrefix(String prefix);

    /**
     * Like {@link #getByPrefix(String)} but without access bookkeeping, for callers that act on a
     * memory rather than read it.
     */
    Memory resolve(String prefix);

    /**
     * Looks up a memory by exact id without access bookkeeping.
     */
    Optional<Memory> find(String id);

    /**
     * Lists active memories, newest first.
     *
     * @param agentHandle only memories scoped to this agent, or null for all
     */
    List<Memory> list(String agentHandle, int limit, int offset);

    /**
     * Lists active memories of one category, newest first.
     */
    List<Memory> listByCategory(MemoryCategory category, String agentHandle, int limit, int offset);

    /**
     * Counts active memories, optionally for one agent.
     */
    long count(String agentHandle);

    /**
     * Counts active memories per category; every category is present in the result.
     */
    Map<MemoryCategory, Long> countByCategory(String agentHandle);

    /**
     * Soft-deletes a memory. Forgetting an already forgotten memory succeeds; a superseded memory is
     * returned unchanged.
     *
     * @return the memory after the transition
     * @throws MemoryNotFoundException if no memory has this id
     */
    Memory forget(String id);

    /**
     * Forgets every active memory in scope.
     *
     * @param agentHandle only this agent's memories, or null for all
     * @return the number of memories forgotten
     */
    int clear(String agentHandle);

    /**
     * Atomically links {@code newId} as the replacement of {@code oldId}: the old memory becomes
     * superseded and points at the new one, the new one points back at the old one.
     *
     * @throws MemoryNotFoundException   if either memory does not exist
     * @throws MemoryValidationException if the ids are equal or either memory is not active
     */
    void supersede(String oldId, String newId, String reason);

    /**
     * Moves an active memory to {@link MemoryStatus#ARCHIVED}. Nothing calls this automatically.
     *
     * @throws MemoryValidationException if the memory is not active
     */
    Memory archive(String id);

    /**
     * Returns the version chain of a memory: the memory itself, then each version it superseded,
     * oldest last.
     */
    List<Memory> history(String id);

    /**
     * Active memories with a vector visible in the given scope. A non-null agent matches that agent's
     * memories plus global ones; a non-null path matches that path plus unscoped memories.
     */
    List<Memory> searchCandidates(String agentHandle, String pathScope);

    /**
     * Finds an active memory in scope whose content equals {@code content}, ignoring case and
     * surrounding whitespace.
     */
    Optional<Memory> findActiveDuplicate(String content, String agentHandle, String pathScope);

    /**
     * Increments the access count and sets the last access time of the given memories.
     */
    void recordAccess(Collection<String> ids, Instant accessedAt);

    /**
     * Verifies the store is operational.
     */
    boolean healthCheck();
}
