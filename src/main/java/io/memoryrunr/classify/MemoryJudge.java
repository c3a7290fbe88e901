package io.memoryrunr.classify;

import io.memoryrunr.memory.Memory;

import java.util.List;

/**
 * Decides whether candidate content repeats, replaces, or adds to memories that embed close to it.
 */
@FunctionalInterface
public interface MemoryJudge {

    /**
     * @param candidate new memory content
     * @param similar   active memories in the candidate's scope, most similar first; never empty
     * @throws io.memoryrunr.memory.MemoryException if the backing model could not be reached or replied garbage
     */
    DuplicateVerdict judge(String candidate, List<Memory> similar);
}
