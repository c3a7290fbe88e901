package io.memoryrunr.classify;

import io.memoryrunr.memory.MemoryCategory;

/**
 * Picks a category for memory content when the caller supplied none.
 */
@FunctionalInterface
public interface MemoryClassifier {

    /**
     * @throws io.memoryrunr.memory.MemoryException if the backing model could not be reached or replied garbage
     */
    MemoryCategory classify(String content);
}
