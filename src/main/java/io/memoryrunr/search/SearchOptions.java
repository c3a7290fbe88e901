package io.memoryrunr.search;

import io.memoryrunr.memory.MemoryCategory;
import io.memoryrunr.memory.MemoryValidationException;

import java.util.Set;

/**
 * Filters and bounds for a similarity search.
 *
 * @param agentHandle restrict to this agent's memories plus global ones, null for all agents
 * @param pathScope   restrict to this path's memories plus unscoped ones, null for all paths
 * @param threshold   minimum cosine similarity, in [0, 1]
 * @param limit       maximum number of results
 * @param categories  only these categories, empty for all
 */
public record SearchOptions(
        String agentHandle,
        String pathScope,
        double threshold,
        int limit,
        Set<MemoryCategory> categories
) {

    public static final double DEFAULT_THRESHOLD = 0.5;
    public static final int DEFAULT_LIMIT = 10;

    public SearchOptions {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new MemoryValidationException("Threshold must be between 0 and 1, got " + threshold);
        }
        if (limit <= 0) {
            throw new MemoryValidationException("Limit must be positive, got " + limit);
        }
        agentHandle = agentHandle == null || agentHandle.isBlank() ? null : agentHandle;
        pathScope = pathScope == null || pathScope.isBlank() ? null : pathScope;
        categories = categories == null ? Set.of() : Set.copyOf(categories);
    }

    public static SearchOptions defaults() {
        return new SearchOptions(null, null, DEFAULT_THRESHOLD, DEFAULT_LIMIT, Set.of());
    }

    public SearchOptions withScope(String agentHandle, String pathScope) {
        return new SearchOptions(agentHandle, pathScope, threshold, limit, categories);
    }

    public SearchOptions withThreshold(double threshold) {
        return new SearchOptions(agentHandle, pathScope, threshold, limit, categories);
    }

    public SearchOptions withLimit(int limit) {
        return new SearchOptions(agentHandle, pathScope, threshold, limit, categories);
    }

    public SearchOptions withCategories(Set<MemoryCategory> categories) {
        return new SearchOptions(agentHandle, pathScope, threshold, limit, categories);
    }
}
