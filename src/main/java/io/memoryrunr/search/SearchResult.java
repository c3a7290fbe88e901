package io.memoryrunr.search;

import io.memoryrunr.memory.Memory;

/**
 * A memory matched by similarity search.
 *
 * @param memory     the matched memory, reflecting the access recorded by the search
 * @param similarity cosine similarity to the query
 */
public record SearchResult(Memory memory, double similarity) {
}
