package io.memoryrunr.search;

import io.memoryrunr.embedding.EmbeddingProvider;
import io.memoryrunr.embedding.EmbeddingUnavailableException;
import io.memoryrunr.embedding.VectorMath;
import io.memoryrunr.memory.Memory;
import io.memoryrunr.memory.MemoryStore;
import io.memoryrunr.memory.MemoryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Semantic retrieval over stored memories. Candidates are scanned linearly and ranked by cosine
 * similarity to the query vector.
 */
@Service
public class MemorySearchService {

    private static final Logger log = LoggerFactory.getLogger(MemorySearchService.class);

    private static final Comparator<SearchResult> RANKING = Comparator
            .comparingDouble(SearchResult::similarity).reversed()
            .thenComparing(r -> r.memory().createdAt(), Comparator.reverseOrder());

    private final MemoryStore store;
    private final @Nullable EmbeddingProvider embeddingProvider;
    private final Clock clock;

    @Autowired
    public MemorySearchService(MemoryStore store, @Nullable EmbeddingProvider embeddingProvider) {
        this(store, embeddingProvider, Clock.systemUTC());
    }

    MemorySearchService(MemoryStore store, @Nullable EmbeddingProvider embeddingProvider, Clock clock) {
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.clock = clock;
    }

    public boolean isAvailable() {
        return embeddingProvider != null;
    }

    /**
     * Embeds the query and returns the most similar active memories in scope.
     *
     * @throws EmbeddingUnavailableException if no provider is configured or embedding fails
     */
    public List<SearchResult> search(String query, SearchOptions options) {
        if (query == null || query.isBlank()) {
            throw new MemoryValidationException("Search query must not be empty");
        }
        if (embeddingProvider == null) {
            throw EmbeddingUnavailableException.notConfigured();
        }
        float[] queryVector = embeddingProvider.embed(query);
        List<SearchResult> results = searchByVector(queryVector, options);
        log.debug("Search '{}' returned {} memories (threshold={}, agent={}, path={})",
                query, results.size(), options.threshold(), options.agentHandle(), options.pathScope());
        return results;
    }

    /**
     * Ranks active in-scope memories against a precomputed vector. Memories whose vector has a
     * different dimension are skipped.
     */
    public List<SearchResult> searchByVector(float[] queryVector, SearchOptions options) {
        if (queryVector == null || queryVector.length == 0) {
            throw new EmbeddingUnavailableException("Query vector is empty");
        }

        List<SearchResult> matches = new ArrayList<>();
        int skipped = 0;
        for (Memory candidate : store.searchCandidates(options.agentHandle(), options.pathScope())) {
            if (!candidate.hasEmbedding() || candidate.embedding().length != queryVector.length) {
                skipped++;
                continue;
            }
            if (!options.categories().isEmpty() && !options.categories().contains(candidate.category())) {
                continue;
            }
            double similarity = VectorMath.cosineSimilarity(queryVector, candidate.embedding());
            if (similarity >= options.threshold()) {
                matches.add(new SearchResult(candidate, similarity));
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} memories with missing or mismatched vectors", skipped);
        }

        matches.sort(RANKING);
        List<SearchResult> top = matches.size() > options.limit()
                ? matches.subList(0, options.limit())
                : matches;
        if (top.isEmpty()) {
            return List.of();
        }

        Instant now = Instant.ofEpochMilli(clock.millis());
        store.recordAccess(top.stream().map(r -> r.memory().id()).toList(), now);
        return top.stream()
                .map(r -> new SearchResult(r.memory().withAccess(now), r.similarity()))
                .toList();
    }
}
