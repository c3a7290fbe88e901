package io.memoryrunr.api;

import io.memoryrunr.classify.MemoryClassifier;
import io.memoryrunr.config.MemoryProperties;
import io.memoryrunr.formation.FormationTask;
import io.memoryrunr.formation.MemoryFormationQueue;
import io.memoryrunr.memory.Memory;
import io.memoryrunr.memory.MemoryCategory;
import io.memoryrunr.memory.MemoryDraft;
import io.memoryrunr.memory.MemoryException;
import io.memoryrunr.memory.MemoryStore;
import io.memoryrunr.search.MemorySearchService;
import io.memoryrunr.search.SearchOptions;
import io.memoryrunr.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API over the memory store, search and formation queue.
 */
@RestController
@RequestMapping("/api/memories")
public class MemoryController {

    private static final Logger log = LoggerFactory.getLogger(MemoryController.class);

    private final MemoryStore store;
    private final MemorySearchService searchService;
    private final MemoryFormationQueue formationQueue;
    private final @Nullable MemoryClassifier classifier;
    private final MemoryProperties.Search searchDefaults;

    public MemoryController(MemoryStore store,
                            MemorySearchService searchService,
                            MemoryFormationQueue formationQueue,
                            @Nullable MemoryClassifier classifier,
                            MemoryProperties properties) {
        this.store = store;
        this.searchService = searchService;
        this.formationQueue = formationQueue;
        this.classifier = classifier;
        this.searchDefaults = properties.search();
    }

    @GetMapping
    public List<MemoryView> list(@RequestParam(required = false) String agent,
                                 @RequestParam(required = false) String category,
                                 @RequestParam(defaultValue = "20") int limit,
                                 @RequestParam(defaultValue = "0") int offset) {
        MemoryCategory filter = MemoryCategory.parse(category);
        List<Memory> memories = filter != null
                ? store.listByCategory(filter, blankToNull(agent), limit, offset)
                : store.list(blankToNull(agent), limit, offset);
        return memories.stream().map(MemoryView::of).toList();
    }

    @GetMapping("/count")
    public Map<String, Object> count(@RequestParam(required = false) String agent) {
        return Map.of("count", store.count(blankToNull(agent)));
    }

    /**
     * Returns store health and per-category counts of active memories.
     */
    @GetMapping("/stats")
    public Map<String, Object> stats(@RequestParam(required = false) String agent) {
        Map<String, Long> byCategory = new LinkedHashMap<>();
        long total = 0;
        for (var entry : store.countByCategory(blankToNull(agent)).entrySet()) {
            byCategory.put(entry.getKey().value(), entry.getValue());
            total += entry.getValue();
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("healthy", store.healthCheck());
        stats.put("total", total);
        stats.put("byCategory", byCategory);
        stats.put("searchAvailable", searchService.isAvailable());
        stats.put("pendingFormations", formationQueue.pending());
        return stats;
    }

    @GetMapping("/search")
    public List<SearchHit> search(@RequestParam("q") String query,
                                  @RequestParam(required = false) String agent,
                                  @RequestParam(required = false) String path,
                                  @RequestParam(required = false) Double threshold,
                                  @RequestParam(required = false) Integer limit,
                                  @RequestParam(required = false) String category) {
        MemoryCategory filter = MemoryCategory.parse(category);
        SearchOptions options = new SearchOptions(agent, path,
                threshold != null ? threshold : searchDefaults.threshold(),
                limit != null ? limit : searchDefaults.limit(),
                filter != null ? Set.of(filter) : Set.of());
        return searchService.search(query, options).stream().map(SearchHit::of).toList();
    }

    @GetMapping("/{id}")
    public MemoryView get(@PathVariable String id) {
        return MemoryView.of(store.getByPrefix(id));
    }

    @GetMapping("/{id}/history")
    public List<MemoryView> history(@PathVariable String id) {
        Memory memory = store.resolve(id);
        return store.history(memory.id()).stream().map(MemoryView::of).toList();
    }

    /**
     * Stores a memory as given. Without a category the classifier picks one, falling back to fact.
     */
    @PostMapping
    public ResponseEntity<MemoryView> create(@RequestBody CreateMemoryRequest request) {
        MemoryCategory category = MemoryCategory.parse(request.category());
        if (category == null) {
            category = classify(request.content());
        }
        MemoryDraft draft = new MemoryDraft(
                request.content(),
                category,
                request.agent(),
                request.path(),
                request.confidence(),
                null,
                request.sessionId(),
                request.messageId());
        Memory created = store.create(draft);
        log.info("Created memory {} [{}]", created.shortId(), created.category().value());
        return ResponseEntity.status(HttpStatus.CREATED).body(MemoryView.of(created));
    }

    /**
     * Queues content for background formation. The returned task id identifies the status updates.
     */
    @PostMapping("/formations")
    public ResponseEntity<Map<String, String>> submitFormation(@RequestBody FormationRequest request) {
        if (request.content() == null || request.content().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "validation", "message", "Memory content must not be empty"));
        }
        FormationTask task = new FormationTask(null, request.content(), MemoryCategory.parse(request.category()),
                blankToNull(request.agent()), blankToNull(request.path()),
                blankToNull(request.sessionId()), blankToNull(request.messageId()));
        String taskId = formationQueue.submit(task);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("taskId", taskId));
    }

    @DeleteMapping("/{id}")
    public MemoryView forget(@PathVariable String id) {
        Memory memory = store.resolve(id);
        return MemoryView.of(store.forget(memory.id()));
    }

    @DeleteMapping
    public Map<String, Object> clear(@RequestParam(required = false) String agent) {
        return Map.of("cleared", store.clear(blankToNull(agent)));
    }

    private MemoryCategory classify(String content) {
        if (classifier == null || content == null || content.isBlank()) {
            return MemoryCategory.FACT;
        }
        try {
            return classifier.classify(content.trim());
        } catch (MemoryException e) {
            log.warn("Could not auto-categorize memory, storing as fact: {}", e.getMessage());
            return MemoryCategory.FACT;
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    public record CreateMemoryRequest(String content, String category, String agent, String path,
                                      Double confidence, String sessionId, String messageId) {}

    public record FormationRequest(String content, String category, String agent, String path,
                                   String sessionId, String messageId) {}

    /**
     * A memory as returned by the API. The vector itself is omitted; only its dimension is shown.
     */
    public record MemoryView(
            String id,
            String content,
            String category,
            String status,
            String agent,
            String path,
            double confidence,
            long accessCount,
            Instant lastAccessedAt,
            String supersedesId,
            String supersededById,
            String supersessionReason,
            String sessionId,
            String messageId,
            int embeddingDimension,
            Instant createdAt,
            Instant updatedAt
    ) {
        static MemoryView of(Memory m) {
            return new MemoryView(m.id(), m.content(), m.category().value(), m.status().value(),
                    m.agentHandle(), m.pathScope(), m.confidence(), m.accessCount(), m.lastAccessedAt(),
                    m.supersedesId(), m.supersededById(), m.supersessionReason(),
                    m.sourceSessionId(), m.sourceMessageId(),
                    m.hasEmbedding() ? m.embedding().length : 0,
                    m.createdAt(), m.updatedAt());
        }
    }

    public record SearchHit(MemoryView memory, double similarity) {
        static SearchHit of(SearchResult result) {
            return new SearchHit(MemoryView.of(result.memory()), result.similarity());
        }
    }
}
