package io.memoryrunr.formation;

import io.memoryrunr.classify.DuplicateVerdict;
import io.memoryrunr.classify.MemoryClassifier;
import io.memoryrunr.classify.MemoryJudge;
import io.memoryrunr.config.MemoryProperties;
import io.memoryrunr.embedding.EmbeddingProvider;
import io.memoryrunr.memory.Memory;
import io.memoryrunr.memory.MemoryCategory;
import io.memoryrunr.memory.MemoryDraft;
import io.memoryrunr.memory.MemoryException;
import io.memoryrunr.memory.MemoryStore;
import io.memoryrunr.memory.MemoryValidationException;
import io.memoryrunr.search.MemorySearchService;
import io.memoryrunr.search.SearchOptions;
import io.memoryrunr.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Decides whether a candidate memory is new, a duplicate, or a replacement of something already
 * known, and applies that decision to the store.
 *
 * <p>With an embedding provider the candidate is embedded once and compared against the closest
 * active memory in the same scope:</p>
 * <ul>
 *   <li>similarity at or above the duplicate threshold: nothing is written ({@code SKIPPED})</li>
 *   <li>similarity at or above the supersede threshold: the new memory replaces the old one ({@code SUPERSEDED})</li>
 *   <li>otherwise: the memory is created ({@code CREATED})</li>
 * </ul>
 * <p>With a {@link MemoryJudge} the matches at or above the supersede threshold are handed to the
 * judge instead, which tells a restatement from a changed preference even when both embed almost
 * identically. If the judge fails the thresholds decide.</p>
 * <p>Without a provider only identical content (ignoring case and surrounding whitespace) is
 * recognised as a duplicate.</p>
 *
 * <p>{@link #form(FormationTask)} never throws; every failure becomes a {@code FAILED} event.</p>
 */
@Service
public class MemoryFormationService {

    private static final Logger log = LoggerFactory.getLogger(MemoryFormationService.class);

    /** Matches shown to the judge. */
    static final int JUDGE_CANDIDATES = 5;

    private final MemoryStore store;
    private final MemorySearchService searchService;
    private final @Nullable EmbeddingProvider embeddingProvider;
    private final @Nullable MemoryClassifier classifier;
    private final @Nullable MemoryJudge judge;
    private final MemoryProperties.Formation config;
    private final List<FormationListener> listeners = new CopyOnWriteArrayList<>();

    @Autowired
    public MemoryFormationService(MemoryStore store,
                                  MemorySearchService searchService,
                                  @Nullable EmbeddingProvider embeddingProvider,
                                  @Nullable MemoryClassifier classifier,
                                  @Nullable MemoryJudge judge,
                                  MemoryProperties properties) {
        this.store = store;
        this.searchService = searchService;
        this.embeddingProvider = embeddingProvider;
        this.classifier = classifier;
        this.judge = judge;
        this.config = properties.formation();
    }

    /**
     * Registers a listener for every formation outcome, including rejected queue tasks.
     */
    public void onFormation(FormationListener listener) {
        listeners.add(listener);
    }

    /**
     * Forms a memory from the task and notifies listeners of the outcome.
     */
    public FormationEvent form(FormationTask task) {
        long start = System.nanoTime();
        FormationEvent event;
        try {
            event = decide(task, start);
        } catch (RuntimeException e) {
            log.warn("Memory formation failed for task {}: {}", task.id(), e.getMessage());
            event = FormationEvent.failed(task, reasonOf(e), since(start));
        }
        log.debug("Formation {} -> {} (memory={}, superseded={}, {} ms)", task.id(), event.type(),
                event.memoryId(), event.supersededId(), event.elapsed().toMillis());
        notifyListeners(event);
        return event;
    }

    /**
     * Reports a task that was never executed, such as a queue overflow or a task abandoned at shutdown.
     */
    public FormationEvent reject(FormationTask task, String reason) {
        FormationEvent event = FormationEvent.failed(task, reason, Duration.ZERO);
        notifyListeners(event);
        return event;
    }

    private FormationEvent decide(FormationTask task, long start) {
        if (task.content() == null || task.content().isBlank()) {
            throw new MemoryValidationException("Memory content must not be empty");
        }
        String content = task.content().trim();

        Optional<Memory> identical = store.findActiveDuplicate(content, task.agentHandle(), task.pathScope());
        if (identical.isPresent()) {
            return FormationEvent.skipped(task, identical.get().id(), since(start));
        }

        MemoryCategory category = task.category() != null ? task.category() : classify(content);
        MemoryDraft draft = new MemoryDraft(content, category, task.agentHandle(), task.pathScope(),
                null, null, task.sourceSessionId(), task.sourceMessageId());

        if (embeddingProvider == null) {
            Memory created = store.create(draft);
            return FormationEvent.created(task, created.id(), since(start));
        }

        float[] vector = embeddingProvider.embed(content);
        SearchOptions nearest = new SearchOptions(task.agentHandle(), task.pathScope(),
                config.supersedeThreshold(), judge != null ? JUDGE_CANDIDATES : 1, Set.of());
        List<SearchResult> similar = searchService.searchByVector(vector, nearest);
        MemoryDraft embedded = draft.withEmbedding(vector);

        if (similar.isEmpty()) {
            Memory created = store.create(embedded);
            return FormationEvent.created(task, created.id(), since(start));
        }

        SearchResult closest = similar.get(0);
        DuplicateVerdict verdict = askJudge(content, similar);
        if (verdict != null) {
            return switch (verdict.action()) {
                case DUPLICATE -> FormationEvent.skipped(task, closest.memory().id(), since(start));
                case SUPERSEDE -> replace(task, embedded, target(verdict.targetId(), similar),
                        verdict.reason() == null || verdict.reason().isBlank()
                                ? config.supersessionReason() : verdict.reason(),
                        start);
                case NEW -> FormationEvent.created(task, store.create(embedded).id(), since(start));
            };
        }

        if (closest.similarity() >= config.duplicateThreshold()) {
            return FormationEvent.skipped(task, closest.memory().id(), since(start));
        }
        return replace(task, embedded, closest.memory().id(), config.supersessionReason(), start);
    }

    private FormationEvent replace(FormationTask task, MemoryDraft embedded, String oldId, String reason, long start) {
        Memory created = store.create(embedded);
        try {
            store.supersede(oldId, created.id(), reason);
        } catch (MemoryException e) {
            log.warn("Superseding {} with {} failed, forgetting the new memory: {}", oldId, created.id(), e.getMessage());
            compensate(created);
            return FormationEvent.failed(task, "supersede failed: " + reasonOf(e), since(start));
        }
        return FormationEvent.superseded(task, created.id(), oldId, since(start));
    }

    @Nullable
    private DuplicateVerdict askJudge(String content, List<SearchResult> similar) {
        if (judge == null) {
            return null;
        }
        try {
            return judge.judge(content, similar.stream().map(SearchResult::memory).toList());
        } catch (MemoryException e) {
            log.warn("Duplicate check failed, deciding by similarity: {}", e.getMessage());
            return null;
        }
    }

    /** The match the judge named by id or short id, else the closest one. */
    private static String target(@Nullable String targetId, List<SearchResult> similar) {
        if (targetId != null) {
            for (SearchResult result : similar) {
                if (result.memory().id().startsWith(targetId)) {
                    return result.memory().id();
                }
            }
        }
        return similar.get(0).memory().id();
    }

    private MemoryCategory classify(String content) {
        if (classifier == null) {
            return MemoryCategory.FACT;
        }
        return classifier.classify(content);
    }

    private void compensate(Memory created) {
        try {
            store.forget(created.id());
        } catch (MemoryException e) {
            log.error("Failed to forget orphaned memory {} after failed supersession", created.id(), e);
        }
    }

    private void notifyListeners(FormationEvent event) {
        for (FormationListener listener : listeners) {
            try {
                listener.onFormation(event);
            } catch (RuntimeException e) {
                log.warn("Formation listener {} failed: {}", listener, e.getMessage());
            }
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String reasonOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
