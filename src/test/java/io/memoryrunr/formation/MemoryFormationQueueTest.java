package io.memoryrunr.formation;

import io.memoryrunr.classify.MemoryClassifier;
import io.memoryrunr.config.MemoryProperties;
import io.memoryrunr.memory.MemoryCategory;
import io.memoryrunr.memory.SQLiteMemoryStore;
import io.memoryrunr.search.MemorySearchService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class MemoryFormationQueueTest {

    @TempDir
    Path tempDir;

    private SQLiteMemoryStore store;
    private final CountDownLatch release = new CountDownLatch(1);
    private final CountDownLatch firstStarted = new CountDownLatch(1);
    private final List<FormationStatus> statuses = new CopyOnWriteArrayList<>();
    private final List<FormationEvent> events = new CopyOnWriteArrayList<>();
    private MemoryFormationQueue queue;

    @BeforeEach
    void setUp() {
        store = new SQLiteMemoryStore(tempDir.resolve("memories.db"), null, Clock.systemUTC());
        store.init();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        if (queue != null) {
            queue.stop(Duration.ofSeconds(5));
        }
        store.close();
    }

    /** Queue whose classifier blocks until {@link #release} opens, for tasks without a category. */
    private MemoryFormationQueue queue(int capacity) {
        MemoryClassifier blocking = content -> {
            firstStarted.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return MemoryCategory.FACT;
        };
        var service = new MemoryFormationService(store, new MemorySearchService(store, null), null, blocking, null,
                MemoryProperties.defaults());
        service.onFormation(events::add);
        var q = new MemoryFormationQueue(service, capacity, Duration.ofSeconds(5));
        q.onStatus(statuses::add);
        return q;
    }

    private static FormationTask task(String content) {
        return FormationTask.of(content, MemoryCategory.FACT, null, null);
    }

    private List<FormationStatus.State> statesOf(String taskId) {
        return statuses.stream().filter(s -> s.taskId().equals(taskId)).map(FormationStatus::state).toList();
    }

    @Test
    void shouldCompleteEveryAcceptedTask() {
        queue = queue(100);
        queue.start();

        List<String> ids = List.of(
                queue.submit(task("Uses PostgreSQL")),
                queue.submit(task("Prefers tabs")),
                queue.submit(task("Works at Acme")));

        assertTrue(queue.waitForFormations(Duration.ofSeconds(5)));
        assertEquals(0, queue.pending());
        assertEquals(3, store.count(null));
        for (String id : ids) {
            assertEquals(8, id.length());
            assertEquals(List.of(FormationStatus.State.QUEUED, FormationStatus.State.IN_PROGRESS,
                    FormationStatus.State.COMPLETED), statesOf(id));
        }
    }

    @Test
    void shouldProcessInSubmissionOrder() {
        queue = queue(100);
        for (int i = 0; i < 10; i++) {
            queue.submit(task("memory " + i));
        }
        queue.start();

        assertTrue(queue.waitForFormations(Duration.ofSeconds(5)));
        assertEquals(List.of("memory 0", "memory 1", "memory 2", "memory 3", "memory 4",
                        "memory 5", "memory 6", "memory 7", "memory 8", "memory 9"),
                events.stream().map(FormationEvent::content).toList());
    }

    @Test
    void shouldReportSkippedTaskAsCompleted() {
        queue = queue(10);
        queue.start();

        queue.submit(task("Prefers tabs"));
        String duplicate = queue.submit(task("prefers tabs"));

        assertTrue(queue.waitForFormations(Duration.ofSeconds(5)));
        assertEquals(FormationStatus.State.COMPLETED, statesOf(duplicate).get(2));
        assertEquals(1, store.count(null));
    }

    @Test
    void shouldRejectWhenFullWithoutBlocking() throws InterruptedException {
        queue = queue(2);
        queue.start();

        queue.submit(FormationTask.of("blocks the worker", null, null, null));
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
        queue.submit(task("second"));
        queue.submit(task("third"));

        long before = System.nanoTime();
        String rejected = queue.submit(task("fourth"));
        assertTrue(System.nanoTime() - before < TimeUnit.SECONDS.toNanos(1));

        assertEquals(List.of(FormationStatus.State.QUEUED, FormationStatus.State.FAILED), statesOf(rejected));
        assertTrue(events.stream().anyMatch(e -> rejected.equals(e.taskId())
                && e.type() == FormationEvent.Type.FAILED
                && "Memory queue full".equals(e.reason())));

        release.countDown();
        assertTrue(queue.waitForFormations(Duration.ofSeconds(5)));
        assertEquals(3, store.count(null));
    }

    @Test
    void shouldWaitWithoutStopping() throws InterruptedException {
        queue = queue(10);
        queue.start();

        queue.submit(FormationTask.of("slow", null, null, null));
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));

        assertFalse(queue.waitForFormations(Duration.ofMillis(100)));
        assertEquals(1, queue.pending());

        release.countDown();
        assertTrue(queue.waitForFormations(Duration.ofSeconds(5)));
        assertTrue(queue.isRunning());
    }

    @Test
    void shouldAbandonQueuedTasksWhenStopTimesOut() throws InterruptedException {
        queue = queue(10);
        queue.start();

        queue.submit(FormationTask.of("in flight", null, null, null));
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
        String second = queue.submit(task("second"));
        String third = queue.submit(task("third"));

        assertFalse(queue.stop(Duration.ofMillis(100)));

        assertEquals(FormationStatus.State.FAILED, statesOf(second).get(statesOf(second).size() - 1));
        assertEquals(FormationStatus.State.FAILED, statesOf(third).get(statesOf(third).size() - 1));
        assertFalse(statesOf(second).contains(FormationStatus.State.IN_PROGRESS));

        release.countDown();
        assertTrue(queue.waitForFormations(Duration.ofSeconds(5)));
        assertEquals(1, store.count(null));
    }

    @Test
    void shouldDrainBeforeStoppingWhenTimeAllows() {
        queue = queue(10);
        queue.start();
        queue.submit(task("one"));
        queue.submit(task("two"));

        assertTrue(queue.stop(Duration.ofSeconds(5)));
        assertEquals(2, store.count(null));
    }

    @Test
    void shouldReportEveryTaskOnceWhenStopDrains() throws InterruptedException {
        queue = queue(2);
        queue.start();

        List<String> ids = new ArrayList<>();
        ids.add(queue.submit(FormationTask.of("blocks the worker", null, null, null)));
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
        ids.add(queue.submit(task("Prefers tabs")));
        ids.add(queue.submit(task("prefers tabs")));
        ids.add(queue.submit(task("overflows the buffer")));
        release.countDown();

        assertTrue(queue.stop(Duration.ofSeconds(5)));

        assertEquals(ids.size(), events.size());
        assertEquals(Map.of(FormationEvent.Type.CREATED, 2L, FormationEvent.Type.SKIPPED, 1L,
                FormationEvent.Type.FAILED, 1L), countByType());
        assertOneTerminalStatusEach(ids);
    }

    @Test
    void shouldReportEveryTaskOnceWhenStopAbandons() throws InterruptedException {
        queue = queue(2);
        queue.start();

        List<String> ids = new ArrayList<>();
        ids.add(queue.submit(FormationTask.of("blocks the worker", null, null, null)));
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
        ids.add(queue.submit(task("Prefers tabs")));
        ids.add(queue.submit(task("Works at Acme")));
        ids.add(queue.submit(task("overflows the buffer")));

        assertFalse(queue.stop(Duration.ofMillis(100)));
        release.countDown();
        assertTrue(queue.waitForFormations(Duration.ofSeconds(5)));

        assertEquals(ids.size(), events.size());
        assertEquals(Map.of(FormationEvent.Type.CREATED, 1L, FormationEvent.Type.FAILED, 3L), countByType());
        assertOneTerminalStatusEach(ids);
    }

    @Test
    void shouldNotStartTasksOnceStopReturns() throws InterruptedException {
        for (int round = 0; round < 20; round++) {
            statuses.clear();
            events.clear();
            CountDownLatch slowRelease = new CountDownLatch(1);
            CountDownLatch slowStarted = new CountDownLatch(1);
            AtomicBoolean stopReturned = new AtomicBoolean();
            List<String> lateStarts = new CopyOnWriteArrayList<>();

            MemoryClassifier slow = content -> {
                slowStarted.countDown();
                try {
                    slowRelease.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return MemoryCategory.FACT;
            };
            var service = new MemoryFormationService(store, new MemorySearchService(store, null), null, slow, null,
                    MemoryProperties.defaults());
            service.onFormation(events::add);
            var q = new MemoryFormationQueue(service, 10, Duration.ofSeconds(5));
            q.onStatus(status -> {
                statuses.add(status);
                if (status.state() == FormationStatus.State.IN_PROGRESS && stopReturned.get()) {
                    lateStarts.add(status.taskId());
                }
            });
            q.start();

            List<String> ids = new ArrayList<>();
            ids.add(q.submit(FormationTask.of("slow " + round, null, null, null)));
            assertTrue(slowStarted.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < 3; i++) {
                ids.add(q.submit(task("round " + round + " task " + i)));
            }

            Thread releaser = new Thread(() -> {
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                slowRelease.countDown();
            });
            releaser.start();
            q.stop(Duration.ofMillis(50));
            stopReturned.set(true);
            releaser.join();
            assertTrue(q.waitForFormations(Duration.ofSeconds(5)));

            assertEquals(List.of(), lateStarts, "round " + round);
            assertEquals(ids.size(), events.size(), "round " + round);
            assertOneTerminalStatusEach(ids);
        }
    }

    @Test
    void shouldRejectSubmissionsAfterStop() {
        queue = queue(10);
        queue.start();
        queue.stop(Duration.ofSeconds(1));

        String id = queue.submit(task("too late"));

        assertEquals(List.of(FormationStatus.State.QUEUED, FormationStatus.State.FAILED), statesOf(id));
        assertEquals(0, queue.pending());
        assertFalse(queue.isRunning());
    }

    private Map<FormationEvent.Type, Long> countByType() {
        return events.stream().collect(Collectors.groupingBy(FormationEvent::type, Collectors.counting()));
    }

    private void assertOneTerminalStatusEach(List<String> ids) {
        for (String id : ids) {
            long terminal = statuses.stream()
                    .filter(status -> status.taskId().equals(id))
                    .filter(FormationStatus::isTerminal)
                    .count();
            assertEquals(1, terminal, "task " + id);
        }
    }
}
