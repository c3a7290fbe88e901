package io.memoryrunr.formation;

import io.memoryrunr.config.MemoryProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Bounded queue that forms memories in the background, one task at a time in submission order.
 *
 * <p>{@link #submit(FormationTask)} never blocks: when the buffer is full the task is rejected at once
 * and reported as failed. Tasks still queued when {@link #stop(Duration)} times out are abandoned and
 * reported as failed without running.</p>
 */
@Component
public class MemoryFormationQueue {

    private static final Logger log = LoggerFactory.getLogger(MemoryFormationQueue.class);

    private static final long POLL_MILLIS = 100;

    private final MemoryFormationService formationService;
    private final BlockingQueue<FormationTask> tasks;
    private final Duration shutdownTimeout;
    private final List<FormationStatusListener> statusListeners = new CopyOnWriteArrayList<>();

    /**
     * Guards {@link #stopping} transitions and the count of accepted, unfinished tasks. Tasks enter and
     * leave the buffer only while holding it, so a task is either taken by the worker or abandoned.
     */
    private final Object state = new Object();
    private int pending;
    private volatile boolean stopping;
    private Thread worker;

    @Autowired
    public MemoryFormationQueue(MemoryFormationService formationService, MemoryProperties properties) {
        this(formationService, properties.queue().capacity(), properties.queue().shutdownTimeout());
    }

    public MemoryFormationQueue(MemoryFormationService formationService, int capacity, Duration shutdownTimeout) {
        this.formationService = formationService;
        this.tasks = new ArrayBlockingQueue<>(capacity);
        this.shutdownTimeout = shutdownTimeout;
    }

    public void onStatus(FormationStatusListener listener) {
        statusListeners.add(listener);
    }

    /**
     * Queues a task and returns its id immediately. A full or stopped queue rejects the task with a
     * FAILED status and a failed formation event.
     */
    public String submit(FormationTask task) {
        String id = UUID.randomUUID().toString().substring(0, 8);
        FormationTask queued = task.withId(id);
        publish(id, FormationStatus.State.QUEUED, "Memory queued");

        String rejection = null;
        synchronized (state) {
            if (stopping) {
                rejection = "Memory queue stopped";
            } else if (tasks.offer(queued)) {
                pending++;
                state.notifyAll();
            } else {
                rejection = "Memory queue full";
            }
        }

        if (rejection != null) {
            log.warn("Rejected memory task {}: {}", id, rejection);
            publish(id, FormationStatus.State.FAILED, rejection);
            formationService.reject(queued, rejection);
        }
        return id;
    }

    /**
     * Starts the consumer thread. Calling it again while running is a no-op.
     */
    public void start() {
        synchronized (state) {
            if (stopping) {
                log.warn("Memory formation queue was stopped and cannot be restarted");
                return;
            }
            if (worker != null && worker.isAlive()) {
                return;
            }
            worker = new Thread(this::consume, "memory-formation");
            worker.setDaemon(true);
            worker.start();
        }
        log.info("Memory formation queue started (capacity {})", tasks.remainingCapacity() + tasks.size());
    }

    /**
     * Stops accepting tasks and waits up to {@code timeout} for the buffer to drain. Tasks not started
     * by then are abandoned.
     *
     * @return true if every accepted task ran before the deadline
     */
    public boolean stop(Duration timeout) {
        Thread consumer;
        synchronized (state) {
            stopping = true;
            consumer = worker;
            state.notifyAll();
        }

        if (consumer != null) {
            try {
                consumer.join(Math.max(1, timeout.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        List<FormationTask> abandoned = new ArrayList<>();
        synchronized (state) {
            tasks.drainTo(abandoned);
        }
        abandoned.forEach(this::abandon);

        if (abandoned.isEmpty()) {
            log.info("Memory formation queue stopped");
            return true;
        }
        log.warn("Memory formation queue stopped, {} queued tasks abandoned", abandoned.size());
        return false;
    }

    /**
     * Blocks until every accepted task has finished or the timeout elapses. The queue keeps running.
     *
     * @return true if no work is outstanding
     */
    public boolean waitForFormations(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (state) {
            while (pending > 0) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) {
                    return false;
                }
                try {
                    state.wait(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    /** Accepted tasks that have not finished yet. */
    public int pending() {
        synchronized (state) {
            return pending;
        }
    }

    public boolean isRunning() {
        Thread consumer = worker;
        return consumer != null && consumer.isAlive() && !stopping;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    @PreDestroy
    public void shutdown() {
        if (!waitForFormations(shutdownTimeout)) {
            log.warn("Memory formations still pending after {}", shutdownTimeout);
        }
        stop(shutdownTimeout);
    }

    private void consume() {
        while (true) {
            FormationTask task;
            synchronized (state) {
                task = tasks.poll();
                while (task == null) {
                    if (stopping) {
                        return;
                    }
                    try {
                        state.wait(POLL_MILLIS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.warn("Memory formation worker interrupted");
                        return;
                    }
                    task = tasks.poll();
                }
            }
            try {
                process(task);
            } finally {
                finished();
            }
        }
    }

    private void abandon(FormationTask task) {
        publish(task.id(), FormationStatus.State.FAILED, "Abandoned at shutdown");
        formationService.reject(task, "abandoned at shutdown");
        finished();
    }

    private void process(FormationTask task) {
        publish(task.id(), FormationStatus.State.IN_PROGRESS, "Storing memory...");
        FormationEvent event = formationService.form(task);
        publish(task.id(),
                event.isSuccess() ? FormationStatus.State.COMPLETED : FormationStatus.State.FAILED,
                event.describe());
    }

    private void finished() {
        synchronized (state) {
            pending--;
            state.notifyAll();
        }
    }

    private void publish(String taskId, FormationStatus.State phase, String message) {
        FormationStatus status = new FormationStatus(taskId, phase, message);
        for (FormationStatusListener listener : statusListeners) {
            try {
                listener.onStatus(status);
            } catch (RuntimeException e) {
                log.warn("Formation status listener failed: {}", e.getMessage());
            }
        }
    }
}
