package com.keyforge.node.pool;

import com.keyforge.core.config.PoolSettings;
import com.keyforge.core.error.ComponentUnavailableException;
import com.keyforge.core.error.PoolClosedException;
import com.keyforge.core.error.QueueFullException;
import com.keyforge.core.error.TaskTimeoutException;
import com.keyforge.core.error.WorkerFailureException;
import com.keyforge.node.event.EventBus;
import com.keyforge.node.event.NodeEvent;
import com.keyforge.node.event.NodeEventType;
import com.keyforge.node.health.ManagedComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of worker threads executing prioritised CPU-bound tasks.
 * <p>
 * Each worker owns one platform thread. Queued tasks are dispatched highest priority
 * first, FIFO within a priority, to an idle worker; with load balancing enabled the idle
 * worker with the lowest average execution time is chosen. Every task carries a deadline
 * enforced from the shared scheduler: an expired task fails with
 * {@link TaskTimeoutException} but a worker already running it is not interrupted.
 * <p>
 * An {@link Error} escaping a task body is treated as a worker crash. With fault
 * tolerance enabled the worker is replaced, the replacement being created before the
 * crashed worker is discarded, and the task fails with {@link WorkerFailureException}.
 * Failed tasks are never resubmitted.
 * <p>
 * All state is guarded by one lock. Futures are completed and events emitted after the
 * lock is released.
 */
public class WorkerPool implements ManagedComponent {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final String COMPONENT = "worker-pool";

    private final PoolSettings settings;
    private final EventBus eventBus;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<PendingTask<?>> queue = new PriorityQueue<>(WorkerPool::compareForDispatch);
    private final Map<String, WorkerRecord> workers = new LinkedHashMap<>();
    private final Map<String, PendingTask<?>> running = new LinkedHashMap<>();
    private final AtomicInteger workerCounter = new AtomicInteger();

    private long sequence;
    private long totalCompleted;
    private long totalErrors;
    private long totalTimeouts;
    private long completedTimeNanos;
    private boolean closed;
    private boolean terminated;
    private CompletableFuture<Void> shutdownFuture;
    private ScheduledFuture<?> shutdownDeadline;

    public WorkerPool(PoolSettings settings, EventBus eventBus, ScheduledExecutorService scheduler, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "Pool settings cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        this.clock = clock != null ? clock : Clock.systemUTC();

        Effects effects = new Effects();
        lock.lock();
        try {
            for (int i = 0; i < settings.poolSize(); i++) {
                createWorker(effects);
            }
        } finally {
            lock.unlock();
        }
        effects.apply();
        log.info("Worker pool started with {} workers", settings.poolSize());
    }

    /**
     * Submits a task for execution.
     *
     * @return future completed with the task result, or failed with the task's exception,
     * {@link TaskTimeoutException}, {@link WorkerFailureException},
     * {@link PoolClosedException} or {@link QueueFullException}
     */
    public <T> CompletableFuture<T> submit(Task<T> task) {
        Objects.requireNonNull(task, "Task cannot be null");
        Effects effects = new Effects();
        CompletableFuture<T> future = new CompletableFuture<>();
        lock.lock();
        try {
            if (closed) {
                return CompletableFuture.failedFuture(new PoolClosedException("Worker pool is shut down"));
            }
            if (queue.size() >= settings.maxQueueSize()) {
                return CompletableFuture.failedFuture(new QueueFullException(settings.maxQueueSize()));
            }
            Duration timeout = task.timeout() != null ? task.timeout() : settings.taskTimeout();
            PendingTask<T> pending = new PendingTask<>(task, future, sequence++, timeout);
            try {
                pending.timeoutHandle = scheduler.schedule(
                        () -> onTimeout(pending), timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                return CompletableFuture.failedFuture(new PoolClosedException("Pool scheduler is shut down"));
            }
            queue.add(pending);
            dispatch(effects);
        } finally {
            lock.unlock();
        }
        effects.apply();
        return future;
    }

    /**
     * Resizes the pool. Growing takes effect immediately. Shrinking retires idle workers
     * first; busy workers finish their current task before they are removed.
     *
     * @return future completed once every retired worker is gone
     */
    public CompletableFuture<Void> scale(int newSize) {
        if (newSize < 1 || newSize > settings.maxPoolSize()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "Pool size must be within [1, " + settings.maxPoolSize() + "], was " + newSize));
        }
        Effects effects = new Effects();
        List<CompletableFuture<Void>> retirements = new ArrayList<>();
        int previous;
        lock.lock();
        try {
            if (closed) {
                return CompletableFuture.failedFuture(new PoolClosedException("Worker pool is shut down"));
            }
            previous = currentSize();
            if (newSize > previous) {
                for (int i = previous; i < newSize; i++) {
                    createWorker(effects);
                }
                dispatch(effects);
            } else if (newSize < previous) {
                List<WorkerRecord> candidates = workers.values().stream()
                        .filter(w -> !w.isRetiring())
                        .sorted(Comparator.comparing(WorkerRecord::isBusy))
                        .toList();
                for (int i = 0; i < previous - newSize; i++) {
                    WorkerRecord worker = candidates.get(i);
                    worker.markRetiring();
                    retirements.add(worker.retired());
                    if (!worker.isBusy()) {
                        retireWorker(worker, effects);
                    }
                }
            }
            effects.event(NodeEventType.POOL_SCALED, COMPONENT, "Pool scaled from " + previous + " to " + newSize,
                    Map.of("from", previous, "to", newSize));
        } finally {
            lock.unlock();
        }
        effects.apply();
        log.info("Worker pool scaled from {} to {}", previous, newSize);
        return CompletableFuture.allOf(retirements.toArray(new CompletableFuture<?>[0]));
    }

    /**
     * Stops accepting tasks and drains the queue. Once every queued and running task has
     * finished the workers are terminated. Tasks still pending when the timeout elapses
     * fail with {@link PoolClosedException} and the returned future fails with
     * {@link TimeoutException}. Calling again returns the same future.
     */
    public CompletableFuture<Void> shutdown(Duration timeout) {
        Effects effects = new Effects();
        boolean forceNow = false;
        lock.lock();
        try {
            if (shutdownFuture != null) {
                return shutdownFuture;
            }
            closed = true;
            shutdownFuture = new CompletableFuture<>();
            log.info("Shutting down worker pool: {} queued, {} running", queue.size(), running.size());
            checkDrained(effects);
            if (!terminated) {
                try {
                    shutdownDeadline = scheduler.schedule(
                            this::forceShutdown, timeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    forceNow = true;
                }
            }
        } finally {
            lock.unlock();
        }
        effects.apply();
        if (forceNow) {
            forceShutdown();
        }
        return shutdownFuture;
    }

    public PoolStats getStats() {
        lock.lock();
        try {
            int size = currentSize();
            int active = (int) workers.values().stream().filter(WorkerRecord::isBusy).count();
            long finished = totalCompleted + totalErrors;
            return new PoolStats(
                    size,
                    active,
                    queue.size(),
                    totalCompleted,
                    totalErrors,
                    totalTimeouts,
                    totalCompleted == 0 ? 0.0 : completedTimeNanos / 1_000_000.0 / totalCompleted,
                    size == 0 ? 0.0 : (double) active / size,
                    (double) queue.size() / settings.maxQueueSize(),
                    finished == 0 ? 0.0 : (double) totalErrors / finished,
                    workers.values().stream().map(WorkerRecord::snapshot).toList());
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return currentSize();
        } finally {
            lock.unlock();
        }
    }

    public int maxPoolSize() {
        return settings.maxPoolSize();
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String componentName() {
        return COMPONENT;
    }

    @Override
    public void ping() {
        lock.lock();
        try {
            if (closed) {
                throw new ComponentUnavailableException(COMPONENT, "pool is shut down");
            }
            if (currentSize() == 0) {
                throw new ComponentUnavailableException(COMPONENT, "no workers");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tops the pool back up to its configured size.
     */
    @Override
    public void recover() {
        Effects effects = new Effects();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            int missing = settings.poolSize() - currentSize();
            for (int i = 0; i < missing; i++) {
                createWorker(effects);
            }
            if (missing > 0) {
                log.info("Recovered worker pool with {} new workers", missing);
                dispatch(effects);
            }
        } finally {
            lock.unlock();
        }
        effects.apply();
    }

    // ==================== Execution ====================

    private <T> void execute(WorkerRecord worker, PendingTask<T> pending) {
        long start = System.nanoTime();
        T result;
        try {
            result = pending.task.body().execute();
        } catch (Exception e) {
            onTaskError(worker, pending, e, System.nanoTime() - start);
            return;
        } catch (Error e) {
            onWorkerCrash(worker, pending, e, System.nanoTime() - start);
            return;
        }
        onTaskSuccess(worker, pending, result, System.nanoTime() - start);
    }

    private <T> void onTaskSuccess(WorkerRecord worker, PendingTask<T> pending, T result, long elapsedNanos) {
        Effects effects = new Effects();
        lock.lock();
        try {
            worker.recordSuccess(elapsedNanos);
            if (pending.settle()) {
                totalCompleted++;
                completedTimeNanos += elapsedNanos;
                effects.later(() -> pending.future.complete(result));
                effects.event(NodeEventType.TASK_COMPLETED, pending.task.id(), null,
                        Map.of("workerId", worker.id(), "durationMillis", elapsedNanos / 1_000_000));
            }
            finishOnWorker(worker, pending, effects);
        } finally {
            lock.unlock();
        }
        effects.apply();
    }

    private <T> void onTaskError(WorkerRecord worker, PendingTask<T> pending, Exception error, long elapsedNanos) {
        Effects effects = new Effects();
        lock.lock();
        try {
            worker.recordError(elapsedNanos);
            if (pending.settle()) {
                totalErrors++;
                effects.later(() -> pending.future.completeExceptionally(error));
                effects.event(NodeEventType.TASK_ERROR, pending.task.id(), error.getMessage(),
                        Map.of("workerId", worker.id()));
            }
            finishOnWorker(worker, pending, effects);
        } finally {
            lock.unlock();
        }
        log.debug("Task {} failed on {}: {}", pending.task.id(), worker.id(), error.getMessage());
        effects.apply();
    }

    private <T> void onWorkerCrash(WorkerRecord worker, PendingTask<T> pending, Error error, long elapsedNanos) {
        log.error("Worker {} crashed running task {}", worker.id(), pending.task.id(), error);
        Effects effects = new Effects();
        lock.lock();
        try {
            worker.recordError(elapsedNanos);
            if (pending.settle()) {
                totalErrors++;
                WorkerFailureException failure = new WorkerFailureException(worker.id(), pending.task.id(), error);
                effects.later(() -> pending.future.completeExceptionally(failure));
                effects.event(NodeEventType.TASK_ERROR, pending.task.id(), failure.getMessage(),
                        Map.of("workerId", worker.id()));
            }
            if (!settings.faultTolerance()) {
                finishOnWorker(worker, pending, effects);
                return;
            }
            running.remove(pending.task.id());
            pending.cancelTimeout();
            worker.release();
            if (!worker.isRetiring() && !closed) {
                WorkerRecord replacement = createWorker(effects);
                effects.event(NodeEventType.WORKER_REPLACED, worker.id(), "Worker crashed: " + error,
                        Map.of("replacementId", replacement.id(), "taskId", pending.task.id()));
            }
            retireWorker(worker, effects);
            dispatch(effects);
            checkDrained(effects);
        } finally {
            lock.unlock();
            effects.apply();
        }
    }

    private void onTimeout(PendingTask<?> pending) {
        Effects effects = new Effects();
        lock.lock();
        try {
            if (!pending.settle()) {
                return;
            }
            totalTimeouts++;
            boolean wasQueued = queue.remove(pending);
            TaskTimeoutException failure = new TaskTimeoutException(pending.task.id(), pending.timeout);
            effects.later(() -> pending.future.completeExceptionally(failure));
            effects.event(NodeEventType.TASK_TIMEOUT, pending.task.id(), failure.getMessage(),
                    Map.of("queued", wasQueued));
            log.warn("Task {} ({}) timed out after {}ms while {}", pending.task.id(), pending.task.type(),
                    pending.timeout.toMillis(), wasQueued ? "queued" : "running");
            checkDrained(effects);
        } finally {
            lock.unlock();
            effects.apply();
        }
    }

    // ==================== Locked helpers ====================

    private void finishOnWorker(WorkerRecord worker, PendingTask<?> pending, Effects effects) {
        running.remove(pending.task.id());
        pending.cancelTimeout();
        worker.release();
        if (worker.isRetiring()) {
            retireWorker(worker, effects);
        }
        dispatch(effects);
        checkDrained(effects);
    }

    private void dispatch(Effects effects) {
        if (terminated) {
            return;
        }
        while (!queue.isEmpty()) {
            WorkerRecord worker = selectIdleWorker();
            if (worker == null) {
                return;
            }
            PendingTask<?> pending = queue.poll();
            worker.assign(pending.task.id());
            running.put(pending.task.id(), pending);
            effects.event(NodeEventType.TASK_ASSIGNED, pending.task.id(), "Assigned to " + worker.id(),
                    Map.of("workerId", worker.id(),
                            "priority", pending.task.priority(),
                            "taskType", pending.task.type().name()));
            worker.thread().execute(() -> execute(worker, pending));
        }
    }

    private WorkerRecord selectIdleWorker() {
        WorkerRecord selected = null;
        for (WorkerRecord worker : workers.values()) {
            if (!worker.isIdle()) {
                continue;
            }
            if (!settings.loadBalancing()) {
                return worker;
            }
            if (selected == null || worker.averageTimeNanos() < selected.averageTimeNanos()) {
                selected = worker;
            }
        }
        return selected;
    }

    private WorkerRecord createWorker(Effects effects) {
        String id = "worker-" + workerCounter.incrementAndGet();
        ExecutorService thread = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, "keyforge-" + id);
            t.setDaemon(true);
            return t;
        });
        WorkerRecord worker = new WorkerRecord(id, thread, clock.instant());
        workers.put(id, worker);
        effects.event(NodeEventType.WORKER_CREATED, id, null, Map.of());
        return worker;
    }

    private void retireWorker(WorkerRecord worker, Effects effects) {
        workers.remove(worker.id());
        worker.thread().shutdown();
        effects.later(() -> worker.retired().complete(null));
        effects.event(NodeEventType.WORKER_RETIRED, worker.id(), null, Map.of());
    }

    private void checkDrained(Effects effects) {
        if (closed && !terminated && queue.isEmpty() && running.isEmpty()) {
            terminate(effects, null);
        }
    }

    private void terminate(Effects effects, Throwable failure) {
        terminated = true;
        for (WorkerRecord worker : workers.values()) {
            if (failure == null) {
                worker.thread().shutdown();
            } else {
                worker.thread().shutdownNow();
            }
            effects.later(() -> worker.retired().complete(null));
        }
        workers.clear();
        if (shutdownDeadline != null) {
            shutdownDeadline.cancel(false);
        }
        CompletableFuture<Void> done = shutdownFuture;
        effects.later(() -> {
            if (failure == null) {
                done.complete(null);
            } else {
                done.completeExceptionally(failure);
            }
        });
        effects.event(NodeEventType.POOL_SHUTDOWN, COMPONENT,
                failure == null ? "Drained" : failure.getMessage(), Map.of());
    }

    private void forceShutdown() {
        Effects effects = new Effects();
        lock.lock();
        try {
            if (terminated) {
                return;
            }
            int abandoned = 0;
            List<PendingTask<?>> remaining = new ArrayList<>(queue);
            remaining.addAll(running.values());
            queue.clear();
            running.clear();
            for (PendingTask<?> pending : remaining) {
                if (pending.settle()) {
                    abandoned++;
                    pending.cancelTimeout();
                    effects.later(() -> pending.future.completeExceptionally(
                            new PoolClosedException("Worker pool shut down before task " + pending.task.id() + " finished")));
                }
            }
            log.warn("Worker pool shutdown deadline passed, abandoned {} tasks", abandoned);
            terminate(effects, new TimeoutException("Worker pool did not drain before the shutdown deadline"));
        } finally {
            lock.unlock();
            effects.apply();
        }
    }

    private int currentSize() {
        int size = 0;
        for (WorkerRecord worker : workers.values()) {
            if (!worker.isRetiring()) {
                size++;
            }
        }
        return size;
    }

    private static int compareForDispatch(PendingTask<?> a, PendingTask<?> b) {
        int byPriority = Integer.compare(b.task.priority(), a.task.priority());
        return byPriority != 0 ? byPriority : Long.compare(a.sequence, b.sequence);
    }

    private static final class PendingTask<T> {
        private final Task<T> task;
        private final CompletableFuture<T> future;
        private final long sequence;
        private final Duration timeout;
        private ScheduledFuture<?> timeoutHandle;
        private boolean settled;

        private PendingTask(Task<T> task, CompletableFuture<T> future, long sequence, Duration timeout) {
            this.task = task;
            this.future = future;
            this.sequence = sequence;
            this.timeout = timeout;
        }

        /**
         * Marks the task settled. Returns false if it already was.
         */
        private boolean settle() {
            if (settled) {
                return false;
            }
            settled = true;
            return true;
        }

        private void cancelTimeout() {
            if (timeoutHandle != null) {
                timeoutHandle.cancel(false);
            }
        }
    }

    /**
     * Side effects gathered under the lock and applied after it is released.
     */
    private final class Effects {
        private final List<Runnable> actions = new ArrayList<>();
        private final List<NodeEvent> events = new ArrayList<>();

        void later(Runnable action) {
            actions.add(action);
        }

        void event(NodeEventType type, String subjectId, String message, Map<String, Object> attributes) {
            events.add(new NodeEvent(type, COMPONENT, subjectId, message, attributes));
        }

        void apply() {
            List<Runnable> pendingActions = new ArrayList<>(actions);
            actions.clear();
            pendingActions.forEach(Runnable::run);
            List<NodeEvent> pendingEvents = new ArrayList<>(events);
            events.clear();
            eventBus.emitAll(pendingEvents);
        }
    }
}
