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
import com.keyforge.node.support.Await;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for WorkerPool: priority dispatch, deadlines, crash handling, scaling and shutdown.
 */
class WorkerPoolTest {

    private ScheduledExecutorService scheduler;
    private EventBus eventBus;
    private List<NodeEvent> events;
    private CountDownLatch release;
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(1);
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribe(NodeEventType.ALL, events::add);
        release = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        if (pool != null) {
            pool.shutdown(Duration.ofSeconds(1));
        }
        scheduler.shutdownNow();
    }

    private WorkerPool newPool(int size, int maxSize, int maxQueue, Duration timeout, boolean faultTolerance) {
        pool = new WorkerPool(new PoolSettings(size, maxSize, maxQueue, timeout, true, faultTolerance),
                eventBus, scheduler, Clock.systemUTC());
        return pool;
    }

    private boolean hasEvent(NodeEventType type) {
        return events.stream().anyMatch(e -> e.eventType() == type);
    }

    private CompletableFuture<String> submitBlocker(CountDownLatch started) {
        return pool.submit(Task.of(TaskType.SIGN, 1, () -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return "blocker";
        }));
    }

    private CompletableFuture<String> submitRecording(String name, int priority, List<String> order) {
        return pool.submit(Task.of(TaskType.SIGN, priority, () -> {
            order.add(name);
            return name;
        }));
    }

    // ==================== Priority Tests ====================

    /**
     * Property: Higher priority runs first, equal priorities run in submission order.
     */
    @Test
    void dispatch_followsPriorityThenSubmissionOrder() throws Exception {
        // Given
        newPool(1, 1, 100, Duration.ofSeconds(10), true);
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<String> blocker = submitBlocker(started);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        List<String> order = new CopyOnWriteArrayList<>();
        List<CompletableFuture<String>> futures = new ArrayList<>();
        futures.add(submitRecording("5a", 5, order));
        futures.add(submitRecording("10a", 10, order));
        futures.add(submitRecording("5b", 5, order));
        futures.add(submitRecording("10b", 10, order));
        futures.add(submitRecording("5c", 5, order));
        assertThat(pool.queuedCount()).isEqualTo(5);
        release.countDown();

        // Then
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);
        assertThat(blocker.get()).isEqualTo("blocker");
        assertThat(order).containsExactly("10a", "10b", "5a", "5b", "5c");
    }

    /**
     * Property: With two workers the two highest-priority tasks are started before any other.
     */
    @Test
    void dispatch_twoWorkersStartHighestPriorityFirst() throws Exception {
        newPool(2, 2, 100, Duration.ofSeconds(10), true);
        CountDownLatch started = new CountDownLatch(2);
        submitBlocker(started);
        submitBlocker(started);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch releaseTens = new CountDownLatch(1);
        List<CompletableFuture<String>> futures = new ArrayList<>();
        futures.add(submitRecording("5a", 5, order));
        for (String name : List.of("10a", "10b")) {
            futures.add(pool.submit(Task.of(TaskType.SIGN, 10, () -> {
                order.add(name);
                releaseTens.await(5, TimeUnit.SECONDS);
                return name;
            })));
        }
        futures.add(submitRecording("5b", 5, order));
        futures.add(submitRecording("5c", 5, order));

        release.countDown();
        Await.until(() -> order.size() >= 2);
        assertThat(order).containsExactlyInAnyOrder("10a", "10b");
        assertThat(pool.queuedCount()).isEqualTo(3);

        releaseTens.countDown();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);
        assertThat(order.subList(2, 5)).containsExactlyInAnyOrder("5a", "5b", "5c");
    }

    @Test
    void submit_returnsTaskResult() throws Exception {
        newPool(2, 2, 10, Duration.ofSeconds(5), true);

        Integer result = pool.submit(Task.of(TaskType.CALCULATE_ENERGY, 5, () -> 6 * 7)).get(5, TimeUnit.SECONDS);

        assertThat(result).isEqualTo(42);
        Await.until(() -> hasEvent(NodeEventType.TASK_COMPLETED));
        assertThat(pool.getStats().totalCompleted()).isEqualTo(1);
        assertThat(events).extracting(NodeEvent::eventType).contains(NodeEventType.TASK_ASSIGNED);
    }

    @Test
    void submit_taskExceptionFailsOnlyThatTask() throws Exception {
        newPool(1, 1, 10, Duration.ofSeconds(5), true);

        CompletableFuture<String> failed = pool.submit(Task.of(TaskType.SIGN, 5, () -> {
            throw new IllegalStateException("bad input");
        }));

        assertThatThrownBy(() -> failed.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(pool.submit(Task.of(TaskType.SIGN, 5, () -> "ok")).get(5, TimeUnit.SECONDS)).isEqualTo("ok");
        assertThat(pool.size()).isEqualTo(1);
        assertThat(pool.getStats().totalErrors()).isEqualTo(1);
    }

    // ==================== Deadline Tests ====================

    @Test
    void timeout_failsRunningTaskWithoutRetry() throws Exception {
        newPool(1, 1, 10, Duration.ofSeconds(5), true);
        CountDownLatch started = new CountDownLatch(1);

        CompletableFuture<String> slow = pool.submit(Task.<String>of(TaskType.SIGN, 5, () -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "late";
        }).withTimeout(Duration.ofMillis(100)));

        assertThatThrownBy(() -> slow.get(5, TimeUnit.SECONDS)).cause()
                .isInstanceOfSatisfying(TaskTimeoutException.class,
                        e -> assertThat(e.getTimeout()).isEqualTo(Duration.ofMillis(100)));
        assertThat(pool.getStats().totalTimeouts()).isEqualTo(1);
        Await.until(() -> hasEvent(NodeEventType.TASK_TIMEOUT));

        release.countDown();
        Await.until(() -> pool.getStats().activeWorkers() == 0);
        assertThat(pool.getStats().totalCompleted()).isZero();
    }

    @Test
    void timeout_removesQueuedTask() throws Exception {
        newPool(1, 1, 10, Duration.ofSeconds(5), true);
        CountDownLatch started = new CountDownLatch(1);
        submitBlocker(started);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<String> queued = pool.submit(Task.<String>of(TaskType.SIGN, 5, () -> "never")
                .withTimeout(Duration.ofMillis(50)));

        assertThatThrownBy(() -> queued.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(TaskTimeoutException.class);
        assertThat(pool.queuedCount()).isZero();
    }

    // ==================== Fault Tolerance Tests ====================

    /**
     * Property: A crashed worker is replaced and the pool keeps its size.
     */
    @Test
    void crash_replacesWorkerAndFailsTask() throws Exception {
        newPool(2, 2, 10, Duration.ofSeconds(5), true);

        CompletableFuture<String> crashed = pool.submit(Task.<String>of(TaskType.SIGN, 5, () -> {
            throw new Error("simulated crash");
        }));

        assertThatThrownBy(() -> crashed.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(WorkerFailureException.class);
        Await.until(() -> hasEvent(NodeEventType.WORKER_RETIRED));
        assertThat(pool.size()).isEqualTo(2);
        assertThat(events).extracting(NodeEvent::eventType).contains(NodeEventType.WORKER_REPLACED);
        assertThat(pool.submit(Task.of(TaskType.SIGN, 5, () -> "after")).get(5, TimeUnit.SECONDS))
                .isEqualTo("after");
    }

    @Test
    void crash_withoutFaultToleranceKeepsWorker() throws Exception {
        newPool(1, 1, 10, Duration.ofSeconds(5), false);
        String workerBefore = pool.getStats().workers().get(0).workerId();

        CompletableFuture<String> crashed = pool.submit(Task.<String>of(TaskType.SIGN, 5, () -> {
            throw new Error("simulated crash");
        }));

        assertThatThrownBy(() -> crashed.get(5, TimeUnit.SECONDS)).cause()
                .isInstanceOfSatisfying(WorkerFailureException.class,
                        e -> assertThat(e.getWorkerId()).isEqualTo(workerBefore));
        assertThat(pool.getStats().workers()).extracting(WorkerSnapshot::workerId).containsExactly(workerBefore);
        assertThat(events).extracting(NodeEvent::eventType).doesNotContain(NodeEventType.WORKER_REPLACED);
    }

    // ==================== Capacity Tests ====================

    @Test
    void submit_rejectsWhenQueueFull() throws Exception {
        newPool(1, 1, 2, Duration.ofSeconds(5), true);
        CountDownLatch started = new CountDownLatch(1);
        submitBlocker(started);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        pool.submit(Task.of(TaskType.SIGN, 5, () -> "one"));
        pool.submit(Task.of(TaskType.SIGN, 5, () -> "two"));

        CompletableFuture<String> rejected = pool.submit(Task.of(TaskType.SIGN, 5, () -> "three"));

        assertThat(rejected).isCompletedExceptionally();
        assertThatThrownBy(rejected::join).cause()
                .isInstanceOfSatisfying(QueueFullException.class, e -> assertThat(e.getCapacity()).isEqualTo(2));
        assertThat(pool.getStats().queueUtilization()).isEqualTo(1.0);
    }

    @Test
    void scale_growsAndShrinks() throws Exception {
        newPool(2, 4, 10, Duration.ofSeconds(5), true);

        pool.scale(4).get(5, TimeUnit.SECONDS);
        assertThat(pool.size()).isEqualTo(4);

        pool.scale(1).get(5, TimeUnit.SECONDS);
        assertThat(pool.size()).isEqualTo(1);
        assertThat(events).extracting(NodeEvent::eventType).contains(NodeEventType.POOL_SCALED);
    }

    @Test
    void scale_rejectsOutOfRangeSizes() {
        newPool(2, 4, 10, Duration.ofSeconds(5), true);

        assertThatThrownBy(() -> pool.scale(0).join()).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pool.scale(5).join()).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(pool.size()).isEqualTo(2);
    }

    @Test
    void scale_retiresBusyWorkerAfterItsTask() throws Exception {
        newPool(1, 2, 10, Duration.ofSeconds(5), true);
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<String> blocker = submitBlocker(started);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        pool.scale(2).get(5, TimeUnit.SECONDS);

        // the idle worker goes first
        pool.scale(1).get(5, TimeUnit.SECONDS);

        assertThat(blocker).isNotDone();
        release.countDown();
        assertThat(blocker.get(5, TimeUnit.SECONDS)).isEqualTo("blocker");
        assertThat(pool.size()).isEqualTo(1);
    }

    @Test
    void recover_topsUpToConfiguredSize() throws Exception {
        newPool(2, 4, 10, Duration.ofSeconds(5), true);
        pool.scale(1).get(5, TimeUnit.SECONDS);

        pool.recover();

        assertThat(pool.size()).isEqualTo(2);
    }

    // ==================== Shutdown Tests ====================

    @Test
    void shutdown_drainsQueuedWork() throws Exception {
        newPool(2, 2, 10, Duration.ofSeconds(5), true);
        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            String name = "task-" + i;
            futures.add(pool.submit(Task.of(TaskType.SIGN, 5, () -> name)));
        }

        pool.shutdown(Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

        for (int i = 0; i < futures.size(); i++) {
            assertThat(futures.get(i).get(5, TimeUnit.SECONDS)).isEqualTo("task-" + i);
        }
        assertThat(pool.isClosed()).isTrue();
        Await.until(() -> hasEvent(NodeEventType.POOL_SHUTDOWN));
        assertThatThrownBy(() -> pool.submit(Task.of(TaskType.SIGN, 5, () -> "late")).join())
                .hasCauseInstanceOf(PoolClosedException.class);
        assertThatThrownBy(pool::ping).isInstanceOf(ComponentUnavailableException.class);
    }

    @Test
    void shutdown_deadlineAbandonsRunningWork() throws Exception {
        newPool(1, 1, 10, Duration.ofSeconds(30), true);
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<String> blocker = submitBlocker(started);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<Void> shutdown = pool.shutdown(Duration.ofMillis(100));

        assertThatThrownBy(() -> shutdown.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(TimeoutException.class);
        assertThatThrownBy(() -> blocker.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(PoolClosedException.class);
        assertThat(pool.shutdown(Duration.ofSeconds(1))).isSameAs(shutdown);
    }
}
