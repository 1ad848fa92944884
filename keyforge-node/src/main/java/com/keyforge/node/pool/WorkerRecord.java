package com.keyforge.node.pool;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Mutable worker state. Owned by {@link WorkerPool} and only touched under its lock.
 */
final class WorkerRecord {

    private final String id;
    private final ExecutorService thread;
    private final Instant createdAt;
    private final CompletableFuture<Void> retired;

    private boolean busy;
    private boolean retiring;
    private String currentTaskId;
    private long completed;
    private long errors;
    private long totalTimeNanos;

    WorkerRecord(String id, ExecutorService thread, Instant createdAt) {
        this.id = id;
        this.thread = thread;
        this.createdAt = createdAt;
        this.retired = new CompletableFuture<>();
    }

    String id() {
        return id;
    }

    ExecutorService thread() {
        return thread;
    }

    CompletableFuture<Void> retired() {
        return retired;
    }

    boolean isBusy() {
        return busy;
    }

    boolean isRetiring() {
        return retiring;
    }

    boolean isIdle() {
        return !busy && !retiring;
    }

    void assign(String taskId) {
        this.busy = true;
        this.currentTaskId = taskId;
    }

    void release() {
        this.busy = false;
        this.currentTaskId = null;
    }

    void markRetiring() {
        this.retiring = true;
    }

    void recordSuccess(long elapsedNanos) {
        completed++;
        totalTimeNanos += elapsedNanos;
    }

    void recordError(long elapsedNanos) {
        errors++;
        totalTimeNanos += elapsedNanos;
    }

    /**
     * Mean execution time over every task this worker finished, in nanoseconds.
     * Zero for a fresh worker, so new workers are preferred by load balancing.
     */
    double averageTimeNanos() {
        long finished = completed + errors;
        return finished == 0 ? 0.0 : (double) totalTimeNanos / finished;
    }

    WorkerSnapshot snapshot() {
        return new WorkerSnapshot(id, busy, retiring, currentTaskId, completed, errors,
                averageTimeNanos() / 1_000_000.0, createdAt);
    }
}
