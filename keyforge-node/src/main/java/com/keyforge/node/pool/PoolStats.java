package com.keyforge.node.pool;

import java.util.List;

/**
 * Point-in-time statistics for the worker pool.
 *
 * @param poolSize              workers not scheduled for retirement
 * @param activeWorkers         workers currently running a task
 * @param queuedTasks           tasks waiting for a worker
 * @param totalCompleted        tasks completed successfully
 * @param totalErrors           tasks failed by their body or by a worker crash
 * @param totalTimeouts         tasks failed by their deadline
 * @param averageResponseMillis mean execution time of completed tasks
 * @param workerUtilization     activeWorkers / poolSize
 * @param queueUtilization      queuedTasks / maxQueueSize
 * @param errorRate             errors / (completed + errors)
 */
public record PoolStats(
        int poolSize,
        int activeWorkers,
        int queuedTasks,
        long totalCompleted,
        long totalErrors,
        long totalTimeouts,
        double averageResponseMillis,
        double workerUtilization,
        double queueUtilization,
        double errorRate,
        List<WorkerSnapshot> workers
) {
    public PoolStats {
        workers = List.copyOf(workers);
    }
}
