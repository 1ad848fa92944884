package com.keyforge.node.pool;

import java.time.Instant;

/**
 * Read-only view of one worker's state and counters.
 */
public record WorkerSnapshot(
        String workerId,
        boolean busy,
        boolean retiring,
        String currentTaskId,
        long tasksCompleted,
        long errors,
        double averageTimeMillis,
        Instant createdAt
) {}
