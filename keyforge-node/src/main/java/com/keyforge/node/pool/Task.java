package com.keyforge.node.pool;

import com.keyforge.core.domain.Energy;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit of work submitted to the {@link WorkerPool}.
 *
 * @param id       unique task id
 * @param type     kind of work
 * @param priority higher runs first; equal priorities run in submission order
 * @param timeout  deadline measured from submission, or null for the pool default
 * @param body     the work itself
 */
public record Task<T>(
        String id,
        TaskType type,
        int priority,
        Duration timeout,
        TaskBody<T> body
) {
    public Task {
        Objects.requireNonNull(id, "Task ID cannot be null");
        Objects.requireNonNull(type, "Task type cannot be null");
        Objects.requireNonNull(body, "Task body cannot be null");
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("Task timeout must be positive: " + timeout);
        }
    }

    public static <T> Task<T> of(TaskType type, int priority, TaskBody<T> body) {
        return new Task<>(UUID.randomUUID().toString(), type, priority, null, body);
    }

    /**
     * Creates a task whose priority follows the value of the resource it works on.
     */
    public static <T> Task<T> forValue(TaskType type, BigInteger value, TaskBody<T> body) {
        return of(type, Energy.priorityFor(value), body);
    }

    public Task<T> withTimeout(Duration newTimeout) {
        return new Task<>(id, type, priority, newTimeout, body);
    }
}
