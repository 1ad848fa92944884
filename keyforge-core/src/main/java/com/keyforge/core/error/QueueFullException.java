package com.keyforge.core.error;

/**
 * The worker pool queue is at capacity. The caller decides whether to retry.
 */
public class QueueFullException extends KeyforgeException {

    private final int capacity;

    public QueueFullException(int capacity) {
        super("Task queue is full (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
