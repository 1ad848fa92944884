package com.keyforge.core.error;

import java.time.Duration;

/**
 * A task exceeded its deadline. The task is discarded and never retried.
 */
public class TaskTimeoutException extends KeyforgeException {

    private final String taskId;
    private final Duration timeout;

    public TaskTimeoutException(String taskId, Duration timeout) {
        super("Task " + taskId + " timed out after " + timeout.toMillis() + "ms");
        this.taskId = taskId;
        this.timeout = timeout;
    }

    public String getTaskId() {
        return taskId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
