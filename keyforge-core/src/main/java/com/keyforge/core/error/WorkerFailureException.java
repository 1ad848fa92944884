package com.keyforge.core.error;

/**
 * The worker running a task crashed. The worker is replaced; the task is not resubmitted.
 */
public class WorkerFailureException extends KeyforgeException {

    private final String workerId;
    private final String taskId;

    public WorkerFailureException(String workerId, String taskId, Throwable cause) {
        super("Worker " + workerId + " failed while running task " + taskId
                + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.workerId = workerId;
        this.taskId = taskId;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getTaskId() {
        return taskId;
    }
}
