package com.keyforge.node.pool;

/**
 * The work carried by a {@link Task}. Runs on a worker thread.
 * <p>
 * A thrown {@link Exception} fails the task. A thrown {@link Error} is treated as a crash
 * of the worker running it.
 */
@FunctionalInterface
public interface TaskBody<T> {
    T execute() throws Exception;
}
