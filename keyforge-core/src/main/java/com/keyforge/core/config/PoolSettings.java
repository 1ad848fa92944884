package com.keyforge.core.config;

import com.keyforge.core.error.ConfigurationException;

import java.time.Duration;

/**
 * Worker pool sizing, queueing and fault-handling settings.
 */
public record PoolSettings(
        int poolSize,
        int maxPoolSize,
        int maxQueueSize,
        Duration taskTimeout,
        boolean loadBalancing,
        boolean faultTolerance
) {
    public PoolSettings {
        if (poolSize < 1) {
            throw new ConfigurationException("pool.poolSize must be at least 1, was " + poolSize);
        }
        if (maxPoolSize < poolSize) {
            throw new ConfigurationException("pool.maxPoolSize (" + maxPoolSize
                    + ") cannot be below pool.poolSize (" + poolSize + ")");
        }
        if (maxQueueSize < 1) {
            throw new ConfigurationException("pool.maxQueueSize must be at least 1, was " + maxQueueSize);
        }
        Settings.requirePositive(taskTimeout, "pool.taskTimeout");
    }

    public static PoolSettings defaults() {
        int cpus = Math.max(1, Runtime.getRuntime().availableProcessors());
        return new PoolSettings(
                cpus,                        // poolSize
                cpus * 2,                    // maxPoolSize
                1000,                        // maxQueueSize
                Duration.ofSeconds(30),      // taskTimeout
                true,                        // loadBalancing
                true                         // faultTolerance
        );
    }

    public PoolSettings withPoolSize(int size) {
        return new PoolSettings(size, Math.max(size, maxPoolSize), maxQueueSize, taskTimeout,
                loadBalancing, faultTolerance);
    }

    public PoolSettings withMaxQueueSize(int size) {
        return new PoolSettings(poolSize, maxPoolSize, size, taskTimeout, loadBalancing, faultTolerance);
    }

    public PoolSettings withTaskTimeout(Duration timeout) {
        return new PoolSettings(poolSize, maxPoolSize, maxQueueSize, timeout, loadBalancing, faultTolerance);
    }

    public PoolSettings withLoadBalancing(boolean enabled) {
        return new PoolSettings(poolSize, maxPoolSize, maxQueueSize, taskTimeout, enabled, faultTolerance);
    }

    public PoolSettings withFaultTolerance(boolean enabled) {
        return new PoolSettings(poolSize, maxPoolSize, maxQueueSize, taskTimeout, loadBalancing, enabled);
    }
}
