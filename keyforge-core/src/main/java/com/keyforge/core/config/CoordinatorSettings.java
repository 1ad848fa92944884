package com.keyforge.core.config;

import com.keyforge.core.error.ConfigurationException;

import java.time.Duration;

/**
 * Coordinator health, failover and load-balancing settings.
 */
public record CoordinatorSettings(
        Duration healthCheckInterval,
        Duration loadBalanceInterval,
        boolean failoverEnabled,
        boolean autoScaleEnabled,
        int poolQueueThreshold,
        int batchPendingThreshold,
        Duration resourceCacheTtl
) {
    public CoordinatorSettings {
        Settings.requirePositive(healthCheckInterval, "coordinator.healthCheckInterval");
        Settings.requirePositive(loadBalanceInterval, "coordinator.loadBalanceInterval");
        Settings.requirePositive(resourceCacheTtl, "coordinator.resourceCacheTtl");
        if (poolQueueThreshold < 0 || batchPendingThreshold < 0) {
            throw new ConfigurationException("coordinator load thresholds cannot be negative");
        }
    }

    public static CoordinatorSettings defaults() {
        return new CoordinatorSettings(
                Duration.ofSeconds(30),      // healthCheckInterval
                Duration.ofSeconds(30),      // loadBalanceInterval
                true,                        // failoverEnabled
                false,                       // autoScaleEnabled
                100,                         // poolQueueThreshold
                50,                          // batchPendingThreshold
                Duration.ofMinutes(10)       // resourceCacheTtl
        );
    }

    public CoordinatorSettings withAutoScale(boolean enabled) {
        return new CoordinatorSettings(healthCheckInterval, loadBalanceInterval, failoverEnabled, enabled,
                poolQueueThreshold, batchPendingThreshold, resourceCacheTtl);
    }

    public CoordinatorSettings withThresholds(int poolQueue, int batchPending) {
        return new CoordinatorSettings(healthCheckInterval, loadBalanceInterval, failoverEnabled, autoScaleEnabled,
                poolQueue, batchPending, resourceCacheTtl);
    }
}
