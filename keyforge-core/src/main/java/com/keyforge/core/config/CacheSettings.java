package com.keyforge.core.config;

import com.keyforge.core.error.ConfigurationException;

import java.time.Duration;

/**
 * Multi-tier cache capacity, expiry and rebalancing settings.
 */
public record CacheSettings(
        int tierCapacity,
        Duration defaultTtl,
        Duration sweepInterval,
        Duration rebalanceInterval,
        int coldPromotionThreshold,
        int warmPromotionThreshold,
        Duration inactivityWindow,
        int remoteWriteThreshold
) {
    public CacheSettings {
        if (tierCapacity < 1) {
            throw new ConfigurationException("cache.tierCapacity must be at least 1, was " + tierCapacity);
        }
        Settings.requirePositive(defaultTtl, "cache.defaultTtl");
        Settings.requirePositive(sweepInterval, "cache.sweepInterval");
        Settings.requirePositive(rebalanceInterval, "cache.rebalanceInterval");
        Settings.requirePositive(inactivityWindow, "cache.inactivityWindow");
        if (coldPromotionThreshold < 1 || warmPromotionThreshold < 1) {
            throw new ConfigurationException("cache promotion thresholds must be at least 1");
        }
        if (remoteWriteThreshold < 0) {
            throw new ConfigurationException("cache.remoteWriteThreshold cannot be negative");
        }
    }

    public static CacheSettings defaults() {
        return new CacheSettings(
                1000,                        // tierCapacity
                Duration.ofMinutes(5),       // defaultTtl
                Duration.ofSeconds(30),      // sweepInterval
                Duration.ofMinutes(5),       // rebalanceInterval
                5,                           // coldPromotionThreshold
                10,                          // warmPromotionThreshold
                Duration.ofMinutes(5),       // inactivityWindow
                1024                         // remoteWriteThreshold (bytes)
        );
    }

    public CacheSettings withTierCapacity(int capacity) {
        return new CacheSettings(capacity, defaultTtl, sweepInterval, rebalanceInterval,
                coldPromotionThreshold, warmPromotionThreshold, inactivityWindow, remoteWriteThreshold);
    }

    public CacheSettings withDefaultTtl(Duration ttl) {
        return new CacheSettings(tierCapacity, ttl, sweepInterval, rebalanceInterval,
                coldPromotionThreshold, warmPromotionThreshold, inactivityWindow, remoteWriteThreshold);
    }

    public CacheSettings withInactivityWindow(Duration window) {
        return new CacheSettings(tierCapacity, defaultTtl, sweepInterval, rebalanceInterval,
                coldPromotionThreshold, warmPromotionThreshold, window, remoteWriteThreshold);
    }

    public CacheSettings withRemoteWriteThreshold(int bytes) {
        return new CacheSettings(tierCapacity, defaultTtl, sweepInterval, rebalanceInterval,
                coldPromotionThreshold, warmPromotionThreshold, inactivityWindow, bytes);
    }
}
