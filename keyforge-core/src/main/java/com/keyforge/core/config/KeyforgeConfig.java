package com.keyforge.core.config;

import com.keyforge.core.error.ConfigurationException;

import java.util.UUID;

/**
 * Complete node configuration. Every section defaults independently.
 */
public record KeyforgeConfig(
        String nodeId,
        PoolSettings pool,
        CacheSettings cache,
        BatchSettings batch,
        ConsensusSettings consensus,
        CoordinatorSettings coordinator
) {
    public KeyforgeConfig {
        if (nodeId == null || nodeId.isBlank()) {
            throw new ConfigurationException("nodeId cannot be null or blank");
        }
        if (pool == null || cache == null || batch == null || consensus == null || coordinator == null) {
            throw new ConfigurationException("All configuration sections are required");
        }
    }

    public static KeyforgeConfig defaults() {
        return defaults("node-" + UUID.randomUUID());
    }

    public static KeyforgeConfig defaults(String nodeId) {
        return new KeyforgeConfig(
                nodeId,
                PoolSettings.defaults(),
                CacheSettings.defaults(),
                BatchSettings.defaults(),
                ConsensusSettings.defaults(),
                CoordinatorSettings.defaults());
    }

    public KeyforgeConfig withPool(PoolSettings settings) {
        return new KeyforgeConfig(nodeId, settings, cache, batch, consensus, coordinator);
    }

    public KeyforgeConfig withCache(CacheSettings settings) {
        return new KeyforgeConfig(nodeId, pool, settings, batch, consensus, coordinator);
    }

    public KeyforgeConfig withBatch(BatchSettings settings) {
        return new KeyforgeConfig(nodeId, pool, cache, settings, consensus, coordinator);
    }

    public KeyforgeConfig withConsensus(ConsensusSettings settings) {
        return new KeyforgeConfig(nodeId, pool, cache, batch, settings, coordinator);
    }

    public KeyforgeConfig withCoordinator(CoordinatorSettings settings) {
        return new KeyforgeConfig(nodeId, pool, cache, batch, consensus, settings);
    }
}
