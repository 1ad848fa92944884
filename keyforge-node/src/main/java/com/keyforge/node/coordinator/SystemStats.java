package com.keyforge.node.coordinator;

import com.keyforge.node.batch.BatchStats;
import com.keyforge.node.cache.CacheStats;
import com.keyforge.node.health.HealthReport;
import com.keyforge.node.pool.PoolStats;
import com.keyforge.node.resource.ResourceStats;

/**
 * Statistics of every component of a node at one point in time.
 */
public record SystemStats(
        String nodeId,
        CoordinatorStats coordinator,
        PoolStats pool,
        CacheStats cache,
        BatchStats batch,
        ResourceStats resources,
        HealthReport health
) {}
