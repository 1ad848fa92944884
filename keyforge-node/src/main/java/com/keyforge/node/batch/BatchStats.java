package com.keyforge.node.batch;

/**
 * Point-in-time statistics for the batched request service.
 *
 * @param requests   every request received, cache hits included
 * @param dedupJoins requests that joined an identical pending or executing request
 * @param executions backend executions submitted to the worker pool
 */
public record BatchStats(
        long requests,
        long cacheHits,
        long dedupJoins,
        long executions,
        long failures,
        long batchesProcessed,
        int pending,
        int inFlight,
        double averageBatchSize
) {}
