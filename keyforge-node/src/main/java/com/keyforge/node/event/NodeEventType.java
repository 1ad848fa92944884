package com.keyforge.node.event;

/**
 * Types of events emitted by node components.
 */
public enum NodeEventType {
    // Worker pool events
    TASK_ASSIGNED,
    TASK_COMPLETED,
    TASK_ERROR,
    TASK_TIMEOUT,
    WORKER_CREATED,
    WORKER_REPLACED,
    WORKER_RETIRED,
    POOL_SCALED,
    POOL_SHUTDOWN,

    // Cache events
    CACHE_EVICTED,
    CACHE_EXPIRED,
    CACHE_REBALANCED,
    REMOTE_CACHE_ERROR,

    // Batch events
    BATCH_FLUSHED,
    BATCH_FAILED,
    PRECOMPUTE_COMPLETE,

    // Resource and consensus events
    RESOURCE_REGISTERED,
    REPLICATION_FAILED,
    PROPOSAL_CREATED,
    VOTE_RECORDED,
    RESOURCE_ADAPTED,
    ADAPTATION_REJECTED,
    ADAPTATION_EXPIRED,
    ADAPTATION_FAILED,
    RESOURCE_MIGRATED,
    MIGRATION_FAILED,
    MIGRATION_RECEIVED,

    // Coordinator events
    COMPONENT_ERROR,
    FAILOVER_TRIGGERED,
    COMPONENT_RECOVERED,
    HEALTH_UPDATED,
    LOAD_REBALANCE_REQUIRED,
    SHUTDOWN_STARTED,
    SHUTDOWN_COMPLETE,

    // Wildcard for subscribing to all events
    ALL
}
