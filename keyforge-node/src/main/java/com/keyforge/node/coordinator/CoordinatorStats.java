package com.keyforge.node.coordinator;

import java.time.Duration;

/**
 * Counters kept by the coordinator itself.
 */
public record CoordinatorStats(
        Coordinator.State state,
        Duration uptime,
        long operations,
        long failedOperations,
        long resourcesCreated,
        long signaturesIssued,
        long verifications,
        long adaptationsProposed,
        long loadRebalanceSignals,
        long autoScaleEvents
) {}
