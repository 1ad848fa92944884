package com.keyforge.node.resource;

/**
 * Point-in-time statistics for the adaptive resource manager.
 */
public record ResourceStats(
        int resourcesManaged,
        int replicasHeld,
        int openProposals,
        long adaptations,
        long consensusReached,
        long consensusRejected,
        long consensusTimedOut,
        long adaptationFailures,
        long migrations,
        long migrationFailures,
        long replicationFailures
) {}
