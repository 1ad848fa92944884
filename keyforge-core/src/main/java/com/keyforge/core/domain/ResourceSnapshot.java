package com.keyforge.core.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Immutable view of a managed resource at one consensus version.
 * Serialised as JSON for replication and migration between peers.
 */
public record ResourceSnapshot(
        String id,
        String ownerNodeId,
        BigInteger value,
        BigInteger frequency,
        ComplexityTier complexityTier,
        KeyRef keyMaterialRef,
        List<AdaptationRecord> adaptationHistory,
        Set<String> replicaSet,
        long consensusVersion,
        boolean locked,
        Instant registeredAt,
        Instant lastAdaptation
) {
    public ResourceSnapshot {
        adaptationHistory = adaptationHistory == null ? List.of() : List.copyOf(adaptationHistory);
        replicaSet = replicaSet == null ? Set.of() : Set.copyOf(replicaSet);
    }

    public BigInteger energy() {
        return Energy.of(value, frequency);
    }
}
