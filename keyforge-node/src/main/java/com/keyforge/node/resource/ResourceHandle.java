package com.keyforge.node.resource;

import com.keyforge.core.domain.AdaptationRecord;
import com.keyforge.core.domain.ComplexityTier;
import com.keyforge.core.domain.Energy;
import com.keyforge.core.domain.KeyRef;
import com.keyforge.core.domain.ResourceSnapshot;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live state of a resource managed by this node.
 * <p>
 * The lock flag guards consensus rounds and migrations. Field updates are synchronized on
 * the handle; readers take {@link #snapshot()}.
 */
final class ResourceHandle {

    private final String id;
    private final String ownerNodeId;
    private final Instant registeredAt;
    private final AtomicBoolean locked = new AtomicBoolean(false);
    private final List<AdaptationRecord> history = new ArrayList<>();
    private final Set<String> replicaSet = new LinkedHashSet<>();

    private BigInteger value;
    private BigInteger frequency;
    private ComplexityTier tier;
    private KeyRef keyRef;
    private long consensusVersion;
    private Instant lastAdaptation;

    ResourceHandle(String id, String ownerNodeId, BigInteger value, BigInteger frequency,
                   ComplexityTier tier, KeyRef keyRef, Instant registeredAt) {
        this.id = id;
        this.ownerNodeId = ownerNodeId;
        this.value = value;
        this.frequency = frequency;
        this.tier = tier;
        this.keyRef = keyRef;
        this.registeredAt = registeredAt;
        this.lastAdaptation = registeredAt;
        this.consensusVersion = 1;
        this.replicaSet.add(ownerNodeId);
    }

    /**
     * Adopts a migrated resource. The history and version carry over; the new owner joins
     * the replica set.
     */
    static ResourceHandle adopt(ResourceSnapshot snapshot, String newOwner) {
        ResourceHandle handle = new ResourceHandle(snapshot.id(), newOwner, snapshot.value(), snapshot.frequency(),
                snapshot.complexityTier(), snapshot.keyMaterialRef(), snapshot.registeredAt());
        synchronized (handle) {
            handle.consensusVersion = snapshot.consensusVersion();
            handle.lastAdaptation = snapshot.lastAdaptation();
            handle.history.addAll(snapshot.adaptationHistory());
            handle.replicaSet.addAll(snapshot.replicaSet());
        }
        return handle;
    }

    boolean tryLock() {
        return locked.compareAndSet(false, true);
    }

    void unlock() {
        locked.set(false);
    }

    boolean isLocked() {
        return locked.get();
    }

    synchronized BigInteger energy() {
        return Energy.of(value, frequency);
    }

    synchronized Instant lastAdaptation() {
        return lastAdaptation;
    }

    synchronized long consensusVersion() {
        return consensusVersion;
    }

    synchronized ComplexityTier tier() {
        return tier;
    }

    synchronized Set<String> replicas() {
        return Set.copyOf(replicaSet);
    }

    synchronized void addReplica(String peerId) {
        replicaSet.add(peerId);
    }

    /**
     * Applies a committed adaptation and bumps the consensus version by one.
     */
    synchronized AdaptationRecord commit(String proposalId, BigInteger newValue, BigInteger newFrequency,
                                         ComplexityTier newTier, KeyRef newKeyRef,
                                         BigDecimal energyChange, Instant now) {
        AdaptationRecord record = new AdaptationRecord(proposalId, now, value, newValue, tier, newTier,
                energyChange, newKeyRef != null, consensusVersion + 1);
        value = newValue;
        frequency = newFrequency;
        tier = newTier;
        if (newKeyRef != null) {
            keyRef = newKeyRef;
        }
        consensusVersion++;
        lastAdaptation = now;
        history.add(record);
        return record;
    }

    synchronized ResourceSnapshot snapshot() {
        return new ResourceSnapshot(id, ownerNodeId, value, frequency, tier, keyRef, history, replicaSet,
                consensusVersion, locked.get(), registeredAt, lastAdaptation);
    }
}
