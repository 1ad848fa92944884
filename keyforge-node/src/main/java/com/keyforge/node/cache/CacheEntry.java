package com.keyforge.node.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value with its bookkeeping. Mutated only by {@link MultiTierCache} under its lock.
 */
public final class CacheEntry {

    private final String key;
    private final Object value;
    private final Instant timestamp;
    private final Duration ttl;
    private final long sizeEstimate;
    private CacheTier tier;
    private Instant lastAccessedAt;
    private long accessCount;

    CacheEntry(String key, Object value, CacheTier tier, Instant timestamp, Duration ttl, long sizeEstimate) {
        this.key = key;
        this.value = value;
        this.tier = tier;
        this.timestamp = timestamp;
        this.lastAccessedAt = timestamp;
        this.ttl = ttl;
        this.sizeEstimate = sizeEstimate;
    }

    public String key() {
        return key;
    }

    public Object value() {
        return value;
    }

    public CacheTier tier() {
        return tier;
    }

    /**
     * Write time. Expiry is measured from here, reads do not extend it.
     */
    public Instant timestamp() {
        return timestamp;
    }

    public Instant lastAccessedAt() {
        return lastAccessedAt;
    }

    public long accessCount() {
        return accessCount;
    }

    public Duration ttl() {
        return ttl;
    }

    public long sizeEstimate() {
        return sizeEstimate;
    }

    boolean isExpired(Instant now) {
        return Duration.between(timestamp, now).compareTo(ttl) > 0;
    }

    void touch(Instant now) {
        accessCount++;
        lastAccessedAt = now;
    }

    void moveTo(CacheTier newTier) {
        this.tier = newTier;
    }
}
