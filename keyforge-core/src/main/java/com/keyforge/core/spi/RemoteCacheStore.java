package com.keyforge.core.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Distributed cache tier shared between nodes. Slower than the local tiers.
 * Implementations may throw any runtime exception; the cache treats it as a miss.
 */
public interface RemoteCacheStore {

    Optional<Object> fetch(String key);

    void store(String key, Object value, Duration ttl);

    void evict(String key);
}
