package com.keyforge.node.cache;

import com.keyforge.core.spi.RemoteCacheStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link RemoteCacheStore} for single-node deployments and tests.
 * Entries expire lazily on fetch.
 */
public class InMemoryRemoteCacheStore implements RemoteCacheStore {

    private final Map<String, StoredValue> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRemoteCacheStore(Clock clock) {
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public InMemoryRemoteCacheStore() {
        this(Clock.systemUTC());
    }

    @Override
    public Optional<Object> fetch(String key) {
        StoredValue stored = entries.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (clock.instant().isAfter(stored.expiresAt())) {
            entries.remove(key, stored);
            return Optional.empty();
        }
        return Optional.of(stored.value());
    }

    @Override
    public void store(String key, Object value, Duration ttl) {
        entries.put(key, new StoredValue(value, clock.instant().plus(ttl)));
    }

    @Override
    public void evict(String key) {
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }

    private record StoredValue(Object value, Instant expiresAt) {}
}
