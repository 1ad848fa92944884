package com.keyforge.core.crypto;

import com.keyforge.core.domain.KeyRef;

import java.security.KeyPair;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of KeyMaterialStore for testing and development.
 * Production implementations should use platform-specific secure storage.
 */
public class InMemoryKeyMaterialStore implements KeyMaterialStore {

    private final Map<String, KeyPair> keyPairs;

    public InMemoryKeyMaterialStore() {
        this.keyPairs = new ConcurrentHashMap<>();
    }

    @Override
    public void store(KeyRef ref, KeyPair keyPair) {
        keyPairs.put(ref.keyId(), keyPair);
    }

    @Override
    public Optional<KeyPair> load(KeyRef ref) {
        return Optional.ofNullable(keyPairs.get(ref.keyId()));
    }

    @Override
    public void destroy(KeyRef ref) {
        keyPairs.remove(ref.keyId());
    }

    @Override
    public boolean isHardwareBacked() {
        return false; // In-memory is not hardware-backed
    }

    @Override
    public int size() {
        return keyPairs.size();
    }

    @Override
    public void wipe() {
        keyPairs.clear();
    }
}
