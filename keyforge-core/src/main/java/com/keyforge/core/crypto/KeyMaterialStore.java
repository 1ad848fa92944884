package com.keyforge.core.crypto;

import com.keyforge.core.domain.KeyRef;

import java.security.KeyPair;
import java.util.Optional;

/**
 * Storage for key pairs issued by {@link JcaCryptoBackend}.
 * Implementations should use hardware-backed storage when available.
 */
public interface KeyMaterialStore {

    /**
     * Stores the key pair behind a reference.
     */
    void store(KeyRef ref, KeyPair keyPair);

    /**
     * Loads the key pair behind a reference.
     *
     * @return the key pair, or empty if the reference was never stored or was destroyed
     */
    Optional<KeyPair> load(KeyRef ref);

    /**
     * Securely discards the key pair behind a reference.
     */
    void destroy(KeyRef ref);

    /**
     * Checks if hardware-backed storage is available.
     */
    boolean isHardwareBacked();

    /**
     * Number of key pairs currently held.
     */
    int size();

    /**
     * Securely deletes all stored keys.
     */
    void wipe();
}
