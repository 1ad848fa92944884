package com.keyforge.core.spi;

import com.keyforge.core.domain.ComplexityTier;
import com.keyforge.core.domain.KeyRef;

/**
 * Pluggable cryptographic backend.
 * <p>
 * Implementations must be safe to call from several worker threads at once. Every call
 * is CPU-bound and is only ever made from inside the worker pool.
 */
public interface CryptoBackend {

    /**
     * Generates key material sized for the given tier.
     *
     * @param tier complexity tier determining the key length
     * @return handle to the generated material
     * @throws com.keyforge.core.error.CryptoBackendException if generation fails
     */
    KeyRef generateKeyMaterial(ComplexityTier tier);

    /**
     * Signs data with the referenced key material.
     *
     * @throws com.keyforge.core.error.CryptoBackendException if the key is unknown or signing fails
     */
    byte[] sign(KeyRef key, byte[] data);

    /**
     * Verifies a signature against data with the referenced key material.
     *
     * @return true only if the signature is valid for the data under this key
     */
    boolean verify(KeyRef key, byte[] signature, byte[] data);
}
