package com.keyforge.core.domain;

import java.time.Instant;

/**
 * Opaque handle to key material held by a crypto backend.
 * Only the backend that issued it can resolve it to actual keys.
 */
public record KeyRef(
        String keyId,
        ComplexityTier tier,
        String algorithm,
        Instant createdAt
) {
    public KeyRef {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key ID cannot be null or blank");
        }
        if (tier == null) {
            throw new IllegalArgumentException("Tier cannot be null");
        }
    }
}
