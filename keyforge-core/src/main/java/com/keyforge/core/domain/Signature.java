package com.keyforge.core.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Signature produced with a resource's key material at a given consensus version.
 */
public record Signature(
        String resourceId,
        String keyId,
        long consensusVersion,
        ComplexityTier tier,
        byte[] value,
        Instant createdAt
) {
    public Signature {
        Objects.requireNonNull(resourceId, "Resource ID cannot be null");
        Objects.requireNonNull(value, "Signature value cannot be null");
        value = value.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Signature other)) {
            return false;
        }
        return consensusVersion == other.consensusVersion
                && resourceId.equals(other.resourceId)
                && Objects.equals(keyId, other.keyId)
                && tier == other.tier
                && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(resourceId, keyId, consensusVersion, tier);
        return 31 * result + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "Signature[resourceId=" + resourceId + ", keyId=" + keyId
                + ", consensusVersion=" + consensusVersion + ", tier=" + tier + "]";
    }
}
