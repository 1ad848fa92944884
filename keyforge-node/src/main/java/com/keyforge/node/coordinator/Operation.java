package com.keyforge.node.coordinator;

import com.keyforge.core.domain.Signature;

import java.math.BigInteger;
import java.util.Objects;

/**
 * One entry of a {@link Coordinator#processBatch} call.
 */
public sealed interface Operation permits Operation.CreateOp, Operation.SignOp, Operation.VerifyOp, Operation.AdaptOp {

    /**
     * Register a new resource.
     */
    record CreateOp(BigInteger value, BigInteger frequency) implements Operation {
        public CreateOp {
            Objects.requireNonNull(value, "Value cannot be null");
            Objects.requireNonNull(frequency, "Frequency cannot be null");
        }
    }

    /**
     * Sign data with a resource's current key material.
     */
    record SignOp(String resourceId, byte[] data) implements Operation {
        public SignOp {
            Objects.requireNonNull(resourceId, "Resource ID cannot be null");
            Objects.requireNonNull(data, "Data cannot be null");
            data = data.clone();
        }

        @Override
        public byte[] data() {
            return data.clone();
        }
    }

    /**
     * Verify a signature issued for a resource.
     */
    record VerifyOp(String resourceId, Signature signature, byte[] data) implements Operation {
        public VerifyOp {
            Objects.requireNonNull(resourceId, "Resource ID cannot be null");
            Objects.requireNonNull(signature, "Signature cannot be null");
            Objects.requireNonNull(data, "Data cannot be null");
            data = data.clone();
        }

        @Override
        public byte[] data() {
            return data.clone();
        }
    }

    /**
     * Propose new value and frequency for a resource.
     */
    record AdaptOp(String resourceId, BigInteger newValue, BigInteger newFrequency) implements Operation {
        public AdaptOp {
            Objects.requireNonNull(resourceId, "Resource ID cannot be null");
            Objects.requireNonNull(newValue, "New value cannot be null");
            Objects.requireNonNull(newFrequency, "New frequency cannot be null");
        }
    }
}
