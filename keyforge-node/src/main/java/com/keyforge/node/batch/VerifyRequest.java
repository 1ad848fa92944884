package com.keyforge.node.batch;

import com.keyforge.core.domain.KeyRef;
import com.keyforge.core.spi.CryptoBackend;
import com.keyforge.node.cache.CacheKeys;
import com.keyforge.node.pool.TaskType;

import java.time.Clock;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * Verify a signature over {@code data} with a resource's key material.
 */
public record VerifyRequest(
        String resourceId,
        KeyRef keyRef,
        byte[] signature,
        byte[] data
) implements BatchRequest<Boolean> {

    public VerifyRequest {
        Objects.requireNonNull(resourceId, "Resource ID cannot be null");
        Objects.requireNonNull(keyRef, "Key reference cannot be null");
        Objects.requireNonNull(signature, "Signature cannot be null");
        Objects.requireNonNull(data, "Data cannot be null");
        signature = signature.clone();
        data = data.clone();
    }

    @Override
    public byte[] signature() {
        return signature.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public RequestKind kind() {
        return RequestKind.VERIFY;
    }

    @Override
    public String cacheKey() {
        Base64.Encoder encoder = Base64.getEncoder();
        return CacheKeys.derive("verify", Map.of(
                "resourceId", resourceId,
                "keyId", keyRef.keyId(),
                "signature", encoder.encodeToString(signature),
                "data", encoder.encodeToString(data)));
    }

    @Override
    public Class<Boolean> resultType() {
        return Boolean.class;
    }

    @Override
    public TaskType taskType() {
        return TaskType.VERIFY;
    }

    @Override
    public Boolean execute(CryptoBackend backend, Clock clock) {
        return backend.verify(keyRef, signature, data);
    }
}
