package com.keyforge.node.batch;

import com.keyforge.core.domain.KeyRef;
import com.keyforge.core.domain.Signature;
import com.keyforge.core.spi.CryptoBackend;
import com.keyforge.node.cache.CacheKeys;
import com.keyforge.node.pool.TaskType;

import java.time.Clock;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * Sign {@code data} with a resource's key material at one consensus version.
 */
public record SignRequest(
        String resourceId,
        KeyRef keyRef,
        long consensusVersion,
        byte[] data
) implements BatchRequest<Signature> {

    public SignRequest {
        Objects.requireNonNull(resourceId, "Resource ID cannot be null");
        Objects.requireNonNull(keyRef, "Key reference cannot be null");
        Objects.requireNonNull(data, "Data cannot be null");
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public RequestKind kind() {
        return RequestKind.SIGN;
    }

    @Override
    public String cacheKey() {
        return CacheKeys.derive("sign", Map.of(
                "resourceId", resourceId,
                "keyId", keyRef.keyId(),
                "version", consensusVersion,
                "data", Base64.getEncoder().encodeToString(data)));
    }

    @Override
    public Class<Signature> resultType() {
        return Signature.class;
    }

    @Override
    public TaskType taskType() {
        return TaskType.SIGN;
    }

    @Override
    public Signature execute(CryptoBackend backend, Clock clock) {
        byte[] value = backend.sign(keyRef, data);
        return new Signature(resourceId, keyRef.keyId(), consensusVersion, keyRef.tier(), value, clock.instant());
    }
}
