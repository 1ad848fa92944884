package com.keyforge.node.support;

import com.keyforge.core.domain.ComplexityTier;
import com.keyforge.core.domain.KeyRef;
import com.keyforge.core.error.CryptoBackendException;
import com.keyforge.core.spi.CryptoBackend;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic backend: a signature is SHA-256 over key id and data. Counts calls and can
 * be switched into failing mode.
 */
public class FakeCryptoBackend implements CryptoBackend {

    private final Set<String> keys = ConcurrentHashMap.newKeySet();
    private final AtomicInteger keyCounter = new AtomicInteger();

    public final AtomicInteger generateCalls = new AtomicInteger();
    public final AtomicInteger signCalls = new AtomicInteger();
    public final AtomicInteger verifyCalls = new AtomicInteger();
    public volatile boolean failGeneration;
    public volatile boolean failSigning;

    @Override
    public KeyRef generateKeyMaterial(ComplexityTier tier) {
        generateCalls.incrementAndGet();
        if (failGeneration) {
            throw new CryptoBackendException("Key generation disabled for test");
        }
        String keyId = "fake-key-" + keyCounter.incrementAndGet();
        keys.add(keyId);
        return new KeyRef(keyId, tier, "FAKE-SHA256", Instant.now());
    }

    @Override
    public byte[] sign(KeyRef key, byte[] data) {
        signCalls.incrementAndGet();
        if (failSigning) {
            throw new CryptoBackendException("Signing disabled for test");
        }
        requireKnown(key);
        return digest(key, data);
    }

    @Override
    public boolean verify(KeyRef key, byte[] signature, byte[] data) {
        verifyCalls.incrementAndGet();
        if (signature == null || data == null || !keys.contains(key.keyId())) {
            return false;
        }
        return MessageDigest.isEqual(digest(key, data), signature);
    }

    private void requireKnown(KeyRef key) {
        if (!keys.contains(key.keyId())) {
            throw new CryptoBackendException("Unknown key material: " + key.keyId());
        }
    }

    private static byte[] digest(KeyRef key, byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(key.keyId().getBytes(StandardCharsets.UTF_8));
            digest.update(data);
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
