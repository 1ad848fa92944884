package com.keyforge.core.crypto;

import com.keyforge.core.domain.ComplexityTier;
import com.keyforge.core.domain.KeyRef;
import com.keyforge.core.error.CryptoBackendException;
import com.keyforge.core.spi.CryptoBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Crypto backend on the platform JCA providers.
 * <p>
 * Generates RSA key pairs whose modulus length follows {@link ComplexityTier#keyLength()}
 * and signs with {@code SHA256withRSA}. Key ids are derived from the public key hash so
 * they are stable and unguessable. MAXIMUM tier generation (8192 bits) takes seconds.
 */
public class JcaCryptoBackend implements CryptoBackend {

    private static final Logger log = LoggerFactory.getLogger(JcaCryptoBackend.class);
    private static final String KEY_ALGORITHM = "RSA";
    private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";

    private final KeyMaterialStore keyStore;
    private final SecureRandom secureRandom;

    public JcaCryptoBackend(KeyMaterialStore keyStore) {
        if (keyStore == null) {
            throw new IllegalArgumentException("KeyStore cannot be null");
        }
        this.keyStore = keyStore;
        this.secureRandom = new SecureRandom();
    }

    public JcaCryptoBackend() {
        this(new InMemoryKeyMaterialStore());
    }

    @Override
    public KeyRef generateKeyMaterial(ComplexityTier tier) {
        if (tier == null) {
            throw new IllegalArgumentException("Tier cannot be null");
        }
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM);
            generator.initialize(tier.keyLength(), secureRandom);
            KeyPair keyPair = generator.generateKeyPair();
            KeyRef ref = new KeyRef(
                    "key:" + computePublicKeyHash(keyPair),
                    tier,
                    SIGNATURE_ALGORITHM,
                    Instant.now());
            keyStore.store(ref, keyPair);
            log.debug("Generated {}-bit key material {}", tier.keyLength(), ref.keyId());
            return ref;
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoBackendException("Key generation unavailable for tier " + tier, e);
        }
    }

    @Override
    public byte[] sign(KeyRef key, byte[] data) {
        KeyPair keyPair = resolve(key);
        try {
            java.security.Signature signer = java.security.Signature.getInstance(SIGNATURE_ALGORITHM);
            signer.initSign(keyPair.getPrivate(), secureRandom);
            signer.update(data);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new CryptoBackendException("Failed to sign with " + key.keyId(), e);
        }
    }

    @Override
    public boolean verify(KeyRef key, byte[] signature, byte[] data) {
        if (signature == null || data == null) {
            return false;
        }
        KeyPair keyPair = resolve(key);
        try {
            java.security.Signature verifier = java.security.Signature.getInstance(SIGNATURE_ALGORITHM);
            verifier.initVerify(keyPair.getPublic());
            verifier.update(data);
            return verifier.verify(signature);
        } catch (GeneralSecurityException e) {
            log.debug("Verification with {} failed: {}", key.keyId(), e.getMessage());
            return false;
        }
    }

    /**
     * Discards the key material behind a reference. Later sign calls with it fail.
     */
    public void destroy(KeyRef key) {
        keyStore.destroy(key);
    }

    private KeyPair resolve(KeyRef key) {
        if (key == null) {
            throw new IllegalArgumentException("Key reference cannot be null");
        }
        return keyStore.load(key)
                .orElseThrow(() -> new CryptoBackendException("Unknown key material: " + key.keyId()));
    }

    private static String computePublicKeyHash(KeyPair keyPair) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(keyPair.getPublic().getEncoded());
            return HexFormat.of().formatHex(hash, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoBackendException("SHA-256 not available", e);
        }
    }
}
