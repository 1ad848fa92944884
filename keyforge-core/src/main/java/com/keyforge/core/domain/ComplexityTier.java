package com.keyforge.core.domain;

import java.math.BigInteger;

/**
 * Discrete cryptographic strength levels.
 * The tier of a resource is derived from its energy through fixed thresholds and
 * determines the size of the key material generated for it.
 */
public enum ComplexityTier {
    LOW(2048, "basic"),
    MEDIUM(3072, "enhanced"),
    HIGH(4096, "advanced"),
    MAXIMUM(8192, "quantum-resistant");

    static final BigInteger LOW_CEILING = BigInteger.valueOf(100);
    static final BigInteger MEDIUM_CEILING = BigInteger.valueOf(1_000);
    static final BigInteger HIGH_CEILING = BigInteger.valueOf(10_000);

    private final int keyLength;
    private final String method;

    ComplexityTier(int keyLength, String method) {
        this.keyLength = keyLength;
        this.method = method;
    }

    /**
     * Key length in bits for material generated at this tier.
     */
    public int keyLength() {
        return keyLength;
    }

    /**
     * Descriptive name of the signing method used at this tier.
     */
    public String method() {
        return method;
    }

    /**
     * Maps an energy level onto a tier.
     *
     * @param energy non-negative energy level
     * @return LOW below 100, MEDIUM below 1000, HIGH below 10000, otherwise MAXIMUM
     */
    public static ComplexityTier forEnergy(BigInteger energy) {
        if (energy == null) {
            throw new IllegalArgumentException("Energy cannot be null");
        }
        if (energy.compareTo(LOW_CEILING) < 0) {
            return LOW;
        }
        if (energy.compareTo(MEDIUM_CEILING) < 0) {
            return MEDIUM;
        }
        if (energy.compareTo(HIGH_CEILING) < 0) {
            return HIGH;
        }
        return MAXIMUM;
    }
}
