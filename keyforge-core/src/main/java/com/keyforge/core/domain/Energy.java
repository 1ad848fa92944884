package com.keyforge.core.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Energy arithmetic over resource value and frequency.
 * <p>
 * Energy is {@code value × frequency} computed exactly with {@link BigInteger}; change
 * ratios use {@link BigDecimal} with {@link MathContext#DECIMAL64}. No operation here
 * overflows or silently loses integer precision.
 */
public final class Energy {

    /**
     * Ratio reported when energy rises from zero. Any positive threshold is exceeded.
     */
    public static final BigDecimal UNBOUNDED_CHANGE = BigDecimal.valueOf(Double.MAX_VALUE);

    private Energy() {
    }

    /**
     * Computes {@code value × frequency}.
     *
     * @throws IllegalArgumentException if either argument is null or negative
     */
    public static BigInteger of(BigInteger value, BigInteger frequency) {
        requireNonNegative(value, "Value");
        requireNonNegative(frequency, "Frequency");
        return value.multiply(frequency);
    }

    /**
     * Relative change {@code |after - before| / before}.
     * Zero to zero is no change; zero to anything else is {@link #UNBOUNDED_CHANGE}.
     */
    public static BigDecimal changeRatio(BigInteger before, BigInteger after) {
        requireNonNegative(before, "Energy before");
        requireNonNegative(after, "Energy after");
        if (before.signum() == 0) {
            return after.signum() == 0 ? BigDecimal.ZERO : UNBOUNDED_CHANGE;
        }
        BigDecimal delta = new BigDecimal(after.subtract(before).abs());
        return delta.divide(new BigDecimal(before), MathContext.DECIMAL64);
    }

    /**
     * Priority of CPU-bound work for a resource of the given value.
     * Thresholds: above 10000 is 10, above 1000 is 7, above 100 is 5, otherwise 3.
     */
    public static int priorityFor(BigInteger value) {
        if (value == null) {
            return 3;
        }
        if (value.compareTo(ComplexityTier.HIGH_CEILING) > 0) {
            return 10;
        }
        if (value.compareTo(ComplexityTier.MEDIUM_CEILING) > 0) {
            return 7;
        }
        if (value.compareTo(ComplexityTier.LOW_CEILING) > 0) {
            return 5;
        }
        return 3;
    }

    private static void requireNonNegative(BigInteger number, String name) {
        if (number == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (number.signum() < 0) {
            throw new IllegalArgumentException(name + " cannot be negative: " + number);
        }
    }
}
