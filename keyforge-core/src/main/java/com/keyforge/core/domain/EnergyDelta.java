package com.keyforge.core.domain;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Energy before and after a proposed adaptation, with the relative change between them.
 */
public record EnergyDelta(
        BigInteger before,
        BigInteger after,
        BigDecimal changeRatio
) {
    public static EnergyDelta between(BigInteger before, BigInteger after) {
        return new EnergyDelta(before, after, Energy.changeRatio(before, after));
    }

    /**
     * Whether the change strictly exceeds the given ratio threshold.
     */
    public boolean exceeds(double threshold) {
        return changeRatio.compareTo(BigDecimal.valueOf(threshold)) > 0;
    }
}
