package com.keyforge.core.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * One committed adaptation in a resource's history.
 */
public record AdaptationRecord(
        String proposalId,
        Instant timestamp,
        BigInteger oldValue,
        BigInteger newValue,
        ComplexityTier oldTier,
        ComplexityTier newTier,
        BigDecimal energyChange,
        boolean keyRotated,
        long resultingVersion
) {}
