package com.keyforge.node.consensus;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Payload of an {@code ADAPTATION_PROPOSAL} peer message.
 */
public record ProposalMessage(
        String proposalId,
        String resourceId,
        String proposerId,
        long baseVersion,
        BigInteger newValue,
        BigInteger newFrequency,
        BigInteger energyBefore,
        BigInteger energyAfter,
        BigDecimal changeRatio,
        Instant expiry
) {}
