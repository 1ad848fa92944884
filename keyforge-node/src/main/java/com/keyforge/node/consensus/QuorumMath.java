package com.keyforge.node.consensus;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Quorum size arithmetic.
 */
public final class QuorumMath {

    private QuorumMath() {
    }

    /**
     * Votes needed for a decision among {@code replicas} voters.
     * <p>
     * {@code replicas × ratio} is rounded to one decimal place before taking the ceiling,
     * so ratios written with two digits behave as intended: 3 × 0.67 = 2.01 becomes 2.0
     * and requires 2 votes, while 4 × 0.67 = 2.68 requires 3. Never less than 1 and never
     * more than {@code replicas}.
     */
    public static int requiredVotes(int replicas, double ratio) {
        if (replicas < 1) {
            throw new IllegalArgumentException("Replica count must be at least 1, was " + replicas);
        }
        if (!(ratio > 0.0) || ratio > 1.0) {
            throw new IllegalArgumentException("Quorum ratio must be within (0, 1], was " + ratio);
        }
        BigDecimal product = BigDecimal.valueOf(replicas)
                .multiply(BigDecimal.valueOf(ratio))
                .setScale(1, RoundingMode.HALF_UP);
        int required = product.setScale(0, RoundingMode.CEILING).intValueExact();
        return Math.min(replicas, Math.max(1, required));
    }
}
