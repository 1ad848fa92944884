package com.keyforge.node.consensus;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class QuorumMathTest {

    @Test
    void requiredVotes_roundsProductToOneDecimalBeforeCeiling() {
        assertThat(QuorumMath.requiredVotes(3, 0.67)).isEqualTo(2);
        assertThat(QuorumMath.requiredVotes(4, 0.67)).isEqualTo(3);
        assertThat(QuorumMath.requiredVotes(5, 0.5)).isEqualTo(3);
        assertThat(QuorumMath.requiredVotes(10, 0.67)).isEqualTo(7);
    }

    @Test
    void requiredVotes_singleReplicaNeedsItsOwnVote() {
        assertThat(QuorumMath.requiredVotes(1, 0.67)).isEqualTo(1);
        assertThat(QuorumMath.requiredVotes(1, 0.01)).isEqualTo(1);
    }

    @Test
    void requiredVotes_unanimityNeedsEveryReplica() {
        assertThat(QuorumMath.requiredVotes(7, 1.0)).isEqualTo(7);
    }

    @Test
    void requiredVotes_rejectsInvalidInput() {
        assertThatThrownBy(() -> QuorumMath.requiredVotes(0, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuorumMath.requiredVotes(3, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuorumMath.requiredVotes(3, 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuorumMath.requiredVotes(3, Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Property: The quorum is always between one vote and every replica.
     */
    @Property(tries = 50)
    void requiredVotesStaysWithinReplicaCount(@ForAll @IntRange(min = 1, max = 200) int replicas,
                                              @ForAll @DoubleRange(min = 0.01, max = 1.0) double ratio) {
        int required = QuorumMath.requiredVotes(replicas, ratio);

        assertThat(required).isBetween(1, replicas);
    }

    /**
     * Property: A larger ratio never needs fewer votes.
     */
    @Property(tries = 50)
    void requiredVotesIsMonotonicInRatio(@ForAll @IntRange(min = 1, max = 50) int replicas,
                                         @ForAll @DoubleRange(min = 0.01, max = 0.5) double ratio) {
        assertThat(QuorumMath.requiredVotes(replicas, ratio * 2))
                .isGreaterThanOrEqualTo(QuorumMath.requiredVotes(replicas, ratio));
    }
}
