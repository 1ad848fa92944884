package com.keyforge.node.consensus;

import com.keyforge.core.domain.EnergyDelta;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class ProposalTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private static Proposal proposal(int requiredVotes) {
        return new Proposal("prop-1", "res-1", "node-a", 1,
                BigInteger.valueOf(100), BigInteger.valueOf(5),
                EnergyDelta.between(BigInteger.valueOf(50), BigInteger.valueOf(500)),
                requiredVotes, NOW, NOW.plusSeconds(30));
    }

    @Test
    void constructor_recordsProposerApproval() {
        Proposal proposal = proposal(2);

        assertThat(proposal.votes()).containsExactly(entry("node-a", true));
        assertThat(proposal.status()).isEqualTo(ProposalStatus.OPEN);
        assertThat(proposal.isQuorumReached()).isFalse();
    }

    @Test
    void recordVote_firstVoteIsFinal() {
        Proposal proposal = proposal(3);

        assertThat(proposal.recordVote("node-b", false, NOW)).isTrue();
        assertThat(proposal.recordVote("node-b", true, NOW)).isFalse();
        assertThat(proposal.recordVote("node-a", false, NOW)).isFalse();

        assertThat(proposal.votes()).containsEntry("node-b", false);
        assertThat(proposal.approvals()).isEqualTo(1);
        assertThat(proposal.voteCount()).isEqualTo(2);
    }

    @Test
    void recordVote_rejectedAfterExpiry() {
        Proposal proposal = proposal(2);

        assertThat(proposal.recordVote("node-b", true, NOW.plusSeconds(31))).isFalse();

        assertThat(proposal.voteCount()).isEqualTo(1);
        assertThat(proposal.status()).isEqualTo(ProposalStatus.OPEN);
    }

    @Test
    void decide_approvesWhenApprovalsMeetQuorum() {
        Proposal proposal = proposal(2);
        assertThat(proposal.decide()).isEqualTo(ProposalStatus.OPEN);

        proposal.recordVote("node-b", true, NOW);

        assertThat(proposal.decide()).isEqualTo(ProposalStatus.APPROVED);
        assertThat(proposal.decide()).isEqualTo(ProposalStatus.OPEN);
        assertThat(proposal.status()).isEqualTo(ProposalStatus.APPROVED);
        assertThat(proposal.recordVote("node-c", true, NOW)).isFalse();
    }

    @Test
    void decide_rejectsWhenQuorumReachedWithoutEnoughApprovals() {
        Proposal proposal = proposal(2);
        proposal.recordVote("node-b", false, NOW);

        assertThat(proposal.decide()).isEqualTo(ProposalStatus.REJECTED);
    }

    @Test
    void expire_onlyClosesOpenRounds() {
        Proposal open = proposal(2);
        assertThat(open.expire()).isTrue();
        assertThat(open.expire()).isFalse();
        assertThat(open.recordVote("node-b", true, NOW)).isFalse();

        Proposal decided = proposal(1);
        decided.decide();
        assertThat(decided.expire()).isFalse();
        assertThat(decided.status()).isEqualTo(ProposalStatus.APPROVED);
    }

    @Test
    void isExpiredAt_isStrictlyAfterExpiry() {
        Proposal proposal = proposal(2);

        assertThat(proposal.isExpiredAt(NOW.plusSeconds(30))).isFalse();
        assertThat(proposal.isExpiredAt(NOW.plusSeconds(31))).isTrue();
    }

    @Test
    void constructor_rejectsZeroRequiredVotes() {
        assertThatThrownBy(() -> proposal(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toMessage_carriesProposedState() {
        ProposalMessage message = proposal(2).toMessage();

        assertThat(message.proposalId()).isEqualTo("prop-1");
        assertThat(message.baseVersion()).isEqualTo(1);
        assertThat(message.newValue()).isEqualTo(BigInteger.valueOf(100));
        assertThat(message.energyAfter()).isEqualTo(BigInteger.valueOf(500));
    }
}
