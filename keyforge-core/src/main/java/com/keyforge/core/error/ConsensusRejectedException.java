package com.keyforge.core.error;

/**
 * Quorum was reached but with fewer approvals than required.
 */
public class ConsensusRejectedException extends KeyforgeException {

    private final String proposalId;
    private final int approvals;
    private final int requiredVotes;

    public ConsensusRejectedException(String proposalId, int approvals, int requiredVotes) {
        super("Proposal " + proposalId + " rejected: " + approvals + " approvals, "
                + requiredVotes + " required");
        this.proposalId = proposalId;
        this.approvals = approvals;
        this.requiredVotes = requiredVotes;
    }

    public String getProposalId() {
        return proposalId;
    }

    public int getApprovals() {
        return approvals;
    }

    public int getRequiredVotes() {
        return requiredVotes;
    }
}
