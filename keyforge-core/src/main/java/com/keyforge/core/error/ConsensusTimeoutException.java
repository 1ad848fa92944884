package com.keyforge.core.error;

/**
 * Quorum was not reached before the proposal expired.
 */
public class ConsensusTimeoutException extends KeyforgeException {

    private final String proposalId;
    private final int votesReceived;
    private final int requiredVotes;

    public ConsensusTimeoutException(String proposalId, int votesReceived, int requiredVotes) {
        super("Proposal " + proposalId + " expired with " + votesReceived + " of "
                + requiredVotes + " required votes");
        this.proposalId = proposalId;
        this.votesReceived = votesReceived;
        this.requiredVotes = requiredVotes;
    }

    public String getProposalId() {
        return proposalId;
    }

    public int getVotesReceived() {
        return votesReceived;
    }

    public int getRequiredVotes() {
        return requiredVotes;
    }
}
