package com.keyforge.node.consensus;

import com.keyforge.core.domain.Energy;
import com.keyforge.core.domain.ResourceSnapshot;

import java.util.Optional;

/**
 * Decides how this node votes on a proposal received from a peer.
 */
@FunctionalInterface
public interface ProposalEvaluator {

    /**
     * @param proposal      the proposal as received
     * @param localReplica  this node's copy of the resource, if it holds one
     * @return true to approve
     */
    boolean evaluate(ProposalMessage proposal, Optional<ResourceSnapshot> localReplica);

    /**
     * Approves when the proposed energy matches the proposed value and frequency and,
     * if a replica is held, the proposal builds on the replica's consensus version.
     */
    static ProposalEvaluator consistentEnergy() {
        return (proposal, replica) -> {
            if (proposal.newValue() == null || proposal.newFrequency() == null || proposal.energyAfter() == null) {
                return false;
            }
            if (proposal.newValue().signum() < 0 || proposal.newFrequency().signum() < 0) {
                return false;
            }
            if (!Energy.of(proposal.newValue(), proposal.newFrequency()).equals(proposal.energyAfter())) {
                return false;
            }
            return replica.map(r -> r.consensusVersion() == proposal.baseVersion()).orElse(true);
        };
    }
}
