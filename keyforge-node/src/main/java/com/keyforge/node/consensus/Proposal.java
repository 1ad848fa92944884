package com.keyforge.node.consensus;

import com.keyforge.core.domain.AdaptationOutcome;
import com.keyforge.core.domain.EnergyDelta;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One consensus round over a resource adaptation.
 * <p>
 * The proposer's approval is recorded at creation. A voter's first vote is final. The
 * round turns terminal when the number of votes reaches {@link #requiredVotes()} or when
 * it expires; after that no vote is accepted. Vote recording and status transitions are
 * synchronized on the proposal.
 */
public final class Proposal {

    private final String id;
    private final String resourceId;
    private final String proposerId;
    private final long baseVersion;
    private final BigInteger newValue;
    private final BigInteger newFrequency;
    private final EnergyDelta metrics;
    private final int requiredVotes;
    private final Instant createdAt;
    private final Instant expiry;
    private final Map<String, Boolean> votes = new LinkedHashMap<>();
    private final CompletableFuture<AdaptationOutcome> outcome = new CompletableFuture<>();
    private ProposalStatus status = ProposalStatus.OPEN;

    public Proposal(String id, String resourceId, String proposerId, long baseVersion,
                    BigInteger newValue, BigInteger newFrequency, EnergyDelta metrics,
                    int requiredVotes, Instant createdAt, Instant expiry) {
        this.id = Objects.requireNonNull(id, "Proposal ID cannot be null");
        this.resourceId = Objects.requireNonNull(resourceId, "Resource ID cannot be null");
        this.proposerId = Objects.requireNonNull(proposerId, "Proposer ID cannot be null");
        this.baseVersion = baseVersion;
        this.newValue = newValue;
        this.newFrequency = newFrequency;
        this.metrics = metrics;
        if (requiredVotes < 1) {
            throw new IllegalArgumentException("Required votes must be at least 1");
        }
        this.requiredVotes = requiredVotes;
        this.createdAt = createdAt;
        this.expiry = expiry;
        this.votes.put(proposerId, Boolean.TRUE);
    }

    public String id() {
        return id;
    }

    public String resourceId() {
        return resourceId;
    }

    public String proposerId() {
        return proposerId;
    }

    public long baseVersion() {
        return baseVersion;
    }

    public BigInteger newValue() {
        return newValue;
    }

    public BigInteger newFrequency() {
        return newFrequency;
    }

    public EnergyDelta metrics() {
        return metrics;
    }

    public int requiredVotes() {
        return requiredVotes;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant expiry() {
        return expiry;
    }

    public CompletableFuture<AdaptationOutcome> outcome() {
        return outcome;
    }

    public synchronized ProposalStatus status() {
        return status;
    }

    public synchronized Map<String, Boolean> votes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(votes));
    }

    public synchronized int approvals() {
        int count = 0;
        for (Boolean approve : votes.values()) {
            if (approve) {
                count++;
            }
        }
        return count;
    }

    public synchronized int voteCount() {
        return votes.size();
    }

    /**
     * Records a vote.
     *
     * @return false if the round is terminal or the voter already voted
     */
    public synchronized boolean recordVote(String voterId, boolean approve, Instant at) {
        if (status.isTerminal() || votes.containsKey(voterId) || isExpiredAt(at)) {
            return false;
        }
        votes.put(voterId, approve);
        return true;
    }

    public synchronized boolean isQuorumReached() {
        return votes.size() >= requiredVotes;
    }

    /**
     * Closes the round once quorum is reached: APPROVED when approvals meet the required
     * count, REJECTED otherwise.
     *
     * @return the new terminal status, or OPEN if quorum is not reached or the round was
     * already closed by someone else
     */
    public synchronized ProposalStatus decide() {
        if (status.isTerminal() || votes.size() < requiredVotes) {
            return ProposalStatus.OPEN;
        }
        status = approvals() >= requiredVotes ? ProposalStatus.APPROVED : ProposalStatus.REJECTED;
        return status;
    }

    /**
     * Expires the round if it is still open.
     *
     * @return true if this call expired it
     */
    public synchronized boolean expire() {
        if (status.isTerminal()) {
            return false;
        }
        status = ProposalStatus.EXPIRED;
        return true;
    }

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiry);
    }

    public ProposalMessage toMessage() {
        return new ProposalMessage(id, resourceId, proposerId, baseVersion, newValue, newFrequency,
                metrics.before(), metrics.after(), metrics.changeRatio(), expiry);
    }
}
