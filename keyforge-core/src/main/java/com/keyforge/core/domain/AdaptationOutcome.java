package com.keyforge.core.domain;

import com.keyforge.core.error.KeyforgeException;

import java.util.Optional;

/**
 * Result of an adaptation request.
 * "Not adapted" is an ordinary outcome: rejected or expired consensus rounds are reported
 * here with the corresponding exception attached, rather than thrown.
 */
public record AdaptationOutcome(
        String resourceId,
        boolean adapted,
        Reason reason,
        String message,
        String proposalId,
        ComplexityTier newTier,
        long consensusVersion,
        KeyforgeException failure
) {

    public static AdaptationOutcome adapted(String resourceId, String proposalId,
                                            ComplexityTier newTier, long consensusVersion) {
        return new AdaptationOutcome(resourceId, true, Reason.ADAPTED,
                "Adaptation committed", proposalId, newTier, consensusVersion, null);
    }

    public static AdaptationOutcome notAdapted(String resourceId, Reason reason, String message,
                                               long consensusVersion) {
        return new AdaptationOutcome(resourceId, false, reason, message, null, null, consensusVersion, null);
    }

    public static AdaptationOutcome failedConsensus(String resourceId, Reason reason, String proposalId,
                                                    long consensusVersion, KeyforgeException failure) {
        return new AdaptationOutcome(resourceId, false, reason, failure.getMessage(),
                proposalId, null, consensusVersion, failure);
    }

    public Optional<ComplexityTier> tier() {
        return Optional.ofNullable(newTier);
    }

    public Optional<KeyforgeException> failureCause() {
        return Optional.ofNullable(failure);
    }

    public enum Reason {
        ADAPTED,
        NO_ADAPTATION_REQUIRED,
        RESOURCE_LOCKED,
        CONSENSUS_REJECTED,
        CONSENSUS_TIMEOUT
    }
}
