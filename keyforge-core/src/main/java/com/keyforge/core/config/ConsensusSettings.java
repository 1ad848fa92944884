package com.keyforge.core.config;

import com.keyforge.core.error.ConfigurationException;

import java.time.Duration;

/**
 * Adaptation trigger and quorum settings.
 */
public record ConsensusSettings(
        double energyChangeThreshold,
        Duration minAdaptationInterval,
        double quorumRatio,
        Duration proposalTimeout,
        Duration peerSendTimeout
) {
    public ConsensusSettings {
        if (energyChangeThreshold < 0.0 || Double.isNaN(energyChangeThreshold)) {
            throw new ConfigurationException(
                    "consensus.energyChangeThreshold cannot be negative, was " + energyChangeThreshold);
        }
        Settings.requireNonNegative(minAdaptationInterval, "consensus.minAdaptationInterval");
        Settings.requireRatio(quorumRatio, "consensus.quorumRatio", false);
        Settings.requirePositive(proposalTimeout, "consensus.proposalTimeout");
        Settings.requirePositive(peerSendTimeout, "consensus.peerSendTimeout");
    }

    public static ConsensusSettings defaults() {
        return new ConsensusSettings(
                0.25,                        // energyChangeThreshold (25%)
                Duration.ofMinutes(5),       // minAdaptationInterval
                0.67,                        // quorumRatio
                Duration.ofSeconds(30),      // proposalTimeout
                Duration.ofSeconds(5)        // peerSendTimeout
        );
    }

    public ConsensusSettings withMinAdaptationInterval(Duration interval) {
        return new ConsensusSettings(energyChangeThreshold, interval, quorumRatio, proposalTimeout, peerSendTimeout);
    }

    public ConsensusSettings withQuorumRatio(double ratio) {
        return new ConsensusSettings(energyChangeThreshold, minAdaptationInterval, ratio, proposalTimeout, peerSendTimeout);
    }

    public ConsensusSettings withProposalTimeout(Duration timeout) {
        return new ConsensusSettings(energyChangeThreshold, minAdaptationInterval, quorumRatio, timeout, peerSendTimeout);
    }
}
