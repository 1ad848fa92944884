package com.keyforge.core.spi;

/**
 * Kinds of messages exchanged between replica peers.
 */
public enum PeerMessageType {
    REPLICATE,
    RESOURCE_UPDATE,
    ADAPTATION_PROPOSAL,
    VOTE,
    MIGRATE,
    PING
}
