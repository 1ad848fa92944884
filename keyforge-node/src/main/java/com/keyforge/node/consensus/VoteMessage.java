package com.keyforge.node.consensus;

/**
 * Payload of a {@code VOTE} peer message.
 */
public record VoteMessage(
        String proposalId,
        String resourceId,
        String voterId,
        boolean approve
) {}
