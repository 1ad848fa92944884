package com.keyforge.node.resource;

import java.time.Instant;

/**
 * Confirms that a resource now lives on another peer.
 */
public record MigrationReceipt(
        String resourceId,
        String targetPeer,
        long consensusVersion,
        Instant migratedAt
) {}
