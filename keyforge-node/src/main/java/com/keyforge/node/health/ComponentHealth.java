package com.keyforge.node.health;

import java.time.Instant;

/**
 * Result of the last ping of one component.
 */
public record ComponentHealth(
        String component,
        boolean healthy,
        String detail,
        Instant checkedAt
) {}
