package com.keyforge.node.health;

/**
 * Aggregate health of a node.
 */
public enum HealthState {
    HEALTHY,
    DEGRADED,
    CRITICAL;

    /**
     * HEALTHY when every component is healthy, DEGRADED when strictly more than half are,
     * CRITICAL otherwise.
     */
    public static HealthState aggregate(int healthy, int total) {
        if (total < 0 || healthy < 0 || healthy > total) {
            throw new IllegalArgumentException("Invalid component counts: " + healthy + " of " + total);
        }
        if (healthy == total) {
            return HEALTHY;
        }
        if (healthy * 2 > total) {
            return DEGRADED;
        }
        return CRITICAL;
    }
}
