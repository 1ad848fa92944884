package com.keyforge.node.cache;

/**
 * Local cache tiers, fastest first. Weights score hits for the efficiency metric.
 */
public enum CacheTier {
    HOT(1.0),
    WARM(0.8),
    COLD(0.6);

    /**
     * Weight of a hit served by the remote store.
     */
    public static final double REMOTE_WEIGHT = 0.3;

    private final double weight;

    CacheTier(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }

    /**
     * The next faster tier, or this tier if it is already the fastest.
     */
    public CacheTier promoted() {
        return this == COLD ? WARM : HOT;
    }
}
