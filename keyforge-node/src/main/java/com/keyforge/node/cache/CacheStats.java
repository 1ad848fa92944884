package com.keyforge.node.cache;

/**
 * Point-in-time cache statistics.
 *
 * @param hitRate    hits / (hits + misses)
 * @param efficiency tier-weighted hit score over all lookups, 1.0 when every lookup hits HOT
 * @param totalBytes sum of entry size estimates across local tiers
 */
public record CacheStats(
        int hotSize,
        int warmSize,
        int coldSize,
        long hotHits,
        long warmHits,
        long coldHits,
        long remoteHits,
        long misses,
        long evictions,
        long expirations,
        long promotions,
        long demotions,
        long remoteErrors,
        double hitRate,
        double efficiency,
        long totalBytes
) {
    public long totalHits() {
        return hotHits + warmHits + coldHits + remoteHits;
    }

    public int totalEntries() {
        return hotSize + warmSize + coldSize;
    }
}
