package com.pitchforge.cache;

/**
 * Lifetime counters plus current occupancy. Counters survive {@link GenerationCache#clear()}.
 */
public record CacheStats(
    long hits,
    long misses,
    long saves,
    int size,
    double hitRatePercent
) {
    public long lookups() {
        return hits + misses;
    }
}
