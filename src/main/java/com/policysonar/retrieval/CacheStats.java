package com.policysonar.retrieval;

/**
 * Point-in-time snapshot of embedding cache counters. Diagnostic only.
 */
public final class CacheStats {
    public final long hits;
    public final long misses;
    public final long totalComputed;
    public final long batchCount;
    public final long evictions;
    public final int size;
    public final int capacity;

    public CacheStats(long hits, long misses, long totalComputed, long batchCount,
                      long evictions, int size, int capacity) {
        this.hits = hits;
        this.misses = misses;
        this.totalComputed = totalComputed;
        this.batchCount = batchCount;
        this.evictions = evictions;
        this.size = size;
        this.capacity = capacity;
    }

    @Override
    public String toString() {
        return String.format("CacheStats{hits=%d, misses=%d, computed=%d, batches=%d, evictions=%d, size=%d/%d}",
            hits, misses, totalComputed, batchCount, evictions, size, capacity);
    }
}
