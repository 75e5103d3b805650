package com.policysonar.consensus;

/**
 * Position counts and derived scores over a set of academic sources.
 */
public final class ConsensusMetrics {
    public final int supportCount;
    public final int opposeCount;
    public final int neutralCount;
    public final double confidenceScore;
    public final int totalSources;
    public final double recencyFactor;

    public ConsensusMetrics(int supportCount, int opposeCount, int neutralCount,
                            double confidenceScore, int totalSources, double recencyFactor) {
        this.supportCount = supportCount;
        this.opposeCount = opposeCount;
        this.neutralCount = neutralCount;
        this.confidenceScore = confidenceScore;
        this.totalSources = totalSources;
        this.recencyFactor = recencyFactor;
    }

    @Override
    public String toString() {
        return String.format("ConsensusMetrics{support=%d, oppose=%d, neutral=%d, confidence=%.2f, recency=%.2f}",
            supportCount, opposeCount, neutralCount, confidenceScore, recencyFactor);
    }
}
