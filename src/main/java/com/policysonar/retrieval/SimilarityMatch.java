package com.policysonar.retrieval;

/**
 * A corpus record paired with its cosine similarity to the query.
 */
public final class SimilarityMatch {
    public final PolicyRecord record;
    public final double score;

    public SimilarityMatch(PolicyRecord record, double score) {
        this.record = record;
        this.score = score;
    }

    @Override
    public String toString() {
        return String.format("SimilarityMatch{id='%s', score=%.3f}", record.id, score);
    }
}
